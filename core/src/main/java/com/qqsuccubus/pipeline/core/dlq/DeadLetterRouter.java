package com.qqsuccubus.pipeline.core.dlq;

import com.qqsuccubus.pipeline.core.backoff.BackoffPolicy;
import com.qqsuccubus.pipeline.core.config.PipelineConfig;
import com.qqsuccubus.pipeline.core.error.TerminalRoutingException;
import com.qqsuccubus.pipeline.core.metrics.PipelineMetrics;
import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.FailureReason;
import com.qqsuccubus.pipeline.core.model.Message;
import com.qqsuccubus.pipeline.core.model.RetryState;
import com.qqsuccubus.pipeline.core.pipeline.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes permanently failed messages to {@code <topic><deadLetterSuffix>}.
 * <p>
 * <b>Publish failures:</b> retried with jittered exponential backoff up to
 * {@code deadLetterMaxAttempts} retries (0 = until it succeeds or the stop signal fires).
 * Once exhausted the envelope goes to the {@link DeadLetterFallback} if one is configured;
 * without one, or if it fails too, the returned Mono fails with {@link TerminalRoutingException}
 * and the caller must not acknowledge the message.
 * </p>
 * <p>
 * While a publish is being retried its partition is reported by {@link #blockedPartitions()}.
 * If the stop signal fires between retries the returned Mono completes empty: the message was
 * not routed and must not be acknowledged.
 * </p>
 */
public class DeadLetterRouter {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterRouter.class);

    private final Transport transport;
    private final String suffix;
    private final BackoffPolicy publishBackoff;
    private final DeadLetterFallback fallback;
    private final PipelineMetrics metrics;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Mono<Void> stopSignal;
    private final Map<String, Integer> blockedLanes = new ConcurrentHashMap<>();

    public DeadLetterRouter(Transport transport,
                            PipelineConfig config,
                            DeadLetterFallback fallback,
                            PipelineMetrics metrics,
                            Scheduler scheduler,
                            Clock clock) {
        this(transport, config, fallback, metrics, scheduler, clock, Mono.never());
    }

    public DeadLetterRouter(Transport transport,
                            PipelineConfig config,
                            DeadLetterFallback fallback,
                            PipelineMetrics metrics,
                            Scheduler scheduler,
                            Clock clock,
                            Mono<Void> stopSignal) {
        this.transport = transport;
        this.suffix = config.getDeadLetterSuffix();
        int budget = config.getDeadLetterMaxAttempts() == 0 ? Integer.MAX_VALUE : config.getDeadLetterMaxAttempts();
        this.publishBackoff = new BackoffPolicy(config.getBaseDelay(), config.getMaxDelay(), budget, e -> true);
        this.fallback = fallback;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.clock = clock;
        this.stopSignal = stopSignal;
    }

    public String destinationFor(Message message) {
        return message.getTopic() + suffix;
    }

    /**
     * Builds the envelope from the message's attempt history and publishes it.
     *
     * @param message Failed message (the reassembled one for chunked input)
     * @param reason  Failure classification
     * @param detail  Human-readable failure description
     * @param state   Attempt bookkeeping; at least one failure recorded
     * @return Mono of the routed envelope, empty if stopped before the envelope was accepted
     */
    public Mono<DeadLetterEnvelope> route(Message message, FailureReason reason, String detail, RetryState state) {
        Instant now = clock.instant();
        DeadLetterEnvelope envelope = DeadLetterEnvelope.builder()
            .originalMessage(message)
            .failureReason(reason)
            .failureDetail(detail)
            .attemptCount(Math.max(1, state.getAttemptCount()))
            .firstFailedAt(state.getFirstFailedAt() != null ? state.getFirstFailedAt() : now)
            .lastFailedAt(state.getLastFailedAt() != null ? state.getLastFailedAt() : now)
            .build();
        return route(envelope);
    }

    public Mono<DeadLetterEnvelope> route(DeadLetterEnvelope envelope) {
        String destination = destinationFor(envelope.getOriginalMessage());
        String lane = envelope.getOriginalMessage().lane();
        AtomicBoolean blocked = new AtomicBoolean(false);
        return Mono.defer(() -> publish(destination, envelope, 0, blocked))
            .onErrorResume(error -> toFallback(destination, envelope, error).thenReturn(true))
            .doOnError(error -> unblock(lane, blocked))
            .doOnCancel(() -> unblock(lane, blocked))
            .flatMap(routed -> {
                unblock(lane, blocked);
                if (!routed) {
                    log.warn("Stopped before {} reached {}, leaving it unacknowledged",
                        envelope.getOriginalMessage().coordinates(), destination);
                    return Mono.empty();
                }
                metrics.recordRouted(envelope.getFailureReason());
                log.error("Dead-lettered {} to {}: {} after {} attempt(s): {}",
                    envelope.getOriginalMessage().coordinates(), destination, envelope.getFailureReason(),
                    envelope.getAttemptCount(), envelope.getFailureDetail());
                return Mono.just(envelope);
            });
    }

    /**
     * Partitions with a dead-letter publish currently failing and being retried.
     */
    public Set<String> blockedPartitions() {
        return Set.copyOf(blockedLanes.keySet());
    }

    /**
     * @return Mono of true once published, false if stopped between retries
     */
    private Mono<Boolean> publish(String destination, DeadLetterEnvelope envelope, int retries, AtomicBoolean blocked) {
        return Mono.defer(() -> transport.republish(destination, envelope))
            .thenReturn(true)
            .onErrorResume(error -> {
                metrics.recordDeadLetterPublishFailure();
                Optional<Duration> delay = publishBackoff.nextDelay(retries);
                if (delay.isEmpty()) {
                    return Mono.error(error);
                }
                String lane = envelope.getOriginalMessage().lane();
                if (blocked.compareAndSet(false, true)) {
                    blockedLanes.merge(lane, 1, Integer::sum);
                    log.error("Dead-letter destination {} rejected {}, partition {} is blocked until it recovers: {}",
                        destination, envelope.getOriginalMessage().coordinates(), lane, error.toString());
                }
                log.warn("Dead-letter publish of {} to {} failed (retry {}), retrying in {} ms: {}",
                    envelope.getOriginalMessage().coordinates(), destination, retries + 1,
                    delay.get().toMillis(), error.toString());
                return Mono.delay(delay.get(), scheduler)
                    .takeUntilOther(stopSignal)
                    .flatMap(tick -> publish(destination, envelope, retries + 1, blocked))
                    .defaultIfEmpty(false);
            });
    }

    private void unblock(String lane, AtomicBoolean blocked) {
        if (blocked.compareAndSet(true, false)
            && blockedLanes.computeIfPresent(lane, (key, count) -> count > 1 ? count - 1 : null) == null) {
            log.info("Partition {} no longer blocked on dead-letter publishing", lane);
        }
    }

    private Mono<Void> toFallback(String destination, DeadLetterEnvelope envelope, Throwable publishError) {
        String coordinates = envelope.getOriginalMessage().coordinates();
        if (fallback == null) {
            return Mono.error(new TerminalRoutingException(
                "Cannot publish " + coordinates + " to " + destination, publishError));
        }
        return fallback.persist(destination, envelope)
            .onErrorMap(fallbackError -> {
                TerminalRoutingException terminal = new TerminalRoutingException(
                    "Cannot publish " + coordinates + " to " + destination + " nor to the fallback", publishError);
                terminal.addSuppressed(fallbackError);
                return terminal;
            });
    }
}
