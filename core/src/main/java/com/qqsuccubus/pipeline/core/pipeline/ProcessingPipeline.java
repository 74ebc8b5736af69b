package com.qqsuccubus.pipeline.core.pipeline;

import com.qqsuccubus.pipeline.core.backoff.BackoffPolicy;
import com.qqsuccubus.pipeline.core.chunk.AssemblyResult;
import com.qqsuccubus.pipeline.core.chunk.ChunkAssembler;
import com.qqsuccubus.pipeline.core.chunk.ChunkFragment;
import com.qqsuccubus.pipeline.core.chunk.ChunkHeaders;
import com.qqsuccubus.pipeline.core.chunk.PartialAssembly;
import com.qqsuccubus.pipeline.core.config.PipelineConfig;
import com.qqsuccubus.pipeline.core.dlq.DeadLetterFallback;
import com.qqsuccubus.pipeline.core.dlq.DeadLetterRouter;
import com.qqsuccubus.pipeline.core.error.ConflictException;
import com.qqsuccubus.pipeline.core.error.ErrorKind;
import com.qqsuccubus.pipeline.core.error.MalformedChunkingException;
import com.qqsuccubus.pipeline.core.error.PipelineException;
import com.qqsuccubus.pipeline.core.error.StoreUnavailableException;
import com.qqsuccubus.pipeline.core.error.TerminalRoutingException;
import com.qqsuccubus.pipeline.core.idempotency.IdempotencyKeyResolver;
import com.qqsuccubus.pipeline.core.idempotency.IdempotencyMode;
import com.qqsuccubus.pipeline.core.idempotency.IdempotencyStore;
import com.qqsuccubus.pipeline.core.metrics.MetricsNames;
import com.qqsuccubus.pipeline.core.metrics.PipelineMetrics;
import com.qqsuccubus.pipeline.core.model.FailureReason;
import com.qqsuccubus.pipeline.core.model.IdempotencyKey;
import com.qqsuccubus.pipeline.core.model.Message;
import com.qqsuccubus.pipeline.core.model.RetryState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Drives delivered messages through reassembly, duplicate detection, processing, retry
 * and dead-lettering.
 * <p>
 * <b>Ordering:</b> messages are grouped by {@link Message#lane()}; each lane processes one
 * message at a time on the bounded worker pool, lanes run in parallel. A retry keeps its lane
 * busy until the message reaches an outcome. Parked chunk fragments do not: the lane moves on
 * so the remaining fragments can arrive.
 * </p>
 * <p>
 * <b>Flow control:</b> each lane buffers what it has not processed yet, so a busy lane never
 * holds back the shared receive stream. The buffer is bounded by pausing the transport for a
 * lane once its backlog reaches {@code laneHighWatermark}; halted lanes stay paused.
 * </p>
 * <p>
 * <b>Acknowledgement:</b> a message is acknowledged only after its outcome is durable, i.e. the
 * idempotency record exists (COMMITTED) or the dead-letter destination accepted the envelope
 * (DEAD_LETTERED). Halted and abandoned messages are never acknowledged and come back through
 * redelivery.
 * </p>
 * <p>
 * <b>Shutdown:</b> {@link #requestShutdown()} stops pulling, lets the current attempt of each
 * lane finish and prevents new retries. Parked fragments and retry bookkeeping are dropped.
 * </p>
 */
public class ProcessingPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProcessingPipeline.class);

    private final Transport transport;
    private final MessageHandler handler;
    private final IdempotencyStore store;
    private final IdempotencyKeyResolver keyResolver;
    private final PipelineConfig config;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Scheduler workers;
    private final ChunkAssembler assembler;
    private final BackoffPolicy backoff;
    private final DeadLetterRouter deadLetterRouter;
    private final LaneBacklog backlog;

    private final Set<String> haltedLanes = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final Sinks.Empty<Void> shutdownSignal = Sinks.empty();
    private final Sinks.Empty<Void> terminated = Sinks.empty();

    private Disposable subscription;
    private Disposable sweeper;

    @Builder
    private ProcessingPipeline(Transport transport,
                               MessageHandler handler,
                               IdempotencyStore store,
                               IdempotencyKeyResolver keyResolver,
                               PipelineConfig config,
                               DeadLetterFallback deadLetterFallback,
                               PipelineMetrics metrics,
                               Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.store = Objects.requireNonNull(store, "store");
        this.config = config != null ? config : PipelineConfig.builder().build();
        this.keyResolver = keyResolver != null
            ? keyResolver
            : IdempotencyKeyResolver.fromHeader(this.config.getIdempotencyKeyHeader());
        this.metrics = metrics != null ? metrics : new PipelineMetrics(new SimpleMeterRegistry(), "local");
        this.clock = clock != null ? clock : Clock.systemUTC();

        this.workers = Schedulers.newBoundedElastic(
            this.config.getWorkerPoolSize(), this.config.getWorkerQueueCapacity(), "pipeline-worker"
        );
        this.assembler = new ChunkAssembler(this.clock, this.config.getMaxAssemblyAge());
        this.backoff = BackoffPolicy.from(this.config, handler::isRetryable);
        this.deadLetterRouter = new DeadLetterRouter(
            transport, this.config, deadLetterFallback, this.metrics, workers, this.clock, shutdownSignal.asMono()
        );
        this.backlog = new LaneBacklog(transport, this.config.getLaneHighWatermark());

        this.metrics.registerGauge(MetricsNames.CHUNKS_PENDING, assembler::pendingCount);
        this.metrics.registerGauge(MetricsNames.PARTITIONS_HALTED, () -> haltedPartitions().size());
        this.metrics.registerGauge(MetricsNames.PARTITIONS_ROUTING_BLOCKED, () -> routingBlockedPartitions().size());
        this.metrics.registerGauge(MetricsNames.LANES_PAUSED, backlog::pausedCount);
    }

    /**
     * Subscribes to the transport and starts the periodic sweeper.
     */
    public synchronized void start() {
        if (subscription != null) {
            throw new IllegalStateException("Pipeline already started");
        }
        log.info("Starting pipeline: {} workers, maxAttempts={}, idempotency={}",
            config.getWorkerPoolSize(), config.getMaxAttempts(), config.getIdempotencyMode());

        subscription = run().subscribe(
            null,
            error -> log.error("Pipeline terminated with error", error),
            () -> log.info("Pipeline stopped")
        );

        sweeper = Flux.interval(config.getSweepInterval(), config.getSweepInterval(), workers)
            .onBackpressureDrop()
            .concatMap(tick -> sweepExpired()
                .onErrorResume(error -> {
                    log.warn("Sweep failed: {}", error.toString());
                    return Mono.empty();
                }))
            .subscribe();
    }

    /**
     * Processes the transport stream until it completes or shutdown is requested.
     */
    public Mono<Void> run() {
        return transport.receive()
            .takeUntilOther(shutdownSignal.asMono())
            .doOnNext(message -> {
                metrics.recordReceived();
                backlog.received(message.lane());
            })
            .groupBy(Message::lane)
            .flatMap(lane -> lane
                    .onBackpressureBuffer()
                    .publishOn(workers)
                    .concatMap(message -> process(message)
                        .doFinally(signal -> backlog.completed(message.lane()))),
                Integer.MAX_VALUE)
            .then()
            .doFinally(signal -> terminated.tryEmitEmpty());
    }

    /**
     * Takes one delivered message to its next resting state. The caller keeps one call per lane in flight.
     *
     * @param message Delivered message
     * @return Mono of the state the message ended in
     */
    public Mono<ProcessingState> process(Message message) {
        return Mono.defer(() -> {
            if (shutdownRequested.get()) {
                log.debug("Shutdown requested, leaving {} for redelivery", message.coordinates());
                return Mono.just(ProcessingState.ABANDONED);
            }
            if (haltedLanes.contains(message.lane())) {
                log.debug("Partition {} halted, skipping {}", message.lane(), message.coordinates());
                return Mono.just(ProcessingState.HALTED);
            }
            if (ChunkHeaders.isFragment(message)) {
                return reassemble(message);
            }
            return handleLogical(message, List.of(message));
        });
    }

    private Mono<ProcessingState> reassemble(Message message) {
        ChunkFragment fragment;
        try {
            fragment = ChunkHeaders.parse(message);
        } catch (MalformedChunkingException e) {
            return deadLetterFragments(List.of(message), e.getMessage());
        }

        AssemblyResult result = assembler.ingest(fragment);
        switch (result.getStatus()) {
            case INCOMPLETE:
                log.debug("Parked chunk {}/{} of {} ({})", fragment.getChunkIndex() + 1,
                    fragment.getTotalChunks(), fragment.getLogicalMessageId(), message.coordinates());
                return Mono.just(ProcessingState.REASSEMBLING);
            case COMPLETE:
                Message logical = ChunkHeaders.reconstruct(result.getFirstFragment(), result.getPayload());
                return handleLogical(logical, result.getOrigins());
            default:
                return deadLetterFragments(result.getOrigins(), result.getDetail());
        }
    }

    /**
     * Runs the attempt loop for a logical message and acknowledges its delivered messages.
     */
    private Mono<ProcessingState> handleLogical(Message message, List<Message> origins) {
        IdempotencyKey key = keyResolver.resolve(message);
        RetryState state = new RetryState(clock.instant());
        return attempt(message, key, state)
            .flatMap(outcome -> outcome.isAcknowledged()
                ? ackAll(origins).thenReturn(outcome)
                : Mono.just(outcome))
            .onErrorResume(TerminalRoutingException.class, error -> halt(message, error));
    }

    private Mono<ProcessingState> attempt(Message message, IdempotencyKey key, RetryState state) {
        return Mono.defer(() -> {
                if (shutdownRequested.get()) {
                    log.info("Shutdown requested, abandoning {} after {} attempt(s)",
                        message.coordinates(), state.getAttemptCount());
                    return Mono.just(ProcessingState.ABANDONED);
                }
                if (state.isHandlerCompleted()) {
                    return markAfterHandler(message, key).thenReturn(ProcessingState.COMMITTED);
                }
                return checkAndProcess(message, key, state);
            })
            .onErrorResume(error -> !(error instanceof TerminalRoutingException),
                error -> onFailure(message, key, state, error));
    }

    private Mono<ProcessingState> checkAndProcess(Message message, IdempotencyKey key, RetryState state) {
        return withStoreTimeout(() -> store.hasProcessed(key)).flatMap(processed -> {
            if (processed) {
                metrics.recordDuplicate();
                log.debug("Duplicate {} ({}), acknowledging without processing", key, message.coordinates());
                return Mono.just(ProcessingState.COMMITTED);
            }

            ProcessingContext context = new ProcessingContext(
                key, state.getAttemptCount() + 1,
                () -> withStoreTimeout(() -> store.markProcessed(key, config.getRetention()))
            );
            long start = System.nanoTime();
            return Mono.defer(() -> handler.process(message, context))
                .timeout(handler.callTimeout(), workers)
                .doFinally(signal -> metrics.recordHandlerLatency(start))
                .then(Mono.defer(() -> {
                    state.markHandlerCompleted();
                    return context.isMarked() ? Mono.<Void>empty() : markAfterHandler(message, key);
                }))
                .then(Mono.fromCallable(() -> {
                    metrics.recordProcessed();
                    log.debug("Processed {} ({}) on attempt {}", key, message.coordinates(), context.getAttempt());
                    return ProcessingState.COMMITTED;
                }));
        });
    }

    private Mono<Void> markAfterHandler(Message message, IdempotencyKey key) {
        if (config.getIdempotencyMode() == IdempotencyMode.TRANSACTIONAL) {
            log.warn("Handler returned without marking {} ({}), marking after the fact", key, message.coordinates());
        }
        return withStoreTimeout(() -> store.markProcessed(key, config.getRetention()));
    }

    private Mono<ProcessingState> onFailure(Message message, IdempotencyKey key, RetryState state, Throwable error) {
        if (error instanceof ConflictException) {
            metrics.recordDuplicate();
            log.debug("Key {} already recorded by a concurrent consumer, acknowledging {}", key, message.coordinates());
            return Mono.just(ProcessingState.COMMITTED);
        }

        state.recordFailure(error, clock.instant());
        ErrorKind kind = backoff.kindOf(error);
        FailureReason reason = FailureReason.of(kind);

        if (kind.isRetryable()) {
            Optional<Duration> delay = backoff.nextDelay(state.retriesPerformed());
            if (delay.isPresent()) {
                if (shutdownRequested.get()) {
                    log.info("Shutdown requested, not retrying {}", message.coordinates());
                    return Mono.just(ProcessingState.ABANDONED);
                }
                metrics.recordRetry(reason);
                log.warn("Attempt {} of {} failed ({}), retrying in {} ms: {}",
                    state.getAttemptCount(), message.coordinates(), kind, delay.get().toMillis(), error.toString());
                return Mono.delay(delay.get(), workers)
                    .takeUntilOther(shutdownSignal.asMono())
                    .then(attempt(message, key, state));
            }
            log.error("Retry budget of {} exhausted for {}", backoff.getMaxAttempts(), message.coordinates());
        }

        return deadLetterRouter.route(message, reason, describe(error), state)
            .map(envelope -> {
                metrics.recordDeadLettered();
                return ProcessingState.DEAD_LETTERED;
            })
            .defaultIfEmpty(ProcessingState.ABANDONED);
    }

    /**
     * Dead-letters delivered fragments one by one with MALFORMED_CHUNKING and acknowledges each.
     */
    private Mono<ProcessingState> deadLetterFragments(List<Message> fragments, String detail) {
        return Flux.fromIterable(fragments)
            .concatMap(fragment -> {
                if (haltedLanes.contains(fragment.lane())) {
                    return Mono.just(ProcessingState.HALTED);
                }
                RetryState state = new RetryState(clock.instant());
                state.recordFailure(new MalformedChunkingException(detail), clock.instant());
                return deadLetterRouter.route(fragment, FailureReason.MALFORMED_CHUNKING, detail, state)
                    .flatMap(envelope -> {
                        metrics.recordDeadLettered();
                        return ackAll(List.of(fragment)).thenReturn(ProcessingState.DEAD_LETTERED);
                    })
                    .defaultIfEmpty(ProcessingState.ABANDONED)
                    .onErrorResume(TerminalRoutingException.class, error -> halt(fragment, error));
            })
            .reduce(ProcessingPipeline::leastProgress)
            .defaultIfEmpty(ProcessingState.DEAD_LETTERED);
    }

    private static ProcessingState leastProgress(ProcessingState first, ProcessingState next) {
        if (first == ProcessingState.HALTED || next == ProcessingState.HALTED) {
            return ProcessingState.HALTED;
        }
        return next == ProcessingState.ABANDONED ? next : first;
    }

    private Mono<Void> ackAll(List<Message> messages) {
        return Flux.fromIterable(messages)
            .concatMap(message -> transport.ack(message)
                .onErrorResume(error -> {
                    log.warn("Ack of {} failed, it will be redelivered: {}", message.coordinates(), error.toString());
                    return Mono.empty();
                }))
            .then();
    }

    private Mono<ProcessingState> halt(Message message, Throwable error) {
        if (haltedLanes.add(message.lane())) {
            log.error("Halting partition {}: dead-letter routing failed for {}. "
                + "Later messages stay unacknowledged until restart.", message.lane(), message.coordinates(), error);
            backlog.pin(message.lane());
        }
        return Mono.just(ProcessingState.HALTED);
    }

    /**
     * Bounds a store call and reports any failure other than a pipeline error as the store being unavailable.
     */
    private <T> Mono<T> withStoreTimeout(Supplier<Mono<T>> operation) {
        Duration timeout = config.getStoreTimeout();
        return Mono.defer(operation)
            .timeout(timeout, workers)
            .onErrorMap(TimeoutException.class, error -> new StoreUnavailableException(
                "Idempotency store did not answer within " + timeout.toMillis() + " ms", error))
            .onErrorMap(error -> !(error instanceof PipelineException), error -> new StoreUnavailableException(
                "Idempotency store call failed: " + describe(error), error));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    /**
     * Evicts aged partial assemblies (dead-lettering their fragments) and expired idempotency records.
     *
     * @return Mono of what was removed
     */
    public Mono<SweepReport> sweepExpired() {
        return Mono.defer(() -> {
            List<PartialAssembly> evicted = assembler.sweepExpired();
            metrics.recordChunksEvicted(evicted.size());
            return Flux.fromIterable(evicted)
                .concatMap(assembly -> deadLetterFragments(assembly.getOrigins(), String.format(
                    "Assembly %s expired after %s with %d of %d chunks",
                    assembly.getLogicalMessageId(), config.getMaxAssemblyAge(),
                    assembly.getReceivedCount(), assembly.getTotalChunks())))
                .then(withStoreTimeout(store::sweepExpired))
                .map(expired -> new SweepReport(evicted.size(), expired));
        });
    }

    /**
     * Stops pulling new messages. Current attempts finish; no retry is scheduled afterwards.
     */
    public void requestShutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("Shutdown requested");
            shutdownSignal.tryEmitEmpty();
        }
    }

    /**
     * Requests shutdown and waits for in-flight attempts.
     *
     * @param grace Maximum time to wait
     * @return true if the pipeline drained within {@code grace}
     */
    public boolean stop(Duration grace) {
        requestShutdown();
        synchronized (this) {
            if (subscription == null) {
                return true;
            }
        }
        boolean drained = Boolean.TRUE.equals(terminated.asMono()
            .thenReturn(true)
            .timeout(grace, Mono.just(false))
            .block());
        if (!drained) {
            log.warn("Pipeline did not drain within {}, cancelling in-flight work", grace);
        }
        return drained;
    }

    /**
     * Partitions that cannot make progress: halted by a terminal routing failure, or blocked
     * while a dead-letter publish of theirs keeps failing.
     */
    public Set<String> haltedPartitions() {
        Set<String> stuck = new HashSet<>(haltedLanes);
        stuck.addAll(deadLetterRouter.blockedPartitions());
        return Set.copyOf(stuck);
    }

    public Set<String> routingBlockedPartitions() {
        return deadLetterRouter.blockedPartitions();
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    public int pendingAssemblies() {
        return assembler.pendingCount();
    }

    @Override
    public synchronized void close() {
        requestShutdown();
        if (sweeper != null) {
            sweeper.dispose();
        }
        if (subscription != null) {
            subscription.dispose();
        }
        workers.dispose();
    }
}
