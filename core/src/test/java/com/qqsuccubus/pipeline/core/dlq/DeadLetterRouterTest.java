package com.qqsuccubus.pipeline.core.dlq;

import com.qqsuccubus.pipeline.core.config.PipelineConfig;
import com.qqsuccubus.pipeline.core.error.TerminalRoutingException;
import com.qqsuccubus.pipeline.core.error.ValidationException;
import com.qqsuccubus.pipeline.core.metrics.MetricsNames;
import com.qqsuccubus.pipeline.core.metrics.MetricsTags;
import com.qqsuccubus.pipeline.core.metrics.PipelineMetrics;
import com.qqsuccubus.pipeline.core.model.DeadLetterEnvelope;
import com.qqsuccubus.pipeline.core.model.FailureReason;
import com.qqsuccubus.pipeline.core.model.Message;
import com.qqsuccubus.pipeline.core.model.RetryState;
import com.qqsuccubus.pipeline.core.support.InMemoryTransport;
import com.qqsuccubus.pipeline.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadLetterRouterTest {

    private final Message message = Message.builder()
        .topic("orders")
        .partitionKey("3")
        .key("order-9")
        .sequenceToken(17)
        .payload("{\"amount\":-1}".getBytes())
        .headers(Map.of("trace-id", "t-1"))
        .build();

    private InMemoryTransport transport;
    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;
    private MutableClock clock;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        transport = new InMemoryTransport();
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry, "test-node");
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        scheduler = Schedulers.newBoundedElastic(2, 100, "dlq-test");
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private DeadLetterRouter router(int deadLetterMaxAttempts, DeadLetterFallback fallback) {
        PipelineConfig config = PipelineConfig.builder()
            .baseDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .deadLetterMaxAttempts(deadLetterMaxAttempts)
            .build();
        return new DeadLetterRouter(transport, config, fallback, metrics, scheduler, clock);
    }

    private RetryState failedOnce() {
        RetryState state = new RetryState(clock.instant());
        state.recordFailure(new ValidationException("negative amount"), clock.instant());
        return state;
    }

    @Test
    void testRoute_PublishesEnvelopeToSuffixedTopic() {
        DeadLetterEnvelope envelope = router(3, null)
            .route(message, FailureReason.VALIDATION_ERROR, "negative amount", failedOnce())
            .block(Duration.ofSeconds(5));

        List<InMemoryTransport.Published> published = transport.getDeadLetters();
        assertEquals(1, published.size());
        assertEquals("orders.dlq", published.get(0).destination);
        assertEquals(envelope, published.get(0).envelope);
        assertEquals(1, envelope.getAttemptCount());
        assertEquals(clock.instant(), envelope.getFirstFailedAt());
        assertEquals(1.0, registry.get(MetricsNames.DEAD_LETTERS_TOTAL)
            .tag(MetricsTags.REASON, FailureReason.VALIDATION_ERROR.name())
            .counter().count());
    }

    @Test
    void testHeaders_KeepOriginalAndAddFailureMetadata() {
        DeadLetterEnvelope envelope = router(3, null)
            .route(message, FailureReason.VALIDATION_ERROR, "negative amount", failedOnce())
            .block(Duration.ofSeconds(5));

        Map<String, String> headers = DeadLetterHeaders.of(envelope);

        assertEquals("t-1", headers.get("trace-id"));
        assertEquals("VALIDATION_ERROR", headers.get(DeadLetterHeaders.FAILURE_REASON));
        assertEquals("negative amount", headers.get(DeadLetterHeaders.FAILURE_DETAIL));
        assertEquals("1", headers.get(DeadLetterHeaders.ATTEMPT_COUNT));
        assertEquals("orders", headers.get(DeadLetterHeaders.ORIGINAL_TOPIC));
        assertEquals("3", headers.get(DeadLetterHeaders.ORIGINAL_PARTITION));
        assertEquals("17", headers.get(DeadLetterHeaders.ORIGINAL_SEQUENCE));
        assertEquals("2024-01-01T00:00:00Z", headers.get(DeadLetterHeaders.FIRST_FAILED_AT));
    }

    @Test
    void testPublishFailure_RetriedUntilAccepted() {
        transport.failRepublish(2);

        router(3, null).route(message, FailureReason.TRANSIENT_ERROR, "boom", failedOnce())
            .block(Duration.ofSeconds(5));

        assertEquals(3, transport.getRepublishCalls());
        assertEquals(1, transport.getDeadLetters().size());
        assertEquals(2.0, registry.get(MetricsNames.DEAD_LETTER_PUBLISH_FAILURES_TOTAL).counter().count());
    }

    @Test
    void testUnboundedBudget_KeepsRetrying() {
        transport.failRepublish(8);

        router(0, null).route(message, FailureReason.TRANSIENT_ERROR, "boom", failedOnce())
            .block(Duration.ofSeconds(10));

        assertEquals(9, transport.getRepublishCalls());
    }

    @Test
    void testExhaustedWithoutFallback_TerminalRoutingFailure() {
        transport.failRepublishAlways();
        Mono<DeadLetterEnvelope> routed = router(2, null)
            .route(message, FailureReason.VALIDATION_ERROR, "bad", failedOnce());

        assertThrows(TerminalRoutingException.class, () -> routed.block(Duration.ofSeconds(5)));
        assertEquals(3, transport.getRepublishCalls());
    }

    @Test
    void testExhaustedWithFallback_WritesJsonLine(@TempDir Path dir) throws Exception {
        transport.failRepublishAlways();
        Path file = dir.resolve("dead-letters.jsonl");

        router(1, new JsonFileDeadLetterFallback(file))
            .route(message, FailureReason.VALIDATION_ERROR, "bad", failedOnce())
            .block(Duration.ofSeconds(5));

        List<String> lines = Files.readAllLines(file);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("\"destination\":\"orders.dlq\""));
        assertTrue(lines.get(0).contains("\"failureReason\":\"VALIDATION_ERROR\""));
    }

    @Test
    void testFallbackFailure_TerminalRoutingFailure() {
        transport.failRepublishAlways();
        DeadLetterFallback broken = (destination, envelope) -> Mono.error(new IllegalStateException("disk full"));
        Mono<DeadLetterEnvelope> routed = router(1, broken)
            .route(message, FailureReason.VALIDATION_ERROR, "bad", failedOnce());

        TerminalRoutingException error = assertThrows(TerminalRoutingException.class,
            () -> routed.block(Duration.ofSeconds(5)));
        assertEquals(1, error.getSuppressed().length);
    }

    @Test
    void testUnboundedRetry_PartitionReportedBlockedUntilStopped() throws Exception {
        transport.failRepublishAlways();
        Sinks.Empty<Void> stop = Sinks.empty();
        PipelineConfig config = PipelineConfig.builder()
            .baseDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .deadLetterMaxAttempts(0)
            .build();
        DeadLetterRouter router = new DeadLetterRouter(transport, config, null, metrics, scheduler, clock, stop.asMono());

        CompletableFuture<DeadLetterEnvelope> routed = router
            .route(message, FailureReason.VALIDATION_ERROR, "bad", failedOnce())
            .toFuture();
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (router.blockedPartitions().isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }

        assertEquals(Set.of("orders-3"), router.blockedPartitions());
        assertFalse(routed.isDone());

        stop.tryEmitEmpty();

        assertNull(routed.get(5, TimeUnit.SECONDS));
        assertTrue(router.blockedPartitions().isEmpty());
        assertTrue(transport.getDeadLetters().isEmpty());
        assertEquals(0.0, registry.get(MetricsNames.DEAD_LETTERS_TOTAL)
            .tag(MetricsTags.REASON, FailureReason.VALIDATION_ERROR.name())
            .counter().count());
    }

    @Test
    void testRecoveredPublish_ClearsBlockedPartition() {
        transport.failRepublish(3);
        DeadLetterRouter router = router(0, null);

        router.route(message, FailureReason.VALIDATION_ERROR, "bad", failedOnce()).block(Duration.ofSeconds(5));

        assertTrue(router.blockedPartitions().isEmpty());
        assertEquals(1, transport.getDeadLetters().size());
    }

    @Test
    void testTerminalFailure_ClearsBlockedPartition() {
        transport.failRepublishAlways();
        DeadLetterRouter router = router(2, null);

        assertThrows(TerminalRoutingException.class, () -> router
            .route(message, FailureReason.VALIDATION_ERROR, "bad", failedOnce())
            .block(Duration.ofSeconds(5)));
        assertTrue(router.blockedPartitions().isEmpty());
    }
}
