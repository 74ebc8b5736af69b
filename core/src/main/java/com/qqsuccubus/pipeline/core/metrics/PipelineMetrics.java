package com.qqsuccubus.pipeline.core.metrics;

import com.qqsuccubus.pipeline.core.model.FailureReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Centralized metrics for one pipeline instance.
 */
public class PipelineMetrics {

    private final MeterRegistry registry;
    private final String nodeId;

    // Counters
    private final Counter received;
    private final Counter processed;
    private final Counter duplicates;
    private final Counter deadLettered;
    private final Counter deadLetterPublishFailures;
    private final Counter chunksEvicted;
    private final Map<FailureReason, Counter> retries = new EnumMap<>(FailureReason.class);
    private final Map<FailureReason, Counter> routed = new EnumMap<>(FailureReason.class);

    // Timers
    private final Timer handlerLatency;

    public PipelineMetrics(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;

        received = Counter.builder(MetricsNames.MESSAGES_RECEIVED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Messages taken from the transport")
            .register(registry);

        processed = completed("processed");
        duplicates = completed("duplicate");
        deadLettered = completed("dead_lettered");

        deadLetterPublishFailures = Counter.builder(MetricsNames.DEAD_LETTER_PUBLISH_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Failed attempts to publish a dead-letter envelope")
            .register(registry);

        chunksEvicted = Counter.builder(MetricsNames.CHUNKS_EVICTED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Partial assemblies evicted for age")
            .register(registry);

        for (FailureReason reason : FailureReason.values()) {
            retries.put(reason, Counter.builder(MetricsNames.RETRIES_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.REASON, reason.name())
                .register(registry));
            routed.put(reason, Counter.builder(MetricsNames.DEAD_LETTERS_TOTAL)
                .tag(MetricsTags.NODE_ID, nodeId)
                .tag(MetricsTags.REASON, reason.name())
                .register(registry));
        }

        handlerLatency = Timer.builder(MetricsNames.HANDLER_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Business handler latency per attempt")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofMillis(1000)
            )
            .register(registry);
    }

    private Counter completed(String outcome) {
        return Counter.builder(MetricsNames.MESSAGES_COMPLETED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(registry);
    }

    /**
     * Registers a gauge backed by live pipeline state.
     */
    public void registerGauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value)
            .tag(MetricsTags.NODE_ID, nodeId)
            .register(registry);
    }

    public void recordReceived() {
        received.increment();
    }

    public void recordProcessed() {
        processed.increment();
    }

    public void recordDuplicate() {
        duplicates.increment();
    }

    public void recordDeadLettered() {
        deadLettered.increment();
    }

    public void recordRetry(FailureReason reason) {
        retries.get(reason).increment();
    }

    public void recordRouted(FailureReason reason) {
        routed.get(reason).increment();
    }

    public void recordDeadLetterPublishFailure() {
        deadLetterPublishFailures.increment();
    }

    public void recordChunksEvicted(int count) {
        chunksEvicted.increment(count);
    }

    /**
     * Records handler latency.
     *
     * @param startNanos start nanos
     */
    public void recordHandlerLatency(long startNanos) {
        handlerLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
