package com.qqsuccubus.pipeline.core.metrics;

/**
 * Micrometer metric names used across the pipeline.
 * <p>
 * <b>Naming convention:</b> {@code pipeline.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Messages taken from the transport.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String MESSAGES_RECEIVED_TOTAL = "pipeline.messages.received.total";

    /**
     * Counter: Messages acknowledged, by outcome.
     * <p>
     * Tags: node_id, outcome (processed/duplicate/dead_lettered)
     * </p>
     */
    public static final String MESSAGES_COMPLETED_TOTAL = "pipeline.messages.completed.total";

    /**
     * Counter: Retries scheduled after a retryable failure.
     * <p>
     * Tags: node_id, reason
     * </p>
     */
    public static final String RETRIES_TOTAL = "pipeline.retries.total";

    /**
     * Counter: Envelopes written to a dead-letter destination or fallback.
     * <p>
     * Tags: node_id, reason
     * </p>
     */
    public static final String DEAD_LETTERS_TOTAL = "pipeline.dlq.routed.total";

    /**
     * Counter: Failed dead-letter publish attempts.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String DEAD_LETTER_PUBLISH_FAILURES_TOTAL = "pipeline.dlq.publish.failures.total";

    /**
     * Timer: Business handler latency per attempt.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String HANDLER_LATENCY = "pipeline.handler.latency";

    /**
     * Gauge: Partial chunk assemblies waiting for fragments.
     */
    public static final String CHUNKS_PENDING = "pipeline.chunks.pending";

    /**
     * Counter: Partial assemblies evicted for age.
     */
    public static final String CHUNKS_EVICTED_TOTAL = "pipeline.chunks.evicted.total";

    /**
     * Gauge: Partition lanes that cannot make progress: halted by a terminal routing failure
     * or blocked on a failing dead-letter publish.
     */
    public static final String PARTITIONS_HALTED = "pipeline.partitions.halted";

    /**
     * Gauge: Partition lanes blocked on a dead-letter publish that is being retried.
     */
    public static final String PARTITIONS_ROUTING_BLOCKED = "pipeline.partitions.routing_blocked";

    /**
     * Gauge: Lanes whose transport fetching is paused.
     */
    public static final String LANES_PAUSED = "pipeline.lanes.paused";
}
