package com.qqsuccubus.pipeline.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Tag key for failure reason ({@link com.qqsuccubus.pipeline.core.model.FailureReason}).
     */
    public static final String REASON = "reason";

    /**
     * Tag key for the terminal outcome of a message.
     */
    public static final String OUTCOME = "outcome";
}
