package com.qqsuccubus.pipeline.core.error;

/**
 * Error taxonomy of the pipeline.
 */
public enum ErrorKind {
    /** Network, timeout or resource exhaustion. Retried up to the attempt budget. */
    TRANSIENT(true),

    /** Malformed or invalid business content. Dead-lettered immediately. */
    VALIDATION(false),

    /** Chunk assembly integrity failure. Dead-lettered immediately. */
    MALFORMED_CHUNKING(false),

    /** Idempotency or durable store failure. Retried, never bypasses the check. */
    STORE_UNAVAILABLE(true),

    /** Dead-letter publish failed. Halts the partition. */
    TERMINAL_ROUTING(false),

    /** Another worker already marked the idempotency key. */
    CONFLICT(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
