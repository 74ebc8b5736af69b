package com.qqsuccubus.pipeline.core.model;

import com.qqsuccubus.pipeline.core.error.ErrorKind;

/**
 * Why a message ended up in the dead-letter destination.
 */
public enum FailureReason {
    /** Transient failures exhausted the retry budget. */
    TRANSIENT_ERROR,

    /** Business content rejected as invalid. */
    VALIDATION_ERROR,

    /** Chunk fragment malformed, corrupted, or its assembly never completed. */
    MALFORMED_CHUNKING,

    /** Idempotency store stayed unavailable for the whole retry budget. */
    STORE_UNAVAILABLE;

    public static FailureReason of(ErrorKind kind) {
        return switch (kind) {
            case TRANSIENT -> TRANSIENT_ERROR;
            case MALFORMED_CHUNKING -> MALFORMED_CHUNKING;
            case STORE_UNAVAILABLE -> STORE_UNAVAILABLE;
            default -> VALIDATION_ERROR;
        };
    }
}
