package com.qqsuccubus.pipeline.core.error;

/**
 * Thrown by {@code markProcessed} when the idempotency key was already marked
 * by another caller inside its retention window.
 */
public class ConflictException extends PipelineException {
    private final String idempotencyKey;

    public ConflictException(String idempotencyKey) {
        super(ErrorKind.CONFLICT, "Idempotency key already marked: " + idempotencyKey);
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
