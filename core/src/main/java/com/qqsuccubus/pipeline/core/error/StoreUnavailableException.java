package com.qqsuccubus.pipeline.core.error;

/** Thrown when the idempotency store cannot answer or persist. */
public class StoreUnavailableException extends PipelineException {
    public StoreUnavailableException(String message) {
        super(ErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
