package com.qqsuccubus.pipeline.core.error;

/** Thrown by business logic or adapters for failures that may succeed on a later attempt. */
public class TransientException extends PipelineException {
    public TransientException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public TransientException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
