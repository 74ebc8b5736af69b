package com.qqsuccubus.pipeline.core.error;

/** Thrown by business logic when message content can never be processed. */
public class ValidationException extends PipelineException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
