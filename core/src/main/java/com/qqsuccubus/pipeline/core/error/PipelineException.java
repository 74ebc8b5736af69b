package com.qqsuccubus.pipeline.core.error;

/**
 * Base exception for all failures raised by the processing pipeline.
 * <p>
 * Every subclass maps to exactly one {@link ErrorKind}, which drives the
 * retry/dead-letter decision.
 * </p>
 */
public class PipelineException extends RuntimeException {
    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** Returns the error taxonomy entry of this failure. */
    public ErrorKind getKind() {
        return kind;
    }
}
