package com.qqsuccubus.pipeline.core.error;

/** Thrown when a chunk fragment cannot be parsed or assembled. */
public class MalformedChunkingException extends PipelineException {
    public MalformedChunkingException(String message) {
        super(ErrorKind.MALFORMED_CHUNKING, message);
    }

    public MalformedChunkingException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_CHUNKING, message, cause);
    }
}
