package com.qqsuccubus.pipeline.core.error;

/** Thrown when a message could not be handed to the dead-letter destination. */
public class TerminalRoutingException extends PipelineException {
    public TerminalRoutingException(String message) {
        super(ErrorKind.TERMINAL_ROUTING, message);
    }

    public TerminalRoutingException(String message, Throwable cause) {
        super(ErrorKind.TERMINAL_ROUTING, message, cause);
    }
}
