package com.figsearchharness;

/** The run cannot start or continue because its environment or arguments are wrong. */
public class PreconditionViolationException extends RuntimeException {
    public PreconditionViolationException(String message) {
        super(message);
    }

    public PreconditionViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
