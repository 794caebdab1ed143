package com.figsearchharness;

/** The program under test could not be run, or exited with a nonzero code where 0 was required. */
public class ProcessFailureException extends RuntimeException {
    private final int exitCode;

    public ProcessFailureException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ProcessFailureException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /** Exit code reported by the process, -1 when it never produced one. */
    public int exitCode() { return exitCode; }
}
