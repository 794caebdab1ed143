package com.figsearchharness;

import java.time.Duration;
import java.util.Objects;

/** What one invocation of the program under test produced. */
public final class ProcessResult {
    public final int exitCode;
    public final String stdout;
    public final String stderr;
    public final Duration elapsed;
    public final boolean timedOut;

    public ProcessResult(int exitCode, String stdout, String stderr, Duration elapsed, boolean timedOut) {
        this.exitCode = exitCode;
        this.stdout = Objects.requireNonNull(stdout, "stdout");
        this.stderr = Objects.requireNonNull(stderr, "stderr");
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
        this.timedOut = timedOut;
    }

    public boolean succeeded() { return !timedOut && exitCode == 0; }
}
