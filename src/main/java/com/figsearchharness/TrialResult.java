package com.figsearchharness;

import java.util.Objects;

/** Record of one trial: the fixture, what the program did and how it was judged. */
public final class TrialResult {
    public final Fixture fixture;
    public final ProcessResult process;
    public final Verdict classified;     // null when the process itself failed
    public final boolean passed;         // final decision after any review

    TrialResult(Fixture fixture, ProcessResult process, Verdict classified, boolean passed) {
        this.fixture = Objects.requireNonNull(fixture, "fixture");
        this.process = Objects.requireNonNull(process, "process");
        this.classified = classified;
        this.passed = passed;
    }

    public boolean processFailed() { return classified == null; }

    public boolean reviewed() { return classified == Verdict.NEEDS_REVIEW; }
}
