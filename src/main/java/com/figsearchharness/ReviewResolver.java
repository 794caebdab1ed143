package com.figsearchharness;

/**
 * Decides uncertain matches and receives failure reports.  Implementations
 * may block on an operator; the harness calls them one trial at a time.
 */
public interface ReviewResolver {

    /** Unattended resolver: uncertain matches are rejected and failures are not paused on. */
    ReviewResolver BATCH = new ReviewResolver() {
        @Override public boolean accept(Fixture fixture, String actual) { return false; }
        @Override public void acknowledgeFailure(Fixture fixture, String actual) { }
    };

    /** Returns true when the operator accepts {@code actual} as a correct answer for {@code fixture}. */
    boolean accept(Fixture fixture, String actual);

    /** Called after a failure has been printed, before the next trial starts. */
    void acknowledgeFailure(Fixture fixture, String actual);
}
