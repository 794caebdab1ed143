package com.figsearchharness;

import java.util.Objects;

/**
 * Tri-state comparison of program output.  Both sides are trimmed first; an
 * exact match passes, an actual output that merely contains the expected text
 * needs review, anything else fails.
 */
public final class OutputComparator {

    private OutputComparator(){}

    public static Verdict classify(String expected, String actual) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
        String e = expected.strip();
        String a = actual.strip();
        if (a.equals(e)) return Verdict.PASS;
        if (!e.isEmpty() && a.contains(e)) return Verdict.NEEDS_REVIEW;
        return Verdict.FAIL;
    }
}
