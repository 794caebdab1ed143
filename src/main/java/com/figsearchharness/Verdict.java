package com.figsearchharness;

/** Outcome of comparing the program's output with the expected output. */
public enum Verdict {
    /** Trimmed outputs are identical. */
    PASS,
    /** Neither identical nor containing the expected text. */
    FAIL,
    /** The actual output contains the expected text among other text; an operator must decide. */
    NEEDS_REVIEW
}
