package com.figsearchharness;

/** Verdict the {@code test} query must print for a fixture. */
public enum Validity {
    VALID("Valid"),
    INVALID("Invalid");

    private final String output;

    Validity(String output) { this.output = output; }

    /** Exact stdout expected from the program under test. */
    public String output() { return output; }
}
