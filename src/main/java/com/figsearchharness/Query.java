package com.figsearchharness;

import java.util.Locale;

/** Query families understood by the program under test. */
public enum Query {
    TEST("test"),
    HLINE("hline"),
    VLINE("vline"),
    SQUARE("square");

    private final String token;

    Query(String token) { this.token = token; }

    /** Command-line word passed to the program under test. */
    public String token() { return token; }

    public static Query parse(String s) {
        String t = s.trim().toLowerCase(Locale.ROOT);
        for (Query q : values()) {
            if (q.token.equals(t)) return q;
        }
        throw new IllegalArgumentException("Unknown query: " + s);
    }
}
