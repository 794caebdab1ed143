package com.figsearchharness;

import java.util.Objects;
import java.util.Random;

/**
 * Source of the whitespace written between fixture tokens.  Every call
 * yields the text for one occurrence, so fuzzed implementations may return
 * a different run each time.
 */
public interface Separators {
    /** Whitespace characters accepted between fixture tokens. */
    String WHITESPACE = " \t\n\u000B\f\r";
    int MAX_FUZZ_RUN = 10;

    /** Single space between tokens, newline after each line. */
    Separators PLAIN = new Separators() {
        @Override public String separator() { return " "; }
        @Override public String lineEnd()   { return "\n"; }
    };

    String separator();
    String lineEnd();

    static boolean isWhitespace(char c) {
        return WHITESPACE.indexOf(c) >= 0;
    }

    /** Every occurrence is an independent run of 1 to 10 whitespace characters. */
    static Separators fuzzed(Random rnd) {
        Objects.requireNonNull(rnd, "rnd");
        return new Separators() {
            @Override public String separator() { return run(); }
            @Override public String lineEnd()   { return run(); }

            private String run() {
                int len = 1 + rnd.nextInt(MAX_FUZZ_RUN);
                StringBuilder sb = new StringBuilder(len);
                for (int i = 0; i < len; i++) sb.append(WHITESPACE.charAt(rnd.nextInt(WHITESPACE.length())));
                return sb.toString();
            }
        };
    }
}
