package com.figsearchharness;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Asks the operator on the console.  Uncertain matches need an explicit
 * "y"; failures wait for Enter.  End of input counts as a rejection so a
 * closed stdin never turns into a pass.
 */
public final class ConsoleReviewResolver implements ReviewResolver {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleReviewResolver(BufferedReader in, PrintStream out) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public boolean accept(Fixture fixture, String actual) {
        out.print("Accept this output as correct? [y/N] ");
        out.flush();
        String answer = readLine();
        return answer != null && answer.trim().toLowerCase(Locale.ROOT).startsWith("y");
    }

    @Override
    public void acknowledgeFailure(Fixture fixture, String actual) {
        out.print("Press Enter to continue...");
        out.flush();
        readLine();
    }

    private String readLine() {
        try {
            String line = in.readLine();
            if (line == null) out.println();
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read operator input", e);
        }
    }
}
