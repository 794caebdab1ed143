package com.figsearchharness;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks, before any random trial, that the program under test prints
 * coordinates in the row-major order "R1 C1 R2 C2".  Each probe is a small
 * asymmetric bitmap with exactly one answer, so a program that swaps rows
 * and columns is told apart from one that is merely wrong.
 */
public final class ConformanceProbe {

    static final class Case {
        final Query query;
        final Bitmap bitmap;
        final String rowMajor;
        final String columnMajor;

        Case(Query query, Bitmap bitmap, String rowMajor, String columnMajor) {
            this.query = query;
            this.bitmap = bitmap;
            this.rowMajor = rowMajor;
            this.columnMajor = columnMajor;
        }
    }

    private ConformanceProbe(){}

    static List<Case> cases() {
        List<Case> cases = new ArrayList<>();

        // 3 rows x 5 columns, one run on row 1 from column 2 to 4
        Bitmap h = new Bitmap(new BitmapSize(5, 3));
        h.fill(Line.horizontal(1, 2, 4));
        cases.add(new Case(Query.HLINE, h, "1 2 1 4", "2 1 4 1"));

        // 3 rows x 5 columns, one 2x2 block at rows 0-1, columns 2-3
        Bitmap s = new Bitmap(new BitmapSize(5, 3));
        s.fill(Square.at(0, 2, 2));
        cases.add(new Case(Query.SQUARE, s, "0 2 1 3", "2 0 3 1"));
        return cases;
    }

    /**
     * Runs every probe whose query is in {@code queries}.
     *
     * @throws PreconditionViolationException when the program answers in column-major order
     */
    public static void check(ProgramRunner runner, ScratchDirectory scratch, List<Query> queries, PrintStream log) throws IOException {
        for (Case c : cases()) {
            if (!queries.contains(c.query)) continue;
            Path file = scratch.newFile("probe_" + c.query.token());
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
                c.bitmap.write(w);
            }
            ProcessResult r = runner.run(c.query, file);
            String actual = r.stdout.strip();
            if (actual.equals(c.rowMajor)) continue;
            if (actual.equals(c.columnMajor)) {
                throw new PreconditionViolationException("Program prints " + c.query.token() +
                        " coordinates column-major (\"" + actual + "\"); expected row-major \"" + c.rowMajor + "\"");
            }
            log.printf("*conformance: %s probe expected [%s] got [%s] (exit %d)%n",
                    c.query.token(), c.rowMajor, actual, r.exitCode);
        }
    }
}
