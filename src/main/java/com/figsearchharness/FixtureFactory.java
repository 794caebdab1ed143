package com.figsearchharness;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Random;

/**
 * Picks the generator for a query, writes the fixture into the scratch
 * directory and records the expected output.  With cross-checking enabled
 * every synthesized answer is compared with a direct scan of the bitmap and
 * differences are reported on the log stream.
 */
public final class FixtureFactory {
    private final Random rnd;
    private final ScratchDirectory scratch;
    private final boolean randomValidity;
    private final boolean whitespaceFuzz;
    private final boolean crossCheck;
    private final PrintStream log;
    private int divergences = 0;

    public FixtureFactory(Random rnd, ScratchDirectory scratch, boolean randomValidity,
                          boolean whitespaceFuzz, boolean crossCheck, PrintStream log) {
        this.rnd = Objects.requireNonNull(rnd, "rnd");
        this.scratch = Objects.requireNonNull(scratch, "scratch");
        this.randomValidity = randomValidity;
        this.whitespaceFuzz = whitespaceFuzz;
        this.crossCheck = crossCheck;
        this.log = Objects.requireNonNull(log, "log");
    }

    /** Number of synthesized answers that disagreed with the direct scan so far. */
    public int divergences() { return divergences; }

    public Fixture create(Query query, BitmapSize size) throws IOException {
        Path file = scratch.newFile(query.token());
        Separators sep = whitespaceFuzz ? Separators.fuzzed(rnd) : Separators.PLAIN;

        switch (query) {
            case TEST: {
                BitmapGenerator gen = new BitmapGenerator(rnd);
                Validity v = (randomValidity && rnd.nextBoolean())
                        ? gen.writeCorrupted(file, size, sep)
                        : gen.writeValid(file, size, sep);
                return new Fixture(query, file, size, v.output());
            }
            case HLINE:
            case VLINE: {
                Line.Axis axis = query == Query.HLINE ? Line.Axis.HORIZONTAL : Line.Axis.VERTICAL;
                SegmentSynthesizer.Result res = new SegmentSynthesizer(rnd, axis).synthesize(size);
                writeBitmap(file, res.bitmap, sep);
                if (crossCheck) {
                    Line scanned = axis == Line.Axis.HORIZONTAL
                            ? ReferenceSearch.longestHorizontal(res.bitmap)
                            : ReferenceSearch.longestVertical(res.bitmap);
                    if (axis == Line.Axis.VERTICAL && isTie(res.longest(), scanned)) {
                        divergences++;
                        log.printf("*note: vline %s tie: expected [%s] keeps the leftmost column;"
                                        + " a program breaking ties by smaller row prints [%s] and is marked failed%n",
                                file.getFileName(), res.expectedOutput(), ReferenceSearch.format(scanned));
                    } else {
                        compare(query, file, res.expectedOutput(), ReferenceSearch.format(scanned));
                    }
                }
                return new Fixture(query, file, size, res.expectedOutput());
            }
            case SQUARE: {
                SquareSynthesizer.Result res = new SquareSynthesizer(rnd).synthesize(size);
                writeBitmap(file, res.bitmap, sep);
                if (crossCheck) {
                    compare(query, file, res.expectedOutput(), ReferenceSearch.format(ReferenceSearch.largestSquare(res.bitmap)));
                }
                return new Fixture(query, file, size, res.expectedOutput());
            }
            default:
                throw new IllegalStateException("Unknown query: " + query);
        }
    }

    private static void writeBitmap(Path file, Bitmap bmp, Separators sep) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.US_ASCII)) {
            new BitmapWriter(sep).write(w, bmp);
        }
    }

    private static boolean isTie(Line synthesized, Line scanned) {
        return synthesized != null && scanned != null
                && synthesized.length() == scanned.length() && !synthesized.equals(scanned);
    }

    private void compare(Query query, Path file, String synthesized, String scanned) {
        if (synthesized.equals(scanned)) return;
        divergences++;
        log.printf("*note: %s %s synthesized answer [%s] differs from scan [%s]%n",
                query.token(), file.getFileName(), synthesized, scanned);
    }
}
