package com.figsearchharness;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Drives the trial loop against in-process stand-ins for the program under test. */
public class HarnessTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private static ProcessResult ok(String stdout) {
        return new ProcessResult(0, stdout, "", Duration.ofMillis(2), false);
    }

    /** Answers like a correct program would for the test and hline queries. */
    static String referenceAnswer(Query q, Path bitmap) {
        try {
            Bitmap bmp = Bitmap.readFromFile(bitmap);
            switch (q) {
                case TEST: return "Valid\n";
                case HLINE: return ReferenceSearch.format(ReferenceSearch.longestHorizontal(bmp)) + "\n";
                default: throw new IllegalArgumentException("not supported here: " + q);
            }
        } catch (IOException e) {
            if (q == Query.TEST) return "Invalid\n";
            throw new UncheckedIOException(e);
        }
    }

    private static final class RecordingResolver implements ReviewResolver {
        final boolean acceptAll;
        int reviews, acknowledgements;

        RecordingResolver(boolean acceptAll) { this.acceptAll = acceptAll; }

        @Override public boolean accept(Fixture fixture, String actual) { reviews++; return acceptAll; }
        @Override public void acknowledgeFailure(Fixture fixture, String actual) { acknowledgements++; }
    }

    private HarnessConfig.Builder config() {
        return new HarnessConfig.Builder()
                .program(tempDir.resolve("figsearch"))
                .scratchDir(tempDir.resolve("pics"))
                .interactive(false)
                .trials(6)
                .maxDimension(25);
    }

    private ScratchDirectory scratch(String name) throws IOException {
        return ScratchDirectory.prepare(tempDir.resolve(name), new Random(1));
    }

    @Test
    public void correctProgramPassesEveryTrial() throws IOException {
        HarnessConfig cfg = config().randomValidity(true).whitespaceFuzz(true)
                .addQuery(Query.TEST).addQuery(Query.HLINE).build();
        RecordingResolver resolver = new RecordingResolver(false);
        HarnessStats stats = new Harness(cfg, (q, p) -> ok(referenceAnswer(q, p)), resolver, out).runFunctional(scratch("s"));

        assertEquals(12, stats.trials);
        assertTrue(stats.allPassed(), buffer.toString(StandardCharsets.UTF_8));
        assertEquals(6, stats.passed(Query.TEST));
        assertEquals(6, stats.passed(Query.HLINE));
        assertEquals(0, resolver.reviews);
        assertEquals(0, resolver.acknowledgements);
    }

    @Test
    public void decoratedOutputIsEscalatedAndAccepted() throws IOException {
        HarnessConfig cfg = config().addQuery(Query.TEST).build();
        RecordingResolver resolver = new RecordingResolver(true);
        HarnessStats stats = new Harness(cfg, (q, p) -> ok("Result: " + referenceAnswer(q, p)), resolver, out)
                .runFunctional(scratch("s"));

        assertEquals(6, resolver.reviews);
        assertEquals(6, stats.reviewsAccepted);
        assertTrue(stats.allPassed());
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("[UNCERTAIN]"));
    }

    @Test
    public void batchResolverRejectsUncertainMatches() throws IOException {
        HarnessConfig cfg = config().addQuery(Query.TEST).build();
        HarnessStats stats = new Harness(cfg, (q, p) -> ok("Error: Invalid bitmap, " + referenceAnswer(q, p)),
                ReviewResolver.BATCH, out).runFunctional(scratch("s"));

        assertEquals(6, stats.failed);
        assertEquals(6, stats.reviewsRejected);
        assertFalse(stats.allPassed());
    }

    @Test
    public void wrongAnswerFailsAndIsAcknowledged() throws IOException {
        HarnessConfig cfg = config().addQuery(Query.SQUARE).build();
        RecordingResolver resolver = new RecordingResolver(true);
        HarnessStats stats = new Harness(cfg, (q, p) -> ok("-1 -1 -1 -1\n"), resolver, out).runFunctional(scratch("s"));

        assertEquals(6, stats.failed(Query.SQUARE));
        assertEquals(0, resolver.reviews);
        assertEquals(6, resolver.acknowledgements);
        String log = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(log.contains("[FAIL]"));
        assertTrue(log.contains("expected:"));
        assertTrue(log.contains("actual:   -1 -1 -1 -1"));
    }

    @Test
    public void nonzeroExitIsRecordedAndTheRunContinues() throws IOException {
        HarnessConfig cfg = config().addQuery(Query.VLINE).build();
        RecordingResolver resolver = new RecordingResolver(true);
        ProgramRunner crashing = (q, p) -> new ProcessResult(139, "", "segfault", Duration.ofMillis(1), false);
        HarnessStats stats = new Harness(cfg, crashing, resolver, out).runFunctional(scratch("s"));

        assertEquals(6, stats.trials);
        assertEquals(6, stats.processFailures);
        assertEquals(6, resolver.acknowledgements);
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("stderr:   segfault"));
    }

    @Test
    public void timedRunAveragesDurations() throws IOException {
        HarnessConfig cfg = config().mode(HarnessConfig.Mode.TIMED).width(40).height(30).trials(4)
                .addQuery(Query.TEST).build();
        List<Path> seen = new ArrayList<>();
        ProgramRunner runner = (q, p) -> {
            seen.add(p);
            return new ProcessResult(0, "Valid", "", Duration.ofMillis(10L * seen.size()), false);
        };
        HarnessStats stats = new Harness(cfg, runner, ReviewResolver.BATCH, out).runTimed(scratch("s"));

        assertEquals(4, stats.timedRuns());
        assertEquals(Duration.ofMillis(25), stats.meanDuration());
        assertEquals(Duration.ofMillis(10), stats.minDuration());
        assertEquals(Duration.ofMillis(40), stats.maxDuration());
        assertEquals(new BitmapSize(40, 30), Bitmap.readFromFile(seen.get(0)).size());
    }

    @Test
    public void timedTotalsAreKeptPerQuery() throws IOException {
        HarnessConfig cfg = config().mode(HarnessConfig.Mode.TIMED).width(20).height(10).trials(2)
                .addQuery(Query.TEST).addQuery(Query.HLINE).build();
        ProgramRunner runner = (q, p) ->
                new ProcessResult(0, "", "", Duration.ofMillis(q == Query.TEST ? 10 : 100), false);
        HarnessStats stats = new Harness(cfg, runner, ReviewResolver.BATCH, out).runTimed(scratch("s"));

        assertEquals(2, stats.timedRuns(Query.TEST));
        assertEquals(2, stats.timedRuns(Query.HLINE));
        assertEquals(0, stats.timedRuns(Query.SQUARE));
        assertEquals(Duration.ofMillis(10), stats.meanDuration(Query.TEST));
        assertEquals(Duration.ofMillis(100), stats.meanDuration(Query.HLINE));
        assertEquals(Duration.ofMillis(100), stats.minDuration(Query.HLINE));

        ByteArrayOutputStream totals = new ByteArrayOutputStream();
        stats.printTimingTotals(new PrintStream(totals, true, StandardCharsets.UTF_8));
        String[] lines = totals.toString(StandardCharsets.UTF_8).trim().split("\\R");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("*Totals: query=test runs=2 "), lines[0]);
        assertTrue(lines[1].startsWith("*Totals: query=hline runs=2 "), lines[1]);
    }

    @Test
    public void timedRunAbortsOnNonzeroExit() throws IOException {
        HarnessConfig cfg = config().mode(HarnessConfig.Mode.TIMED).width(5).height(5).addQuery(Query.TEST).build();
        ProgramRunner failing = (q, p) -> new ProcessResult(1, "", "", Duration.ofMillis(1), false);
        ScratchDirectory sd = scratch("s");
        ProcessFailureException e = assertThrows(ProcessFailureException.class,
                () -> new Harness(cfg, failing, ReviewResolver.BATCH, out).runTimed(sd));
        assertEquals(1, e.exitCode());
    }

    @Test
    public void sameSeedReplaysTheSameFixtures() throws IOException {
        HarnessConfig cfg = config().seed(77).randomValidity(true).whitespaceFuzz(true).build();
        List<byte[]> first = new ArrayList<>(), second = new ArrayList<>();

        new Harness(cfg, (q, p) -> { first.add(read(p)); return ok(""); }, ReviewResolver.BATCH, out).runFunctional(scratch("a"));
        new Harness(cfg, (q, p) -> { second.add(read(p)); return ok(""); }, ReviewResolver.BATCH, out).runFunctional(scratch("b"));

        assertEquals(24, first.size());
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) assertArrayEquals(first.get(i), second.get(i), "fixture " + i);
    }

    private static byte[] read(Path p) {
        try {
            return Files.readAllBytes(p);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
