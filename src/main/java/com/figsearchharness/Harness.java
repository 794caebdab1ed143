package com.figsearchharness;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Random;

/**
 * Sequential trial loop: generate a fixture, run the program on it, judge
 * the output, and move on only once any review or acknowledgement is done.
 */
public final class Harness {
    static final BitmapSize DEFAULT_TIMED_SIZE = new BitmapSize(1920, 1080);

    private final HarnessConfig cfg;
    private final ProgramRunner runner;
    private final ReviewResolver resolver;
    private final PrintStream out;

    public Harness(HarnessConfig cfg, ProgramRunner runner, ReviewResolver resolver, PrintStream out) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.out = Objects.requireNonNull(out, "out");
    }

    /** Runs {@code trials} rounds, each exercising every configured query once. */
    public HarnessStats runFunctional(ScratchDirectory scratch) throws IOException {
        out.println("[functionality test]");
        Random rnd = new Random(cfg.seed);
        FixtureFactory factory = new FixtureFactory(rnd, scratch, cfg.randomValidity, cfg.whitespaceFuzz, cfg.verbose, out);
        HarnessStats stats = new HarnessStats();

        for (int trial = 1; trial <= cfg.trials; trial++) {
            for (Query q : cfg.queries) {
                Fixture f = factory.create(q, functionalSize(rnd));
                TrialResult t = runTrial(f);
                stats.record(t);
                if (cfg.verbose) {
                    out.printf("trial %d %s -> %s (%.3fms)%n", trial, f, t.passed ? "pass" : "fail",
                            HarnessStats.millis(t.process.elapsed));
                }
            }
        }
        stats.oracleDivergences = factory.divergences();
        return stats;
    }

    /**
     * Measures wall-clock time of each invocation.  A nonzero exit code aborts
     * the run because the measured duration would be meaningless.
     */
    public HarnessStats runTimed(ScratchDirectory scratch) throws IOException {
        out.println("[timed test]");
        Random rnd = new Random(cfg.seed);
        FixtureFactory factory = new FixtureFactory(rnd, scratch, cfg.randomValidity, cfg.whitespaceFuzz, false, out);
        BitmapSize size = timedSize();
        HarnessStats stats = new HarnessStats();

        for (Query q : cfg.queries) {
            for (int trial = 1; trial <= cfg.trials; trial++) {
                Fixture f = factory.create(q, size);
                ProcessResult r = runner.run(q, f.path());
                if (!r.succeeded()) {
                    throw new ProcessFailureException("Timed " + q.token() + " run on " + f.path() +
                            (r.timedOut ? " timed out" : " returned " + r.exitCode + "; expected: 0"), r.exitCode);
                }
                stats.recordDuration(q, r.elapsed);
                out.printf("%s took: %.3fms%n", q.token(), HarnessStats.millis(r.elapsed));
            }
        }
        return stats;
    }

    /** Runs one fixture and settles its verdict, asking the resolver where needed. */
    TrialResult runTrial(Fixture f) {
        ProcessResult r = runner.run(f.query(), f.path());
        if (!r.succeeded()) {
            report("FAIL", f, r, r.timedOut ? "timed out" : "exit code " + r.exitCode + ", expected 0");
            resolver.acknowledgeFailure(f, r.stdout);
            return new TrialResult(f, r, null, false);
        }

        Verdict v = OutputComparator.classify(f.expectedOutput(), r.stdout);
        switch (v) {
            case PASS:
                return new TrialResult(f, r, v, true);
            case NEEDS_REVIEW: {
                report("UNCERTAIN", f, r, "expected output found inside actual output");
                boolean accepted = resolver.accept(f, r.stdout);
                out.println(accepted ? "  -> accepted" : "  -> rejected");
                return new TrialResult(f, r, v, accepted);
            }
            case FAIL:
                report("FAIL", f, r, "output mismatch");
                resolver.acknowledgeFailure(f, r.stdout);
                return new TrialResult(f, r, v, false);
            default:
                throw new IllegalStateException("Unknown verdict: " + v);
        }
    }

    private void report(String tag, Fixture f, ProcessResult r, String reason) {
        out.printf("[%s] %s: %s%n", tag, f, reason);
        out.printf("  expected: %s%n", f.expectedOutput());
        out.printf("  actual:   %s%n", r.stdout.strip());
        if (!r.stderr.isBlank()) out.printf("  stderr:   %s%n", r.stderr.strip());
    }

    private BitmapSize functionalSize(Random rnd) {
        int w = cfg.width > 0 ? cfg.width : 1 + rnd.nextInt(cfg.maxDimension);
        int h = cfg.height > 0 ? cfg.height : 1 + rnd.nextInt(cfg.maxDimension);
        return new BitmapSize(w, h);
    }

    private BitmapSize timedSize() {
        return new BitmapSize(cfg.width > 0 ? cfg.width : DEFAULT_TIMED_SIZE.width(),
                cfg.height > 0 ? cfg.height : DEFAULT_TIMED_SIZE.height());
    }
}
