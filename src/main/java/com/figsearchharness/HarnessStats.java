package com.figsearchharness;

import java.io.PrintStream;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public final class HarnessStats {
    public int trials;
    public int passed;
    public int failed;
    public int processFailures;
    public int reviewsAccepted;
    public int reviewsRejected;
    public int oracleDivergences;

    private final Map<Query, int[]> perQuery = new EnumMap<>(Query.class);   // {passed, failed}

    private final Timing overall = new Timing();
    private final Map<Query, Timing> perQueryTiming = new EnumMap<>(Query.class);

    private static final class Timing {
        long totalNanos;
        long minNanos = Long.MAX_VALUE;
        long maxNanos;
        int runs;

        void add(long n) {
            totalNanos += n;
            minNanos = Math.min(minNanos, n);
            maxNanos = Math.max(maxNanos, n);
            runs++;
        }

        Duration mean() { return runs == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / runs); }
        Duration min() { return runs == 0 ? Duration.ZERO : Duration.ofNanos(minNanos); }
        Duration max() { return Duration.ofNanos(maxNanos); }
    }

    public void record(TrialResult t) {
        trials++;
        int[] pf = perQuery.computeIfAbsent(t.fixture.query(), q -> new int[2]);
        if (t.passed) { passed++; pf[0]++; } else { failed++; pf[1]++; }
        if (t.processFailed()) processFailures++;
        if (t.reviewed()) {
            if (t.passed) reviewsAccepted++; else reviewsRejected++;
        }
        recordDuration(t.fixture.query(), t.process.elapsed);
    }

    public void recordDuration(Query q, Duration d) {
        long n = d.toNanos();
        overall.add(n);
        perQueryTiming.computeIfAbsent(q, k -> new Timing()).add(n);
    }

    public int passed(Query q) { int[] pf = perQuery.get(q); return pf == null ? 0 : pf[0]; }
    public int failed(Query q) { int[] pf = perQuery.get(q); return pf == null ? 0 : pf[1]; }

    public int timedRuns() { return overall.runs; }

    /** Mean duration over every recorded run, zero when nothing ran. */
    public Duration meanDuration() { return overall.mean(); }
    public Duration minDuration() { return overall.min(); }
    public Duration maxDuration() { return overall.max(); }

    public int timedRuns(Query q) { Timing t = perQueryTiming.get(q); return t == null ? 0 : t.runs; }
    public Duration meanDuration(Query q) { Timing t = perQueryTiming.get(q); return t == null ? Duration.ZERO : t.mean(); }
    public Duration minDuration(Query q) { Timing t = perQueryTiming.get(q); return t == null ? Duration.ZERO : t.min(); }
    public Duration maxDuration(Query q) { Timing t = perQueryTiming.get(q); return t == null ? Duration.ZERO : t.max(); }

    public boolean allPassed() { return failed == 0; }

    public void printFunctionalTotals(PrintStream out, boolean verbose) {
        out.println(this);
        if (!verbose) return;
        for (Map.Entry<Query, int[]> e : perQuery.entrySet()) {
            out.printf("*  %-6s passed=%d failed=%d%n", e.getKey().token(), e.getValue()[0], e.getValue()[1]);
        }
        out.printf("*reviews accepted=%d rejected=%d oracle_divergences=%d%n",
                reviewsAccepted, reviewsRejected, oracleDivergences);
    }

    /** One {@code *Totals} line per query, in query order. */
    public void printTimingTotals(PrintStream out) {
        for (Map.Entry<Query, Timing> e : perQueryTiming.entrySet()) {
            Timing t = e.getValue();
            out.printf("*Totals: query=%s runs=%d mean=%.3fms min=%.3fms max=%.3fms%n", e.getKey().token(),
                    t.runs, millis(t.mean()), millis(t.min()), millis(t.max()));
        }
    }

    static double millis(Duration d) {
        return d.toNanos() / 1_000_000.0;
    }

    @Override
    public String toString() {
        return "*Totals: trials=" + trials +
                " passed=" + passed +
                " failed=" + failed +
                " process_failures=" + processFailures;
    }
}
