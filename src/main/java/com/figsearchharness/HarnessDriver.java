package com.figsearchharness;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Runs one harness job end to end:
 *  - parse the command line (OptionsParser)
 *  - clear the scratch directory
 *  - check that the program exists and prints coordinates in the canonical order
 *  - dispatch to the functional or the timed loop
 *  - print totals and elapsed time
 *
 * The returned value is the process exit code: 0 all trials passed, 1 a trial
 * failed or I/O broke, 2 bad arguments or environment, -1 anything else.
 */
public final class HarnessDriver {
    private static final long NAME_SEED_SALT = 0x5DEECE66DL;

    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader console;

    public HarnessDriver() {
        this(System.out, System.err, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    public HarnessDriver(PrintStream out, PrintStream err, BufferedReader console) {
        this.out = out;
        this.err = err;
        this.console = console;
    }

    public int run(String[] args) {
        HarnessConfig cfg;
        try {
            cfg = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            return 2;
        }

        final Instant t0 = Instant.now();
        try {
            ExternalProgram program = new ExternalProgram(cfg.program, cfg.timeoutSeconds);
            program.checkExecutable();
            ScratchDirectory scratch = ScratchDirectory.prepare(cfg.scratchDir, new Random(cfg.seed ^ NAME_SEED_SALT));

            int code;
            if (cfg.mode == HarnessConfig.Mode.TIMED) {
                HarnessStats stats = new Harness(cfg, program, ReviewResolver.BATCH, out).runTimed(scratch);
                stats.printTimingTotals(out);
                code = 0;
            } else {
                ConformanceProbe.check(program, scratch, cfg.queries, out);
                ReviewResolver resolver = cfg.interactive ? new ConsoleReviewResolver(console, out) : ReviewResolver.BATCH;
                HarnessStats stats = new Harness(cfg, program, resolver, out).runFunctional(scratch);
                stats.printFunctionalTotals(out, cfg.verbose);
                code = stats.allPassed() ? 0 : 1;
            }

            double secs = Duration.between(t0, Instant.now()).toMillis() / 1000.0;
            out.printf("*elapsed time: %.3f seconds%n", secs);
            return code;
        } catch (PreconditionViolationException e) {
            err.println("Precondition violated: " + e.getMessage());
            return 2;
        } catch (ProcessFailureException e) {
            err.println("Process failure: " + e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            err.println("*unrecoverable error: " + e);
            return -1;
        }
    }

    static void usage(PrintStream err) {
        err.println(
                "Usage: figsearch-harness [options] <program>\n" +
                        "Modes:\n" +
                        "  -functional   compare outputs against generated answers  [default]\n" +
                        "  -time         measure wall-clock time per invocation\n" +
                        "Options:\n" +
                        "  -random       mix corrupted fixtures into the test query\n" +
                        "  -whitespace   random whitespace runs between tokens\n" +
                        "  -verbose      per-trial lines, answer cross-check, per-query totals\n" +
                        "  -batch        never prompt; uncertain matches count as failures\n" +
                        "  -seed N       random seed (default 1)\n" +
                        "  -trials N     number of rounds (default 10)\n" +
                        "  -width N      fixed bitmap width (default random, timed 1920)\n" +
                        "  -height N     fixed bitmap height (default random, timed 1080)\n" +
                        "  -maxdim N     upper bound for random dimensions (default 50)\n" +
                        "  -timeout S    kill the program after S seconds (0 = wait forever)\n" +
                        "  -scratch DIR  fixture directory, emptied at start (default pics)\n" +
                        "  -queries q,.. subset of test,hline,vline,square\n" +
                        "Note: vline ties keep the leftmost column, so a program that breaks ties\n" +
                        "      by smaller row can fail on equal-length runs; -verbose names them.\n"
        );
    }
}
