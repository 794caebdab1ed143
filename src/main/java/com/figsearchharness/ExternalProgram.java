package com.figsearchharness;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Launches the program under test as {@code <exec> <query> <bitmap>}.
 * Standard output and error go to temporary files so the harness never has
 * to drain pipes while it waits.  With a timeout of zero the call waits
 * indefinitely.
 */
public final class ExternalProgram implements ProgramRunner {
    private final Path exec;
    private final long timeoutSeconds;

    public ExternalProgram(Path exec, long timeoutSeconds) {
        this.exec = Objects.requireNonNull(exec, "exec");
        this.timeoutSeconds = Math.max(0, timeoutSeconds);
    }

    /** Fails fast when the configured program cannot possibly be started. */
    public void checkExecutable() {
        if (!Files.isRegularFile(exec))
            throw new PreconditionViolationException("Program under test not found: " + exec);
        if (!Files.isExecutable(exec))
            throw new PreconditionViolationException("Program under test is not executable: " + exec);
    }

    List<String> command(Query query, Path bitmap) {
        return Arrays.asList(exec.toString(), query.token(), bitmap.toString());
    }

    @Override
    public ProcessResult run(Query query, Path bitmap) {
        Path out = null, err = null;
        try {
            out = Files.createTempFile("figsearch-out", ".txt");
            err = Files.createTempFile("figsearch-err", ".txt");
            ProcessBuilder pb = new ProcessBuilder(command(query, bitmap))
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile());

            long t0 = System.nanoTime();
            Process p = pb.start();
            p.getOutputStream().close();
            boolean finished;
            if (timeoutSeconds > 0) {
                finished = p.waitFor(timeoutSeconds, TimeUnit.SECONDS);
                if (!finished) {
                    p.destroyForcibly();
                    p.waitFor();
                }
            } else {
                p.waitFor();
                finished = true;
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);

            return new ProcessResult(finished ? p.exitValue() : -1,
                    decode(out), decode(err),
                    elapsed, !finished);
        } catch (IOException e) {
            throw new ProcessFailureException("Cannot run " + exec + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessFailureException("Interrupted while waiting for " + exec, e);
        } finally {
            deleteTemp(out);
            deleteTemp(err);
        }
    }

    /** Undecodable bytes become U+FFFD so garbage output still reaches the comparator. */
    static String decode(Path p) throws IOException {
        return new String(Files.readAllBytes(p), StandardCharsets.UTF_8);
    }

    private static void deleteTemp(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            System.err.println("Could not delete temporary file " + p + ": " + e.getMessage());
        }
    }
}
