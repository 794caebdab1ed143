package com.figsearchharness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Directory holding the fixtures of one run.  It is emptied once when the run
 * starts; afterwards files are only added, each under a name made of a
 * per-run sequence number and a random suffix.
 */
public final class ScratchDirectory {
    private static final int SUFFIX_RANGE = 100_000;

    private final Path dir;
    private final Random names;
    private int sequence = 0;

    private ScratchDirectory(Path dir, Random names) {
        this.dir = dir;
        this.names = names;
    }

    /**
     * Creates {@code dir} if needed and deletes every file in it.
     *
     * @throws PreconditionViolationException if {@code dir} is not a directory or
     *         holds anything other than regular files; nothing is deleted then
     */
    public static ScratchDirectory prepare(Path dir, Random names) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(names, "names");
        if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS))
            throw new PreconditionViolationException("Scratch path is not a directory: " + dir);
        Files.createDirectories(dir);

        List<Path> entries = new ArrayList<>();
        try (Stream<Path> s = Files.list(dir)) {
            s.forEach(entries::add);
        }
        for (Path p : entries) {
            if (!Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                throw new PreconditionViolationException("Scratch directory contains a non-regular entry: " + p);
        }
        for (Path p : entries) Files.delete(p);
        return new ScratchDirectory(dir, names);
    }

    public Path path() { return dir; }

    /** A path inside the directory named {@code <prefix>_<seq>_<n>} that does not exist yet. */
    public Path newFile(String prefix) {
        Path p;
        do {
            p = dir.resolve(prefix + "_" + (sequence++) + "_" + names.nextInt(SUFFIX_RANGE));
        } while (Files.exists(p, LinkOption.NOFOLLOW_LINKS));
        return p;
    }
}
