package com.figsearchharness;

import java.nio.file.Path;
import java.util.Objects;

/** A fixture file on disk paired with the output the program under test must print for it. */
public final class Fixture {
    private final Query query;
    private final Path path;
    private final BitmapSize size;
    private final String expectedOutput;

    public Fixture(Query query, Path path, BitmapSize size, String expectedOutput) {
        this.query = Objects.requireNonNull(query, "query");
        this.path = Objects.requireNonNull(path, "path");
        this.size = Objects.requireNonNull(size, "size");
        this.expectedOutput = Objects.requireNonNull(expectedOutput, "expectedOutput");
    }

    public Query query()           { return query; }
    public Path path()             { return path; }
    public BitmapSize size()       { return size; }
    public String expectedOutput() { return expectedOutput; }

    @Override public String toString() {
        return query.token() + " " + path + " " + size.height() + "x" + size.width();
    }
}
