package com.figsearchharness;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public final class HarnessConfig {
    public enum Mode { FUNCTIONAL, TIMED }

    public final Mode mode;

    // fixture generation
    public final boolean randomValidity;    // coin flip between valid and corrupted test fixtures
    public final boolean whitespaceFuzz;    // random whitespace runs between tokens
    public final long seed;
    public final int width;                 // 0 = random per fixture (timed: 1920)
    public final int height;                // 0 = random per fixture (timed: 1080)
    public final int maxDimension;          // upper bound for random sizes

    // run control
    public final int trials;
    public final boolean verbose;
    public final boolean interactive;       // ask the operator on uncertain matches
    public final long timeoutSeconds;       // 0 = wait forever
    public final List<Query> queries;

    public final Path scratchDir;
    public final Path program;

    private HarnessConfig(Builder b) {
        this.mode = b.mode;
        this.randomValidity = b.randomValidity;
        this.whitespaceFuzz = b.whitespaceFuzz;
        this.seed = b.seed;
        this.width = b.width;
        this.height = b.height;
        this.maxDimension = b.maxDimension;
        this.trials = b.trials;
        this.verbose = b.verbose;
        this.interactive = b.interactive;
        this.timeoutSeconds = b.timeoutSeconds;
        this.queries = Collections.unmodifiableList(new ArrayList<>(b.queries.isEmpty() ? EnumSet.allOf(Query.class) : b.queries));
        this.scratchDir = b.scratchDir;
        this.program = b.program;
    }

    public static final class Builder {
        private Mode mode = Mode.FUNCTIONAL;
        private boolean randomValidity, whitespaceFuzz, verbose;
        private boolean interactive = true;
        private long seed = 1L;
        private int width = 0, height = 0;
        private int maxDimension = 50;
        private int trials = 10;
        private long timeoutSeconds = 0;
        private final Set<Query> queries = EnumSet.noneOf(Query.class);
        private Path scratchDir = Paths.get("pics");
        private Path program;

        public Builder mode(Mode m){ this.mode=m; return this; }
        public Builder randomValidity(boolean v){ this.randomValidity=v; return this; }
        public Builder whitespaceFuzz(boolean v){ this.whitespaceFuzz=v; return this; }
        public Builder verbose(boolean v){ this.verbose=v; return this; }
        public Builder interactive(boolean v){ this.interactive=v; return this; }
        public Builder seed(long v){ this.seed=v; return this; }
        public Builder width(int v){ this.width=requireNonNegative("width", v); return this; }
        public Builder height(int v){ this.height=requireNonNegative("height", v); return this; }
        public Builder maxDimension(int v){ this.maxDimension=requirePositive("maxdim", v); return this; }
        public Builder trials(int v){ this.trials=requirePositive("trials", v); return this; }
        public Builder timeoutSeconds(long v){ this.timeoutSeconds=Math.max(0, v); return this; }
        public Builder addQuery(Query q){ this.queries.add(q); return this; }
        public Builder scratchDir(Path p){ this.scratchDir=p; return this; }
        public Builder program(Path p){ this.program=p; return this; }

        public HarnessConfig build(){
            if (program == null) throw new IllegalArgumentException("Missing program under test");
            if (scratchDir == null) throw new IllegalArgumentException("Missing scratch directory");
            return new HarnessConfig(this);
        }

        private static int requirePositive(String name, int v) {
            if (v <= 0) throw new IllegalArgumentException(name + " must be positive, got " + v);
            return v;
        }

        private static int requireNonNegative(String name, int v) {
            if (v < 0) throw new IllegalArgumentException(name + " must not be negative, got " + v);
            return v;
        }
    }
}
