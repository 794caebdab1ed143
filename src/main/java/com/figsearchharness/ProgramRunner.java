package com.figsearchharness;

import java.nio.file.Path;

/** Runs the program under test on one fixture and blocks until it finishes. */
public interface ProgramRunner {
    ProcessResult run(Query query, Path bitmap);
}
