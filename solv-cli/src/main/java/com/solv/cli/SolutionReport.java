package com.solv.cli;

import com.solv.core.scanner.SolutionConsumer;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for console reports fed by the scanner.
 *
 * <p>Collects the files that could not be parsed and lists them when the report finishes.
 */
public abstract class SolutionReport implements SolutionConsumer {

    protected final PrintStream out;
    private final boolean verbose;
    private final List<Path> failures = new ArrayList<>();

    protected SolutionReport(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    @Override
    public void onFailure(Path path) {
        failures.add(path);
    }

    @Override
    public boolean isVerboseMode() {
        return verbose;
    }

    /**
     * Prints the summary and the files that could not be parsed.
     *
     * @return process exit code
     */
    int finish() {
        printSummary();
        if (!failures.isEmpty()) {
            out.println();
            out.println("✗ Files that could not be parsed:");
            failures.stream().sorted().forEach(p -> out.println("    " + p));
        }
        return failures.isEmpty() ? 0 : 1;
    }

    /**
     * Prints report-specific totals. Does nothing by default.
     */
    protected void printSummary() {
    }
}
