package com.solv.cli;

import com.solv.core.model.ConfigPlatform;
import com.solv.core.model.Solution;
import com.solv.core.validation.SolutionValidator;
import com.solv.core.validation.ValidationReport;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prints validation findings per solution and problem counters at the end.
 */
class ValidationPrinter extends SolutionReport {

    private final boolean showOnlyProblems;
    private final ValidationStatistics statistics = new ValidationStatistics();

    ValidationPrinter(PrintStream out, boolean verbose, boolean showOnlyProblems) {
        super(out, verbose);
        this.showOnlyProblems = showOnlyProblems;
    }

    @Override
    public void onSuccess(Path path, Solution solution) {
        ValidationReport report = SolutionValidator.validate(path, solution);
        statistics.record(report);

        if (showOnlyProblems && report.isClean()) {
            return;
        }

        out.println(" " + path);
        if (report.isClean()) {
            out.println("   ✓ No problems found");
            return;
        }
        if (report.cycleDetected()) {
            out.println("   ✗ Solution contains project dependency cycles");
        }
        if (!report.danglingConfigurations().isEmpty()) {
            out.println("   ✗ Configurations of projects not declared in the solution:");
            report.danglingConfigurations().forEach(id -> out.println("       " + id));
        }
        for (Map.Entry<String, List<ConfigPlatform>> missing : report.missingConfigurations().entrySet()) {
            out.println("   ✗ Project " + missing.getKey() + " uses configurations missing from the solution:");
            out.println("       " + missing.getValue().stream()
                .map(ConfigPlatform::toString)
                .collect(Collectors.joining(", ")));
        }
        if (!report.unresolvedPaths().isEmpty()) {
            out.println("   ✗ Project files not found:");
            report.unresolvedPaths().forEach(p -> out.println("       " + p));
        }
        out.println();
    }

    @Override
    public void onFailure(Path path) {
        super.onFailure(path);
        statistics.recordFailure();
    }

    @Override
    int finish() {
        int code = super.finish();
        return statistics.hasProblems() ? 1 : code;
    }

    @Override
    protected void printSummary() {
        statistics.print(out);
    }
}
