package com.solv.cli;

import com.solv.core.validation.ValidationReport;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Counts solutions per kind of problem.
 */
class ValidationStatistics {

    private int cycles;
    private int danglings;
    private int missings;
    private int notFound;
    private int parsed;
    private int notParsed;

    void record(ValidationReport report) {
        parsed++;
        if (report.cycleDetected()) {
            cycles++;
        }
        if (!report.danglingConfigurations().isEmpty()) {
            danglings++;
        }
        if (!report.missingConfigurations().isEmpty()) {
            missings++;
        }
        if (!report.unresolvedPaths().isEmpty()) {
            notFound++;
        }
    }

    void recordFailure() {
        notParsed++;
    }

    int total() {
        return parsed + notParsed;
    }

    int cycles() {
        return cycles;
    }

    int danglings() {
        return danglings;
    }

    int missings() {
        return missings;
    }

    int notFound() {
        return notFound;
    }

    int parsed() {
        return parsed;
    }

    int notParsed() {
        return notParsed;
    }

    boolean hasProblems() {
        return cycles + danglings + missings + notFound > 0;
    }

    void print(PrintStream out) {
        if (total() == 0) {
            return;
        }
        out.println("Statistic:");
        printRow(out, "Solutions with dependency cycles", cycles);
        printRow(out, "Solutions with dangling configurations", danglings);
        printRow(out, "Solutions with missing configurations", missings);
        printRow(out, "Solutions with missing project files", notFound);
        printRow(out, "Parsed", parsed);
        printRow(out, "Not parsed", notParsed);
        out.printf(Locale.ROOT, "  %-42s %6d%n", "Total", total());
    }

    private void printRow(PrintStream out, String label, int value) {
        out.printf(Locale.ROOT, "  %-42s %6d %8.2f%%%n", label, value, percent(value, total()));
    }

    static double percent(int value, int total) {
        return total == 0 ? 0.0 : (value * 100.0) / total;
    }
}
