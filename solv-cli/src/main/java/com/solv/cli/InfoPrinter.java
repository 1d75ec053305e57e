package com.solv.cli;

import com.solv.core.model.Project;
import com.solv.core.model.Solution;
import com.solv.core.model.VersionEntry;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Prints a summary of each solution and project type totals across all of them.
 */
class InfoPrinter extends SolutionReport {

    private final Map<String, Long> totalsByType = new TreeMap<>();
    private int solutions;

    InfoPrinter(PrintStream out, boolean verbose) {
        super(out, verbose);
    }

    @Override
    public void onSuccess(Path path, Solution solution) {
        solutions++;
        Map<String, Long> byType = solution.iterateProjects()
            .collect(Collectors.groupingBy(Project::typeDescription, TreeMap::new, Collectors.counting()));
        byType.forEach((type, count) -> totalsByType.merge(type, count, Long::sum));

        out.println(" " + path);
        out.printf("   %-28s %s%n", "Format", solution.format());
        if (!solution.product().isEmpty()) {
            out.printf("   %-28s %s%n", "Product", solution.product());
        }
        for (VersionEntry version : solution.versions()) {
            out.printf("   %-28s %s%n", version.name(), version.value());
        }

        out.println();
        out.printf("   %-28s %s%n", "Project type", "Count");
        byType.forEach((type, count) -> out.printf("   %-28s %d%n", type, count));

        out.println();
        out.println("   Configurations: " + String.join(", ", solution.configurationNames()));
        out.println("   Platforms:      " + String.join(", ", solution.platformNames()));
        out.println();
    }

    @Override
    protected void printSummary() {
        if (solutions == 0) {
            return;
        }
        long projects = totalsByType.values().stream().mapToLong(Long::longValue).sum();
        out.println("✓ " + solutions + " solutions, " + projects + " projects");
        totalsByType.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
            .forEach(e -> out.printf("   %-28s %d%n", e.getKey(), e.getValue()));
    }
}
