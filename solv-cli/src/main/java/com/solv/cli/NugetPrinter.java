package com.solv.cli;

import com.solv.core.model.Project;
import com.solv.core.model.Solution;
import com.solv.core.msbuild.MsbuildProject;
import com.solv.core.msbuild.MsbuildProjectReader;
import com.solv.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Prints the versions of each NuGet package referenced by a solution's projects.
 */
class NugetPrinter extends SolutionReport {

    private static final Logger log = LoggerFactory.getLogger(NugetPrinter.class);

    private final boolean onlyMismatched;
    private final MsbuildProjectReader reader;
    private int mismatches;

    NugetPrinter(PrintStream out, boolean verbose, boolean onlyMismatched, MsbuildProjectReader reader) {
        super(out, verbose);
        this.onlyMismatched = onlyMismatched;
        this.reader = reader;
    }

    @Override
    public void onSuccess(Path path, Solution solution) {
        SortedMap<String, SortedSet<String>> packages = packageVersions(path, solution);
        if (onlyMismatched) {
            packages.values().removeIf(versions -> versions.size() < 2);
        }
        mismatches += (int) packages.values().stream().filter(v -> v.size() > 1).count();

        if (packages.isEmpty()) {
            return;
        }
        out.println(" " + path);
        for (Map.Entry<String, SortedSet<String>> entry : packages.entrySet()) {
            out.printf("   %-48s %s%n", entry.getKey(), String.join(", ", entry.getValue()));
        }
        out.println();
    }

    /**
     * Collects package versions from every project file of the solution that can be read.
     *
     * @return package id to the distinct versions requested for it
     */
    SortedMap<String, SortedSet<String>> packageVersions(Path solutionFile, Solution solution) {
        SortedMap<String, SortedSet<String>> packages = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        solution.iterateProjectsWithoutWebSites()
            .map(Project::path)
            .filter(p -> !FileUtils.isUrl(p))
            .map(p -> FileUtils.resolveProjectPath(solutionFile, p))
            .filter(Files::isRegularFile)
            .forEach(projectFile -> {
                try {
                    MsbuildProject project = reader.read(projectFile);
                    for (MsbuildProject.PackageReference reference : project.packageReferences()) {
                        packages.computeIfAbsent(reference.include(), k -> new TreeSet<>()).add(reference.version());
                    }
                } catch (IOException e) {
                    log.warn("Failed to read project file: {} - {}", projectFile, e.getMessage());
                }
            });
        return packages;
    }

    @Override
    protected void printSummary() {
        if (mismatches > 0) {
            out.println("✗ " + mismatches + " packages referenced with more than one version");
        }
    }
}
