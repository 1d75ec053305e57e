package com.solv.core.validation;

import com.solv.core.model.ConfigPlatform;
import com.solv.core.model.Project;
import com.solv.core.model.ProjectConfigGroup;
import com.solv.core.model.Solution;
import com.solv.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Structural checks over a parsed {@link Solution}.
 *
 * <p>Each check reads the model only. {@link #validate(Path, Solution)} runs all of them.
 */
public final class SolutionValidator {

    private static final Logger log = LoggerFactory.getLogger(SolutionValidator.class);

    private SolutionValidator() {
        // Utility class
    }

    /**
     * Runs every check.
     *
     * @param solutionFile path of the solution file, used to resolve project paths
     * @param solution parsed solution
     * @return findings
     */
    public static ValidationReport validate(Path solutionFile, Solution solution) {
        ValidationReport report = new ValidationReport(
            hasCycles(solution),
            danglingConfigurations(solution),
            missingConfigurations(solution),
            unresolvedPaths(solutionFile, solution)
        );
        log.debug("Validated {}: clean={}", solutionFile, report.isClean());
        return report;
    }

    /**
     * Returns whether project dependencies form a cycle. Cycle members are not reported.
     */
    public static boolean hasCycles(Solution solution) {
        return solution.dependencies().hasCycle();
    }

    /**
     * Returns ids of configuration groups that belong to no declared project.
     *
     * @return upper-cased ids, sorted
     */
    public static SortedSet<String> danglingConfigurations(Solution solution) {
        Set<String> declared = solution.iterateProjects()
            .map(p -> normalize(p.id()))
            .collect(Collectors.toSet());

        SortedSet<String> dangling = new TreeSet<>();
        for (ProjectConfigGroup group : solution.projectConfigurations()) {
            String id = normalize(group.projectId());
            if (!declared.contains(id)) {
                dangling.add(id);
            }
        }
        return dangling;
    }

    /**
     * Returns, per project id, the pairs that are not solution configurations.
     *
     * @return offending pairs in group order; projects without findings are absent
     */
    public static Map<String, List<ConfigPlatform>> missingConfigurations(Solution solution) {
        Set<ConfigPlatform> declared = new HashSet<>(solution.configurations());

        Map<String, List<ConfigPlatform>> missing = new LinkedHashMap<>();
        for (ProjectConfigGroup group : solution.projectConfigurations()) {
            List<ConfigPlatform> absent = group.configurations().stream()
                .filter(c -> !declared.contains(c))
                .toList();
            if (!absent.isEmpty()) {
                missing.merge(group.projectId(), absent, (a, b) -> {
                    Set<ConfigPlatform> merged = new TreeSet<>(a);
                    merged.addAll(b);
                    return List.copyOf(merged);
                });
            }
        }
        return missing;
    }

    /**
     * Returns project files that do not exist.
     *
     * <p>Solution folders, web sites and projects addressed by URL are not checked.
     *
     * @param solutionFile solution file the project paths are relative to
     * @param solution parsed solution
     * @return normalized absolute paths, sorted
     */
    public static SortedSet<Path> unresolvedPaths(Path solutionFile, Solution solution) {
        SortedSet<Path> unresolved = new TreeSet<>();
        solution.iterateProjectsWithoutWebSites()
            .map(Project::path)
            .filter(path -> !FileUtils.isUrl(path))
            .map(path -> FileUtils.resolveProjectPath(solutionFile, path))
            .filter(path -> !Files.exists(path))
            .forEach(unresolved::add);
        return unresolved;
    }

    private static String normalize(String id) {
        return id.toUpperCase(Locale.ROOT);
    }
}
