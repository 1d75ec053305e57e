package com.solv.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.solv.core.graph.DependencyGraph;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Parsed solution file.
 *
 * <p>Built once by the reducer and never modified afterwards.
 *
 * @param format file format version, e.g. "12.00"
 * @param product product label taken from the comment after the format line, empty when absent
 * @param projects all projects in declaration order, solution folders included
 * @param versions version lines in declaration order
 * @param configurations solution configuration/platform pairs in declaration order, deduplicated
 * @param projectConfigurations per-project configuration groups in first-seen order
 * @param dependencies "depends on" graph over non-folder projects
 */
public record Solution(
    String format,
    String product,
    List<Project> projects,
    List<VersionEntry> versions,
    List<ConfigPlatform> configurations,
    List<ProjectConfigGroup> projectConfigurations,
    @JsonIgnore DependencyGraph dependencies
) {

    public Solution {
        Objects.requireNonNull(format, "format must not be null");
        product = product != null ? product : "";
        projects = projects != null ? List.copyOf(projects) : List.of();
        versions = versions != null ? List.copyOf(versions) : List.of();
        configurations = configurations != null ? List.copyOf(configurations) : List.of();
        projectConfigurations = projectConfigurations != null ? List.copyOf(projectConfigurations) : List.of();
        dependencies = dependencies != null ? dependencies : DependencyGraph.empty();
    }

    /**
     * Projects other than solution folders.
     */
    public Stream<Project> iterateProjects() {
        return projects.stream().filter(p -> !p.isSolutionFolder());
    }

    /**
     * Projects other than solution folders and web sites, i.e. projects backed by a project file.
     */
    public Stream<Project> iterateProjectsWithoutWebSites() {
        return iterateProjects().filter(p -> !p.isWebSite());
    }

    /**
     * Finds a project by id, ignoring case.
     */
    public Optional<Project> findProject(String id) {
        String wanted = id.toUpperCase(Locale.ROOT);
        return projects.stream()
            .filter(p -> p.id().toUpperCase(Locale.ROOT).equals(wanted))
            .findFirst();
    }

    /**
     * Distinct configuration names of the solution configurations, in declaration order.
     */
    public Set<String> configurationNames() {
        Set<String> names = new LinkedHashSet<>();
        configurations.forEach(c -> names.add(c.configuration()));
        return names;
    }

    /**
     * Distinct platform names of the solution configurations, in declaration order.
     */
    public Set<String> platformNames() {
        Set<String> names = new LinkedHashSet<>();
        configurations.forEach(c -> names.add(c.platform()));
        return names;
    }
}
