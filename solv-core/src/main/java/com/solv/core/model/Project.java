package com.solv.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Project declared in a solution.
 *
 * <p>Optional parts are never null: a project without configurations, solution items or
 * dependencies has empty collections.
 *
 * @param typeGuid project type guid
 * @param typeDescription label from {@link ProjectTypes}, or the guid when unknown
 * @param id project guid
 * @param name display name
 * @param path path relative to the solution directory, as written (may use {@code \})
 * @param configurations solution configuration/platform pairs mapped for this project
 * @param items files attached through a {@code SolutionItems} section
 * @param dependsOn ids of projects this project depends on
 */
public record Project(
    String typeGuid,
    String typeDescription,
    String id,
    String name,
    String path,
    SortedSet<ConfigPlatform> configurations,
    List<String> items,
    List<String> dependsOn
) {

    public Project {
        Objects.requireNonNull(typeGuid, "typeGuid must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(path, "path must not be null");
        typeDescription = typeDescription != null ? typeDescription : ProjectTypes.describe(typeGuid);
        configurations = configurations != null
            ? Collections.unmodifiableSortedSet(new TreeSet<>(configurations))
            : Collections.emptySortedSet();
        items = items != null ? List.copyOf(items) : List.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    @JsonIgnore
    public boolean isSolutionFolder() {
        return ProjectTypes.isSolutionFolder(typeGuid);
    }

    @JsonIgnore
    public boolean isWebSite() {
        return ProjectTypes.WEB_SITE.equals(typeDescription);
    }
}
