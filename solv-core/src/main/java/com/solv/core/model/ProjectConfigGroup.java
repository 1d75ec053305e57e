package com.solv.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Configuration/platform pairs that one project declares in the global section.
 *
 * <p>The pairs are the solution-level side of each mapping line (the key), so they are
 * comparable with {@link Solution#configurations()}.
 *
 * @param projectId project guid as written in the file
 * @param configurations deduplicated pairs, sorted
 */
public record ProjectConfigGroup(String projectId, SortedSet<ConfigPlatform> configurations) {

    public ProjectConfigGroup {
        Objects.requireNonNull(projectId, "projectId must not be null");
        configurations = configurations != null
            ? Collections.unmodifiableSortedSet(new TreeSet<>(configurations))
            : Collections.emptySortedSet();
    }

    public static ProjectConfigGroup of(String projectId, Collection<ConfigPlatform> configurations) {
        return new ProjectConfigGroup(projectId, new TreeSet<>(configurations));
    }
}
