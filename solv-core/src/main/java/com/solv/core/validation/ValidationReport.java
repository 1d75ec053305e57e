package com.solv.core.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.solv.core.model.ConfigPlatform;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structural findings for one solution. Findings are results, not errors.
 *
 * @param cycleDetected whether project dependencies form a cycle
 * @param danglingConfigurations upper-cased ids of configuration groups with no declared project
 * @param missingConfigurations per project id, pairs absent from the solution configurations
 * @param unresolvedPaths project files that do not exist
 */
public record ValidationReport(
    boolean cycleDetected,
    SortedSet<String> danglingConfigurations,
    Map<String, List<ConfigPlatform>> missingConfigurations,
    SortedSet<Path> unresolvedPaths
) {

    public ValidationReport {
        danglingConfigurations = danglingConfigurations != null
            ? Collections.unmodifiableSortedSet(new TreeSet<>(danglingConfigurations))
            : Collections.emptySortedSet();
        missingConfigurations = missingConfigurations != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(missingConfigurations))
            : Map.of();
        unresolvedPaths = unresolvedPaths != null
            ? Collections.unmodifiableSortedSet(new TreeSet<>(unresolvedPaths))
            : Collections.emptySortedSet();
    }

    /**
     * Returns whether no check found anything.
     */
    @JsonIgnore
    public boolean isClean() {
        return !cycleDetected
            && danglingConfigurations.isEmpty()
            && missingConfigurations.isEmpty()
            && unresolvedPaths.isEmpty();
    }
}
