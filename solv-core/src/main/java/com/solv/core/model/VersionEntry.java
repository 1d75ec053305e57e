package com.solv.core.model;

import java.util.Objects;

/**
 * Version line of a solution, e.g. {@code VisualStudioVersion = 17.0.31903.59}.
 *
 * @param name version name
 * @param value version number
 */
public record VersionEntry(String name, String value) {

    public VersionEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
