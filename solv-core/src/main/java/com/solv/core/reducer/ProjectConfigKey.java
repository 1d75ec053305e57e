package com.solv.core.reducer;

import com.solv.core.model.ConfigPlatform;

import java.util.Objects;

/**
 * Left-hand side of a per-project configuration line, decomposed.
 *
 * @param projectId project guid
 * @param configuration solution configuration/platform pair, {@link ConfigPlatform#INVALID} when unparseable
 */
public record ProjectConfigKey(String projectId, ConfigPlatform configuration) {

    public ProjectConfigKey {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");
    }

    public boolean isValid() {
        return !projectId.isEmpty() && configuration.isValid();
    }
}
