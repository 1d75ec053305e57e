package com.solv.core.reducer;

import com.solv.core.model.ConfigPlatform;

/**
 * Decomposes per-project configuration keys.
 *
 * <p>Keys look like {@code {ID}.Debug .NET 4.0|Any CPU.ActiveCfg} or
 * {@code {ID}.Release|.NET.Build.0}. Configuration and platform names may themselves contain
 * dots, so the key is cut at fixed anchors:
 * <ol>
 *   <li>the project id ends at the first {@code .}</li>
 *   <li>the configuration runs from there to the first {@code |}</li>
 *   <li>the platform is the rest minus a {@code .ActiveCfg} suffix, or minus its last two
 *       dot-separated segments ({@code .Build.0}, {@code .Deploy.0})</li>
 * </ol>
 */
public final class ConfigKeyParser {

    private static final String ACTIVE_CFG = ".ActiveCfg";

    private ConfigKeyParser() {
        // Utility class
    }

    /**
     * Decomposes a {@code ProjectConfigurationPlatforms} key.
     *
     * @param key line key
     * @return decomposed key; its pair is {@link ConfigPlatform#INVALID} when the key has no such shape
     */
    public static ProjectConfigKey parse(String key) {
        int dot = key.indexOf('.');
        if (dot < 0) {
            return new ProjectConfigKey(key, ConfigPlatform.INVALID);
        }
        String projectId = key.substring(0, dot);

        int bar = key.indexOf('|', dot + 1);
        if (bar < 0) {
            return new ProjectConfigKey(projectId, ConfigPlatform.INVALID);
        }
        String configuration = key.substring(dot + 1, bar);
        String trail = key.substring(bar + 1);

        return new ProjectConfigKey(projectId, ConfigPlatform.of(configuration, platformOf(trail)));
    }

    /**
     * Decomposes a legacy {@code ProjectConfiguration} key such as {@code {ID}.Debug.ActiveCfg}.
     *
     * <p>Legacy keys carry no platform; it is taken from the line value, e.g. {@code Debug|Win32}.
     *
     * @param key line key
     * @param value line value
     * @return decomposed key pairing the key's configuration with the value's platform
     */
    public static ProjectConfigKey parseLegacy(String key, String value) {
        int dot = key.indexOf('.');
        if (dot < 0) {
            return new ProjectConfigKey(key, ConfigPlatform.INVALID);
        }
        String projectId = key.substring(0, dot);

        int next = key.indexOf('.', dot + 1);
        String configuration = next < 0 ? key.substring(dot + 1) : key.substring(dot + 1, next);
        ConfigPlatform target = ConfigPlatform.parse(value);
        if (!target.isValid()) {
            return new ProjectConfigKey(projectId, ConfigPlatform.INVALID);
        }
        return new ProjectConfigKey(projectId, ConfigPlatform.of(configuration, target.platform()));
    }

    static String platformOf(String trail) {
        if (trail.endsWith(ACTIVE_CFG)) {
            return trail.substring(0, trail.length() - ACTIVE_CFG.length());
        }
        int last = trail.lastIndexOf('.');
        if (last <= 0) {
            return "";
        }
        int secondLast = trail.lastIndexOf('.', last - 1);
        return secondLast < 0 ? "" : trail.substring(0, secondLast);
    }
}
