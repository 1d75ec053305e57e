package com.solv.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;
import java.util.Objects;

/**
 * A (configuration, platform) pair such as ("Debug", "Any CPU").
 *
 * <p>Pairs compare case-sensitively, configuration first. A pair with an empty half is the
 * {@link #INVALID} sentinel that parsing returns for malformed text; callers skip it.
 *
 * @param configuration configuration name
 * @param platform platform name
 */
public record ConfigPlatform(String configuration, String platform) implements Comparable<ConfigPlatform> {

    public static final ConfigPlatform INVALID = new ConfigPlatform("", "");

    private static final Comparator<ConfigPlatform> ORDER =
        Comparator.comparing(ConfigPlatform::configuration).thenComparing(ConfigPlatform::platform);

    public ConfigPlatform {
        Objects.requireNonNull(configuration, "configuration must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
    }

    /**
     * Parses {@code Configuration|Platform}.
     *
     * <p>Anything other than exactly one {@code |} with non-empty text on both sides yields
     * {@link #INVALID}.
     *
     * @param text pair text, may be null
     * @return parsed pair or the sentinel
     */
    public static ConfigPlatform parse(String text) {
        if (text == null) {
            return INVALID;
        }
        int bar = text.indexOf('|');
        if (bar < 0 || text.indexOf('|', bar + 1) >= 0) {
            return INVALID;
        }
        return of(text.substring(0, bar), text.substring(bar + 1));
    }

    /**
     * Creates a pair, or {@link #INVALID} when either half is empty.
     */
    public static ConfigPlatform of(String configuration, String platform) {
        if (configuration == null || platform == null || configuration.isEmpty() || platform.isEmpty()) {
            return INVALID;
        }
        return new ConfigPlatform(configuration, platform);
    }

    @JsonIgnore
    public boolean isValid() {
        return !configuration.isEmpty() && !platform.isEmpty();
    }

    @Override
    public int compareTo(ConfigPlatform other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return configuration + "|" + platform;
    }
}
