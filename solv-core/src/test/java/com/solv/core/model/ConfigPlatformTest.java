package com.solv.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigPlatform}.
 */
class ConfigPlatformTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
        "Debug|Any CPU;Debug;Any CPU",
        "Release|x64;Release;x64",
        "Debug .NET 4.0|Mixed Platforms;Debug .NET 4.0;Mixed Platforms",
        "Release|.NET;Release;.NET"
    })
    void parse_wellFormedPair_splitsOnBar(String text, String configuration, String platform) {
        ConfigPlatform pair = ConfigPlatform.parse(text);

        assertThat(pair.configuration()).isEqualTo(configuration);
        assertThat(pair.platform()).isEqualTo(platform);
        assertThat(pair.isValid()).isTrue();
        assertThat(pair).hasToString(text);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Debug", "|x86", "Debug|", "a|b|c"})
    void parse_malformedPair_returnsInvalid(String text) {
        assertThat(ConfigPlatform.parse(text)).isSameAs(ConfigPlatform.INVALID);
    }

    @ParameterizedTest
    @NullSource
    void parse_null_returnsInvalid(String text) {
        assertThat(ConfigPlatform.parse(text)).isSameAs(ConfigPlatform.INVALID);
    }

    @Test
    void compareTo_ordersByConfigurationThenPlatform() {
        TreeSet<ConfigPlatform> sorted = new TreeSet<>(List.of(
            ConfigPlatform.of("Release", "Any CPU"),
            ConfigPlatform.of("Debug", "x86"),
            ConfigPlatform.of("Debug", "Any CPU")
        ));

        assertThat(sorted).containsExactly(
            ConfigPlatform.of("Debug", "Any CPU"),
            ConfigPlatform.of("Debug", "x86"),
            ConfigPlatform.of("Release", "Any CPU")
        );
    }

    @Test
    void equals_isCaseSensitive() {
        assertThat(ConfigPlatform.of("Debug", "x86")).isNotEqualTo(ConfigPlatform.of("debug", "x86"));
    }
}
