package com.solv.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for solv.
 *
 * <p>Loaded from {@code solv.yaml}. Missing blocks and keys fall back to defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * scan:
 *   extension: sln
 *   threads: 4
 *
 * validate:
 *   showOnlyProblems: true
 * }</pre>
 *
 * @param scan file discovery settings
 * @param validate validation output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SolvConfig(
    @JsonProperty("scan") ScanSettings scan,
    @JsonProperty("validate") ValidateSettings validate
) {

    public SolvConfig {
        scan = scan != null ? scan : ScanSettings.defaults();
        validate = validate != null ? validate : ValidateSettings.defaults();
    }

    /**
     * Creates the configuration used when no file is present.
     *
     * @return default configuration
     */
    public static SolvConfig defaults() {
        return new SolvConfig(ScanSettings.defaults(), ValidateSettings.defaults());
    }

    /**
     * File discovery settings.
     *
     * @param extension solution file extension, without the dot
     * @param threads worker threads; 0 means one per available processor
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScanSettings(
        @JsonProperty("extension") String extension,
        @JsonProperty("threads") int threads
    ) {
        public static final String DEFAULT_EXTENSION = "sln";

        public ScanSettings {
            extension = extension != null && !extension.isBlank() ? extension : DEFAULT_EXTENSION;
            if (threads < 0) {
                throw new IllegalArgumentException("threads must not be negative: " + threads);
            }
        }

        public static ScanSettings defaults() {
            return new ScanSettings(DEFAULT_EXTENSION, 0);
        }
    }

    /**
     * Validation output settings.
     *
     * @param showOnlyProblems print only solutions that have findings
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidateSettings(
        @JsonProperty("showOnlyProblems") boolean showOnlyProblems
    ) {
        public static ValidateSettings defaults() {
            return new ValidateSettings(false);
        }
    }
}
