package com.plcmodel.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for extraction runs.
 *
 * <p>Loaded from {@code plcmodel.yaml}. Every section is optional; missing sections and
 * values fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * namespaces:
 *   application: "http://www.3s-software.com/plcopenxml/application"
 *   union: "http://www.3s-software.com/plcopenxml/union"
 *
 * classification:
 *   strictBasicTypes: false
 *
 * output:
 *   prettyPrint: true
 * }</pre>
 *
 * @param namespaces identifiers of the auxiliary-data blocks the locator looks for
 * @param classification classifier switches
 * @param output JSON output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractorConfig(
    @JsonProperty("namespaces") NamespaceConfig namespaces,
    @JsonProperty("classification") ClassificationConfig classification,
    @JsonProperty("output") OutputConfig output
) {
    public static final String DEFAULT_APPLICATION_BLOCK = "http://www.3s-software.com/plcopenxml/application";
    public static final String DEFAULT_UNION_BLOCK = "http://www.3s-software.com/plcopenxml/union";

    public ExtractorConfig {
        if (namespaces == null) {
            namespaces = new NamespaceConfig(null, null);
        }
        if (classification == null) {
            classification = new ClassificationConfig(null);
        }
        if (output == null) {
            output = new OutputConfig(null);
        }
    }

    /**
     * Creates the default configuration: CODESYS block identifiers, lenient basic types,
     * pretty-printed output.
     *
     * @return default configuration
     */
    public static ExtractorConfig defaults() {
        return new ExtractorConfig(null, null, null);
    }

    /**
     * Auxiliary-data block identifiers.
     *
     * @param application name of the block holding application content
     * @param union name of the block holding union declarations
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamespaceConfig(
        @JsonProperty("application") String application,
        @JsonProperty("union") String union
    ) {
        public NamespaceConfig {
            if (application == null || application.isBlank()) {
                application = DEFAULT_APPLICATION_BLOCK;
            }
            if (union == null || union.isBlank()) {
                union = DEFAULT_UNION_BLOCK;
            }
        }
    }

    /**
     * Classifier configuration.
     *
     * @param strictBasicTypes when true, type nodes without a {@code baseType} child are
     *                         rejected instead of being accepted as basic types
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassificationConfig(
        @JsonProperty("strictBasicTypes") Boolean strictBasicTypes
    ) {
        public ClassificationConfig {
            if (strictBasicTypes == null) {
                strictBasicTypes = Boolean.FALSE;
            }
        }
    }

    /**
     * Output configuration.
     *
     * @param prettyPrint whether JSON output is indented
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("prettyPrint") Boolean prettyPrint
    ) {
        public OutputConfig {
            if (prettyPrint == null) {
                prettyPrint = Boolean.TRUE;
            }
        }
    }
}
