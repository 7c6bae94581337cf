package com.schemareverse.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.schemareverse.core.parser.ConstructKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Root configuration of a reverse-engineering run.
 *
 * <p>Loaded from {@code schema-reverse.yaml}. Every section is optional; missing
 * sections and values take the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * confidence:
 *   minimum: 0.80
 *   actionBaseline: 0.70
 *
 * parsers:
 *   disabled:
 *     - dynamic_sql
 *
 * classification:
 *   tablePrefixes: [tb_, tv_]
 *   vocabularySuffix: _info
 * }</pre>
 *
 * @param confidence scoring thresholds
 * @param parsers construct parser selection
 * @param classification naming conventions of the pattern classifiers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReverseConfig(
    @JsonProperty("confidence") ConfidenceConfig confidence,
    @JsonProperty("parsers") ParserConfig parsers,
    @JsonProperty("classification") ClassificationConfig classification
) {
    public ReverseConfig {
        if (confidence == null) {
            confidence = ConfidenceConfig.defaults();
        }
        if (parsers == null) {
            parsers = ParserConfig.defaults();
        }
        if (classification == null) {
            classification = ClassificationConfig.defaults();
        }
    }

    /**
     * Creates the default configuration: threshold 0.80, action baseline 0.70, all
     * parsers enabled, prefixes {@code tb_}/{@code tv_}, vocabulary suffix {@code _info}.
     *
     * @return default configuration
     */
    public static ReverseConfig defaults() {
        return new ReverseConfig(null, null, null);
    }

    /**
     * Returns a copy with another entity acceptance threshold.
     *
     * @param minimum threshold in [0, 1]
     * @return new configuration
     */
    public ReverseConfig withMinimumConfidence(double minimum) {
        return new ReverseConfig(new ConfidenceConfig(minimum, confidence.actionBaseline()), parsers, classification);
    }

    /**
     * Scoring thresholds.
     *
     * @param minimum entity acceptance threshold
     * @param actionBaseline baseline score of function and procedure bodies
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConfidenceConfig(
        @JsonProperty("minimum") Double minimum,
        @JsonProperty("actionBaseline") Double actionBaseline
    ) {
        public static final double DEFAULT_MINIMUM = 0.80;
        public static final double DEFAULT_ACTION_BASELINE = 0.70;

        public ConfidenceConfig {
            if (minimum == null) {
                minimum = DEFAULT_MINIMUM;
            }
            if (actionBaseline == null) {
                actionBaseline = DEFAULT_ACTION_BASELINE;
            }
            if (minimum < 0.0 || minimum > 1.0) {
                throw new IllegalArgumentException("confidence.minimum must be within [0, 1]: " + minimum);
            }
            if (actionBaseline < 0.0 || actionBaseline > 1.0) {
                throw new IllegalArgumentException("confidence.actionBaseline must be within [0, 1]: " + actionBaseline);
            }
        }

        public static ConfidenceConfig defaults() {
            return new ConfidenceConfig(DEFAULT_MINIMUM, DEFAULT_ACTION_BASELINE);
        }
    }

    /**
     * Construct parser selection.
     *
     * @param disabled construct ids (e.g. {@code dynamic_sql}) skipped during dispatch
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserConfig(
        @JsonProperty("disabled") List<String> disabled
    ) {
        private static final Logger log = LoggerFactory.getLogger(ParserConfig.class);

        public ParserConfig {
            disabled = disabled == null ? List.of() : List.copyOf(disabled);
        }

        public static ParserConfig defaults() {
            return new ParserConfig(List.of());
        }

        /**
         * Resolves the constructs that stay enabled.
         *
         * <p>Unknown ids are logged and ignored.
         *
         * @return enabled constructs
         */
        public Set<ConstructKind> enabledKinds() {
            Set<ConstructKind> enabled = EnumSet.allOf(ConstructKind.class);
            for (String id : disabled) {
                Optional<ConstructKind> kind = ConstructKind.fromId(id);
                if (kind.isPresent()) {
                    enabled.remove(kind.get());
                } else {
                    log.warn("Unknown construct id in parsers.disabled: '{}' (ignored)", id);
                }
            }
            return enabled;
        }
    }

    /**
     * Naming conventions of the vocabulary/instance classifier.
     *
     * @param tablePrefixes table-kind prefixes stripped before classification
     * @param vocabularySuffix suffix marking vocabulary tables
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassificationConfig(
        @JsonProperty("tablePrefixes") List<String> tablePrefixes,
        @JsonProperty("vocabularySuffix") String vocabularySuffix
    ) {
        public ClassificationConfig {
            tablePrefixes = tablePrefixes == null ? List.of("tb_", "tv_") : List.copyOf(tablePrefixes);
            if (vocabularySuffix == null || vocabularySuffix.isBlank()) {
                vocabularySuffix = "_info";
            }
        }

        public static ClassificationConfig defaults() {
            return new ClassificationConfig(null, null);
        }
    }
}
