package com.szntopology.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.szntopology.core.python.PythonConstantExtractor;

import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration of the SZN topology tools.
 *
 * <p>Loaded from {@code szntopology.yaml}. Every section and setting is
 * optional; missing values fall back to the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * parser:
 *   warnOnRepeatedKeys: true
 *
 * injection:
 *   searchPaths:
 *     - ./test
 *   filePatterns:
 *     - "test_*.py"
 *     - "*.szn"
 *   topologyVariable: TOPOLOGY
 * }</pre>
 *
 * @param parser parser settings
 * @param injection attribute injection settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SznTopologyConfig(
    @JsonProperty("parser") ParserConfig parser,
    @JsonProperty("injection") InjectionConfig injection
) {
    public static final List<String> DEFAULT_FILE_PATTERNS = List.of("test_*.py", "*.szn");

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SznTopologyConfig defaults() {
        return new SznTopologyConfig(
            new ParserConfig(true),
            new InjectionConfig(List.of(), DEFAULT_FILE_PATTERNS, PythonConstantExtractor.DEFAULT_VARIABLE)
        );
    }

    /**
     * Returns the parser section, or its defaults when absent.
     */
    public ParserConfig getEffectiveParser() {
        return parser != null ? parser : defaults().parser();
    }

    /**
     * Returns the injection section, or its defaults when absent.
     */
    public InjectionConfig getEffectiveInjection() {
        return injection != null ? injection : defaults().injection();
    }

    /**
     * Parser configuration.
     *
     * @param warnOnRepeatedKeys log a warning when a key repeats inside one attribute block
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ParserConfig(
        @JsonProperty("warnOnRepeatedKeys") Boolean warnOnRepeatedKeys
    ) {
        public boolean isWarnOnRepeatedKeys() {
            return warnOnRepeatedKeys == null || warnOnRepeatedKeys;
        }
    }

    /**
     * Attribute injection configuration.
     *
     * @param searchPaths directories searched for relative file patterns (empty = working directory)
     * @param filePatterns file name globs a matched file must satisfy
     * @param topologyVariable name of the topology constant in Python test modules
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InjectionConfig(
        @JsonProperty("searchPaths") List<String> searchPaths,
        @JsonProperty("filePatterns") List<String> filePatterns,
        @JsonProperty("topologyVariable") String topologyVariable
    ) {
        public List<Path> getEffectiveSearchPaths() {
            return searchPaths == null ? List.of() : searchPaths.stream().map(Path::of).toList();
        }

        public List<String> getEffectiveFilePatterns() {
            return filePatterns == null || filePatterns.isEmpty() ? DEFAULT_FILE_PATTERNS : filePatterns;
        }

        public String getEffectiveTopologyVariable() {
            return topologyVariable == null || topologyVariable.isBlank()
                ? PythonConstantExtractor.DEFAULT_VARIABLE
                : topologyVariable;
        }
    }
}
