package com.rustarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for an analysis run.
 *
 * <p>Loaded from {@code rustarchitect.yaml} in the project root. Every section and
 * every field is optional; missing values take the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: my-crate
 *
 * source:
 *   directory: src
 *   includeTests: false
 *
 * detection:
 *   patternThreshold: 0.2
 *   styleThreshold: 0.3
 *
 * output:
 *   directory: ./docs/architecture
 *   generators: [json, markdown, mermaid]
 * }</pre>
 *
 * @param project project metadata
 * @param source source discovery settings
 * @param detection detection thresholds and catalog overrides
 * @param index semantic index settings
 * @param output report output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("source") SourceConfig source,
    @JsonProperty("detection") DetectionConfig detection,
    @JsonProperty("index") IndexConfig index,
    @JsonProperty("output") OutputConfig output
) {
    public AnalysisConfig {
        project = project == null ? new ProjectInfo(null) : project;
        source = source == null ? SourceConfig.defaults() : source;
        detection = detection == null ? DetectionConfig.defaults() : detection;
        index = index == null ? IndexConfig.defaults() : index;
        output = output == null ? OutputConfig.defaults() : output;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name, or null to use the directory name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name
    ) {}

    /**
     * Source discovery settings.
     *
     * @param directory source directory relative to the project root
     * @param includeTests whether test/bench/example paths are scanned
     * @param excludePatterns path substrings that exclude a file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("includeTests") Boolean includeTests,
        @JsonProperty("excludePatterns") List<String> excludePatterns
    ) {
        public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "/tests/", "/test/", "/benches/", "/bench/", "/examples/", "/example/",
            "_test.rs", "_tests.rs", "_bench.rs", "/fuzz/", "/stress/"
        );

        public SourceConfig {
            directory = directory == null || directory.isBlank() ? "src" : directory;
            includeTests = includeTests != null && includeTests;
            excludePatterns = excludePatterns == null ? DEFAULT_EXCLUDE_PATTERNS : List.copyOf(excludePatterns);
        }

        public static SourceConfig defaults() {
            return new SourceConfig(null, null, null);
        }
    }

    /**
     * Detection settings.
     *
     * @param patternThreshold minimum confidence for design patterns
     * @param styleThreshold minimum confidence for scored architecture styles
     * @param workspacePackageThreshold package count above which a workspace is multi-crate
     * @param monolithModuleThreshold module declarations above which a crate is a modular monolith
     * @param catalogs optional catalog file overrides
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DetectionConfig(
        @JsonProperty("patternThreshold") Double patternThreshold,
        @JsonProperty("styleThreshold") Double styleThreshold,
        @JsonProperty("workspacePackageThreshold") Integer workspacePackageThreshold,
        @JsonProperty("monolithModuleThreshold") Integer monolithModuleThreshold,
        @JsonProperty("catalogs") CatalogOverrides catalogs
    ) {
        public DetectionConfig {
            patternThreshold = patternThreshold == null ? 0.2 : patternThreshold;
            styleThreshold = styleThreshold == null ? 0.3 : styleThreshold;
            workspacePackageThreshold = workspacePackageThreshold == null ? 3 : workspacePackageThreshold;
            monolithModuleThreshold = monolithModuleThreshold == null ? 10 : monolithModuleThreshold;
            catalogs = catalogs == null ? new CatalogOverrides(null, null, null) : catalogs;
        }

        public static DetectionConfig defaults() {
            return new DetectionConfig(null, null, null, null, null);
        }
    }

    /**
     * Catalog file overrides. A null entry keeps the bundled catalog.
     *
     * @param designPatterns design-pattern catalog file
     * @param architectureStyles architecture-style catalog file
     * @param communicationPatterns communication-pattern catalog file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CatalogOverrides(
        @JsonProperty("designPatterns") String designPatterns,
        @JsonProperty("architectureStyles") String architectureStyles,
        @JsonProperty("communicationPatterns") String communicationPatterns
    ) {}

    /**
     * Semantic index settings.
     *
     * @param hotSpotLimit number of hot spots retained
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IndexConfig(
        @JsonProperty("hotSpotLimit") Integer hotSpotLimit
    ) {
        public IndexConfig {
            hotSpotLimit = hotSpotLimit == null || hotSpotLimit < 0 ? 20 : hotSpotLimit;
        }

        public static IndexConfig defaults() {
            return new IndexConfig(null);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param generators enabled report generator ids
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("generators") List<String> generators
    ) {
        public OutputConfig {
            directory = directory == null || directory.isBlank() ? "./docs/architecture" : directory;
            generators = generators == null ? List.of("json", "markdown", "mermaid") : List.copyOf(generators);
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }
}
