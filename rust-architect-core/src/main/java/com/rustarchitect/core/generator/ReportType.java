package com.rustarchitect.core.generator;

/**
 * Types of reports that can be generated from an analysis.
 */
public enum ReportType {
    /** Entities, edges and clusters */
    KNOWLEDGE_GRAPH("knowledge-graph"),

    /** File/concept maps, hot spots and entry points */
    SEMANTIC_INDEX("semantic-index"),

    /** Design patterns, architecture styles and communication patterns */
    PATTERNS("patterns"),

    /** Architecture overview: workspace, styles, communication */
    ARCHITECTURE("architecture"),

    /** Non-private declarations grouped by kind, visibility and module */
    API_SURFACE("api-surface"),

    /** Line counts and scan statistics */
    METRICS("metrics"),

    /** Public structs, enums, type aliases and traits */
    DOMAIN_MODEL("domain-model"),

    /** Error types and error propagation counts */
    ERROR_HANDLING("error-handling"),

    /** Detected design patterns with usage guidance */
    PATTERN_LIBRARY("pattern-library"),

    /** Layer diagram of the knowledge graph */
    LAYER_DIAGRAM("layers");

    private final String baseName;

    ReportType(String baseName) {
        this.baseName = baseName;
    }

    /**
     * Returns the file name, without extension, reports of this type are written to.
     *
     * @return base file name
     */
    public String baseName() {
        return baseName;
    }
}
