package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Complete result of analysing one project.
 *
 * <p>Everything is recomputed on each run from the file system; nothing here is
 * persisted by the analyzer itself. Report generators consume this record.
 *
 * @param project project name
 * @param manifest manifest metadata (empty when there is no {@code Cargo.toml})
 * @param entities every extracted entity candidate, file path then line order
 * @param graph collapsed knowledge graph
 * @param index semantic index
 * @param designPatterns design-pattern detections, confidence descending
 * @param architectureStyles architecture-style detections, confidence descending
 * @param communicationPatterns communication patterns, usage descending
 * @param apiSurface non-private declarations grouped for documentation
 * @param metrics line counts
 * @param statistics scan statistics
 * @param domainModel public structs, enums, type aliases and traits
 * @param errorHandling error handling idioms
 * @param patternLibrary design patterns with usage guidance
 */
public record ArchitectureModel(
    String project,
    Manifest manifest,
    List<Entity> entities,
    KnowledgeGraph graph,
    SemanticIndex index,
    List<Detection> designPatterns,
    List<Detection> architectureStyles,
    List<CommunicationPattern> communicationPatterns,
    ApiSurface apiSurface,
    CodeMetrics metrics,
    ScanStatistics statistics,
    DomainModel domainModel,
    ErrorHandling errorHandling,
    PatternLibrary patternLibrary
) {
    public ArchitectureModel {
        Objects.requireNonNull(project, "project must not be null");
        manifest = manifest == null ? Manifest.empty() : manifest;
        entities = entities == null ? List.of() : List.copyOf(entities);
        graph = graph == null ? KnowledgeGraph.empty(project) : graph;
        index = index == null ? SemanticIndex.empty() : index;
        designPatterns = designPatterns == null ? List.of() : List.copyOf(designPatterns);
        architectureStyles = architectureStyles == null ? List.of() : List.copyOf(architectureStyles);
        communicationPatterns = communicationPatterns == null ? List.of() : List.copyOf(communicationPatterns);
        apiSurface = apiSurface == null ? ApiSurface.empty() : apiSurface;
        metrics = metrics == null ? CodeMetrics.empty() : metrics;
        statistics = statistics == null ? ScanStatistics.empty() : statistics;
        domainModel = domainModel == null ? DomainModel.empty() : domainModel;
        errorHandling = errorHandling == null ? ErrorHandling.empty() : errorHandling;
        patternLibrary = patternLibrary == null ? PatternLibrary.empty() : patternLibrary;
    }

    /**
     * Creates the model of a project without any source files.
     *
     * @param project project name
     * @param manifest manifest metadata
     * @param statistics scan statistics
     * @return all-empty model
     */
    public static ArchitectureModel empty(String project, Manifest manifest, ScanStatistics statistics) {
        return new ArchitectureModel(project, manifest, List.of(), null, null,
            List.of(), List.of(), List.of(), null, null, statistics, null, null, null);
    }
}
