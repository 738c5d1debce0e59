package com.rustarchitect.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Navigation index over the knowledge graph.
 *
 * <p>{@code publicApis} holds every bare-{@code pub} fn, struct and trait. Display
 * caps are applied by report generators, never here.
 *
 * @param fileToConcepts file path to the entity names it declares
 * @param conceptToFiles entity name to the distinct files declaring it
 * @param hotSpots names ranked by undirected edge degree, highest first
 * @param entryPoints detected program entry points
 * @param publicApis public fn/struct/trait entities
 * @param stats summary counts
 */
public record SemanticIndex(
    Map<String, List<String>> fileToConcepts,
    Map<String, List<String>> conceptToFiles,
    List<HotSpot> hotSpots,
    List<EntryPoint> entryPoints,
    List<Entity> publicApis,
    Stats stats
) {
    public SemanticIndex {
        fileToConcepts = orderedCopy(Objects.requireNonNull(fileToConcepts, "fileToConcepts must not be null"));
        conceptToFiles = orderedCopy(Objects.requireNonNull(conceptToFiles, "conceptToFiles must not be null"));
        hotSpots = hotSpots == null ? List.of() : List.copyOf(hotSpots);
        entryPoints = entryPoints == null ? List.of() : List.copyOf(entryPoints);
        publicApis = publicApis == null ? List.of() : List.copyOf(publicApis);
        if (stats == null) {
            stats = Stats.empty();
        }
    }

    /**
     * Creates an index for a project without entities.
     *
     * @return index with empty maps and zero stats
     */
    public static SemanticIndex empty() {
        return new SemanticIndex(Map.of(), Map.of(), List.of(), List.of(), List.of(), Stats.empty());
    }

    // keeps insertion order, which reports rely on
    private static Map<String, List<String>> orderedCopy(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * A structurally central name.
     *
     * @param name node name (may be a file stem or synthetic source)
     * @param degree number of edges touching the node, in and out
     */
    public record HotSpot(String name, int degree) {
        public HotSpot {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * A heuristically identified program start.
     *
     * @param file project-relative file path
     * @param type "main", "lib" or "main_function"
     * @param description fixed descriptive label
     */
    public record EntryPoint(String file, String type, String description) {
        public EntryPoint {
            Objects.requireNonNull(file, "file must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /**
     * Summary counts. {@code totalPublicApis} is always the full count.
     *
     * @param totalFiles files declaring at least one entity
     * @param totalConcepts distinct entity names
     * @param totalPublicApis public fn/struct/trait entities
     * @param totalHotSpots retained hot spots
     */
    public record Stats(int totalFiles, int totalConcepts, int totalPublicApis, int totalHotSpots) {
        public static Stats empty() {
            return new Stats(0, 0, 0, 0);
        }
    }
}
