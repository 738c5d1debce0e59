package com.rustarchitect.core.index;

import com.rustarchitect.core.model.Edge;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.EntityKind;
import com.rustarchitect.core.model.SemanticIndex;
import com.rustarchitect.core.model.SemanticIndex.EntryPoint;
import com.rustarchitect.core.model.SemanticIndex.HotSpot;
import com.rustarchitect.core.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the navigation index of a knowledge graph.
 *
 * <p>Hot spots rank every name that appears as an edge endpoint by its undirected degree.
 * Equal degrees keep the order in which names first appear in the edge list. Entry points
 * come from two independent checks: canonical entry files among the scanned paths, and
 * the first {@code fn main} entity.
 */
public class SemanticIndexer {

    public static final int DEFAULT_HOT_SPOT_LIMIT = 20;

    static final String TYPE_MAIN = "main";
    static final String TYPE_LIB = "lib";
    static final String TYPE_MAIN_FUNCTION = "main_function";

    private static final Logger log = LoggerFactory.getLogger(SemanticIndexer.class);

    /** Canonical entry files, checked in this order. */
    private static final List<EntryFile> ENTRY_FILES = List.of(
        new EntryFile("src/main.rs", "Binary entry point"),
        new EntryFile("src/lib.rs", "Library entry point"),
        new EntryFile("lib.rs", "Library entry point"),
        new EntryFile("main.rs", "Binary entry point")
    );

    private static final Set<EntityKind> PUBLIC_API_KINDS = Set.of(EntityKind.FN, EntityKind.STRUCT, EntityKind.TRAIT);

    private final int hotSpotLimit;

    public SemanticIndexer() {
        this(DEFAULT_HOT_SPOT_LIMIT);
    }

    public SemanticIndexer(int hotSpotLimit) {
        if (hotSpotLimit < 0) {
            throw new IllegalArgumentException("hotSpotLimit must not be negative: " + hotSpotLimit);
        }
        this.hotSpotLimit = hotSpotLimit;
    }

    /**
     * Builds an index without entry-file detection.
     *
     * @param entities graph nodes
     * @param edges graph edges
     * @return semantic index
     */
    public SemanticIndex build(List<Entity> entities, List<Edge> edges) {
        return build(entities, edges, List.of());
    }

    /**
     * Builds an index.
     *
     * @param entities graph nodes, normally collapsed by name
     * @param edges graph edges
     * @param filePaths project-relative paths of the scanned files
     * @return semantic index
     */
    public SemanticIndex build(List<Entity> entities, List<Edge> edges, Collection<String> filePaths) {
        Objects.requireNonNull(entities, "entities must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        Objects.requireNonNull(filePaths, "filePaths must not be null");

        Map<String, List<String>> fileToConcepts = new LinkedHashMap<>();
        Map<String, List<String>> conceptToFiles = new LinkedHashMap<>();
        for (Entity entity : entities) {
            fileToConcepts.computeIfAbsent(entity.module(), key -> new ArrayList<>()).add(entity.name());
            List<String> files = conceptToFiles.computeIfAbsent(entity.name(), key -> new ArrayList<>());
            if (!files.contains(entity.module())) {
                files.add(entity.module());
            }
        }

        List<HotSpot> hotSpots = rankHotSpots(edges);
        List<EntryPoint> entryPoints = detectEntryPoints(entities, filePaths);
        List<Entity> publicApis = entities.stream()
            .filter(entity -> entity.visibility() == Visibility.PUB)
            .filter(entity -> PUBLIC_API_KINDS.contains(entity.kind()))
            .toList();

        SemanticIndex.Stats stats = new SemanticIndex.Stats(
            fileToConcepts.size(),
            conceptToFiles.size(),
            publicApis.size(),
            hotSpots.size()
        );
        log.debug("Semantic index: {} files, {} concepts, {} hot spots, {} entry points",
            stats.totalFiles(), stats.totalConcepts(), stats.totalHotSpots(), entryPoints.size());

        return new SemanticIndex(fileToConcepts, conceptToFiles, hotSpots, entryPoints, publicApis, stats);
    }

    private List<HotSpot> rankHotSpots(List<Edge> edges) {
        Map<String, Integer> degree = new LinkedHashMap<>();
        for (Edge edge : edges) {
            degree.merge(edge.from(), 1, Integer::sum);
            degree.merge(edge.to(), 1, Integer::sum);
        }
        // List.sort is stable: equal degrees keep first-appearance order
        List<HotSpot> ranked = new ArrayList<>();
        degree.forEach((name, count) -> ranked.add(new HotSpot(name, count)));
        ranked.sort(Comparator.comparingInt(HotSpot::degree).reversed());
        return ranked.size() > hotSpotLimit ? List.copyOf(ranked.subList(0, hotSpotLimit)) : ranked;
    }

    private List<EntryPoint> detectEntryPoints(List<Entity> entities, Collection<String> filePaths) {
        List<EntryPoint> entryPoints = new ArrayList<>();
        for (EntryFile entryFile : ENTRY_FILES) {
            if (filePaths.contains(entryFile.path())) {
                String type = entryFile.path().contains(TYPE_MAIN) ? TYPE_MAIN : TYPE_LIB;
                entryPoints.add(new EntryPoint(entryFile.path(), type, entryFile.description()));
            }
        }
        entities.stream()
            .filter(entity -> entity.kind() == EntityKind.FN && entity.name().equals("main"))
            .findFirst()
            .ifPresent(main -> entryPoints.add(new EntryPoint(main.module(), TYPE_MAIN_FUNCTION, "main() function")));
        return entryPoints;
    }

    private record EntryFile(String path, String description) {}
}
