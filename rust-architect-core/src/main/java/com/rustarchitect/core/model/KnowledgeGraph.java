package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Entity/edge graph of one project.
 *
 * <p>Nodes are collapsed by bare name, first-seen by file path then line.
 * {@code collapsedNames} lists names declared in more than one file, whose
 * declarations were merged into a single node.
 *
 * @param project project name
 * @param nodes one entity per distinct name
 * @param edges all inferred edges in extraction order
 * @param clusters layer partition of the nodes
 * @param collapsedNames names merged across files, sorted
 * @param stats summary counts
 */
public record KnowledgeGraph(
    String project,
    List<Entity> nodes,
    List<Edge> edges,
    List<Cluster> clusters,
    List<String> collapsedNames,
    Stats stats
) {
    public KnowledgeGraph {
        Objects.requireNonNull(project, "project must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        clusters = clusters == null ? List.of() : List.copyOf(clusters);
        collapsedNames = collapsedNames == null ? List.of() : List.copyOf(collapsedNames);
        stats = new Stats(nodes.size(), edges.size(), clusters.size());
    }

    /**
     * Creates a graph without nodes or edges.
     *
     * @param project project name
     * @return empty graph
     */
    public static KnowledgeGraph empty(String project) {
        return new KnowledgeGraph(project, List.of(), List.of(), List.of(), List.of(), null);
    }

    /**
     * @param totalNodes node count
     * @param totalEdges edge count
     * @param totalClusters cluster count
     */
    public record Stats(int totalNodes, int totalEdges, int totalClusters) {}
}
