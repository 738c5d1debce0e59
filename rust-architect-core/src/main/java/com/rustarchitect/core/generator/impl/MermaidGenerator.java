package com.rustarchitect.core.generator.impl;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rustarchitect.core.generator.GeneratedReport;
import com.rustarchitect.core.generator.GeneratorConfig;
import com.rustarchitect.core.generator.ReportGenerator;
import com.rustarchitect.core.generator.ReportType;
import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.Cluster;
import com.rustarchitect.core.model.Edge;
import com.rustarchitect.core.model.KnowledgeGraph;

/**
 * Generates Mermaid diagram definitions from the knowledge graph.
 *
 * <p>The layer diagram draws one {@code subgraph} per cluster holding its entity
 * names, followed by the relationship edges whose both ends were drawn. At most
 * {@link GeneratorConfig#maxNodes()} nodes are drawn, filled cluster by cluster in
 * cluster order. Duplicate edges are drawn once.
 *
 * <p>Output format is Markdown (*.md files) with an embedded {@code ```mermaid} code
 * block suitable for rendering in GitHub, GitLab and Mermaid Live Editor.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Mermaid diagram types
    private static final String GRAPH_TB = "graph TB\n";

    // Sanitization
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String NODE_PREFIX = "n_";
    private static final String CLUSTER_PREFIX = "c_";

    // Placeholder node for empty graphs
    private static final String NO_ENTITIES_NODE = "  A[No entities found]\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return Set.of(ReportType.LAYER_DIAGRAM);
    }

    @Override
    public GeneratedReport generate(ArchitectureModel model, ReportType type, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedReportTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }

        log.debug("Generating Mermaid diagram for type: {}", type);
        String content = generateLayerDiagram(model.graph(), config);
        return new GeneratedReport(type.baseName(), content, FILE_EXTENSION);
    }

    /**
     * Generates the layer diagram.
     *
     * @param graph knowledge graph with clusters and edges
     * @param config generator configuration limiting the node count
     * @return Markdown-formatted Mermaid diagram
     */
    private String generateLayerDiagram(KnowledgeGraph graph, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append("Layer Diagram: ").append(graph.project())
            .append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        sb.append(GRAPH_TB);

        if (graph.clusters().isEmpty() || config.maxNodes() == 0) {
            sb.append(NO_ENTITIES_NODE);
        } else {
            Set<String> drawnNodes = appendClusters(sb, graph, config.maxNodes());
            appendEdges(sb, graph, drawnNodes);
        }

        sb.append(CODE_BLOCK_END);
        return sb.toString();
    }

    private Set<String> appendClusters(StringBuilder sb, KnowledgeGraph graph, int maxNodes) {
        Set<String> drawnNodes = new LinkedHashSet<>();
        Set<String> clusterIds = new HashSet<>();
        for (Cluster cluster : graph.clusters()) {
            if (drawnNodes.size() >= maxNodes) {
                log.debug("Node limit {} reached, remaining clusters omitted", maxNodes);
                break;
            }
            sb.append("  subgraph ").append(clusterId(cluster.name(), clusterIds))
                .append("[\"").append(escape(cluster.name())).append("\"]\n");
            for (String entityId : cluster.entityIds()) {
                if (drawnNodes.size() >= maxNodes) {
                    break;
                }
                if (drawnNodes.add(entityId)) {
                    sb.append("    ").append(nodeId(entityId)).append("[\"")
                        .append(escape(entityId)).append("\"]\n");
                }
            }
            sb.append("  end\n");
        }
        return drawnNodes;
    }

    private void appendEdges(StringBuilder sb, KnowledgeGraph graph, Set<String> drawnNodes) {
        Set<String> drawnEdges = new LinkedHashSet<>();
        for (Edge edge : graph.edges()) {
            if (!drawnNodes.contains(edge.from()) || !drawnNodes.contains(edge.to())) {
                continue;
            }
            String line = "  " + nodeId(edge.from()) + " -->|" + edge.relationship().label() + "| "
                + nodeId(edge.to()) + "\n";
            if (drawnEdges.add(line)) {
                sb.append(line);
            }
        }
    }

    /**
     * Returns a subgraph id not handed out before. Names that sanitize to the same id,
     * such as {@code a-b} and {@code a_b}, get a numeric suffix from the second one on.
     */
    private String clusterId(String name, Set<String> usedIds) {
        String base = CLUSTER_PREFIX + sanitizeId(name);
        String id = base;
        for (int suffix = 2; !usedIds.add(id); suffix++) {
            id = base + "_" + suffix;
        }
        return id;
    }

    private String nodeId(String name) {
        return NODE_PREFIX + sanitizeId(name);
    }

    /**
     * Replaces every character outside {@code [a-zA-Z0-9_]} with an underscore.
     *
     * @param id the identifier to sanitize (may be null)
     * @return sanitized identifier, or "unknown" if input is null
     */
    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Replaces double quotes and newlines, which Mermaid labels cannot hold.
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ");
    }
}
