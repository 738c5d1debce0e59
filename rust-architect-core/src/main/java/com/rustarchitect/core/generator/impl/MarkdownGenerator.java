package com.rustarchitect.core.generator.impl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rustarchitect.core.generator.GeneratedReport;
import com.rustarchitect.core.generator.GeneratorConfig;
import com.rustarchitect.core.generator.ReportGenerator;
import com.rustarchitect.core.generator.ReportType;
import com.rustarchitect.core.model.ApiSurface;
import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.Cluster;
import com.rustarchitect.core.model.CodeMetrics;
import com.rustarchitect.core.model.CommunicationPattern;
import com.rustarchitect.core.model.Detection;
import com.rustarchitect.core.model.DomainModel;
import com.rustarchitect.core.model.Edge;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.ErrorHandling;
import com.rustarchitect.core.model.KnowledgeGraph;
import com.rustarchitect.core.model.Manifest;
import com.rustarchitect.core.model.PatternComparison;
import com.rustarchitect.core.model.PatternLibrary;
import com.rustarchitect.core.model.ScanStatistics;
import com.rustarchitect.core.model.SemanticIndex;

/**
 * Generates human-readable Markdown reports from an analysis result.
 *
 * <h2>Generated Reports</h2>
 * <ul>
 *   <li><b>Knowledge Graph:</b> node/edge statistics, entity kinds, clusters and relationship counts</li>
 *   <li><b>Semantic Index:</b> navigation guide with entry points, hot spots and public APIs</li>
 *   <li><b>Patterns:</b> detected design patterns with confidence and evidence</li>
 *   <li><b>Architecture:</b> workspace shape, architecture styles and communication patterns</li>
 *   <li><b>API Surface:</b> non-private declarations by visibility and by module</li>
 *   <li><b>Metrics:</b> line counts and scan statistics</li>
 *   <li><b>Domain Model:</b> public structs with fields, enums with variants, type aliases and traits</li>
 *   <li><b>Error Handling:</b> error crates, custom error enums and propagation counts</li>
 *   <li><b>Pattern Library:</b> detected patterns with description, use cases and related patterns</li>
 * </ul>
 *
 * <p>Long lists are truncated for display only, with a trailing "... and N more"
 * line. The underlying model always keeps the full lists. The public API list of
 * the semantic index is capped by {@link GeneratorConfig#maxListItems()}.
 *
 * <p>{@link #generateComparisonMatrix(PatternComparison)} renders the cross-project
 * matrix, which is not tied to a single model.
 */
public class MarkdownGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownGenerator.class);

    private static final String GENERATOR_ID = "markdown";
    private static final String GENERATOR_DISPLAY_NAME = "Markdown Report Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting constants
    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String BULLET = "- ";
    private static final String CODE = "`";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";

    // Display caps
    private static final int CLUSTER_MEMBER_LIMIT = 10;
    private static final int HOT_SPOT_LIMIT = 10;
    private static final int STYLE_EVIDENCE_LIMIT = 5;
    private static final int VISIBILITY_NAME_LIMIT = 20;
    private static final int MODULE_LIMIT = 15;
    private static final int MODULE_NAME_LIMIT = 10;
    private static final int KEY_PATTERN_LIMIT = 3;
    private static final int LIBRARY_EVIDENCE_LIMIT = 5;

    // Default values
    private static final String MORE_FORMAT = "- ... and %d more";
    private static final String NOT_AVAILABLE = "N/A";
    private static final String PRESENT = "✅";
    private static final String ABSENT = "❌";

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
        return Set.of(
            ReportType.KNOWLEDGE_GRAPH,
            ReportType.SEMANTIC_INDEX,
            ReportType.PATTERNS,
            ReportType.ARCHITECTURE,
            ReportType.API_SURFACE,
            ReportType.METRICS,
            ReportType.DOMAIN_MODEL,
            ReportType.ERROR_HANDLING,
            ReportType.PATTERN_LIBRARY
        );
    }

    @Override
    public GeneratedReport generate(ArchitectureModel model, ReportType type, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedReportTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }

        log.debug("Generating Markdown report for type: {}", type);

        String content = switch (type) {
            case KNOWLEDGE_GRAPH -> generateKnowledgeGraphSummary(model.graph());
            case SEMANTIC_INDEX -> generateSemanticIndexGuide(model.project(), model.index(), config);
            case PATTERNS -> generatePatternReport(model.designPatterns());
            case ARCHITECTURE -> generateArchitectureReport(model);
            case API_SURFACE -> generateApiSurfaceReport(model.project(), model.apiSurface());
            case METRICS -> generateMetricsReport(model.project(), model.metrics(), model.statistics());
            case DOMAIN_MODEL -> generateDomainModelReport(model.project(), model.domainModel(), config);
            case ERROR_HANDLING -> generateErrorHandlingReport(model.project(), model.errorHandling());
            case PATTERN_LIBRARY -> generatePatternLibrary(model.project(), model.patternLibrary());
            default -> throw new IllegalArgumentException("Unsupported report type: " + type);
        };

        return new GeneratedReport(type.baseName(), content, FILE_EXTENSION);
    }

    private String generateKnowledgeGraphSummary(KnowledgeGraph graph) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Knowledge Graph: " + graph.project());
        lines.add("");
        lines.add(H2 + "Statistics");
        lines.add("- **Nodes:** " + graph.stats().totalNodes());
        lines.add("- **Edges:** " + graph.stats().totalEdges());
        lines.add("- **Clusters:** " + graph.stats().totalClusters());
        lines.add("");
        lines.add(H2 + "Entity Types");

        Map<String, Integer> kindCounts = new LinkedHashMap<>();
        for (Entity node : graph.nodes()) {
            kindCounts.merge(node.kind().keyword(), 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : byCountDescending(kindCounts)) {
            lines.add(BULLET + entry.getKey() + ": " + entry.getValue());
        }

        lines.add("");
        lines.add(H2 + "Clusters (Layers)");
        for (Cluster cluster : graph.clusters()) {
            lines.add(H3 + cluster.name());
            appendCapped(lines, cluster.entityIds(), CLUSTER_MEMBER_LIMIT, id -> BULLET + id);
            lines.add("");
        }

        if (!graph.collapsedNames().isEmpty()) {
            lines.add(H2 + "Merged Names");
            lines.add("Declared in more than one file and merged into a single node:");
            for (String name : graph.collapsedNames()) {
                lines.add(BULLET + CODE + name + CODE);
            }
            lines.add("");
        }

        lines.add("");
        lines.add(H2 + "Key Relationships");
        Map<String, Integer> relationshipCounts = new LinkedHashMap<>();
        for (Edge edge : graph.edges()) {
            relationshipCounts.merge(edge.relationship().label(), 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : byCountDescending(relationshipCounts)) {
            lines.add(BULLET + entry.getKey() + ": " + entry.getValue() + " connections");
        }

        return join(lines);
    }

    private String generateSemanticIndexGuide(String project, SemanticIndex index, GeneratorConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Semantic Index: " + project);
        lines.add("");
        lines.add(H2 + "Quick Navigation Guide");
        lines.add("");
        lines.add(H3 + "Entry Points");
        lines.add("Start here to understand the codebase:");
        for (SemanticIndex.EntryPoint entryPoint : index.entryPoints()) {
            lines.add("- **" + entryPoint.file() + "** - " + entryPoint.description());
        }

        lines.add("");
        lines.add(H3 + "Hot Spots (Most Connected)");
        lines.add("Key components with many relationships:");
        index.hotSpots().stream()
            .limit(HOT_SPOT_LIMIT)
            .forEach(hotSpot -> lines.add(BULLET + CODE + hotSpot.name() + CODE
                + " (" + hotSpot.degree() + " connections)"));

        lines.add("");
        lines.add(H3 + "Public APIs");
        lines.add("Exported interfaces:");
        appendCapped(lines, index.publicApis(), config.maxListItems(),
            api -> BULLET + CODE + api.name() + CODE + " (" + api.kind().keyword() + ") in "
                + CODE + api.module() + CODE);

        lines.add("");
        lines.add(H3 + "File Overview");
        lines.add("- Total files with entities: " + index.stats().totalFiles());
        lines.add("- Total named concepts: " + index.stats().totalConcepts());
        lines.add("- Total public APIs: " + index.stats().totalPublicApis());

        return join(lines);
    }

    private String generatePatternReport(List<Detection> patterns) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Detected Architectural Patterns");
        lines.add("");

        if (patterns.isEmpty()) {
            lines.add("No patterns detected.");
            return join(lines);
        }

        for (Detection pattern : patterns) {
            lines.add(H2 + pattern.name());
            lines.add("**Confidence:** " + percent(pattern.confidence()));
            lines.add("");
            lines.add("**Evidence:**");
            for (String evidence : pattern.evidence()) {
                lines.add(BULLET + evidence);
            }
            lines.add("");
        }
        return join(lines);
    }

    private String generateArchitectureReport(ArchitectureModel model) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "System Architecture Analysis: " + model.project());
        lines.add("");

        Manifest manifest = model.manifest();
        if (manifest.isWorkspace()) {
            lines.add(H2 + "Workspace Structure");
            lines.add("");
            lines.add("- **Type:** Multi-crate workspace");
            lines.add("- **Package count:** " + manifest.packageCount());
            lines.add("");
            lines.add(H3 + "Members");
            lines.add("");
            for (String member : manifest.workspaceMembers()) {
                lines.add(BULLET + CODE + member + CODE);
            }
            lines.add("");
        }

        if (!model.architectureStyles().isEmpty()) {
            lines.add(H2 + "Detected Architecture Styles");
            lines.add("");
            for (Detection style : model.architectureStyles()) {
                lines.add(H3 + style.name());
                lines.add("**Confidence:** " + percent(style.confidence()));
                if (style.description() != null) {
                    lines.add("**Description:** " + style.description());
                }
                lines.add("");
                lines.add("**Evidence:**");
                style.evidence().stream()
                    .limit(STYLE_EVIDENCE_LIMIT)
                    .forEach(evidence -> lines.add(BULLET + evidence));
                lines.add("");
            }
        }

        if (!model.communicationPatterns().isEmpty()) {
            lines.add(H2 + "Communication Patterns");
            lines.add("");
            for (CommunicationPattern pattern : model.communicationPatterns()) {
                lines.add("- **" + pattern.name() + "** (found " + pattern.usageCount() + " usages)");
            }
            lines.add("");
        }

        if (!manifest.isWorkspace()
                && model.architectureStyles().isEmpty()
                && model.communicationPatterns().isEmpty()) {
            lines.add("No architecture styles or communication patterns detected.");
        }

        return join(lines);
    }

    private String generateApiSurfaceReport(String project, ApiSurface api) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Public API Surface: " + project);
        lines.add("");
        lines.add(H2 + "Statistics");
        lines.add("");
        lines.add("- **Total public items:** " + api.stats().totalItems());
        lines.add("- **Structs:** " + api.stats().structs());
        lines.add("- **Enums:** " + api.stats().enums());
        lines.add("- **Traits:** " + api.stats().traits());
        lines.add("- **Functions:** " + api.stats().functions());
        lines.add("- **Modules:** " + api.stats().modules());
        lines.add("");
        lines.add(H2 + "By Visibility Level");
        lines.add("");

        for (Map.Entry<String, List<String>> entry : api.byVisibility().entrySet()) {
            appendNameGroup(lines, entry.getKey(), entry.getValue(), VISIBILITY_NAME_LIMIT);
        }

        lines.add(H2 + "By Module");
        lines.add("");
        api.byModule().entrySet().stream()
            .limit(MODULE_LIMIT)
            .forEach(entry -> appendNameGroup(lines, entry.getKey(), entry.getValue(), MODULE_NAME_LIMIT));

        return join(lines);
    }

    private String generateMetricsReport(String project, CodeMetrics metrics, ScanStatistics statistics) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Code Metrics: " + project);
        lines.add("");
        lines.add(PIPE + " Metric " + PIPE + " Count " + PIPE);
        lines.add("|--------|-------|");
        lines.add(row("Files", metrics.files()));
        lines.add(row("Lines", metrics.lines()));
        lines.add(row("Code", metrics.code()));
        lines.add(row("Comments", metrics.comments()));
        lines.add(row("Blanks", metrics.blanks()));
        lines.add("");
        lines.add(H2 + "Scan");
        lines.add("");
        lines.add(statistics.summary());

        if (!statistics.topErrors().isEmpty()) {
            lines.add("");
            lines.add(H3 + "Errors");
            lines.add("");
            for (String error : statistics.topErrors()) {
                lines.add(BULLET + error);
            }
        }
        return join(lines);
    }

    private String generateDomainModelReport(String project, DomainModel domain, GeneratorConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Domain Model: " + project);
        lines.add("");

        lines.add(H2 + "Structs");
        lines.add("");
        if (domain.structs().isEmpty()) {
            lines.add("No public structs found.");
        }
        appendCapped(lines, domain.structs(), config.maxListItems(),
            struct -> BULLET + "**" + struct.name() + "** (" + CODE + struct.file() + CODE + ")"
                + memberSuffix("fields", struct.fields()));
        lines.add("");

        lines.add(H2 + "Enums");
        lines.add("");
        if (domain.enums().isEmpty()) {
            lines.add("No public enums found.");
        }
        appendCapped(lines, domain.enums(), config.maxListItems(),
            enumType -> BULLET + "**" + enumType.name() + "** (" + CODE + enumType.file() + CODE + ")"
                + memberSuffix("variants", enumType.variants()));
        lines.add("");

        if (!domain.typeAliases().isEmpty()) {
            lines.add(H2 + "Type Aliases");
            lines.add("");
            appendCapped(lines, domain.typeAliases(), config.maxListItems(),
                alias -> BULLET + CODE + alias.name() + " = " + alias.target() + CODE);
            lines.add("");
        }

        if (!domain.traits().isEmpty()) {
            lines.add(H2 + "Traits");
            lines.add("");
            appendCapped(lines, domain.traits(), config.maxListItems(),
                trait -> BULLET + CODE + trait.name() + CODE + " in " + CODE + trait.file() + CODE);
        }
        return join(lines);
    }

    private static String memberSuffix(String label, List<String> members) {
        if (members.isEmpty()) {
            return "";
        }
        return " - " + label + ": " + members.stream()
            .map(member -> CODE + member + CODE)
            .collect(Collectors.joining(", "));
    }

    private String generateErrorHandlingReport(String project, ErrorHandling errors) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Error Handling: " + project);
        lines.add("");
        lines.add(H2 + "Error Crates");
        lines.add("");
        lines.add("- **anyhow:** " + (errors.usesAnyhow() ? PRESENT : ABSENT));
        lines.add("- **thiserror:** " + (errors.usesThiserror() ? PRESENT : ABSENT));
        lines.add("");
        lines.add(H2 + "Propagation");
        lines.add("");
        lines.add(PIPE + " Idiom " + PIPE + " Count " + PIPE);
        lines.add("|-------|-------|");
        lines.add(row("Functions returning Result", errors.resultReturns()));
        lines.add(row("`?` operators", errors.questionMarks()));
        lines.add(row("`.unwrap()` calls", errors.unwrapCalls()));
        lines.add(row("`.expect()` calls", errors.expectCalls()));
        lines.add(row("Error derives", errors.errorDerives()));
        lines.add("");
        lines.add(H2 + "Custom Error Types");
        lines.add("");
        if (errors.customErrors().isEmpty()) {
            lines.add("No custom error enums found.");
        }
        for (ErrorHandling.CustomError error : errors.customErrors()) {
            lines.add(BULLET + CODE + error.name() + CODE + " in " + CODE + error.file() + CODE);
        }
        return join(lines);
    }

    private String generatePatternLibrary(String project, PatternLibrary library) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Pattern Library: " + project);
        lines.add("");
        lines.add(H2 + "Detected Patterns");
        lines.add("");

        if (library.entries().isEmpty()) {
            lines.add("No patterns detected.");
            return join(lines);
        }

        for (PatternLibrary.Entry entry : library.entries()) {
            lines.add(H3 + entry.name());
            lines.add("**Confidence:** " + percent(entry.confidence()));
            lines.add("");
            if (!entry.description().isEmpty()) {
                lines.add("#### Description");
                lines.add(entry.description());
                lines.add("");
            }
            if (!entry.evidence().isEmpty()) {
                lines.add("#### Evidence");
                entry.evidence().stream()
                    .limit(LIBRARY_EVIDENCE_LIMIT)
                    .forEach(evidence -> lines.add(BULLET + evidence));
                lines.add("");
            }
            if (!entry.whenToUse().isEmpty()) {
                lines.add("#### When to Use");
                entry.whenToUse().forEach(use -> lines.add(BULLET + use));
                lines.add("");
            }
            if (!entry.relatedPatterns().isEmpty()) {
                lines.add("#### Related Patterns");
                lines.add(String.join(", ", entry.relatedPatterns()));
                lines.add("");
            }
            lines.add("---");
            lines.add("");
        }
        return join(lines);
    }

    /**
     * Renders the cross-project pattern matrix.
     *
     * <p>Style cells show the confidence of a present style, pattern and
     * communication cells only presence. Projects appear in input order.
     *
     * @param comparison comparison produced by the pattern comparator
     * @return Markdown document
     */
    public String generateComparisonMatrix(PatternComparison comparison) {
        Objects.requireNonNull(comparison, "comparison must not be null");

        List<PatternComparison.ProjectPatterns> projects = comparison.projects();
        List<String> lines = new ArrayList<>();
        lines.add(H1 + "Pattern Cross-Reference Matrix");
        lines.add("");
        lines.add("Comparison of architectural patterns across Rust projects.");
        lines.add("");

        lines.add(H2 + "Architecture Styles");
        lines.add("");
        appendMatrixHeader(lines, "Style", projects);
        for (String style : comparison.allStyles()) {
            List<String> cells = new ArrayList<>();
            cells.add(escape(style));
            for (PatternComparison.ProjectPatterns project : projects) {
                cells.add(project.style(style)
                    .map(detection -> PRESENT + " " + percent(detection.confidence()))
                    .orElse(ABSENT));
            }
            lines.add(tableRow(cells));
        }

        lines.add("");
        lines.add(H2 + "Design Patterns");
        lines.add("");
        appendMatrixHeader(lines, "Pattern", projects);
        for (String pattern : comparison.allPatterns()) {
            List<String> cells = new ArrayList<>();
            cells.add(escape(pattern));
            for (PatternComparison.ProjectPatterns project : projects) {
                cells.add(project.hasPattern(pattern) ? PRESENT : ABSENT);
            }
            lines.add(tableRow(cells));
        }

        lines.add("");
        lines.add(H2 + "Communication Patterns");
        lines.add("");
        appendMatrixHeader(lines, "Pattern", projects);
        for (String communication : comparison.allCommunication()) {
            List<String> cells = new ArrayList<>();
            cells.add(escape(communication));
            for (PatternComparison.ProjectPatterns project : projects) {
                cells.add(project.communication().contains(communication) ? PRESENT : ABSENT);
            }
            lines.add(tableRow(cells));
        }

        lines.add("");
        lines.add(H2 + "Project Summary");
        lines.add("");
        lines.add("| Project | Crates | Primary Style | Key Patterns |");
        lines.add("|---------|--------|---------------|--------------|");
        for (PatternComparison.ProjectPatterns project : projects) {
            String primaryStyle = project.styles().isEmpty()
                ? NOT_AVAILABLE
                : project.styles().get(0).name();
            String keyPatterns = project.designPatterns().stream()
                .limit(KEY_PATTERN_LIMIT)
                .map(Detection::name)
                .collect(Collectors.joining(", "));
            lines.add(tableRow(List.of(
                escape(project.project()),
                String.valueOf(project.packageCount()),
                escape(primaryStyle),
                keyPatterns.isEmpty() ? NOT_AVAILABLE : escape(keyPatterns))));
        }

        return join(lines);
    }

    private void appendNameGroup(List<String> lines, String label, List<String> names, int limit) {
        lines.add(H3 + CODE + label + CODE + " (" + names.size() + " items)");
        lines.add("");
        new TreeSet<>(names).stream()
            .limit(limit)
            .forEach(name -> lines.add(BULLET + CODE + name + CODE));
        if (names.size() > limit) {
            lines.add(String.format(MORE_FORMAT, names.size() - limit));
        }
        lines.add("");
    }

    private <T> void appendCapped(List<String> lines, List<T> items, int limit,
                                  Function<T, String> formatter) {
        items.stream()
            .limit(limit)
            .forEach(item -> lines.add(formatter.apply(item)));
        if (items.size() > limit) {
            lines.add(String.format(MORE_FORMAT, items.size() - limit));
        }
    }

    private void appendMatrixHeader(List<String> lines, String firstColumn,
                                    List<PatternComparison.ProjectPatterns> projects) {
        List<String> header = new ArrayList<>();
        header.add(firstColumn);
        projects.forEach(project -> header.add(escape(project.project())));
        lines.add(tableRow(header));
        lines.add(PIPE + "---|".repeat(projects.size() + 1));
    }

    private static List<Map.Entry<String, Integer>> byCountDescending(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        return entries;
    }

    private static String percent(double confidence) {
        return String.format(Locale.ROOT, "%.0f%%", confidence * 100);
    }

    private static String row(String label, int value) {
        return PIPE + " " + label + " " + PIPE + " " + value + " " + PIPE;
    }

    private static String tableRow(List<String> cells) {
        return PIPE + " " + String.join(" " + PIPE + " ", cells) + " " + PIPE;
    }

    /**
     * Escapes pipes and newlines so values stay inside one table cell.
     */
    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace(PIPE, "\\|").replace(NEWLINE, " ");
    }

    private static String join(List<String> lines) {
        return String.join(NEWLINE, lines) + NEWLINE;
    }
}
