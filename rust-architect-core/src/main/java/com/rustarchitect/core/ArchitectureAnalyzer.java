package com.rustarchitect.core;

import com.rustarchitect.core.cluster.ClusterAssigner;
import com.rustarchitect.core.config.AnalysisConfig;
import com.rustarchitect.core.config.ConfigLoader;
import com.rustarchitect.core.detector.PatternDetector;
import com.rustarchitect.core.detector.PatternLibraryBuilder;
import com.rustarchitect.core.detector.SignatureCatalogLoader;
import com.rustarchitect.core.extractor.EntityExtractor;
import com.rustarchitect.core.extractor.RelationshipExtractor;
import com.rustarchitect.core.index.ApiSurfaceAnalyzer;
import com.rustarchitect.core.index.DomainModelAnalyzer;
import com.rustarchitect.core.index.SemanticIndexer;
import com.rustarchitect.core.metrics.CodeMetricsCollector;
import com.rustarchitect.core.metrics.ErrorHandlingAnalyzer;
import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.CommunicationPattern;
import com.rustarchitect.core.model.Detection;
import com.rustarchitect.core.model.Edge;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.KnowledgeGraph;
import com.rustarchitect.core.model.Manifest;
import com.rustarchitect.core.model.ScanStatistics;
import com.rustarchitect.core.model.SemanticIndex;
import com.rustarchitect.core.model.SignatureCatalog;
import com.rustarchitect.core.scanner.ManifestReader;
import com.rustarchitect.core.scanner.SourceFile;
import com.rustarchitect.core.scanner.SourceScanResult;
import com.rustarchitect.core.scanner.SourceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs the full extraction pipeline over one project.
 *
 * <p>Files are processed sequentially in path order. Entities of all files are collected
 * first, so relationship extraction sees every name declared anywhere in the project.
 * Graph nodes are collapsed by bare name, first seen by file path then line.
 *
 * <p>A failure inside an extractor for one file is logged and counted; the run continues
 * with the other files. A project without source files yields an all-empty model.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchitectureAnalyzer analyzer = ArchitectureAnalyzer.forProject(root);
 * ArchitectureModel model = analyzer.analyze(root);
 * model.designPatterns().forEach(d -> System.out.println(d.name() + " " + d.confidence()));
 * }</pre>
 */
public class ArchitectureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureAnalyzer.class);
    private static final String DEFAULT_PROJECT_NAME = "project";

    private final AnalysisConfig config;
    private final SourceScanner sourceScanner;
    private final ManifestReader manifestReader;
    private final EntityExtractor entityExtractor;
    private final RelationshipExtractor relationshipExtractor;
    private final PatternDetector patternDetector;
    private final ClusterAssigner clusterAssigner;
    private final SemanticIndexer semanticIndexer;
    private final ApiSurfaceAnalyzer apiSurfaceAnalyzer;
    private final CodeMetricsCollector metricsCollector;
    private final DomainModelAnalyzer domainModelAnalyzer;
    private final ErrorHandlingAnalyzer errorHandlingAnalyzer;
    private final PatternLibraryBuilder patternLibraryBuilder;
    private final SignatureCatalogLoader catalogLoader;

    public ArchitectureAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public ArchitectureAnalyzer(AnalysisConfig config) {
        this(config, new EntityExtractor(), new RelationshipExtractor());
    }

    ArchitectureAnalyzer(AnalysisConfig config, EntityExtractor entityExtractor,
                         RelationshipExtractor relationshipExtractor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sourceScanner = new SourceScanner(config.source());
        this.manifestReader = new ManifestReader();
        this.entityExtractor = entityExtractor;
        this.relationshipExtractor = relationshipExtractor;
        this.patternDetector = new PatternDetector(config.detection());
        this.clusterAssigner = new ClusterAssigner();
        this.semanticIndexer = new SemanticIndexer(config.index().hotSpotLimit());
        this.apiSurfaceAnalyzer = new ApiSurfaceAnalyzer();
        this.metricsCollector = new CodeMetricsCollector();
        this.domainModelAnalyzer = new DomainModelAnalyzer();
        this.errorHandlingAnalyzer = new ErrorHandlingAnalyzer();
        this.patternLibraryBuilder = new PatternLibraryBuilder();
        this.catalogLoader = new SignatureCatalogLoader();
    }

    /**
     * Creates an analyzer configured from {@code rustarchitect.yaml} in the project root,
     * or with defaults when there is none.
     *
     * @param projectRoot project root directory
     * @return configured analyzer
     */
    public static ArchitectureAnalyzer forProject(Path projectRoot) {
        return new ArchitectureAnalyzer(ConfigLoader.loadFromProject(projectRoot));
    }

    public AnalysisConfig config() {
        return config;
    }

    /**
     * Analyses a project.
     *
     * @param projectRoot project root directory
     * @return complete architecture model
     * @throws com.rustarchitect.core.detector.CatalogLoadException if a configured catalog cannot be loaded
     */
    public ArchitectureModel analyze(Path projectRoot) {
        Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        Path root = projectRoot.toAbsolutePath().normalize();
        String project = projectName(root);
        log.info("Analyzing project {} at {}", project, root);

        Manifest manifest = manifestReader.read(root);
        SourceScanResult scan = sourceScanner.scan(root);
        if (scan.isEmpty()) {
            log.warn("No source files in {}, returning an empty model", root);
            return ArchitectureModel.empty(project, manifest, scan.statistics());
        }

        ScanStatistics.Builder failures = new ScanStatistics.Builder();
        List<Entity> entities = extractEntities(scan.files(), failures);
        Set<String> knownNames = new LinkedHashSet<>();
        entities.forEach(entity -> knownNames.add(entity.name()));
        List<Edge> edges = extractRelationships(scan.files(), knownNames, failures);

        List<Entity> nodes = collapseByName(entities);
        KnowledgeGraph graph = new KnowledgeGraph(
            project,
            nodes,
            edges,
            clusterAssigner.assign(nodes),
            collapsedNames(entities),
            null
        );
        SemanticIndex index = semanticIndexer.build(nodes, edges, scan.paths());

        AnalysisConfig.CatalogOverrides overrides = config.detection().catalogs();
        SignatureCatalog designCatalog = catalogLoader.loadOrBundled(
            SignatureCatalogLoader.DESIGN_PATTERNS, overrides.designPatterns(), root);
        SignatureCatalog styleCatalog = catalogLoader.loadOrBundled(
            SignatureCatalogLoader.ARCHITECTURE_STYLES, overrides.architectureStyles(), root);
        SignatureCatalog communicationCatalog = catalogLoader.loadOrBundled(
            SignatureCatalogLoader.COMMUNICATION_PATTERNS, overrides.communicationPatterns(), root);

        String corpus = scan.corpus();
        List<Detection> designPatterns = patternDetector.detectSignatures(corpus, manifest.rawText(), designCatalog);
        List<Detection> styles = patternDetector.detectArchitectureStyles(corpus, manifest, styleCatalog);
        List<CommunicationPattern> communication =
            patternDetector.detectCommunicationPatterns(corpus, manifest.rawText(), communicationCatalog);

        ScanStatistics statistics = scan.statistics().withFailures(failures.build());
        log.info("Extracted {} entities ({} nodes), {} edges, {} clusters from {} files",
            entities.size(), nodes.size(), edges.size(), graph.clusters().size(), scan.files().size());
        log.info("Detected {} design patterns, {} architecture styles, {} communication patterns",
            designPatterns.size(), styles.size(), communication.size());
        if (statistics.hasFailures()) {
            log.warn("{} files failed: {}", statistics.filesFailed(), statistics.topErrors());
        }

        return new ArchitectureModel(
            project,
            manifest,
            entities,
            graph,
            index,
            designPatterns,
            styles,
            communication,
            apiSurfaceAnalyzer.analyze(entities),
            metricsCollector.collect(scan.files()),
            statistics,
            domainModelAnalyzer.analyze(scan.files()),
            errorHandlingAnalyzer.analyze(scan.files()),
            patternLibraryBuilder.build(designPatterns)
        );
    }

    private List<Entity> extractEntities(List<SourceFile> files, ScanStatistics.Builder failures) {
        List<Entity> entities = new ArrayList<>();
        for (SourceFile file : files) {
            try {
                entities.addAll(entityExtractor.extract(file.content(), file.path()));
            } catch (RuntimeException e) {
                recordFailure(failures, file, "entity extraction", e);
            }
        }
        return entities;
    }

    private List<Edge> extractRelationships(List<SourceFile> files, Set<String> knownNames,
                                            ScanStatistics.Builder failures) {
        List<Edge> edges = new ArrayList<>();
        for (SourceFile file : files) {
            try {
                edges.addAll(relationshipExtractor.extract(file.content(), file.path(), knownNames));
            } catch (RuntimeException e) {
                recordFailure(failures, file, "relationship extraction", e);
            }
        }
        return edges;
    }

    private static void recordFailure(ScanStatistics.Builder failures, SourceFile file, String stage,
                                      RuntimeException e) {
        log.warn("Skipping {} for {}: {}", stage, file.path(), e.getMessage(), e);
        failures.incrementFilesFailed();
        failures.addError(e.getClass().getSimpleName(), file.path() + " (" + stage + "): " + e.getMessage());
    }

    /**
     * Keeps the first entity of every name. Input order is file path then line, so the
     * result is deterministic.
     */
    static List<Entity> collapseByName(List<Entity> entities) {
        Map<String, Entity> nodes = new LinkedHashMap<>();
        for (Entity entity : entities) {
            nodes.putIfAbsent(entity.name(), entity);
        }
        return new ArrayList<>(nodes.values());
    }

    /**
     * Returns the names declared in more than one file, sorted.
     */
    static List<String> collapsedNames(List<Entity> entities) {
        Map<String, Set<String>> modules = new LinkedHashMap<>();
        for (Entity entity : entities) {
            modules.computeIfAbsent(entity.name(), key -> new LinkedHashSet<>()).add(entity.module());
        }
        TreeSet<String> collapsed = new TreeSet<>();
        modules.forEach((name, files) -> {
            if (files.size() > 1) {
                collapsed.add(name);
            }
        });
        return new ArrayList<>(collapsed);
    }

    private String projectName(Path root) {
        String configured = config.project().name();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        Path fileName = root.getFileName();
        return fileName == null ? DEFAULT_PROJECT_NAME : fileName.toString();
    }
}
