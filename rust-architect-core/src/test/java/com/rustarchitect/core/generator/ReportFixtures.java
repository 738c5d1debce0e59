package com.rustarchitect.core.generator;

import com.rustarchitect.core.index.ApiSurfaceAnalyzer;
import com.rustarchitect.core.index.SemanticIndexer;
import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.Cluster;
import com.rustarchitect.core.model.CodeMetrics;
import com.rustarchitect.core.model.CommunicationPattern;
import com.rustarchitect.core.model.Detection;
import com.rustarchitect.core.model.DomainModel;
import com.rustarchitect.core.model.Edge;
import com.rustarchitect.core.model.EdgeType;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.EntityKind;
import com.rustarchitect.core.model.ErrorHandling;
import com.rustarchitect.core.model.KnowledgeGraph;
import com.rustarchitect.core.model.Manifest;
import com.rustarchitect.core.model.PatternLibrary;
import com.rustarchitect.core.model.ScanStatistics;
import com.rustarchitect.core.model.Visibility;

import java.util.List;
import java.util.Map;

/**
 * Hand-built analysis results shared by the generator tests.
 */
public final class ReportFixtures {

    public static final String PROJECT = "demo";

    private ReportFixtures() {
    }

    public static List<Entity> entities() {
        return List.of(
            new Entity("Config", EntityKind.STRUCT, Visibility.PUB, "src/config.rs", 3, "Application settings."),
            new Entity("Pool", EntityKind.STRUCT, Visibility.PUB, "src/config.rs", 9, null),
            new Entity("main", EntityKind.FN, Visibility.PRIVATE, "src/main.rs", 7, null),
            new Entity("Handler", EntityKind.TRAIT, Visibility.PUB, "src/server.rs", 1, null),
            new Entity("Server", EntityKind.STRUCT, Visibility.PUB, "src/server.rs", 3, null),
            new Entity("run", EntityKind.FN, Visibility.PUB_CRATE, "src/server.rs", 9, null)
        );
    }

    public static List<Edge> edges() {
        return List.of(
            new Edge("Server", "Handler", EdgeType.IMPLEMENTS, "src/server.rs"),
            new Edge("Server", "Handler", EdgeType.IMPLEMENTS, "src/server.rs"),
            new Edge(Edge.FIELD_USAGE, "Config", EdgeType.REFERENCES, "src/server.rs"),
            new Edge("main", "Config", EdgeType.USES, "src/main.rs")
        );
    }

    public static KnowledgeGraph graph() {
        return new KnowledgeGraph(
            PROJECT,
            entities(),
            edges(),
            List.of(
                new Cluster("Domain Layer", List.of("Config", "Pool")),
                new Cluster("Interface Layer", List.of("Handler", "Server", "main", "run"))
            ),
            List.of("Config"),
            null
        );
    }

    /**
     * A workspace model with detections of every kind.
     */
    public static ArchitectureModel model() {
        Manifest manifest = new Manifest("[workspace]\n", null, null, List.of("tokio"),
            List.of("crates/api", "crates/core"), 4);
        ScanStatistics statistics = new ScanStatistics(5, 1, 4, 1,
            Map.of("IllegalStateException", 1), List.of("src/bad.rs (entity extraction): broken"));
        return new ArchitectureModel(
            PROJECT,
            manifest,
            entities(),
            graph(),
            new SemanticIndexer().build(entities(), edges(), List.of("src/main.rs")),
            List.of(new Detection("Builder", 2.0 / 3.0, List.of("keyword: Builder", "keyword: with_"),
                "Fluent construction of complex values")),
            List.of(new Detection("Multi-Crate Workspace", 0.9, List.of("Workspace with 4 packages"),
                "Multiple crates in a workspace, each with specific responsibility")),
            List.of(new CommunicationPattern("Shared State (Mutex)", List.of("Arc<Mutex", "Mutex<"), 4)),
            new ApiSurfaceAnalyzer().analyze(entities()),
            new CodeMetrics(4, 120, 90, 10, 20),
            statistics,
            domainModel(),
            errorHandling(),
            patternLibrary()
        );
    }

    public static DomainModel domainModel() {
        return new DomainModel(
            List.of(new DomainModel.StructType("Config", List.of("name", "port"), "src/config.rs")),
            List.of(new DomainModel.EnumType("Mode", List.of("Fast", "Safe"), "src/config.rs")),
            List.of(new DomainModel.TypeAlias("Result", "std::result::Result<T, Error>", "src/lib.rs")),
            List.of(new DomainModel.TraitType("Handler", "src/server.rs"))
        );
    }

    public static ErrorHandling errorHandling() {
        return new ErrorHandling(true, false,
            List.of(new ErrorHandling.CustomError("ConfigError", "src/config.rs")),
            1, 6, 2, 1, 9);
    }

    public static PatternLibrary patternLibrary() {
        return new PatternLibrary(List.of(new PatternLibrary.Entry("Builder", 2.0 / 3.0,
            List.of("keyword: Builder", "keyword: with_"),
            "Constructs complex objects step by step.",
            List.of("Complex object construction", "Fluent API design"),
            List.of("Type-State"))));
    }

    /**
     * A single-crate model with no detections.
     */
    public static ArchitectureModel emptyModel() {
        return ArchitectureModel.empty(PROJECT, Manifest.empty(), ScanStatistics.empty());
    }
}
