package com.rustarchitect.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rustarchitect.core.ArchitectureAnalyzer;
import com.rustarchitect.core.config.AnalysisConfig;
import com.rustarchitect.core.config.ConfigLoader;
import com.rustarchitect.core.generator.GeneratedReport;
import com.rustarchitect.core.generator.GeneratorConfig;
import com.rustarchitect.core.generator.ReportGenerator;
import com.rustarchitect.core.generator.ReportGenerators;
import com.rustarchitect.core.generator.ReportWriter;
import com.rustarchitect.core.model.ArchitectureModel;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to analyse a project and write the reports of all enabled generators.
 *
 * <p>Orchestrates the full pipeline:
 * <ol>
 *   <li>Load {@code rustarchitect.yaml} (or the file given with {@code --config})</li>
 *   <li>Run the analyzer over the project</li>
 *   <li>Generate reports with the configured generators</li>
 *   <li>Write them below the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Analyse current directory
 * rustarchitect analyze
 *
 * # Analyse a crate and write reports elsewhere
 * rustarchitect analyze ../serde -o /tmp/serde-docs
 *
 * # Dry run (summary only, no reports written)
 * rustarchitect analyze --dry-run
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyse a Rust project and generate architecture reports",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: rustarchitect.yaml in the project)"
    )
    private Path configPath;

    @Option(
        names = {"--dry-run"},
        description = "Run the analysis but don't write reports"
    )
    private boolean dryRun;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Path root = projectPath.toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                err.println("✗ Project directory not found: " + root);
                return 1;
            }

            log.info("Starting analysis of: {}", root);
            out.println("Analysing project: " + root);
            out.println();

            if (dryRun) {
                out.println("Running in dry-run mode (no reports will be written)");
                out.println();
            }

            AnalysisConfig config = loadConfiguration(root);
            ArchitectureModel model = new ArchitectureAnalyzer(config).analyze(root);
            out.println("✓ Scanned " + model.statistics().filesScanned() + " files");
            printModelSummary(out, model);

            if (dryRun) {
                out.println("Dry-run mode: Skipping report generation");
                return 0;
            }

            List<ReportGenerator> generators = ReportGenerators.enabled(config.output().generators());
            List<GeneratedReport> reports =
                ReportGenerators.generateAll(generators, model, GeneratorConfig.defaults());
            out.println("✓ Generated " + reports.size() + " reports");

            Path outputDirectory = resolveOutputDirectory(root, config);
            new ReportWriter(outputDirectory).write(reports);
            out.println("✓ Wrote reports to: " + outputDirectory);
            out.println();
            out.println("✓ Analysis complete");
            return 0;

        } catch (Exception e) {
            log.error("Analysis failed", e);
            err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads the configuration file given on the command line, or the project's own.
     */
    private AnalysisConfig loadConfiguration(Path root) {
        if (configPath == null) {
            return ConfigLoader.loadFromProject(root);
        }
        Path absoluteConfigPath = configPath.isAbsolute() ? configPath : root.resolve(configPath);
        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    private Path resolveOutputDirectory(Path root, AnalysisConfig config) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath().normalize();
        }
        Path configured = Path.of(config.output().directory());
        return configured.isAbsolute() ? configured : root.resolve(configured).normalize();
    }

    private void printModelSummary(PrintWriter out, ArchitectureModel model) {
        out.println();
        out.println("Architecture Model Summary:");
        out.println("  Entities:         " + model.entities().size());
        out.println("  Graph Nodes:      " + model.graph().stats().totalNodes());
        out.println("  Relationships:    " + model.graph().stats().totalEdges());
        out.println("  Clusters:         " + model.graph().stats().totalClusters());
        out.println("  Design Patterns:  " + model.designPatterns().size());
        out.println("  Styles:           " + model.architectureStyles().size());
        out.println("  Communication:    " + model.communicationPatterns().size());
        out.println("  Public APIs:      " + model.index().stats().totalPublicApis());
        if (model.statistics().hasFailures()) {
            out.println("  Failed Files:     " + model.statistics().filesFailed());
        }
        out.println();
    }
}
