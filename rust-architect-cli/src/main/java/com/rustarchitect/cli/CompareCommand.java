package com.rustarchitect.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rustarchitect.core.ArchitectureAnalyzer;
import com.rustarchitect.core.comparison.PatternComparator;
import com.rustarchitect.core.generator.impl.MarkdownGenerator;
import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.PatternComparison;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to compare detected patterns across several projects.
 *
 * <p>Each project is analysed with its own configuration. The result is a Markdown
 * matrix of styles, design patterns and communication patterns per project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print the matrix
 * rustarchitect compare ../tokio ../axum ../serde
 *
 * # Write it to a file
 * rustarchitect compare ../tokio ../axum -o docs/matrix.md
 * }</pre>
 */
@Command(
    name = "compare",
    description = "Compare architecture patterns across projects",
    mixinStandardHelpOptions = true
)
public class CompareCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompareCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        arity = "1..*",
        description = "Project directories to compare"
    )
    private List<Path> projectPaths;

    @Option(
        names = {"-o", "--output"},
        description = "Write the comparison matrix to this file instead of stdout"
    )
    private Path outputFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            List<ArchitectureModel> models = new ArrayList<>();
            for (Path projectPath : projectPaths) {
                Path root = projectPath.toAbsolutePath().normalize();
                if (!Files.isDirectory(root)) {
                    err.println("✗ Project directory not found: " + root);
                    return 1;
                }
                log.info("Analysing {}", root);
                models.add(ArchitectureAnalyzer.forProject(root).analyze(root));
            }

            PatternComparison comparison = new PatternComparator().compare(models);
            String matrix = new MarkdownGenerator().generateComparisonMatrix(comparison);

            if (outputFile == null) {
                out.print(matrix);
                out.flush();
                return 0;
            }

            Path target = outputFile.toAbsolutePath().normalize();
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, matrix, StandardCharsets.UTF_8);
            out.println("✓ Compared " + models.size() + " projects");
            out.println("✓ Wrote comparison matrix to: " + target);
            return 0;

        } catch (Exception e) {
            log.error("Comparison failed", e);
            err.println("✗ Comparison failed: " + e.getMessage());
            return 1;
        }
    }
}
