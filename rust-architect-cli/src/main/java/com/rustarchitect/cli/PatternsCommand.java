package com.rustarchitect.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rustarchitect.core.ArchitectureAnalyzer;
import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.CommunicationPattern;
import com.rustarchitect.core.model.Detection;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to print the design patterns, architecture styles and communication
 * patterns detected in a project.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * rustarchitect patterns ../tokio
 * }</pre>
 */
@Command(
    name = "patterns",
    description = "Detect design patterns, architecture styles and communication patterns",
    mixinStandardHelpOptions = true
)
public class PatternsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PatternsCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

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

            ArchitectureModel model = ArchitectureAnalyzer.forProject(root).analyze(root);

            printDetections(out, "Design Patterns", model.designPatterns());
            printDetections(out, "Architecture Styles", model.architectureStyles());

            out.println("Communication Patterns:");
            if (model.communicationPatterns().isEmpty()) {
                out.println("  None detected.");
            }
            for (CommunicationPattern pattern : model.communicationPatterns()) {
                out.printf("  • %s (%d usages)%n", pattern.name(), pattern.usageCount());
                out.printf("    Markers: %s%n", String.join(", ", pattern.evidence()));
            }
            out.println();
            return 0;

        } catch (Exception e) {
            log.error("Pattern detection failed", e);
            err.println("✗ Pattern detection failed: " + e.getMessage());
            return 1;
        }
    }

    private void printDetections(PrintWriter out, String title, List<Detection> detections) {
        out.println(title + ":");
        if (detections.isEmpty()) {
            out.println("  None detected.");
        }
        for (Detection detection : detections) {
            out.printf("  • %s (%.0f%%)%n", detection.name(), detection.confidence() * 100);
            for (String evidence : detection.evidence()) {
                out.println("    - " + evidence);
            }
        }
        out.println();
    }
}
