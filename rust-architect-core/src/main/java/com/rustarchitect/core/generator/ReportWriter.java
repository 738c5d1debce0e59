package com.rustarchitect.core.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes generated reports to the filesystem.
 *
 * <p>Creates the output directory automatically. Existing files are overwritten.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ReportWriter writer = new ReportWriter(Path.of("./docs/architecture"));
 * writer.write(List.of(new GeneratedReport("patterns", "# Patterns", "md")));
 * // Creates: ./docs/architecture/patterns.md
 * }</pre>
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final Path outputDirectory;

    public ReportWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Writes reports below the output directory.
     *
     * @param reports reports to write
     * @return written file paths
     * @throws IllegalStateException if the directory or a file cannot be written
     */
    public List<Path> write(List<GeneratedReport> reports) {
        log.info("Writing {} reports to {}", reports.size(), outputDirectory);
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDirectory, e);
        }

        List<Path> written = new ArrayList<>();
        for (GeneratedReport report : reports) {
            written.add(writeReport(report));
        }
        return written;
    }

    private Path writeReport(GeneratedReport report) {
        Path target = outputDirectory.resolve(report.fileName());
        try {
            Files.writeString(target, report.content(), StandardCharsets.UTF_8);
            log.debug("Wrote report: {} ({} chars)", target, report.content().length());
            return target;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report: " + target, e);
        }
    }
}
