package com.rustarchitect.core.scanner;

import com.rustarchitect.core.config.AnalysisConfig;
import com.rustarchitect.core.model.ScanStatistics;
import com.rustarchitect.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Enumerates the production Rust files of a project.
 *
 * <p>Files are collected from the configured source directory ({@code src} by default),
 * falling back to the project root when it does not exist. A file is excluded when its
 * project-relative path, prefixed with {@code /}, contains one of the exclude patterns;
 * {@code target} directories are never entered.
 *
 * <p>Files are decoded as UTF-8, replacing malformed input. A file that cannot be read
 * is logged and counted as failed; the scan continues with the other files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceScanResult result = new SourceScanner().scan(Path.of("my-crate"));
 * result.files().forEach(f -> System.out.println(f.path()));
 * }</pre>
 */
public class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    private static final String RUST_EXTENSION = "rs";
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of("target", ".git");

    private final AnalysisConfig.SourceConfig config;

    public SourceScanner() {
        this(AnalysisConfig.SourceConfig.defaults());
    }

    public SourceScanner(AnalysisConfig.SourceConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Scans a project for source files.
     *
     * @param projectRoot project root directory
     * @return decoded files sorted by relative path; empty if the root does not exist
     */
    public SourceScanResult scan(Path projectRoot) {
        Objects.requireNonNull(projectRoot, "projectRoot must not be null");

        if (!Files.isDirectory(projectRoot)) {
            log.warn("Project directory does not exist: {}", projectRoot);
            return SourceScanResult.empty(projectRoot);
        }

        Path sourceRoot = resolveSourceRoot(projectRoot);
        List<Path> candidates;
        try {
            candidates = FileUtils.findFiles(sourceRoot, RUST_EXTENSION, SKIPPED_DIRECTORIES);
        } catch (IOException e) {
            log.warn("Failed to list source files under {}: {}", sourceRoot, e.getMessage());
            return SourceScanResult.empty(projectRoot);
        }

        ScanStatistics.Builder stats = new ScanStatistics.Builder();
        List<SourceFile> files = new ArrayList<>();

        candidates.stream()
            .sorted(Comparator.comparing(file -> FileUtils.relativePath(projectRoot, file)))
            .forEach(file -> {
                stats.incrementFilesDiscovered();
                String relativePath = FileUtils.relativePath(projectRoot, file);

                if (isExcluded(relativePath)) {
                    log.debug("Excluding {}", relativePath);
                    stats.incrementFilesExcluded();
                    return;
                }

                try {
                    files.add(new SourceFile(relativePath, readContent(file)));
                    stats.incrementFilesScanned();
                } catch (IOException e) {
                    log.warn("Skipping unreadable file {}: {}", relativePath, e.getMessage());
                    stats.incrementFilesFailed();
                    stats.addError(e.getClass().getSimpleName(), relativePath + ": " + e.getMessage());
                }
            });

        if (files.isEmpty()) {
            log.warn("No source files found under {}", sourceRoot);
        } else {
            log.info("Scanned {} source files under {}", files.size(), sourceRoot);
        }

        return new SourceScanResult(projectRoot, sourceRoot, files, stats.build());
    }

    /**
     * Checks a project-relative path against the exclude patterns.
     *
     * @param relativePath {@code /}-separated path relative to the project root
     * @return true if the file is test, bench or example code
     */
    public boolean isExcluded(String relativePath) {
        if (config.includeTests()) {
            return false;
        }
        String anchored = "/" + relativePath;
        for (String pattern : config.excludePatterns()) {
            if (anchored.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads and decodes one source file.
     *
     * @param file absolute file path
     * @return file content
     * @throws IOException if the file cannot be read
     */
    String readContent(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private Path resolveSourceRoot(Path projectRoot) {
        Path sourceRoot = projectRoot.resolve(config.directory());
        if (Files.isDirectory(sourceRoot)) {
            return sourceRoot;
        }
        log.debug("Source directory {} not found, scanning project root", sourceRoot);
        return projectRoot;
    }
}
