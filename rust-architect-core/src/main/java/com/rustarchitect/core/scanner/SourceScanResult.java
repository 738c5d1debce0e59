package com.rustarchitect.core.scanner;

import com.rustarchitect.core.model.ScanStatistics;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Production source files of one project, sorted by relative path.
 *
 * @param projectRoot project root directory
 * @param sourceRoot directory the files were collected from
 * @param files decoded files in path order
 * @param statistics discovery and read statistics
 */
public record SourceScanResult(
    Path projectRoot,
    Path sourceRoot,
    List<SourceFile> files,
    ScanStatistics statistics
) {
    public SourceScanResult {
        Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        sourceRoot = sourceRoot == null ? projectRoot : sourceRoot;
        files = files == null ? List.of() : List.copyOf(files);
        statistics = statistics == null ? ScanStatistics.empty() : statistics;
    }

    /**
     * Creates a result without any files.
     *
     * @param projectRoot project root
     * @return empty result
     */
    public static SourceScanResult empty(Path projectRoot) {
        return new SourceScanResult(projectRoot, projectRoot, List.of(), ScanStatistics.empty());
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * Concatenates all file contents, each followed by a newline.
     *
     * @return aggregated corpus text
     */
    public String corpus() {
        StringBuilder corpus = new StringBuilder();
        for (SourceFile file : files) {
            corpus.append(file.content()).append('\n');
        }
        return corpus.toString();
    }

    /**
     * Returns the relative paths of all files.
     *
     * @return paths in scan order
     */
    public List<String> paths() {
        return files.stream().map(SourceFile::path).toList();
    }
}
