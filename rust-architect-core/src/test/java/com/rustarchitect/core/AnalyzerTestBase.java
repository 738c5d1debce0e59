package com.rustarchitect.core;

import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Base class for tests that analyse a project laid out on disk.
 *
 * <p>Provides a temporary project root and helpers to populate it with
 * {@code Cargo.toml} manifests and Rust source files.
 */
public abstract class AnalyzerTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "Cargo.toml" or "src/model/user.rs")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Creates a directory in the temp directory.
     *
     * @param relativePath path relative to tempDir (e.g., "src/net")
     * @return the created directory path
     * @throws IOException if directory cannot be created
     */
    protected Path createDirectory(String relativePath) throws IOException {
        Path dirPath = tempDir.resolve(relativePath);
        Files.createDirectories(dirPath);
        return dirPath;
    }

    /**
     * Creates multiple files from a map of relative paths to content.
     *
     * @param files map of relative path to content
     * @throws IOException if any file cannot be created
     */
    protected void createFiles(Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            createFile(entry.getKey(), entry.getValue());
        }
    }
}
