package com.rustarchitect.core.generator;

import java.util.Objects;

/**
 * Represents a generated report.
 *
 * @param name report name, used as the file name without extension
 * @param content report content (JSON, Markdown, Mermaid)
 * @param fileExtension file extension for this content
 */
public record GeneratedReport(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name this report is written to.
     *
     * @return name plus extension
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
