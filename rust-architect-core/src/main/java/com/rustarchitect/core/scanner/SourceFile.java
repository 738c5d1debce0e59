package com.rustarchitect.core.scanner;

import com.rustarchitect.core.util.FileUtils;

import java.util.Objects;

/**
 * A decoded source file.
 *
 * @param path project-relative path with {@code /} separators
 * @param content decoded text (invalid UTF-8 sequences replaced)
 */
public record SourceFile(String path, String content) {

    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Returns the file name without extension, used as the approximate module scope.
     *
     * @return file stem
     */
    public String stem() {
        return FileUtils.stem(path);
    }
}
