package com.rustarchitect.core.metrics;

import com.rustarchitect.core.model.CodeMetrics;
import com.rustarchitect.core.scanner.SourceFile;

import java.util.List;
import java.util.Objects;

/**
 * Counts lines of the scanned source files.
 *
 * <p>A trimmed line starting with {@code //} or {@code /*} is a comment line. Lines inside
 * a multi-line block comment count as code; this is a line counter, not a lexer.
 */
public class CodeMetricsCollector {

    public CodeMetrics collect(List<SourceFile> files) {
        Objects.requireNonNull(files, "files must not be null");

        int lines = 0;
        int code = 0;
        int comments = 0;
        int blanks = 0;

        for (SourceFile file : files) {
            for (String line : file.content().lines().toList()) {
                String trimmed = line.strip();
                lines++;
                if (trimmed.isEmpty()) {
                    blanks++;
                } else if (trimmed.startsWith("//") || trimmed.startsWith("/*")) {
                    comments++;
                } else {
                    code++;
                }
            }
        }

        return new CodeMetrics(files.size(), lines, code, comments, blanks);
    }
}
