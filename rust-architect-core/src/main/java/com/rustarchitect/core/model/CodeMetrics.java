package com.rustarchitect.core.model;

/**
 * Line counts over the scanned source files.
 *
 * @param files number of files counted
 * @param lines total lines
 * @param code non-blank, non-comment lines
 * @param comments lines starting with a comment marker
 * @param blanks blank lines
 */
public record CodeMetrics(
    int files,
    int lines,
    int code,
    int comments,
    int blanks
) {
    public static CodeMetrics empty() {
        return new CodeMetrics(0, 0, 0, 0, 0);
    }
}
