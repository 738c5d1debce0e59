package com.rustarchitect.core.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for extractors that read source text with regular expressions.
 *
 * <p>Matching is single-pass over raw text: there is no brace-depth tracking and no
 * exclusion of comments or string literals. Subclasses receive the text of one file
 * and its project-relative path.
 *
 * <p>Provides:
 * <ul>
 *   <li>Match iteration with access to named groups</li>
 *   <li>Offset to 1-based line number conversion</li>
 *   <li>Argument validation shared by all extractors</li>
 * </ul>
 */
public abstract class AbstractRegexExtractor {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected AbstractRegexExtractor() {
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Invokes {@code action} for each match of {@code pattern} in {@code text}, in text order.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @param action callback receiving the matcher positioned on the current match
     */
    protected void forEachMatch(Pattern pattern, String text, Consumer<Matcher> action) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            action.accept(matcher);
        }
    }

    /**
     * Checks if a pattern matches anywhere in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return true if pattern matches
     */
    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Returns the last {@code ::}-separated segment of a path.
     *
     * @param path Rust path such as {@code crate::model::User}
     * @return trailing segment, trimmed
     */
    protected static String lastSegment(String path) {
        String trimmed = path.trim();
        int separator = trimmed.lastIndexOf("::");
        return separator >= 0 ? trimmed.substring(separator + 2).trim() : trimmed;
    }

    // ==================== Line Utilities ====================

    /**
     * Computes the start offset of every line in {@code text}.
     *
     * @param text source text
     * @return ascending array of line start offsets, first element 0
     */
    protected static int[] lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Converts a character offset to a 1-based line number.
     *
     * @param lineStarts result of {@link #lineStarts(String)}
     * @param offset character offset
     * @return 1-based line number
     */
    protected static int lineAt(int[] lineStarts, int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    /**
     * Splits text into lines, dropping carriage returns.
     *
     * @param text source text
     * @return lines in order; index 0 is line 1
     */
    protected static String[] lines(String text) {
        return text.replace("\r", "").split("\n", -1);
    }

    // ==================== Validation ====================

    protected static void requireArguments(String text, String path) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
