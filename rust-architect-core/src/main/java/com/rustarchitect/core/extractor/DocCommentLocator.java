package com.rustarchitect.core.extractor;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Finds the documentation block attached to a declaration line.
 *
 * <p>A block is a run of {@code ///} lines or a {@code /**} block comment that ends
 * at most {@value #MAX_DISTANCE} lines above the declaration. Only blank lines and
 * attribute lines ({@code #[...]}) may sit in between. The nearest block wins.
 */
final class DocCommentLocator {

    static final int MAX_DISTANCE = 5;
    static final int MAX_LENGTH = 200;

    private DocCommentLocator() {
    }

    /**
     * Returns the documentation text for the declaration on {@code line}.
     *
     * @param lines file lines, index 0 being line 1
     * @param line 1-based declaration line
     * @return doc text truncated to {@value #MAX_LENGTH} characters, or null
     */
    static String locate(String[] lines, int line) {
        int declaration = line - 1;
        for (int index = declaration - 1; index >= 0 && declaration - index <= MAX_DISTANCE; index--) {
            String trimmed = lines[index].trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#[")) {
                continue;
            }
            if (isLineDoc(trimmed)) {
                return truncate(collectLineDoc(lines, index));
            }
            if (trimmed.endsWith("*/")) {
                return truncate(collectBlockDoc(lines, index));
            }
            return null;
        }
        return null;
    }

    private static boolean isLineDoc(String trimmed) {
        return trimmed.startsWith("///") && !trimmed.startsWith("////");
    }

    private static String collectLineDoc(String[] lines, int last) {
        Deque<String> block = new ArrayDeque<>();
        for (int index = last; index >= 0; index--) {
            String trimmed = lines[index].trim();
            if (!isLineDoc(trimmed)) {
                break;
            }
            block.addFirst(trimmed.substring(3).trim());
        }
        return String.join("\n", block).trim();
    }

    private static String collectBlockDoc(String[] lines, int last) {
        Deque<String> block = new ArrayDeque<>();
        for (int index = last; index >= 0; index--) {
            String trimmed = lines[index].trim();
            int opening = trimmed.indexOf("/**");
            if (opening >= 0) {
                block.addFirst(trimmed.substring(opening + 3));
                return cleanBlock(block);
            }
            if (trimmed.contains("/*")) {
                // plain block comment, not documentation
                return null;
            }
            block.addFirst(trimmed);
        }
        return null;
    }

    private static String cleanBlock(Deque<String> block) {
        StringBuilder text = new StringBuilder();
        for (String raw : block) {
            String line = raw.replace("*/", "").trim();
            while (line.startsWith("*")) {
                line = line.substring(1).trim();
            }
            if (!line.isEmpty()) {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(line);
            }
        }
        return text.length() == 0 ? null : text.toString();
    }

    private static String truncate(String doc) {
        if (doc == null || doc.isEmpty()) {
            return null;
        }
        return doc.length() > MAX_LENGTH ? doc.substring(0, MAX_LENGTH) : doc;
    }
}
