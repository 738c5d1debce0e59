package com.rustarchitect.core.model;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One weighted evidence item of a {@link Signature}.
 *
 * @param kind evidence category (determines the weight)
 * @param value keyword, crate name, regular expression or trait literal
 */
public record Evidence(
    EvidenceKind kind,
    String value
) {
    private static final int DESCRIBE_PATTERN_LIMIT = 30;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if value is blank or a pattern does not compile
     */
    public Evidence {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("evidence value must not be blank");
        }
        if (kind == EvidenceKind.PATTERN) {
            try {
                Pattern.compile(value);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid evidence pattern: " + value, e);
            }
        }
    }

    public static Evidence keyword(String value) {
        return new Evidence(EvidenceKind.KEYWORD, value);
    }

    public static Evidence importOf(String value) {
        return new Evidence(EvidenceKind.IMPORT, value);
    }

    public static Evidence pattern(String value) {
        return new Evidence(EvidenceKind.PATTERN, value);
    }

    public static Evidence trait(String value) {
        return new Evidence(EvidenceKind.TRAIT, value);
    }

    /**
     * Returns the weight contributed by this item.
     *
     * @return weight of the evidence kind
     */
    public int weight() {
        return kind.weight();
    }

    /**
     * Describes a hit of this item for a detection's evidence list.
     *
     * <p>Patterns are abbreviated to their first 30 characters.
     *
     * @return description such as {@code "import: tokio"}
     */
    public String describe() {
        if (kind == EvidenceKind.PATTERN && value.length() > DESCRIBE_PATTERN_LIMIT) {
            return kind.label() + ": " + value.substring(0, DESCRIBE_PATTERN_LIMIT) + "...";
        }
        return kind.label() + ": " + value;
    }
}
