package com.rustarchitect.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named bundle of weighted evidence describing an architecture style or design pattern.
 *
 * <p>A signature with no evidence has a maximum score of zero and can never be
 * detected.
 *
 * @param name signature name, e.g. "Builder"
 * @param description short description carried into detections, may be null
 * @param evidence evidence items in declaration order
 */
public record Signature(
    String name,
    String description,
    List<Evidence> evidence
) {
    /**
     * Compact constructor with validation.
     */
    public Signature {
        Objects.requireNonNull(name, "name must not be null");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /**
     * Builds a signature from per-category lists. Null lists contribute nothing.
     *
     * @param name signature name
     * @param description optional description
     * @param keywords keyword literals
     * @param imports crate names
     * @param patterns regular expressions
     * @param traits trait literals
     * @return signature with evidence ordered keywords, imports, patterns, traits
     */
    public static Signature of(
            String name,
            String description,
            List<String> keywords,
            List<String> imports,
            List<String> patterns,
            List<String> traits) {
        List<Evidence> items = new ArrayList<>();
        addAll(items, EvidenceKind.KEYWORD, keywords);
        addAll(items, EvidenceKind.IMPORT, imports);
        addAll(items, EvidenceKind.PATTERN, patterns);
        addAll(items, EvidenceKind.TRAIT, traits);
        return new Signature(name, description, items);
    }

    private static void addAll(List<Evidence> items, EvidenceKind kind, List<String> values) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            items.add(new Evidence(kind, value));
        }
    }

    /**
     * Returns the evidence values of one category.
     *
     * @param kind evidence category
     * @return values in declaration order
     */
    public List<String> valuesOf(EvidenceKind kind) {
        return evidence.stream()
            .filter(e -> e.kind() == kind)
            .map(Evidence::value)
            .toList();
    }

    /**
     * Returns the score reached when every evidence item hits.
     *
     * @return sum of all evidence weights
     */
    public int maxScore() {
        return evidence.stream().mapToInt(Evidence::weight).sum();
    }
}
