package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Evidence categories of a {@link Signature}, each carrying its own weight.
 *
 * <p>A hit adds {@link #weight()} to the score; every declared item adds the same
 * weight to the maximum score whether it hits or not.
 */
public enum EvidenceKind {
    /** Literal substring of the source corpus. */
    KEYWORD("keyword", 1),

    /** Crate name found in the manifest or in a {@code use} statement. Stronger signal. */
    IMPORT("import", 2),

    /** Regular expression matched anywhere in the corpus. */
    PATTERN("pattern", 1),

    /** Literal trait usage in the corpus. */
    TRAIT("trait", 1);

    private final String label;
    private final int weight;

    EvidenceKind(String label, int weight) {
        this.label = label;
        this.weight = weight;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int weight() {
        return weight;
    }
}
