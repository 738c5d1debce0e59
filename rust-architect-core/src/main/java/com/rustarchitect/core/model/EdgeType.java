package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of relationships inferred between entity names.
 */
public enum EdgeType {
    /** {@code impl Trait for Type}: Type implements Trait */
    IMPLEMENTS("implements"),

    /** {@code #[derive(Trait)]} on a struct or enum */
    DERIVES("derives"),

    /** Module declaration inside a file */
    CONTAINS("contains"),

    /** Import of a known entity */
    USES("uses"),

    /** Field type annotation naming a known entity */
    REFERENCES("references");

    private final String label;

    EdgeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
