package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of declarations recognised in Rust source text.
 *
 * <p>Eight kinds carry a visibility qualifier. {@link #IMPL} blocks never do and
 * are always reported as {@link Visibility#PRIVATE}.
 */
public enum EntityKind {
    STRUCT("struct"),
    ENUM("enum"),
    TRAIT("trait"),
    FN("fn"),
    MOD("mod"),
    IMPL("impl"),
    TYPE("type"),
    CONST("const"),
    STATIC("static");

    private final String keyword;

    EntityKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the Rust keyword introducing this declaration.
     *
     * @return keyword, e.g. {@code struct}
     */
    @JsonValue
    public String keyword() {
        return keyword;
    }

    /**
     * Returns whether declarations of this kind can carry a {@code pub} qualifier.
     *
     * @return false only for impl blocks
     */
    public boolean hasVisibility() {
        return this != IMPL;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
