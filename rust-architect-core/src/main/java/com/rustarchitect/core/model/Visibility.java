package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical Rust visibility categories.
 */
public enum Visibility {
    PUB("pub"),
    PUB_CRATE("pub(crate)"),
    PUB_SUPER("pub(super)"),
    PUB_SELF("pub(self)"),
    PUB_IN("pub(in ...)"),
    PRIVATE("private");

    private final String label;

    Visibility(String label) {
        this.label = label;
    }

    /**
     * Returns the canonical label used in reports and JSON output.
     *
     * @return label such as {@code pub(crate)}
     */
    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
