package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A directed, typed link between two entity names.
 *
 * <p>Edges are not deduplicated; the same pair may be linked several times.
 *
 * <p>{@code uses} edges start at the importing file's stem and {@code references}
 * edges start at the synthetic {@link #FIELD_USAGE} node. Neither source is a
 * declared entity: the calling symbol is not tracked.
 *
 * @param from source node name
 * @param to target node name
 * @param relationship relationship type
 * @param source project-relative path of the file the edge was found in
 */
public record Edge(
    String from,
    String to,
    @JsonProperty("relationship") EdgeType relationship,
    String source
) {

    /** Synthetic source node of every {@code references} edge. */
    public static final String FIELD_USAGE = "field_usage";

    /**
     * Compact constructor with validation.
     */
    public Edge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(relationship, "relationship must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
