package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A heuristic architectural layer and the entity names assigned to it.
 *
 * @param name layer label, e.g. "Domain Layer" or "Module: net"
 * @param entityIds sorted, distinct entity names
 */
public record Cluster(
    String name,
    List<String> entityIds
) {
    public Cluster {
        Objects.requireNonNull(name, "name must not be null");
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
    }

    public int size() {
        return entityIds.size();
    }
}
