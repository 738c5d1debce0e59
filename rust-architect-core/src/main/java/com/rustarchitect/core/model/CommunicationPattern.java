package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A communication mechanism found in the corpus, such as channels or shared state.
 *
 * @param name pattern name
 * @param evidence markers that were found
 * @param usageCount total occurrences of the found markers
 */
public record CommunicationPattern(
    String name,
    List<String> evidence,
    int usageCount
) {
    public CommunicationPattern {
        Objects.requireNonNull(name, "name must not be null");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
