package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Scored result of matching a signature or a workspace-shape heuristic.
 *
 * <p>There is no separate "not found" result: absence is a missing detection.
 *
 * @param name signature or style name
 * @param confidence score in [0, 1]
 * @param evidence descriptions of the evidence that matched
 * @param description optional description of the style or pattern
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Detection(
    String name,
    double confidence,
    List<String> evidence,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public Detection {
        Objects.requireNonNull(name, "name must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /**
     * Returns a copy with a different confidence, e.g. after an external refiner.
     *
     * @param refined new confidence
     * @return refined detection
     */
    public Detection withConfidence(double refined) {
        return new Detection(name, refined, evidence, description);
    }
}
