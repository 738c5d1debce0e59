package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Detected design patterns with usage guidance, confidence descending.
 *
 * @param entries one entry per detection
 */
public record PatternLibrary(List<Entry> entries) {

    public PatternLibrary {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static PatternLibrary empty() {
        return new PatternLibrary(List.of());
    }

    /**
     * @param name pattern name
     * @param confidence detection confidence
     * @param evidence detection evidence
     * @param description longer explanation, empty when none is known
     * @param whenToUse typical use cases
     * @param relatedPatterns names of related patterns
     */
    public record Entry(
        String name,
        double confidence,
        List<String> evidence,
        String description,
        List<String> whenToUse,
        List<String> relatedPatterns
    ) {
        public Entry {
            Objects.requireNonNull(name, "name must not be null");
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
            description = description == null ? "" : description;
            whenToUse = whenToUse == null ? List.of() : List.copyOf(whenToUse);
            relatedPatterns = relatedPatterns == null ? List.of() : List.copyOf(relatedPatterns);
        }
    }
}
