package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detected patterns of several projects side by side.
 *
 * @param projects per-project results in input order
 * @param allStyles sorted union of architecture-style names
 * @param allPatterns sorted union of design-pattern names
 * @param allCommunication sorted union of communication-pattern names
 */
public record PatternComparison(
    List<ProjectPatterns> projects,
    List<String> allStyles,
    List<String> allPatterns,
    List<String> allCommunication
) {
    public PatternComparison {
        projects = projects == null ? List.of() : List.copyOf(projects);
        allStyles = allStyles == null ? List.of() : List.copyOf(allStyles);
        allPatterns = allPatterns == null ? List.of() : List.copyOf(allPatterns);
        allCommunication = allCommunication == null ? List.of() : List.copyOf(allCommunication);
    }

    /**
     * Patterns of one project.
     *
     * @param project project name
     * @param styles architecture-style detections
     * @param designPatterns design-pattern detections
     * @param communication communication-pattern names
     * @param packageCount workspace package count (at least 1)
     */
    public record ProjectPatterns(
        String project,
        List<Detection> styles,
        List<Detection> designPatterns,
        List<String> communication,
        int packageCount
    ) {
        public ProjectPatterns {
            Objects.requireNonNull(project, "project must not be null");
            styles = styles == null ? List.of() : List.copyOf(styles);
            designPatterns = designPatterns == null ? List.of() : List.copyOf(designPatterns);
            communication = communication == null ? List.of() : List.copyOf(communication);
        }

        public Optional<Detection> style(String name) {
            return styles.stream().filter(d -> d.name().equals(name)).findFirst();
        }

        public boolean hasPattern(String name) {
            return designPatterns.stream().anyMatch(d -> d.name().equals(name));
        }
    }
}
