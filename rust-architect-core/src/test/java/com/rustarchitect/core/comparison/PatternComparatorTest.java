package com.rustarchitect.core.comparison;

import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.CommunicationPattern;
import com.rustarchitect.core.model.Detection;
import com.rustarchitect.core.model.Manifest;
import com.rustarchitect.core.model.PatternComparison;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PatternComparator}.
 */
class PatternComparatorTest {

    private final PatternComparator comparator = new PatternComparator();

    @Test
    void compare_buildsSortedUnionsAndPerProjectRows() {
        // Given
        ArchitectureModel gateway = model("gateway", Manifest.ofText("", 6),
            List.of(new Detection("Multi-Crate Workspace", 0.9, List.of(), null)),
            List.of(new Detection("Tower Service", 0.5, List.of(), null), new Detection("Builder", 0.4, List.of(), null)),
            List.of(new CommunicationPattern("Channel-based (tokio)", List.of("tokio::sync::mpsc"), 3)));
        ArchitectureModel tool = model("tool", Manifest.empty(),
            List.of(new Detection("Event-Driven", 0.4, List.of(), null)),
            List.of(new Detection("Builder", 0.7, List.of(), null)),
            List.of());

        // When
        PatternComparison comparison = comparator.compare(List.of(gateway, tool));

        // Then
        assertThat(comparison.allStyles()).containsExactly("Event-Driven", "Multi-Crate Workspace");
        assertThat(comparison.allPatterns()).containsExactly("Builder", "Tower Service");
        assertThat(comparison.allCommunication()).containsExactly("Channel-based (tokio)");
        assertThat(comparison.projects()).extracting(PatternComparison.ProjectPatterns::project)
            .containsExactly("gateway", "tool");

        PatternComparison.ProjectPatterns toolRow = comparison.projects().get(1);
        assertThat(toolRow.packageCount()).isEqualTo(1);
        assertThat(toolRow.hasPattern("Builder")).isTrue();
        assertThat(toolRow.hasPattern("Tower Service")).isFalse();
        assertThat(toolRow.style("Event-Driven")).get().extracting(Detection::confidence).isEqualTo(0.4);
        assertThat(comparison.projects().get(0).packageCount()).isEqualTo(6);
        assertThat(comparison.projects().get(0).communication()).containsExactly("Channel-based (tokio)");
    }

    @Test
    void compare_withNoModels_returnsEmptyComparison() {
        PatternComparison comparison = comparator.compare(List.of());

        assertThat(comparison.projects()).isEmpty();
        assertThat(comparison.allStyles()).isEmpty();
    }

    private static ArchitectureModel model(String project, Manifest manifest, List<Detection> styles,
                                           List<Detection> patterns, List<CommunicationPattern> communication) {
        return new ArchitectureModel(project, manifest, List.of(), null, null,
            patterns, styles, communication, null, null, null, null, null, null);
    }
}
