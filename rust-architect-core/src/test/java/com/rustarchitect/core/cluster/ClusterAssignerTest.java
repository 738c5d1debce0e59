package com.rustarchitect.core.cluster;

import com.rustarchitect.core.model.Cluster;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.EntityKind;
import com.rustarchitect.core.model.Visibility;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ClusterAssigner}.
 */
class ClusterAssignerTest {

    private final ClusterAssigner assigner = new ClusterAssigner();

    @ParameterizedTest
    @CsvSource({
        "src/domain/user.rs, Domain Layer",
        "src/model/service.rs, Domain Layer",
        "src/services/auth.rs, Application Layer",
        "src/repository/pg.rs, Infrastructure Layer",
        "src/api/routes.rs, Interface Layer",
        "src/utils/fmt.rs, Utilities",
        "src/net/tcp.rs, 'Module: net'",
        "src/lib.rs, 'Module: src'",
        "lib.rs, Core"
    })
    void layerOf_classifiesPathByFirstMatchingRule(String path, String expected) {
        assertThat(assigner.layerOf(path)).isEqualTo(expected);
    }

    @Test
    void assign_partitionsEntitiesIntoSortedClusters() {
        // Given
        List<Entity> entities = List.of(
            entity("User", "src/domain/user.rs"),
            entity("Router", "src/api/routes.rs"),
            entity("Account", "src/domain/account.rs"),
            entity("main", "main.rs")
        );

        // When
        List<Cluster> clusters = assigner.assign(entities);

        // Then
        assertThat(clusters)
            .extracting(Cluster::name, Cluster::entityIds)
            .containsExactly(
                tuple("Core", List.of("main")),
                tuple("Domain Layer", List.of("Account", "User")),
                tuple("Interface Layer", List.of("Router"))
            );
        assertThat(clusters).flatExtracting(Cluster::entityIds).hasSize(entities.size());
    }

    @Test
    void assign_withNoEntities_returnsNoClusters() {
        assertThat(assigner.assign(List.of())).isEmpty();
    }

    private static Entity entity(String name, String module) {
        return new Entity(name, EntityKind.STRUCT, Visibility.PUB, module, 1, null);
    }
}
