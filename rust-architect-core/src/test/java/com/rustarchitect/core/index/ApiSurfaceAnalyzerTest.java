package com.rustarchitect.core.index;

import com.rustarchitect.core.model.ApiSurface;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.EntityKind;
import com.rustarchitect.core.model.Visibility;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link ApiSurfaceAnalyzer}.
 */
class ApiSurfaceAnalyzerTest {

    private final ApiSurfaceAnalyzer analyzer = new ApiSurfaceAnalyzer();

    @Test
    void analyze_keepsNonPrivateItemsAndGroupsThem() {
        // Given
        List<Entity> entities = List.of(
            entity("Client", EntityKind.STRUCT, Visibility.PUB, "src/net/client.rs"),
            entity("connect", EntityKind.FN, Visibility.PUB_CRATE, "src/net/client.rs"),
            entity("Client", EntityKind.IMPL, Visibility.PRIVATE, "src/net/client.rs"),
            entity("Error", EntityKind.ENUM, Visibility.PUB, "lib.rs"),
            entity("net", EntityKind.MOD, Visibility.PUB, "lib.rs"),
            entity("secret", EntityKind.FN, Visibility.PRIVATE, "lib.rs")
        );

        // When
        ApiSurface surface = analyzer.analyze(entities);

        // Then
        assertThat(surface.items()).extracting(Entity::name).containsExactly("Client", "connect", "Error", "net");
        assertThat(surface.byType()).containsExactly(
            entry("enum", List.of("Error")),
            entry("fn", List.of("connect")),
            entry("mod", List.of("net")),
            entry("struct", List.of("Client"))
        );
        assertThat(surface.byVisibility()).containsExactly(
            entry("pub", List.of("Client", "Error", "net")),
            entry("pub(crate)", List.of("connect"))
        );
        assertThat(surface.byModule()).containsExactly(
            entry("root", List.of("Error", "net")),
            entry("src/net", List.of("Client", "connect"))
        );
        assertThat(surface.stats()).isEqualTo(new ApiSurface.Stats(4, 1, 1, 0, 1, 1));
    }

    @Test
    void analyze_withNoEntities_returnsZeroStats() {
        ApiSurface surface = analyzer.analyze(List.of());

        assertThat(surface.items()).isEmpty();
        assertThat(surface.stats()).isEqualTo(new ApiSurface.Stats(0, 0, 0, 0, 0, 0));
    }

    private static Entity entity(String name, EntityKind kind, Visibility visibility, String module) {
        return new Entity(name, kind, visibility, module, 1, null);
    }
}
