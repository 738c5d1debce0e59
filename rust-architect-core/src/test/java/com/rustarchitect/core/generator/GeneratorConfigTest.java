package com.rustarchitect.core.generator;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GeneratorConfig}.
 */
class GeneratorConfigTest {

    @Test
    void defaults_useDocumentedLimits() {
        GeneratorConfig config = GeneratorConfig.defaults();

        assertThat(config.maxNodes()).isEqualTo(GeneratorConfig.DEFAULT_MAX_NODES);
        assertThat(config.maxListItems()).isEqualTo(GeneratorConfig.DEFAULT_MAX_LIST_ITEMS);
        assertThat(config.customSettings()).isEmpty();
    }

    @Test
    void constructor_withNegativeLimits_meansUnlimited() {
        GeneratorConfig config = new GeneratorConfig(-1, -1, null);

        assertThat(config.maxNodes()).isEqualTo(Integer.MAX_VALUE);
        assertThat(config.maxListItems()).isEqualTo(Integer.MAX_VALUE);
        assertThat(config.customSettings()).isEmpty();
    }

    @Test
    void getSettingOrDefault_returnsSettingOrFallback() {
        GeneratorConfig config = new GeneratorConfig(10, 10, Map.of("title", "Layers"));

        assertThat(config.<String>getSettingOrDefault("title", "Untitled")).isEqualTo("Layers");
        assertThat(config.<String>getSettingOrDefault("missing", "Untitled")).isEqualTo("Untitled");
    }
}
