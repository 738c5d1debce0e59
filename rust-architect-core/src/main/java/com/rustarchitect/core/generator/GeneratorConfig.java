package com.rustarchitect.core.generator;

import java.util.Map;

/**
 * Configuration for report generation.
 *
 * @param maxNodes maximum number of nodes drawn in diagrams
 * @param maxListItems maximum number of items listed per section in human-readable reports
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    int maxNodes,
    int maxListItems,
    Map<String, Object> customSettings
) {
    public static final int DEFAULT_MAX_NODES = 50;
    public static final int DEFAULT_MAX_LIST_ITEMS = 15;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (maxNodes < 0) {
            maxNodes = Integer.MAX_VALUE;
        }
        if (maxListItems < 0) {
            maxListItems = Integer.MAX_VALUE;
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_MAX_NODES, DEFAULT_MAX_LIST_ITEMS, Map.of());
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
