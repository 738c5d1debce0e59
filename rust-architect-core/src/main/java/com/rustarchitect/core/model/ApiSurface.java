package com.rustarchitect.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-private declarations grouped by kind, visibility and module directory.
 *
 * @param items non-private, non-impl entities in extraction order
 * @param byType kind keyword to names
 * @param byVisibility visibility label to names
 * @param byModule module directory ("root" for top-level files) to names
 * @param stats per-kind counts
 */
public record ApiSurface(
    List<Entity> items,
    Map<String, List<String>> byType,
    Map<String, List<String>> byVisibility,
    Map<String, List<String>> byModule,
    Stats stats
) {
    public ApiSurface {
        items = items == null ? List.of() : List.copyOf(items);
        byType = orderedCopy(byType);
        byVisibility = orderedCopy(byVisibility);
        byModule = orderedCopy(byModule);
        if (stats == null) {
            stats = new Stats(0, 0, 0, 0, 0, 0);
        }
    }

    public static ApiSurface empty() {
        return new ApiSurface(List.of(), Map.of(), Map.of(), Map.of(), null);
    }

    private static Map<String, List<String>> orderedCopy(Map<String, List<String>> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    public record Stats(
        int totalItems,
        int structs,
        int enums,
        int traits,
        int functions,
        int modules
    ) {}
}
