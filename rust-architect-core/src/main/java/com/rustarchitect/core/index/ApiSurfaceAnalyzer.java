package com.rustarchitect.core.index;

import com.rustarchitect.core.model.ApiSurface;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.EntityKind;
import com.rustarchitect.core.model.Visibility;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Groups the non-private declarations of a project.
 *
 * <p>Works on all entity candidates, not on collapsed graph nodes, so a name declared in
 * two files is listed under both modules. Impl blocks carry no visibility and are left out.
 */
public class ApiSurfaceAnalyzer {

    /** Module key for files directly under the project root. */
    public static final String ROOT_MODULE = "root";

    public ApiSurface analyze(List<Entity> entities) {
        Objects.requireNonNull(entities, "entities must not be null");

        List<Entity> items = entities.stream()
            .filter(entity -> entity.kind().hasVisibility())
            .filter(entity -> entity.visibility() != Visibility.PRIVATE)
            .toList();

        Map<String, List<String>> byType = new TreeMap<>();
        Map<String, List<String>> byVisibility = new TreeMap<>();
        Map<String, List<String>> byModule = new TreeMap<>();
        for (Entity item : items) {
            byType.computeIfAbsent(item.kind().keyword(), key -> new ArrayList<>()).add(item.name());
            byVisibility.computeIfAbsent(item.visibility().label(), key -> new ArrayList<>()).add(item.name());
            byModule.computeIfAbsent(moduleOf(item.module()), key -> new ArrayList<>()).add(item.name());
        }

        ApiSurface.Stats stats = new ApiSurface.Stats(
            items.size(),
            count(items, EntityKind.STRUCT),
            count(items, EntityKind.ENUM),
            count(items, EntityKind.TRAIT),
            count(items, EntityKind.FN),
            count(items, EntityKind.MOD)
        );
        return new ApiSurface(items, byType, byVisibility, byModule, stats);
    }

    /**
     * Returns the directory part of a file path.
     *
     * @param path project-relative file path
     * @return parent directory, or {@value #ROOT_MODULE} for a top-level file
     */
    static String moduleOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : ROOT_MODULE;
    }

    private static int count(List<Entity> items, EntityKind kind) {
        return (int) items.stream().filter(item -> item.kind() == kind).count();
    }
}
