package com.rustarchitect.core.cluster;

import com.rustarchitect.core.model.Cluster;
import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.util.FileUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Assigns entities to architectural layers from their file path.
 *
 * <p>Rules are checked in order against the case-sensitive module path; the first
 * rule with a matching substring wins:
 * <ol>
 *   <li>domain, entity, model: {@value #DOMAIN}</li>
 *   <li>service, application, handler: {@value #APPLICATION}</li>
 *   <li>repo, db, storage: {@value #INFRASTRUCTURE}</li>
 *   <li>api, http, web: {@value #INTERFACE}</li>
 *   <li>util, common, helper: {@value #UTILITIES}</li>
 * </ol>
 * Otherwise the entity goes to {@code Module: <parent dir>}, or {@value #CORE} for a
 * top-level file.
 */
public class ClusterAssigner {

    public static final String DOMAIN = "Domain Layer";
    public static final String APPLICATION = "Application Layer";
    public static final String INFRASTRUCTURE = "Infrastructure Layer";
    public static final String INTERFACE = "Interface Layer";
    public static final String UTILITIES = "Utilities";
    public static final String CORE = "Core";
    public static final String MODULE_PREFIX = "Module: ";

    private static final List<LayerRule> RULES = List.of(
        new LayerRule(DOMAIN, List.of("domain", "entity", "model")),
        new LayerRule(APPLICATION, List.of("service", "application", "handler")),
        new LayerRule(INFRASTRUCTURE, List.of("repo", "db", "storage")),
        new LayerRule(INTERFACE, List.of("api", "http", "web")),
        new LayerRule(UTILITIES, List.of("util", "common", "helper"))
    );

    /**
     * Partitions entities into clusters.
     *
     * <p>Entity ids are names, so pass entities already collapsed by name to obtain a
     * partition in which every id occurs exactly once.
     *
     * @param entities entities to classify
     * @return clusters sorted by name, each with sorted entity ids
     */
    public List<Cluster> assign(List<Entity> entities) {
        Objects.requireNonNull(entities, "entities must not be null");

        Map<String, TreeSet<String>> members = new TreeMap<>();
        for (Entity entity : entities) {
            members.computeIfAbsent(layerOf(entity.module()), key -> new TreeSet<>()).add(entity.name());
        }

        List<Cluster> clusters = new ArrayList<>(members.size());
        members.forEach((name, ids) -> clusters.add(new Cluster(name, new ArrayList<>(ids))));
        return clusters;
    }

    /**
     * Classifies one file path.
     *
     * @param modulePath project-relative file path
     * @return layer label
     */
    public String layerOf(String modulePath) {
        Objects.requireNonNull(modulePath, "modulePath must not be null");
        for (LayerRule rule : RULES) {
            if (rule.matches(modulePath)) {
                return rule.layer();
            }
        }
        String parent = FileUtils.parentName(modulePath);
        return parent == null ? CORE : MODULE_PREFIX + parent;
    }

    private record LayerRule(String layer, List<String> markers) {
        boolean matches(String path) {
            return markers.stream().anyMatch(path::contains);
        }
    }
}
