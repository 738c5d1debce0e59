package com.rustarchitect.core.extractor;

import com.rustarchitect.core.model.Edge;
import com.rustarchitect.core.model.EdgeType;
import com.rustarchitect.core.util.FileUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Infers typed edges from the text of one Rust file.
 *
 * <p>Five independent scans run in a fixed order, so edges come out grouped by type:
 * <ol>
 *   <li>{@code implements}: {@code impl Trait for Type} gives Type to Trait</li>
 *   <li>{@code derives}: {@code #[derive(A, B)] struct Name} gives Name to A, Name to B</li>
 *   <li>{@code contains}: {@code mod name} gives file stem to name</li>
 *   <li>{@code uses}: an imported trailing segment that is a known entity gives file stem to it</li>
 *   <li>{@code references}: a field type (one Option/Vec/Box/Arc/Rc layer stripped) that is a
 *       known, non-primitive entity gives {@value Edge#FIELD_USAGE} to it</li>
 * </ol>
 *
 * <p>{@code contains} and {@code uses} take the file stem as the source node; nested module
 * blocks are not tracked. Edges are never deduplicated.
 */
public class RelationshipExtractor extends AbstractRegexExtractor {

    /**
     * Extracts edges from a file.
     *
     * @param text decoded file text
     * @param path project-relative file path, stored as the edge source
     * @param knownEntities entity names known across the project
     * @return edges grouped by relationship type, each group in text order
     */
    public List<Edge> extract(String text, String path, Set<String> knownEntities) {
        requireArguments(text, path);
        if (knownEntities == null) {
            throw new NullPointerException("knownEntities must not be null");
        }

        String stem = FileUtils.stem(path);
        List<Edge> edges = new ArrayList<>();

        forEachMatch(RustPatterns.IMPLEMENTS, text, m ->
            edges.add(new Edge(m.group("type"), m.group("trait"), EdgeType.IMPLEMENTS, path)));

        forEachMatch(RustPatterns.DERIVES, text, m -> {
            String typeName = m.group(RustPatterns.GROUP_NAME);
            for (String derived : m.group("traits").split(",")) {
                String trait = lastSegment(derived);
                if (!trait.isEmpty()) {
                    edges.add(new Edge(typeName, trait, EdgeType.DERIVES, path));
                }
            }
        });

        forEachMatch(RustPatterns.CONTAINS, text, m ->
            edges.add(new Edge(stem, m.group(RustPatterns.GROUP_NAME), EdgeType.CONTAINS, path)));

        forEachMatch(RustPatterns.USES, text, m -> {
            for (String imported : importedNames(m.group("path"), m.group("tail"), m.group("group"))) {
                if (knownEntities.contains(imported)) {
                    edges.add(new Edge(stem, imported, EdgeType.USES, path));
                }
            }
        });

        forEachMatch(RustPatterns.REFERENCES, text, m -> {
            String type = m.group("type");
            if (knownEntities.contains(type) && !RustPatterns.PRIMITIVE_TYPES.contains(type)) {
                edges.add(new Edge(Edge.FIELD_USAGE, type, EdgeType.REFERENCES, path));
            }
        });

        log.debug("Extracted {} edges from {}", edges.size(), path);
        return edges;
    }

    /**
     * Resolves the names an import brings into scope.
     *
     * <p>{@code a::b::C} gives C; {@code a::{B, c::D as E}} gives B and D. Nested brace
     * lists and globs give nothing.
     */
    private static List<String> importedNames(String importPath, String tail, String group) {
        if (tail == null) {
            return List.of(lastSegment(importPath));
        }
        if (group == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String item : group.split(",")) {
            String entry = item.trim();
            int alias = entry.indexOf(" as ");
            if (alias >= 0) {
                entry = entry.substring(0, alias);
            }
            String name = lastSegment(entry);
            if (!name.isEmpty() && !name.equals("self") && !name.equals("*")) {
                names.add(name);
            }
        }
        return names;
    }
}
