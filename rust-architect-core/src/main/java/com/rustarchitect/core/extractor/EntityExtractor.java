package com.rustarchitect.core.extractor;

import com.rustarchitect.core.model.Entity;
import com.rustarchitect.core.model.EntityKind;
import com.rustarchitect.core.model.Visibility;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts declaration entities from the text of one Rust file.
 *
 * <p>Each {@link EntityKind} has its own lexical pattern in {@link RustPatterns#DECLARATIONS}.
 * Every textual occurrence becomes a candidate, even when the same (kind, name) pair
 * repeats; collapsing by name happens later, in the knowledge graph. Candidates are
 * returned in source order.
 *
 * <p>Names in {@link #NOISE_NAMES} are dropped whatever their visibility.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Entity> entities = new EntityExtractor().extract(text, "src/model/user.rs");
 * }</pre>
 */
public class EntityExtractor extends AbstractRegexExtractor {

    /** Identifiers that are structurally noisy or near-universal. */
    public static final Set<String> NOISE_NAMES = Set.of(
        "self", "Self", "crate", "super", "new", "default", "from", "into", "as_ref", "as_mut", "_"
    );

    private final Map<EntityKind, Pattern> patterns;

    public EntityExtractor() {
        this(RustPatterns.DECLARATIONS);
    }

    /**
     * Creates an extractor over a custom pattern table. Each pattern must expose a
     * {@code name} group and may expose a {@code vis} group.
     *
     * @param patterns kind to declaration pattern
     */
    public EntityExtractor(Map<EntityKind, Pattern> patterns) {
        this.patterns = Map.copyOf(patterns);
    }

    /**
     * Extracts entity candidates from a file.
     *
     * @param text decoded file text
     * @param path project-relative file path, stored as the entity module
     * @return candidates ordered by position in the file
     */
    public List<Entity> extract(String text, String path) {
        requireArguments(text, path);

        int[] lineStarts = lineStarts(text);
        String[] lines = lines(text);
        List<Candidate> candidates = new ArrayList<>();

        for (EntityKind kind : EntityKind.values()) {
            Pattern pattern = patterns.get(kind);
            if (pattern == null) {
                continue;
            }
            forEachMatch(pattern, text, matcher -> {
                String name = matcher.group(RustPatterns.GROUP_NAME);
                if (NOISE_NAMES.contains(name)) {
                    return;
                }
                int offset = matcher.start(RustPatterns.GROUP_NAME);
                Visibility visibility = kind.hasVisibility()
                    ? VisibilityParser.parse(visibilityGroup(matcher))
                    : Visibility.PRIVATE;
                candidates.add(new Candidate(offset, kind, name, visibility));
            });
        }

        candidates.sort(Comparator.comparingInt(Candidate::offset)
            .thenComparing(Candidate::kind));

        List<Entity> entities = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            int line = lineAt(lineStarts, candidate.offset());
            String doc = DocCommentLocator.locate(lines, line);
            entities.add(new Entity(candidate.name(), candidate.kind(), candidate.visibility(), path, line, doc));
        }

        log.debug("Extracted {} entities from {}", entities.size(), path);
        return entities;
    }

    private static String visibilityGroup(Matcher matcher) {
        try {
            return matcher.group(RustPatterns.GROUP_VISIBILITY);
        } catch (IllegalArgumentException e) {
            // pattern without a visibility group
            return null;
        }
    }

    private record Candidate(int offset, EntityKind kind, String name, Visibility visibility) {}
}
