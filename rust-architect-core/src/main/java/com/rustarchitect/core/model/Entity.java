package com.rustarchitect.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A named declaration found in a source file.
 *
 * <p>Graph identity is the bare {@code name}: two entities with the same name in
 * different modules denote the same knowledge-graph node.
 *
 * @param name declared identifier (case-sensitive)
 * @param kind declaration kind
 * @param visibility parsed visibility qualifier
 * @param module project-relative path of the declaring file
 * @param line 1-based line of the declared identifier
 * @param doc attached documentation block, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Entity(
    String name,
    EntityKind kind,
    Visibility visibility,
    String module,
    int line,
    String doc
) {
    /**
     * Compact constructor with validation.
     */
    public Entity {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(module, "module must not be null");
        if (visibility == null) {
            visibility = Visibility.PRIVATE;
        }
        if (line < 1) {
            throw new IllegalArgumentException("line must be 1-based: " + line);
        }
    }

    /**
     * Returns a copy of this entity carrying the given documentation.
     *
     * @param documentation doc text
     * @return entity with doc attached
     */
    public Entity withDoc(String documentation) {
        return new Entity(name, kind, visibility, module, line, documentation);
    }

    /**
     * Returns true if the entity is visible as plain {@code pub}.
     *
     * @return true for bare pub
     */
    @JsonIgnore
    public boolean isPublic() {
        return visibility == Visibility.PUB;
    }
}
