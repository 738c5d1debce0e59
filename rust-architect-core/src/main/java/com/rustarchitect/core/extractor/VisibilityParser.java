package com.rustarchitect.core.extractor;

import com.rustarchitect.core.model.Visibility;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a raw visibility qualifier to its canonical {@link Visibility}.
 *
 * <p>The most specific qualifier wins: {@code pub(in path)}, then {@code pub(self)},
 * {@code pub(super)}, {@code pub(crate)}, then bare {@code pub}. Anything else,
 * including an absent qualifier, is private.
 */
public final class VisibilityParser {

    private static final Pattern RESTRICTED = Pattern.compile("^pub\\s*\\(\\s*(?<scope>[^)]*?)\\s*\\)$");
    private static final Pattern IN_PATH = Pattern.compile("^in\\s+\\S.*");

    private VisibilityParser() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Parses a visibility qualifier.
     *
     * @param qualifier matched text such as {@code pub(crate) }, or null
     * @return canonical visibility
     */
    public static Visibility parse(String qualifier) {
        if (qualifier == null) {
            return Visibility.PRIVATE;
        }
        String trimmed = qualifier.trim();
        if (trimmed.isEmpty() || !trimmed.startsWith("pub")) {
            return Visibility.PRIVATE;
        }

        Matcher restricted = RESTRICTED.matcher(trimmed);
        if (!restricted.matches()) {
            return trimmed.equals("pub") ? Visibility.PUB : Visibility.PRIVATE;
        }

        String scope = restricted.group("scope");
        if (IN_PATH.matcher(scope).matches()) {
            return Visibility.PUB_IN;
        }
        return switch (scope) {
            case "self" -> Visibility.PUB_SELF;
            case "super" -> Visibility.PUB_SUPER;
            case "crate" -> Visibility.PUB_CRATE;
            default -> Visibility.PUB;
        };
    }
}
