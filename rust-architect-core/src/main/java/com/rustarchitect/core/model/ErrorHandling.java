package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Error handling style of a project, counted over the production sources.
 *
 * @param usesAnyhow whether any file refers to {@code anyhow}
 * @param usesThiserror whether any file refers to {@code thiserror}
 * @param customErrors enums whose name ends in {@code Error}
 * @param errorDerives {@code #[derive(..Error..)]} attributes
 * @param resultReturns functions returning a {@code Result}
 * @param unwrapCalls {@code .unwrap()} calls
 * @param expectCalls {@code .expect(} calls
 * @param questionMarks {@code ?} propagation operators
 */
public record ErrorHandling(
    boolean usesAnyhow,
    boolean usesThiserror,
    List<CustomError> customErrors,
    int errorDerives,
    int resultReturns,
    int unwrapCalls,
    int expectCalls,
    int questionMarks
) {
    public ErrorHandling {
        customErrors = customErrors == null ? List.of() : List.copyOf(customErrors);
    }

    public static ErrorHandling empty() {
        return new ErrorHandling(false, false, List.of(), 0, 0, 0, 0, 0);
    }

    /**
     * Calls that panic on failure.
     *
     * @return unwrap plus expect calls
     */
    public int panickingCalls() {
        return unwrapCalls + expectCalls;
    }

    /**
     * @param name enum name
     * @param file project-relative file path
     */
    public record CustomError(String name, String file) {
        public CustomError {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(file, "file must not be null");
        }
    }
}
