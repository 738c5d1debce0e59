package com.rustarchitect.core.detector;

/**
 * Exception thrown when a signature catalog cannot be found or parsed.
 *
 * <p>This is a packaging or configuration error. Problems inside a single signature
 * are not reported this way; the offending entries are dropped with a warning.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    public CatalogLoadException(String message) {
        super(message);
    }
}
