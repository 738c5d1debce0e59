package com.rustarchitect.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A versioned, ordered list of signatures passed explicitly into the detector.
 *
 * <p>Declaration order matters: detections with equal confidence keep it.
 *
 * @param id catalog identifier, e.g. "design-patterns"
 * @param version catalog data version
 * @param signatures signatures in declaration order
 */
public record SignatureCatalog(
    String id,
    String version,
    List<Signature> signatures
) {
    /**
     * Compact constructor with validation.
     */
    public SignatureCatalog {
        Objects.requireNonNull(id, "id must not be null");
        if (version == null) {
            version = "unversioned";
        }
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }

    /**
     * Creates a catalog without signatures.
     *
     * @param id catalog identifier
     * @return empty catalog
     */
    public static SignatureCatalog empty(String id) {
        return new SignatureCatalog(id, null, List.of());
    }

    /**
     * Finds a signature by name.
     *
     * @param name signature name
     * @return matching signature, if declared
     */
    public Optional<Signature> find(String name) {
        return signatures.stream().filter(s -> s.name().equals(name)).findFirst();
    }
}
