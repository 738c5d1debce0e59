package com.rustarchitect.core.detector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.rustarchitect.core.model.Evidence;
import com.rustarchitect.core.model.EvidenceKind;
import com.rustarchitect.core.model.Signature;
import com.rustarchitect.core.model.SignatureCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads {@link SignatureCatalog}s from YAML.
 *
 * <p>Three catalogs are bundled under {@code catalogs/} on the classpath. Any of them can
 * be replaced by a file with the same layout:
 * <pre>{@code
 * id: design-patterns
 * version: "1.0"
 * signatures:
 *   - name: Builder
 *     description: Fluent construction of complex values
 *     keywords: [Builder, "build()"]
 *     patterns: ['fn\s+builder\s*\(']
 * }</pre>
 *
 * <p>Every evidence category is optional. Blank values and invalid regular expressions
 * are dropped with a warning; the rest of the signature is kept.
 */
public class SignatureCatalogLoader {

    public static final String DESIGN_PATTERNS = "design-patterns";
    public static final String ARCHITECTURE_STYLES = "architecture-styles";
    public static final String COMMUNICATION_PATTERNS = "communication-patterns";

    /** Ids of the catalogs shipped with the library. */
    public static final List<String> BUNDLED_IDS = List.of(DESIGN_PATTERNS, ARCHITECTURE_STYLES, COMMUNICATION_PATTERNS);

    private static final Logger log = LoggerFactory.getLogger(SignatureCatalogLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String RESOURCE_PREFIX = "catalogs/";

    /**
     * Loads a bundled catalog from the classpath.
     *
     * @param id catalog id, for example {@link #DESIGN_PATTERNS}
     * @return parsed catalog
     * @throws CatalogLoadException if the resource is missing or malformed
     */
    public SignatureCatalog loadBundled(String id) {
        Objects.requireNonNull(id, "id must not be null");
        String resource = RESOURCE_PREFIX + id + ".yaml";
        try (InputStream in = SignatureCatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogLoadException("Bundled catalog not found on classpath: " + resource);
            }
            return toCatalog(YAML_MAPPER.readValue(in, CatalogDocument.class), id, resource);
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read bundled catalog " + resource, e);
        }
    }

    /**
     * Loads a catalog file.
     *
     * @param file YAML catalog file
     * @param fallbackId id used when the file declares none
     * @return parsed catalog
     * @throws CatalogLoadException if the file cannot be read or parsed
     */
    public SignatureCatalog load(Path file, String fallbackId) {
        Objects.requireNonNull(file, "file must not be null");
        if (!Files.isRegularFile(file)) {
            throw new CatalogLoadException("Catalog file not found: " + file);
        }
        try {
            log.debug("Loading signature catalog from {}", file);
            return toCatalog(YAML_MAPPER.readValue(file.toFile(), CatalogDocument.class), fallbackId, file.toString());
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to parse catalog " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a catalog file when {@code override} is set, the bundled catalog otherwise.
     *
     * @param id bundled catalog id
     * @param override catalog file path, or null
     * @param baseDir directory relative override paths are resolved against
     * @return parsed catalog
     */
    public SignatureCatalog loadOrBundled(String id, String override, Path baseDir) {
        if (override == null || override.isBlank()) {
            return loadBundled(id);
        }
        Path file = baseDir.resolve(override);
        log.info("Using catalog override for {}: {}", id, file);
        return load(file, id);
    }

    private SignatureCatalog toCatalog(CatalogDocument document, String fallbackId, String source) {
        if (document == null) {
            throw new CatalogLoadException("Catalog is empty: " + source);
        }
        String id = document.id() == null || document.id().isBlank() ? fallbackId : document.id();
        List<Signature> signatures = new ArrayList<>();
        if (document.signatures() != null) {
            for (SignatureDocument entry : document.signatures()) {
                if (entry == null || entry.name() == null || entry.name().isBlank()) {
                    log.warn("Skipping unnamed signature in {}", source);
                    continue;
                }
                signatures.add(toSignature(entry, source));
            }
        }
        log.debug("Loaded catalog {} ({}) with {} signatures", id, document.version(), signatures.size());
        return new SignatureCatalog(id, document.version(), signatures);
    }

    private Signature toSignature(SignatureDocument entry, String source) {
        List<Evidence> evidence = new ArrayList<>();
        addEvidence(evidence, EvidenceKind.KEYWORD, entry.keywords(), entry.name(), source);
        addEvidence(evidence, EvidenceKind.IMPORT, entry.imports(), entry.name(), source);
        addEvidence(evidence, EvidenceKind.PATTERN, entry.patterns(), entry.name(), source);
        addEvidence(evidence, EvidenceKind.TRAIT, entry.traits(), entry.name(), source);
        return new Signature(entry.name(), entry.description(), evidence);
    }

    private void addEvidence(List<Evidence> evidence, EvidenceKind kind, List<String> values,
                             String signature, String source) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            try {
                evidence.add(new Evidence(kind, value));
            } catch (IllegalArgumentException e) {
                log.warn("Dropping {} evidence '{}' of signature '{}' in {}: {}",
                    kind.label(), value, signature, source, e.getMessage());
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(
        @JsonProperty("id") String id,
        @JsonProperty("version") String version,
        @JsonProperty("signatures") List<SignatureDocument> signatures
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SignatureDocument(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("imports") List<String> imports,
        @JsonProperty("patterns") List<String> patterns,
        @JsonProperty("traits") List<String> traits
    ) {}
}
