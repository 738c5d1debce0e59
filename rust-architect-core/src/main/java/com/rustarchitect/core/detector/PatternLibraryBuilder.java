package com.rustarchitect.core.detector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.rustarchitect.core.model.Detection;
import com.rustarchitect.core.model.PatternLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns design-pattern detections into a pattern library with a description, typical
 * use cases and related patterns for each entry.
 *
 * <p>Guidance is read from the bundled {@value #GUIDANCE_RESOURCE}. A detection without
 * guidance keeps the description of its signature and gets empty lists.
 */
public class PatternLibraryBuilder {

    public static final String GUIDANCE_RESOURCE = "catalogs/pattern-guidance.yaml";

    private static final Logger log = LoggerFactory.getLogger(PatternLibraryBuilder.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, Guidance> guidance;

    public PatternLibraryBuilder() {
        this(loadBundledGuidance());
    }

    PatternLibraryBuilder(Map<String, Guidance> guidance) {
        this.guidance = Map.copyOf(Objects.requireNonNull(guidance, "guidance must not be null"));
    }

    /**
     * Builds the library.
     *
     * @param detections design-pattern detections
     * @return entries sorted by confidence descending, ties in input order
     */
    public PatternLibrary build(List<Detection> detections) {
        Objects.requireNonNull(detections, "detections must not be null");

        List<PatternLibrary.Entry> entries = new ArrayList<>();
        for (Detection detection : detections) {
            Guidance known = guidance.get(detection.name());
            if (known == null) {
                log.debug("No guidance for pattern {}", detection.name());
                entries.add(new PatternLibrary.Entry(detection.name(), detection.confidence(),
                    detection.evidence(), detection.description(), List.of(), List.of()));
                continue;
            }
            String description = known.description() == null || known.description().isBlank()
                ? detection.description()
                : known.description().strip();
            entries.add(new PatternLibrary.Entry(detection.name(), detection.confidence(),
                detection.evidence(), description, known.whenToUse(), known.related()));
        }
        entries.sort(Comparator.comparingDouble(PatternLibrary.Entry::confidence).reversed());
        return new PatternLibrary(entries);
    }

    /**
     * Loads the bundled guidance keyed by pattern name.
     *
     * @return guidance per pattern name, in file order
     * @throws CatalogLoadException if the resource is missing or malformed
     */
    static Map<String, Guidance> loadBundledGuidance() {
        try (InputStream in = PatternLibraryBuilder.class.getClassLoader().getResourceAsStream(GUIDANCE_RESOURCE)) {
            if (in == null) {
                throw new CatalogLoadException("Bundled guidance not found on classpath: " + GUIDANCE_RESOURCE);
            }
            GuidanceDocument document = YAML_MAPPER.readValue(in, GuidanceDocument.class);
            Map<String, Guidance> byName = new LinkedHashMap<>();
            if (document != null && document.patterns() != null) {
                for (Guidance entry : document.patterns()) {
                    if (entry == null || entry.name() == null || entry.name().isBlank()) {
                        log.warn("Skipping unnamed guidance entry in {}", GUIDANCE_RESOURCE);
                        continue;
                    }
                    byName.putIfAbsent(entry.name(), entry);
                }
            }
            return byName;
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read bundled guidance " + GUIDANCE_RESOURCE, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GuidanceDocument(
        @JsonProperty("id") String id,
        @JsonProperty("version") String version,
        @JsonProperty("patterns") List<Guidance> patterns
    ) {}

    /**
     * Guidance for one pattern.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Guidance(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("whenToUse") List<String> whenToUse,
        @JsonProperty("related") List<String> related
    ) {
        Guidance {
            whenToUse = whenToUse == null ? List.of() : List.copyOf(whenToUse);
            related = related == null ? List.of() : List.copyOf(related);
        }
    }
}
