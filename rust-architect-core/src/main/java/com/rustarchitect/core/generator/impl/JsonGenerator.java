package com.rustarchitect.core.generator.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rustarchitect.core.generator.GeneratedReport;
import com.rustarchitect.core.generator.GeneratorConfig;
import com.rustarchitect.core.generator.ReportGenerator;
import com.rustarchitect.core.generator.ReportType;
import com.rustarchitect.core.model.ArchitectureModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Serialises analysis results to pretty-printed JSON for downstream tools.
 */
public class JsonGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonGenerator.class);

    private static final String GENERATOR_ID = "json";
    private static final String GENERATOR_DISPLAY_NAME = "JSON Report Generator";
    private static final String FILE_EXTENSION = "json";

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return Set.of(
            ReportType.KNOWLEDGE_GRAPH,
            ReportType.SEMANTIC_INDEX,
            ReportType.PATTERNS,
            ReportType.ARCHITECTURE,
            ReportType.API_SURFACE,
            ReportType.METRICS,
            ReportType.DOMAIN_MODEL,
            ReportType.ERROR_HANDLING,
            ReportType.PATTERN_LIBRARY
        );
    }

    @Override
    public GeneratedReport generate(ArchitectureModel model, ReportType type, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        Object payload = switch (type) {
            case KNOWLEDGE_GRAPH -> model.graph();
            case SEMANTIC_INDEX -> withProject(model, "index", model.index());
            case PATTERNS -> patternsOf(model);
            case ARCHITECTURE -> model;
            case API_SURFACE -> withProject(model, "apiSurface", model.apiSurface());
            case METRICS -> metricsOf(model);
            case DOMAIN_MODEL -> withProject(model, "domainModel", model.domainModel());
            case ERROR_HANDLING -> withProject(model, "errorHandling", model.errorHandling());
            case PATTERN_LIBRARY -> withProject(model, "patterns", model.patternLibrary().entries());
            default -> throw new IllegalArgumentException("Unsupported report type: " + type);
        };

        log.debug("Generating JSON report: {}", type);
        return new GeneratedReport(type.baseName(), toJson(payload), FILE_EXTENSION);
    }

    /**
     * Serialises any value with the generator's mapper settings.
     *
     * @param value value to serialise
     * @return pretty-printed JSON
     */
    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise report: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> withProject(ArchitectureModel model, String key, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("project", model.project());
        payload.put(key, value);
        return payload;
    }

    private static Map<String, Object> patternsOf(ArchitectureModel model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("project", model.project());
        payload.put("designPatterns", model.designPatterns());
        payload.put("architectureStyles", model.architectureStyles());
        payload.put("communicationPatterns", model.communicationPatterns());
        return payload;
    }

    private static Map<String, Object> metricsOf(ArchitectureModel model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("project", model.project());
        payload.put("metrics", model.metrics());
        payload.put("statistics", model.statistics());
        return payload;
    }
}
