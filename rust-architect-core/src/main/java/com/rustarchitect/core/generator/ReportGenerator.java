package com.rustarchitect.core.generator;

import com.rustarchitect.core.model.ArchitectureModel;

import java.util.Set;

/**
 * Interface for generators that turn an {@link ArchitectureModel} into a report format.
 *
 * <p>Each generator supports one or more {@link ReportType}s. Generators are discovered
 * via Java Service Provider Interface (SPI) and selected by id in the output configuration.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.rustarchitect.core.generator.ReportGenerator}
 *
 * @see ReportType
 * @see GeneratorConfig
 * @see GeneratedReport
 */
public interface ReportGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Used for referencing the generator in configuration. Lowercase
     * (e.g., "json", "markdown", "mermaid").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated reports.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns set of report types this generator can produce.
     *
     * @return supported report types
     */
    Set<ReportType> getSupportedReportTypes();

    /**
     * Generates a report from the architecture model.
     *
     * <p>An empty model produces a report with a meaningful placeholder rather than
     * an error.
     *
     * @param model the analysis result
     * @param type the report type to generate
     * @param config configuration settings for generation
     * @return generated report
     * @throws IllegalArgumentException if report type is not supported
     */
    GeneratedReport generate(ArchitectureModel model, ReportType type, GeneratorConfig config);
}
