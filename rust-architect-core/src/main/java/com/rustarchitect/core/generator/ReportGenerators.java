package com.rustarchitect.core.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rustarchitect.core.model.ArchitectureModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Discovers {@link ReportGenerator} implementations via {@link ServiceLoader}.
 */
public final class ReportGenerators {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerators.class);

    private ReportGenerators() {
    }

    /**
     * Returns all registered generators sorted by id.
     *
     * @return generators on the classpath
     */
    public static List<ReportGenerator> discover() {
        List<ReportGenerator> generators = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(generators::add);
        generators.sort(Comparator.comparing(ReportGenerator::getId));
        log.debug("Discovered {} report generators", generators.size());
        return generators;
    }

    /**
     * Returns the registered generators whose id is enabled, in the order given.
     *
     * @param enabledIds generator ids from the output configuration
     * @return matching generators; unknown ids are logged and skipped
     */
    public static List<ReportGenerator> enabled(List<String> enabledIds) {
        List<ReportGenerator> available = discover();
        List<ReportGenerator> selected = new ArrayList<>();
        for (String id : enabledIds) {
            available.stream()
                .filter(generator -> generator.getId().equals(id))
                .findFirst()
                .ifPresentOrElse(selected::add, () -> log.warn("Unknown report generator: {}", id));
        }
        return selected;
    }

    /**
     * Runs every generator for each report type it supports, in {@link ReportType} order.
     *
     * @param generators generators to run
     * @param model analysis result
     * @param config generation settings
     * @return all generated reports
     */
    public static List<GeneratedReport> generateAll(List<ReportGenerator> generators, ArchitectureModel model,
                                                    GeneratorConfig config) {
        List<GeneratedReport> reports = new ArrayList<>();
        for (ReportGenerator generator : generators) {
            for (ReportType type : ReportType.values()) {
                if (generator.getSupportedReportTypes().contains(type)) {
                    reports.add(generator.generate(model, type, config));
                }
            }
        }
        log.info("Generated {} reports with {} generators", reports.size(), generators.size());
        return reports;
    }
}
