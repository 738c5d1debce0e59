package com.rustarchitect.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading analysis configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code rustarchitect.yaml} into {@link AnalysisConfig} records.
 * If the config file is missing or invalid, returns {@link AnalysisConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalysisConfig config = ConfigLoader.load(projectRoot.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * double threshold = config.detection().patternThreshold();
 * }</pre>
 */
public class ConfigLoader {

    /** Configuration file looked up in the project root. */
    public static final String DEFAULT_FILE_NAME = "rustarchitect.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link AnalysisConfig#defaults()}.
     *
     * @param configPath path to {@code rustarchitect.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalysisConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return AnalysisConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalysisConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            AnalysisConfig config = YAML_MAPPER.readValue(configPath.toFile(), AnalysisConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalysisConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalysisConfig.defaults();
        }
    }

    /**
     * Loads {@code rustarchitect.yaml} from a project root, or returns defaults.
     *
     * @param projectRoot project root directory
     * @return loaded configuration or defaults
     */
    public static AnalysisConfig loadFromProject(Path projectRoot) {
        return load(projectRoot.resolve(DEFAULT_FILE_NAME));
    }
}
