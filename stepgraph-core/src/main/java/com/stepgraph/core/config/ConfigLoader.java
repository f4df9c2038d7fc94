package com.stepgraph.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link StepGraphConfig} from YAML.
 *
 * <p>Never fails: a missing, unreadable or malformed file logs a warning and yields
 * {@link StepGraphConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StepGraphConfig config = ConfigLoader.load(Paths.get("stepgraph.yaml"));
 * int radius = config.view().radius();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file looked up in the working directory when none is given */
    public static final String DEFAULT_FILE_NAME = "stepgraph.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code stepgraph.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static StepGraphConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return StepGraphConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return StepGraphConfig.defaults();
        }

        try {
            StepGraphConfig config = YAML_MAPPER.readValue(configPath.toFile(), StepGraphConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return StepGraphConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return StepGraphConfig.defaults();
        }
    }
}
