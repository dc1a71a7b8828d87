package com.szntopology.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code szntopology.yaml} into {@link SznTopologyConfig} records.
 * If the config file is missing or invalid, returns {@link SznTopologyConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SznTopologyConfig config = ConfigLoader.load(Paths.get("szntopology.yaml"));
 * List<String> patterns = config.getEffectiveInjection().getEffectiveFilePatterns();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_CONFIG_FILE = "szntopology.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link SznTopologyConfig#defaults()}.
     *
     * @param configPath path to {@code szntopology.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static SznTopologyConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return SznTopologyConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return SznTopologyConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SznTopologyConfig config = YAML_MAPPER.readValue(configPath.toFile(), SznTopologyConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return SznTopologyConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return SznTopologyConfig.defaults();
        }
    }
}
