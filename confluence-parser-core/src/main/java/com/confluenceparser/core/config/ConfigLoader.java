package com.confluenceparser.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads parser configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code confluence-parser.yaml} into {@link ParserConfig}.
 * If the file is missing or invalid, returns {@link ParserConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParserConfig config = ConfigLoader.load(Path.of("confluence-parser.yaml"));
 * ConfluenceParser parser = new ConfluenceParser(config.parser());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "confluence-parser.yaml";

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns the
     * defaults.
     *
     * @param configPath path to the YAML file
     * @return loaded configuration or defaults if unavailable
     */
    public static ParserConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ParserConfig config = YAML_MAPPER.readValue(configPath.toFile(), ParserConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ParserConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ParserConfig.defaults();
        }
    }
}
