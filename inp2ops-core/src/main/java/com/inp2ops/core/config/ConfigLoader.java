package com.inp2ops.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads converter configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code inp2ops.yaml} into {@link ConverterConfig} records.
 * A missing or unreadable file is not an error: the loader logs it and returns
 * {@link ConverterConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ConverterConfig config = ConfigLoader.load(Path.of("inp2ops.yaml"));
 * ConversionOptions options = config.conversion().toOptions();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** File name looked up in the working directory when no path is given. */
    public static final String DEFAULT_FILE_NAME = "inp2ops.yaml";

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code inp2ops.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ConverterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ConverterConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ConverterConfig config = YAML_MAPPER.readValue(configPath.toFile(), ConverterConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ConverterConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ConverterConfig.defaults();
        }
    }
}
