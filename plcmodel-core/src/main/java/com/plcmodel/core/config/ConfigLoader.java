package com.plcmodel.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the extractor settings file, {@code plcmodel.yaml}.
 *
 * <p>The file tunes three things: which auxiliary-data blocks count as CODESYS application
 * and union blocks ({@code namespaces.application}, {@code namespaces.union}), whether type
 * nodes without a {@code baseType} are still accepted as basic types
 * ({@code classification.strictBasicTypes}), and whether JSON output is indented
 * ({@code output.prettyPrint}). See {@link ExtractorConfig} for a complete file.
 *
 * <p>Configuration is optional. A settings file that is absent, is a directory, cannot be
 * read, is blank or is not valid YAML for these keys leaves every setting at
 * {@link ExtractorConfig#defaults()}; extraction of a document never fails because of it.
 * Keys this version does not know are ignored, keys left out keep their default.
 *
 * <p>The CLI passes {@code -c/--config}, which points at {@value #DEFAULT_CONFIG_FILE} in the
 * working directory unless given.
 */
public final class ConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "plcmodel.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectReader SETTINGS_READER =
        new ObjectMapper(new YAMLFactory()).readerFor(ExtractorConfig.class);

    private ConfigLoader() {
    }

    /**
     * Loads the settings file, falling back to defaults.
     *
     * @param configPath location of the settings file
     * @return settings from the file, or defaults when the file is unusable
     */
    public static ExtractorConfig load(Path configPath) {
        return read(configPath).orElseGet(() -> {
            log.debug("Extracting with default settings");
            return ExtractorConfig.defaults();
        });
    }

    /**
     * Reads the settings file without falling back.
     *
     * @param configPath location of the settings file
     * @return parsed settings, empty when the file is unusable
     */
    static Optional<ExtractorConfig> read(Path configPath) {
        if (Files.notExists(configPath)) {
            log.debug("No settings file at {}", configPath);
            return Optional.empty();
        }
        if (Files.isDirectory(configPath) || !Files.isReadable(configPath)) {
            log.warn("Settings path {} is not a readable file, ignoring it", configPath);
            return Optional.empty();
        }

        String yaml;
        try {
            yaml = Files.readString(configPath);
        } catch (IOException e) {
            log.warn("Could not read settings file {}: {}", configPath, e.getMessage());
            return Optional.empty();
        }
        if (yaml.isBlank()) {
            log.warn("Settings file {} is blank, ignoring it", configPath);
            return Optional.empty();
        }

        try {
            ExtractorConfig config = SETTINGS_READER.readValue(yaml);
            log.info("Using settings from {} (application block {}, strict basic types {})",
                configPath, config.namespaces().application(), config.classification().strictBasicTypes());
            return Optional.of(config);
        } catch (JsonProcessingException e) {
            log.error("Settings file {} is not valid, ignoring it: {}", configPath, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
