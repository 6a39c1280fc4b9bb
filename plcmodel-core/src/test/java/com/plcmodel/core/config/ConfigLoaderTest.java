package com.plcmodel.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("plcmodel.yaml");
        Files.writeString(configFile, """
            namespaces:
              application: "urn:vendor:application"
              union: "urn:vendor:union"

            classification:
              strictBasicTypes: true

            output:
              prettyPrint: false
            """);

        ExtractorConfig config = ConfigLoader.load(configFile);

        assertThat(config.namespaces().application()).isEqualTo("urn:vendor:application");
        assertThat(config.namespaces().union()).isEqualTo("urn:vendor:union");
        assertThat(config.classification().strictBasicTypes()).isTrue();
        assertThat(config.output().prettyPrint()).isFalse();
    }

    @Test
    void load_partialYaml_fillsMissingValuesWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("plcmodel.yaml");
        Files.writeString(configFile, """
            namespaces:
              union: "urn:vendor:union"
            unknownSection:
              ignored: true
            """);

        ExtractorConfig config = ConfigLoader.load(configFile);

        assertThat(config.namespaces().application()).isEqualTo(ExtractorConfig.DEFAULT_APPLICATION_BLOCK);
        assertThat(config.namespaces().union()).isEqualTo("urn:vendor:union");
        assertThat(config.classification().strictBasicTypes()).isFalse();
        assertThat(config.output().prettyPrint()).isTrue();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        ExtractorConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ExtractorConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("plcmodel.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ExtractorConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("plcmodel.yaml");
        Files.writeString(configFile, """
            classification:
              strictBasicTypes: [not, a, boolean
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ExtractorConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ExtractorConfig.defaults());
    }

    @Test
    void load_whitespaceOnlyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("plcmodel.yaml");
        Files.writeString(configFile, "\n   \n");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ExtractorConfig.defaults());
    }

    @Test
    void read_unusableFile_isEmptyWhileUsableFileIsPresent() throws IOException {
        Path configFile = tempDir.resolve("plcmodel.yaml");
        Files.writeString(configFile, """
            output:
              prettyPrint: false
            """);

        assertThat(ConfigLoader.read(tempDir.resolve("absent.yaml"))).isEmpty();
        assertThat(ConfigLoader.read(tempDir)).isEmpty();
        assertThat(ConfigLoader.read(configFile))
            .hasValueSatisfying(config -> assertThat(config.output().prettyPrint()).isFalse());
    }

    @Test
    void defaults_useCodesysBlocks() {
        ExtractorConfig config = ExtractorConfig.defaults();

        assertThat(config.namespaces().application())
            .isEqualTo("http://www.3s-software.com/plcopenxml/application");
        assertThat(config.namespaces().union())
            .isEqualTo("http://www.3s-software.com/plcopenxml/union");
    }
}
