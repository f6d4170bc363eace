package com.inp2ops.core.config;

import com.inp2ops.core.translator.ConversionOptions;
import com.inp2ops.core.translator.UnmappedPolicy;
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
    void load_missingFile_returnsDefaults() {
        ConverterConfig config = ConfigLoader.load(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME));

        assertThat(config).isEqualTo(ConverterConfig.defaults());
        assertThat(config.conversion().toOptions()).isEqualTo(ConversionOptions.defaults());
    }

    @Test
    void load_validFile_readsAllSections() throws IOException {
        Path file = tempDir.resolve("inp2ops.yaml");
        Files.writeString(file, """
            conversion:
              unmappedElements: FAIL
              defaultNdf: 3
            mappings:
              path: tables/custom.yaml
            output:
              overwrite: true
            """);

        ConverterConfig config = ConfigLoader.load(file);

        assertThat(config.conversion().toOptions())
            .isEqualTo(new ConversionOptions(UnmappedPolicy.FAIL, 3));
        assertThat(config.mappings().path()).isEqualTo("tables/custom.yaml");
        assertThat(config.output().overwrite()).isTrue();
    }

    @Test
    void load_partialFile_fillsMissingSectionsWithDefaults() throws IOException {
        Path file = tempDir.resolve("inp2ops.yaml");
        Files.writeString(file, """
            output:
              overwrite: true
            futureSetting: 42
            """);

        ConverterConfig config = ConfigLoader.load(file);

        assertThat(config.conversion()).isEqualTo(ConverterConfig.ConversionSettings.defaults());
        assertThat(config.mappings().path()).isNull();
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path file = tempDir.resolve("inp2ops.yaml");
        Files.writeString(file, "conversion: [unclosed");

        assertThat(ConfigLoader.load(file)).isEqualTo(ConverterConfig.defaults());
    }

    @Test
    void toOptions_unsupportedNdf_fallsBackToSix() {
        ConverterConfig.ConversionSettings settings = new ConverterConfig.ConversionSettings("skip", 4);

        assertThat(settings.toOptions().defaultNdf()).isEqualTo(6);
    }
}
