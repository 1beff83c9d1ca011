package com.confluenceparser.core.config;

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
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            parser:
              strictOnDiagnostics: false
            """);

        ParserConfig config = ConfigLoader.load(configFile);

        assertThat(config.parser().strictOnDiagnostics()).isFalse();
        assertThat(config.parser().isStrict()).isFalse();
    }

    @Test
    void load_missingSection_returnsStrictDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            other:
              key: value
            """);

        ParserConfig config = ConfigLoader.load(configFile);

        assertThat(config.parser()).isEqualTo(ParserSettings.defaults());
        assertThat(config.parser().isStrict()).isTrue();
    }

    @Test
    void load_emptySection_defaultsToStrict() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            parser:
              unknownSetting: 42
            """);

        assertThat(ConfigLoader.load(configFile).parser().isStrict()).isTrue();
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        ParserConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ParserConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(ParserConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ParserConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            parser:
              strictOnDiagnostics: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ParserConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ParserConfig.defaults());
    }

    @Test
    void settings_factories() {
        assertThat(ParserSettings.defaults().isStrict()).isTrue();
        assertThat(ParserSettings.lenient().isStrict()).isFalse();
        assertThat(new ParserSettings(null).isStrict()).isTrue();
        assertThat(new ParserConfig(null).parser()).isEqualTo(ParserSettings.defaults());
    }
}
