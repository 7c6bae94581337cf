package com.schemareverse.core.config;

import com.schemareverse.core.parser.ConstructKind;
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
        Path configFile = tempDir.resolve("schema-reverse.yaml");
        Files.writeString(configFile, """
            confidence:
              minimum: 0.6
              actionBaseline: 0.5
            parsers:
              disabled:
                - dynamic_sql
                - cursor
            classification:
              tablePrefixes: [t_]
              vocabularySuffix: _kind
            """);

        ReverseConfig config = ConfigLoader.load(configFile);

        assertThat(config.confidence().minimum()).isEqualTo(0.6);
        assertThat(config.confidence().actionBaseline()).isEqualTo(0.5);
        assertThat(config.parsers().disabled()).containsExactly("dynamic_sql", "cursor");
        assertThat(config.parsers().enabledKinds())
            .doesNotContain(ConstructKind.DYNAMIC_SQL, ConstructKind.CURSOR_OPERATIONS)
            .hasSize(ConstructKind.values().length - 2);
        assertThat(config.classification().tablePrefixes()).containsExactly("t_");
        assertThat(config.classification().vocabularySuffix()).isEqualTo("_kind");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("schema-reverse.yaml");
        Files.writeString(configFile, """
            confidence:
              minimum: 0.9
            unknownSection:
              foo: bar
            """);

        ReverseConfig config = ConfigLoader.load(configFile);

        assertThat(config.confidence().minimum()).isEqualTo(0.9);
        assertThat(config.confidence().actionBaseline()).isEqualTo(0.70);
        assertThat(config.parsers().enabledKinds()).hasSize(ConstructKind.values().length);
        assertThat(config.classification().tablePrefixes()).containsExactly("tb_", "tv_");
        assertThat(config.classification().vocabularySuffix()).isEqualTo("_info");
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        ReverseConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ReverseConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("schema-reverse.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ReverseConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("schema-reverse.yaml");
        Files.writeString(configFile, "confidence: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ReverseConfig.defaults());
    }

    @Test
    void load_outOfRangeThreshold_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("schema-reverse.yaml");
        Files.writeString(configFile, """
            confidence:
              minimum: 1.5
            """);

        assertThat(ConfigLoader.load(configFile).confidence().minimum()).isEqualTo(0.80);
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ReverseConfig.defaults());
    }
}
