package com.stepgraph.core.config;

import com.stepgraph.core.graph.Direction;
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
        Path configFile = tempDir.resolve("stepgraph.yaml");
        Files.writeString(configFile, """
            view:
              radius: 3
              direction: OUTGOING
              showDanglingReferences: false

            output:
              format: mermaid
              height: "600px"
              labelWrap: 60
              networkScript: lib/vis-network.min.js

            colors:
              focus: gold
              types:
                ifcwall: steelblue
                CARTESIAN_POINT: black
            """);

        StepGraphConfig config = ConfigLoader.load(configFile);

        assertThat(config.view().radius()).isEqualTo(3);
        assertThat(config.view().direction()).isEqualTo(Direction.OUTGOING);
        assertThat(config.view().showDanglingReferences()).isFalse();
        assertThat(config.output().format()).isEqualTo("mermaid");
        assertThat(config.output().height()).isEqualTo("600px");
        assertThat(config.output().width()).isEqualTo("100%");
        assertThat(config.output().labelWrap()).isEqualTo(60);
        assertThat(config.output().networkScript()).isEqualTo("lib/vis-network.min.js");
        assertThat(config.colors().focus()).isEqualTo("gold");
        assertThat(config.colors().missing()).isEqualTo("red");
        assertThat(config.colors().types())
            .containsEntry("IFCWALL", "steelblue")
            .containsEntry("CARTESIAN_POINT", "black")
            .containsEntry("PCURVE", "orange");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        StepGraphConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(StepGraphConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(StepGraphConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(StepGraphConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("invalid.yaml");
        Files.writeString(configFile, "view: [unclosed\n  radius: : :");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(StepGraphConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(StepGraphConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("extra.yaml");
        Files.writeString(configFile, """
            project: something
            view:
              radius: 2
              zoom: 5
            """);

        StepGraphConfig config = ConfigLoader.load(configFile);

        assertThat(config.view().radius()).isEqualTo(2);
        assertThat(config.view().direction()).isEqualTo(Direction.BOTH);
    }

    @Test
    void defaults_matchDocumentedValues() {
        StepGraphConfig config = StepGraphConfig.defaults();

        assertThat(config.view().radius()).isEqualTo(1);
        assertThat(config.view().direction()).isEqualTo(Direction.BOTH);
        assertThat(config.view().showDanglingReferences()).isTrue();
        assertThat(config.output().format()).isEqualTo("html");
        assertThat(config.output().labelWrap()).isEqualTo(100);
        assertThat(config.output().networkScript()).isNull();
        assertThat(config.colors().focus()).isEqualTo("indigo");
        assertThat(config.colors().types()).containsAllEntriesOf(StepGraphConfig.ColorConfig.DEFAULT_TYPE_COLORS);
    }
}
