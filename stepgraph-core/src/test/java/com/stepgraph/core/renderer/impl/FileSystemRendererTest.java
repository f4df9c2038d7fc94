package com.stepgraph.core.renderer.impl;

import com.stepgraph.core.renderer.GeneratedFile;
import com.stepgraph.core.renderer.GeneratedOutput;
import com.stepgraph.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withSingleFile_writesFileToOutputDirectory() throws IOException {
        // Given
        String content = "<html>été</html>";
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("wall.html", content, "text/html"));
        RenderContext context = new RenderContext(tempDir);

        // When
        renderer.render(output, context);

        // Then
        Path expectedFile = tempDir.resolve("wall.html");
        assertThat(expectedFile).exists();
        assertThat(Files.readString(expectedFile, StandardCharsets.UTF_8)).isEqualTo(content);
    }

    @Test
    void render_withMissingDirectories_createsThem() throws IOException {
        // Given
        Path outputDir = tempDir.resolve("out/graphs");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.md", "A", "text/markdown"),
            new GeneratedFile("nested/b.json", "{}", "application/json")
        ));

        // When
        renderer.render(output, new RenderContext(outputDir));

        // Then
        assertThat(Files.readString(outputDir.resolve("a.md"))).isEqualTo("A");
        assertThat(Files.readString(outputDir.resolve("nested/b.json"))).isEqualTo("{}");
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("graph.html"), "old content that is longer");

        // When
        renderer.render(GeneratedOutput.of(new GeneratedFile("graph.html", "new", "text/html")),
            new RenderContext(tempDir));

        // Then
        assertThat(Files.readString(tempDir.resolve("graph.html"))).isEqualTo("new");
    }

    @Test
    void render_outputDirectoryIsAFile_throwsIllegalState() throws IOException {
        // Given
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");

        // When / Then
        assertThatThrownBy(() -> renderer.render(
            GeneratedOutput.of(new GeneratedFile("graph.html", "x", "text/html")),
            new RenderContext(blocker)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }

    @Test
    void render_pathOutsideOutputDirectory_isRejected() {
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("../escape.html", "x", "text/html"));
        Path outputDir = tempDir.resolve("out");

        assertThatThrownBy(() -> renderer.render(output, new RenderContext(outputDir)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Refusing to write outside");
        assertThat(tempDir.resolve("escape.html")).doesNotExist();
    }
}
