package com.stepgraph.core.renderer.impl;

import com.stepgraph.core.renderer.GeneratedFile;
import com.stepgraph.core.renderer.GeneratedOutput;
import com.stepgraph.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ConsoleRenderer renderer;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_printsRawContentByDefault() {
        // Given
        String content = "graph LR\n  e1 --> e2\n";
        GeneratedOutput output = GeneratedOutput.of(new GeneratedFile("graph.md", content, "text/markdown"));

        // When
        renderer.render(output, RenderContext.workingDirectory());

        // Then
        assertThat(outputStream.toString(StandardCharsets.UTF_8)).isEqualTo(content);
    }

    @Test
    void render_contentWithoutTrailingNewline_isTerminated() {
        renderer.render(GeneratedOutput.of(new GeneratedFile("g.json", "{}", "application/json")),
            RenderContext.workingDirectory());

        assertThat(outputStream.toString(StandardCharsets.UTF_8)).isEqualTo("{}" + System.lineSeparator());
    }

    @Test
    void render_multipleFiles_printsInOrder() {
        GeneratedOutput output = GeneratedOutput.of(
            new GeneratedFile("a.md", "A\n", "text/markdown"),
            new GeneratedFile("b.md", "B", null));

        renderer.render(output, RenderContext.workingDirectory());

        assertThat(outputStream.toString(StandardCharsets.UTF_8)).isEqualTo("A\nB" + System.lineSeparator());
    }
}
