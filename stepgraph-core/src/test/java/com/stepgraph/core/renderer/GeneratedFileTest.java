package com.stepgraph.core.renderer;

import com.stepgraph.core.generator.GeneratedDiagram;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the renderer value types.
 */
class GeneratedFileTest {

    @Test
    void of_takesContentFromDiagram() {
        GeneratedDiagram diagram = new GeneratedDiagram("entity-graph", "<html/>", "html", "text/html");

        GeneratedFile named = GeneratedFile.of("wall.html", diagram);
        GeneratedFile defaulted = GeneratedFile.of(diagram);

        assertThat(named.relativePath()).isEqualTo("wall.html");
        assertThat(named.content()).isEqualTo("<html/>");
        assertThat(named.contentType()).isEqualTo("text/html");
        assertThat(defaulted.relativePath()).isEqualTo("entity-graph.html");
    }

    @Test
    void constructor_blankPath_throws() {
        assertThatThrownBy(() -> new GeneratedFile(" ", "x", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GeneratedFile(null, "x", null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generatedOutput_countsUtf8Bytes() {
        GeneratedOutput output = GeneratedOutput.of(
            new GeneratedFile("a.md", "ab", null),
            new GeneratedFile("b.md", "é", null));

        assertThat(output.totalBytes()).isEqualTo(4);
    }

    @Test
    void renderContext_forFile_usesParentDirectory() {
        Path target = Paths.get("graphs", "wall.html");

        assertThat(RenderContext.forFile(target).outputDirectory())
            .isEqualTo(target.toAbsolutePath().getParent());
    }
}
