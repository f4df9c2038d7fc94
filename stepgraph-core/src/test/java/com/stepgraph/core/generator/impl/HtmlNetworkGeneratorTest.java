package com.stepgraph.core.generator.impl;

import com.stepgraph.core.generator.GeneratedDiagram;
import com.stepgraph.core.generator.GeneratorConfig;
import com.stepgraph.core.view.GraphEdge;
import com.stepgraph.core.view.GraphNode;
import com.stepgraph.core.view.GraphView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link HtmlNetworkGenerator}.
 */
class HtmlNetworkGeneratorTest {

    private HtmlNetworkGenerator generator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        generator = new HtmlNetworkGenerator();
    }

    @Test
    void metadata() {
        assertThat(generator.getId()).isEqualTo("html");
        assertThat(generator.getFileExtension()).isEqualTo("html");
        assertThat(generator.getContentType()).isEqualTo("text/html");
    }

    @Test
    void generate_embedsNodesEdgesAndFocus() {
        GraphView view = new GraphView("wall.ifc - #2 LINE",
            List.of(
                new GraphNode("#1", "POINT", "#1=POINT('P1')", "lightgrey", false, false),
                new GraphNode("#2", "LINE", "#2=LINE(#1)", "indigo", true, false)
            ),
            List.of(new GraphEdge("#2", "#1", "1")),
            "#2");

        GeneratedDiagram diagram = generator.generate(view, new GeneratorConfig("600px", "80%", null));
        String html = diagram.content();

        assertThat(diagram.fileExtension()).isEqualTo("html");
        assertThat(html)
            .startsWith("<!DOCTYPE html>")
            .contains("<title>wall.ifc - #2 LINE</title>")
            .contains("2 nodes")
            .contains("1 edges")
            .contains("width: 80%; height: 600px;")
            .contains("{\"id\":\"#1\",\"label\":\"#1\\nPOINT\",\"title\":\"#1=POINT('P1')\",\"color\":\"lightgrey\"")
            .contains("\"borderWidth\":3")
            .contains("{\"from\":\"#2\",\"to\":\"#1\",\"label\":\"1\"}")
            .contains("var focus = \"#2\";")
            .doesNotContain("{{");
    }

    @Test
    void generate_wholeGraph_hasNullFocus() {
        GraphView view = new GraphView("all", List.of(new GraphNode("#1", "A", "", "red", false, false)), List.of(), null);

        String html = generator.generate(view, GeneratorConfig.defaults()).content();

        assertThat(html).contains("var focus = null;");
    }

    @Test
    void generate_scriptBreakingText_isEscaped() {
        GraphView view = new GraphView("<b>title</b>",
            List.of(new GraphNode("#1", "A", "#1=A('</script><script>alert(1)')", "red", false, false)),
            List.of(), null);

        String html = generator.generate(view, GeneratorConfig.defaults()).content();

        assertThat(html)
            .contains("<title>&lt;b&gt;title&lt;/b&gt;</title>")
            .contains("<\\/script><script>alert(1)")
            .doesNotContain("</script><script>alert");
    }

    @Test
    void generate_missingNode_isBox() {
        GraphView view = new GraphView("m", List.of(new GraphNode("#5", "missing", "", "red", false, true)), List.of(), null);

        assertThat(generator.generate(view, GeneratorConfig.defaults()).content()).contains("\"shape\":\"box\"");
    }

    @Test
    void generate_placeholderTextInEntityData_isKeptVerbatim() {
        // Given
        String tooltip = "#1=IFCWALL('see {{FOCUS}} and {{EDGES}}',#2)";
        GraphView view = new GraphView("wall {{NODES}}",
            List.of(
                new GraphNode("#1", "IFCWALL", tooltip, "indigo", true, false),
                new GraphNode("#2", "IFCLOCALPLACEMENT", "#2=IFCLOCALPLACEMENT($,$)", "grey", false, false)
            ),
            List.of(new GraphEdge("#1", "#2", "2")),
            "#1");

        // When
        String html = generator.generate(view, GeneratorConfig.defaults()).content();

        // Then
        assertThat(html)
            .contains("\"title\":\"#1=IFCWALL('see {{FOCUS}} and {{EDGES}}',#2)\"")
            .contains("<title>wall {{NODES}}</title>")
            .contains("var edgeData = [{\"from\":\"#1\",\"to\":\"#2\",\"label\":\"2\"}];")
            .contains("var focus = \"#1\";");
    }

    @Test
    void fill_replacesKnownPlaceholdersOnly() {
        String filled = HtmlNetworkGenerator.fill("{{A}}-{{B}}-{{C}}", Map.of("A", "{{B}}", "B", "$1\\"));

        assertThat(filled).isEqualTo("{{B}}-$1\\-{{C}}");
    }

    @Test
    void generate_withoutNetworkScript_referencesCdn() {
        GraphView view = new GraphView("all", List.of(), List.of(), null);

        String html = generator.generate(view, GeneratorConfig.defaults()).content();

        assertThat(html).contains("<script src=\"" + HtmlNetworkGenerator.NETWORK_CDN_URL + "\"></script>");
    }

    @Test
    void generate_withNetworkScript_inlinesLibrary() throws IOException {
        // Given
        Path script = tempDir.resolve("vis-network.min.js");
        Files.writeString(script, "var vis = {}; /* </script> */");
        GraphView view = new GraphView("all", List.of(), List.of(), null);

        // When
        String html = generator.generate(view, GeneratorConfig.defaults().withNetworkScript(script)).content();

        // Then
        assertThat(html)
            .contains("<script>\nvar vis = {}; /* <\\/script> */\n</script>")
            .doesNotContain("unpkg.com");
    }

    @Test
    void generate_missingNetworkScript_throwsIllegalState() {
        GeneratorConfig config = GeneratorConfig.defaults().withNetworkScript(tempDir.resolve("absent.js"));
        GraphView view = new GraphView("all", List.of(), List.of(), null);

        assertThatThrownBy(() -> generator.generate(view, config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to read network script");
    }
}
