package com.stepgraph.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RenderCommand}.
 */
class RenderCommandTest {

    private final CliTestSupport cli = new CliTestSupport();

    @TempDir
    Path tempDir;

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = CliTestSupport.copyFixture("wall.ifc", tempDir);
        cli.capture();
    }

    @AfterEach
    void tearDown() {
        cli.restore();
    }

    @Test
    void render_wholeFile_writesHtml() throws IOException {
        // Given
        Path output = tempDir.resolve("wall.html");

        // When
        int exitCode = cli.execute("render", input.toString(), output.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(output).exists();
        String html = Files.readString(output);
        assertThat(html).contains("vis-network").contains("IFCWALL").contains("<title>wall.ifc</title>");
        assertThat(cli.out())
            .contains("✓ Parsed")
            .contains("10 entities, 11 references")
            .contains("Entities:   10")
            .contains("Elapsed time:");
    }

    @Test
    void render_danglingReferences_countsOnlyParsedEntities() throws IOException {
        Path dangling = tempDir.resolve("dangling.step");
        Files.writeString(dangling, "#1=A(#7,#8,#9);\n#2=B(#1);\n");
        Path output = tempDir.resolve("dangling.html");

        int exitCode = cli.execute("render", dangling.toString(), output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).contains("#7").contains("#9");
        assertThat(cli.out())
            .contains("Entities:   2")
            .contains("References: 1")
            .contains("Warnings:   3");
    }

    @Test
    void render_networkScriptOption_inlinesLibrary() throws IOException {
        Path script = tempDir.resolve("vis-network.min.js");
        Files.writeString(script, "var vis = { Network: function () {} };");
        Path output = tempDir.resolve("offline.html");

        int exitCode = cli.execute("render", input.toString(), output.toString(), "--network-script", script.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output))
            .contains("var vis = { Network: function () {} };")
            .doesNotContain("unpkg.com");
    }

    @Test
    void render_entityNeighborhood_limitsNodes() throws IOException {
        Path output = tempDir.resolve("placement.html");

        int exitCode = cli.execute("render", input.toString(), output.toString(), "3");

        assertThat(exitCode).isZero();
        String html = Files.readString(output);
        assertThat(html).contains("IFCAXIS2PLACEMENT3D").contains("IFCLOCALPLACEMENT").doesNotContain("IFCWALL");
        assertThat(cli.out()).contains("✓ Extracted 5 entities around #3 (radius 1, BOTH)");
    }

    @Test
    void render_hashPrefixedIdAndOptions_areAccepted() throws IOException {
        Path output = tempDir.resolve("wall-out.html");

        int exitCode = cli.execute("render", input.toString(), output.toString(), "#10",
            "--radius", "-1", "--direction", "outgoing");

        assertThat(exitCode).isZero();
        assertThat(cli.out()).contains("✓ Extracted 10 entities around #10 (radius -1, OUTGOING)");
    }

    @Test
    void render_jsonExtension_selectsJsonGenerator() throws IOException {
        Path output = tempDir.resolve("wall.json");

        int exitCode = cli.execute("render", input.toString(), output.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).startsWith("{").contains("\"nodes\"").contains("\"edges\"");
        assertThat(cli.out()).contains("JSON Graph Generator");
    }

    @Test
    void render_unknownEntity_failsWithoutWriting() {
        Path output = tempDir.resolve("missing.html");

        int exitCode = cli.execute("render", input.toString(), output.toString(), "99");

        assertThat(exitCode).isEqualTo(1);
        assertThat(output).doesNotExist();
        assertThat(cli.err()).contains("Entity #99 not found");
    }

    @Test
    void render_unknownEntityWithJson_printsDiagnostic() {
        int exitCode = cli.execute("render", "--json", input.toString(), tempDir.resolve("x.html").toString(), "99");

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.out()).contains("\"type\":\"entity_not_found\"").contains("\"name\":\"#99\"");
    }

    @Test
    void render_missingInput_returnsError() {
        int exitCode = cli.execute("render", tempDir.resolve("nope.ifc").toString(), tempDir.resolve("x.html").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("Error: No such file");
    }

    @Test
    void render_invalidEntityId_isUsageError() {
        int exitCode = cli.execute("render", input.toString(), tempDir.resolve("x.html").toString(), "wall");

        assertThat(exitCode).isEqualTo(2);
        assertThat(tempDir.resolve("x.html")).doesNotExist();
    }

    @Test
    void render_unknownFormat_isUsageError() {
        int exitCode = cli.execute("render", input.toString(), tempDir.resolve("x.svg").toString(), "--format", "svg");

        assertThat(exitCode).isEqualTo(2);
        assertThat(tempDir.resolve("x.svg")).doesNotExist();
    }

    @Test
    void render_parseErrorWithJson_printsDiagnostic() throws IOException {
        // Given
        Path broken = tempDir.resolve("broken.ifc");
        Files.writeString(broken, "ISO-10303-21;\nHEADER;\nENDSEC;\nDATA;\n#1=IFCWALL(;\nENDSEC;\nEND-ISO-10303-21;\n");

        // When
        int exitCode = cli.execute("render", "--json", broken.toString(), tempDir.resolve("x.html").toString());

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.out())
            .contains("\"type\":\"unexpected_token\"")
            .contains("\"lineno\":5");
    }

    @Test
    void render_parseError_printsLocation() throws IOException {
        Path broken = tempDir.resolve("broken.ifc");
        Files.writeString(broken, "#1=IFCWALL(;\n");

        int exitCode = cli.execute("render", broken.toString(), tempDir.resolve("x.html").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("On line 1 column 12");
    }

    @Test
    void render_mermaidToStdout_keepsStdoutClean() {
        int exitCode = cli.execute("render", input.toString(), "-", "10", "--format", "mermaid");

        assertThat(exitCode).isZero();
        assertThat(cli.out())
            .startsWith("# wall.ifc - #10 IFCWALL")
            .contains("```mermaid")
            .contains("graph LR")
            .doesNotContain("Elapsed time");
        assertThat(cli.err()).contains("Elapsed time:");
    }

    @Test
    void render_quiet_printsNothing() {
        int exitCode = cli.execute("-q", "render", input.toString(), tempDir.resolve("q.html").toString());

        assertThat(exitCode).isZero();
        assertThat(cli.out()).isEmpty();
        assertThat(tempDir.resolve("q.html")).exists();
    }
}
