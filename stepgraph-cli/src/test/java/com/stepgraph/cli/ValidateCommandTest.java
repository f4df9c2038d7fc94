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
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    private final CliTestSupport cli = new CliTestSupport();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        cli.capture();
    }

    @AfterEach
    void tearDown() {
        cli.restore();
    }

    @Test
    void validate_validFile_succeeds() throws IOException {
        Path input = CliTestSupport.copyFixture("wall.ifc", tempDir);

        int exitCode = cli.execute("validate", input.toString());

        assertThat(exitCode).isZero();
        assertThat(cli.out()).contains("is valid: 10 entities, 11 references");
    }

    @Test
    void validate_danglingReference_warnsButPasses() throws IOException {
        Path input = tempDir.resolve("dangling.step");
        Files.writeString(input, "#1=A(#2,#3);\n#2=B();\n");

        int exitCode = cli.execute("validate", input.toString());

        assertThat(exitCode).isZero();
        assertThat(cli.err()).contains("⚠ #1 [2] references missing #3");
    }

    @Test
    void validate_strictWithDanglingReference_fails() throws IOException {
        Path input = tempDir.resolve("dangling.step");
        Files.writeString(input, "#1=A(#2,#3);\n#2=B();\n");

        int exitCode = cli.execute("validate", "--strict", input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.err()).contains("✗ 1 dangling references in");
    }

    @Test
    void validate_duplicateName_fails() throws IOException {
        Path input = tempDir.resolve("dup.step");
        Files.writeString(input, "#1=A();\n#1=B();\n");

        int exitCode = cli.execute("validate", "--json", input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(cli.out())
            .contains("\"type\":\"duplicate_name\"")
            .contains("\"lineno\":2")
            .contains("\"first_lineno\":1");
    }
}
