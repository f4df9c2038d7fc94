package com.stepgraph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StepGraphCLITest {

    @Test
    void commandLine_registersSubcommands() {
        assertThat(StepGraphCLI.commandLine().getSubcommands())
            .containsKeys("render", "summary", "validate", "list");
    }

    @Test
    void globalOptions_areParsed() {
        StepGraphCLI cli = new StepGraphCLI();
        new picocli.CommandLine(cli).parseArgs("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }
}
