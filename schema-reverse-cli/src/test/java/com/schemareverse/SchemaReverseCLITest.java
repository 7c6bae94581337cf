package com.schemareverse;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaReverseCLITest {

    @Test
    void commandLine_registersSubcommands() {
        CommandLine commandLine = SchemaReverseCLI.commandLine();

        assertThat(commandLine.getSubcommands()).containsOnlyKeys("analyze", "constructs");
    }

    @Test
    void commandLine_withVerboseFlag_parsesGlobalOption() {
        CommandLine commandLine = SchemaReverseCLI.commandLine();

        commandLine.parseArgs("-v", "constructs");

        SchemaReverseCLI cli = commandLine.getCommand();
        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void commandLine_withVersion_exitsCleanly() {
        assertThat(SchemaReverseCLI.commandLine().execute("--version")).isZero();
    }
}
