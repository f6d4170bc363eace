package com.inp2ops;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class Inp2OpsCLITest {

    @Test
    void commandLine_registersAllSubcommands() {
        assertThat(Inp2OpsCLI.commandLine().getSubcommands())
            .containsKeys("convert", "batch", "info", "validate", "list");
    }

    @Test
    void list_knownTypes_succeed() {
        assertThat(Inp2OpsCLI.commandLine().execute("list", "elements")).isZero();
        assertThat(Inp2OpsCLI.commandLine().execute("list", "materials")).isZero();
        assertThat(Inp2OpsCLI.commandLine().execute("list", "renderers")).isZero();
    }

    @Test
    void list_unknownType_fails() {
        assertThat(Inp2OpsCLI.commandLine().execute("list", "sections")).isEqualTo(1);
    }

    @Test
    void globalOptions_areParsed() {
        Inp2OpsCLI cli = new Inp2OpsCLI();
        new picocli.CommandLine(cli).parseArgs("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }
}
