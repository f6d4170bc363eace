package com.inp2ops.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class InfoAndValidateCommandTest extends CliTestBase {

    @Test
    void info_details_listsElementTypesAndSkippedKeywords() throws IOException {
        Path input = writeDeck("truss.inp", "*HEADING\nDemo\n" + TRUSS_DECK);

        int exitCode = execute("info", input.toString(), "--details");

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("T3D2").contains("HEADING");
    }

    @Test
    void validate_convertibleDeck_reportsSuccessWithoutWriting() throws IOException {
        Path input = writeDeck("truss.inp", TRUSS_DECK);

        int exitCode = execute("validate", input.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ truss.inp converts");
        assertThat(tempDir.resolve("truss.py")).doesNotExist();
    }

    @Test
    void validate_undefinedNode_fails() throws IOException {
        Path input = writeDeck("dangling.inp", "*NODE\n1, 0, 0, 0\n*ELEMENT, TYPE=T3D2\n1, 1, 9\n");

        assertThat(execute("validate", input.toString())).isEqualTo(1);
        assertThat(stderr()).contains("✗ Validation failed");
    }
}
