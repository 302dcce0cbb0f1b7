package org.botblocks.cli.commands;

import org.botblocks.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class BlocksCommandTest {

    @Test
    void blocks_shouldListEveryStandardBlock() {
        // Given
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        // When
        int exitCode = commandLine.execute("blocks");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).hasSize(13);
        assertThat(out.toString())
                .contains("button-pressed")
                .contains("set-motor-speed")
                .contains("left[-500..500]")
                .doesNotContain("no code generator");
    }
}
