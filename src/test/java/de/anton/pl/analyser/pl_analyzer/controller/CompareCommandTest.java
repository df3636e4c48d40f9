package de.anton.pl.analyser.pl_analyzer.controller;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CompareCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmd = new CommandLine(new CompareCommand());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void shouldPrintShiftAndRatio() throws IOException {
        Path before = tempDir.resolve("before.csv");
        Path after = tempDir.resolve("after.csv");
        Files.writeString(before, "500,0.2\n510,0.8\n520,0.1\n");
        Files.writeString(after, "500,0.1\n510,0.3\n520,0.4\n");

        int exitCode = execute(before.toString(), after.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("Spectral shift: +10.00 nm")
                .contains("Intensity ratio: 0.500 (quenched, 50.0%)");
    }

    @Test
    void shouldFailOnDarkReference() throws IOException {
        Path dark = tempDir.resolve("dark.csv");
        Path after = tempDir.resolve("after.csv");
        Files.writeString(dark, "500,0\n510,0\n");
        Files.writeString(after, "500,0.1\n510,0.3\n");

        int exitCode = execute(dark.toString(), after.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("intensity ratio undefined");
    }

    @Test
    void shouldRequireTwoFiles() {
        assertThat(execute("only-one.csv")).isEqualTo(2);
    }
}
