package com.szntopology.cli;

import com.szntopology.SznTopologyCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        commandLine = SznTopologyCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
    }

    @Test
    void validate_validFiles_exitsZero() throws IOException {
        Path szn = Files.writeString(tempDir.resolve("lab.szn"), "[type=switch] sw1\nsw1:1 -- hs1:1\n");
        Path module = Files.writeString(tempDir.resolve("test_lab.py"), "TOPOLOGY = \"\"\"\nhs1\n\"\"\"\n");

        int exitCode = commandLine.execute("-q", "validate", szn.toString(), module.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("✓ " + szn + ": 2 nodes, 2 ports, 1 links")
            .contains("✓ " + module + ": 1 nodes, 0 ports, 0 links");
    }

    @Test
    void validate_brokenFile_reportsLineAndExitsOne() throws IOException {
        Path good = Files.writeString(tempDir.resolve("good.szn"), "sw1\n");
        Path bad = Files.writeString(tempDir.resolve("bad.szn"), "sw1\nsw1 -- sw2\n");

        int exitCode = commandLine.execute("-q", "validate", good.toString(), bad.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("✓ " + good)
            .contains("✗ " + bad + ": line 2:");
    }

    @Test
    void validate_missingFile_fails() {
        int exitCode = commandLine.execute("-q", "validate", tempDir.resolve("missing.szn").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("✗");
    }
}
