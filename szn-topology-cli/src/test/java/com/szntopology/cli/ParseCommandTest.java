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
 * Tests for {@link ParseCommand} and {@link InjectCommand}.
 */
class ParseCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = SznTopologyCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void parse_sznFile_printsJson() throws IOException {
        Path szn = Files.writeString(tempDir.resolve("lab.szn"), "[type=switch] sw1\nsw1:1 -- hs1:1\n");

        int exitCode = commandLine.execute("-q", "parse", szn.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("\"nodes\"")
            .contains("\"sw1\"")
            .contains("\"switch\"")
            .contains("\"sw1:1\"");
    }

    @Test
    void parse_withInjection_mergesAttributes() throws IOException {
        Path suite = Files.createDirectories(tempDir.resolve("suite"));
        Path module = Files.writeString(suite.resolve("test_lab.py"),
            "TOPOLOGY = \"\"\"\n[type=host] hs1\n\"\"\"\n");
        Path spec = Files.writeString(tempDir.resolve("attributes.json"), """
            [{"files": ["test_lab.py"], "modifiers": [{"nodes": ["hs1"], "attributes": {"image": "injected_image"}}]}]
            """);

        int exitCode = commandLine.execute("-q", "parse", module.toString(),
            "--inject", spec.toString(), "--search-path", suite.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"injected_image\"").contains("\"host\"");
    }

    @Test
    void parse_brokenFile_exitsOne() throws IOException {
        Path bad = Files.writeString(tempDir.resolve("bad.szn"), "[unclosed sw1\n");

        int exitCode = commandLine.execute("-q", "parse", bad.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unable to parse line #1");
    }

    @Test
    void inject_printsResultPerFile() throws IOException {
        Path suite = Files.createDirectories(tempDir.resolve("suite"));
        Path module = Files.writeString(suite.resolve("test_lab.py"),
            "TOPOLOGY = \"\"\"\n[type=host] hs1\nsw1\n\"\"\"\n");
        Path spec = Files.writeString(tempDir.resolve("attributes.json"), """
            [{"files": ["*"], "modifiers": [{"nodes": ["type=host"], "attributes": {"image": "host_image"}}]}]
            """);

        int exitCode = commandLine.execute("-q", "inject", spec.toString(), suite.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains(module.toAbsolutePath().normalize().toString().replace("\\", "\\\\"))
            .contains("\"host_image\"")
            .doesNotContain("\"sw1\"");
    }

    @Test
    void inject_malformedSpec_exitsOne() throws IOException {
        Path spec = Files.writeString(tempDir.resolve("attributes.json"), "{}");

        int exitCode = commandLine.execute("-q", "inject", spec.toString(), tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Injection failed");
    }
}
