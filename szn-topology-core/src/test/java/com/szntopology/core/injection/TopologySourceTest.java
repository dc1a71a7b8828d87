package com.szntopology.core.injection;

import com.szntopology.core.TopologyException;
import com.szntopology.core.model.Node;
import com.szntopology.core.model.Topology;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TopologySource}.
 */
class TopologySourceTest {

    @TempDir
    Path tempDir;

    private final TopologySource source = new TopologySource();

    @Test
    void load_pythonModule_readsTopologyConstant() throws IOException {
        Path module = Files.writeString(tempDir.resolve("test_ping.py"),
            "TOPOLOGY = \"\"\"\n[type=host] hs1\nhs1:1 -- sw1:1\n\"\"\"\n");

        Topology topology = source.load(module);

        assertThat(topology.nodes()).extracting(Node::id).containsExactly("hs1", "sw1");
    }

    @Test
    void load_sznFile_readsWholeFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("lab.szn"), "\n\n  sw1 sw2\n\n");

        assertThat(source.readText(file)).contains("sw1 sw2");
        assertThat(source.load(file).nodes()).hasSize(2);
    }

    @Test
    void load_moduleWithoutConstant_throws() throws IOException {
        Path module = Files.writeString(tempDir.resolve("test_none.py"), "import os\n");

        assertThatThrownBy(() -> source.load(module))
            .isInstanceOf(TopologyException.class)
            .hasMessageContaining("TOPOLOGY variable could not be found");
    }

    @Test
    void tryLoad_brokenOrMissingFile_returnsEmpty() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.szn"), "sw1 -- sw2\n");

        assertThat(source.tryLoad(broken)).isEmpty();
        assertThat(source.tryLoad(tempDir.resolve("missing.szn"))).isEmpty();
    }
}
