package com.szntopology.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.szntopology.core.model.FileInjection;
import com.szntopology.core.model.InjectionResult;
import com.szntopology.core.model.Topology;
import com.szntopology.core.parser.TopologyParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TopologyJson}.
 */
class TopologyJsonTest {

    private final TopologyJson json = new TopologyJson();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void write_topology_rendersAllSections() throws Exception {
        Topology topology = new TopologyParser().parse("""
            [kernel="4.4"]
            [type=switch ports=(1, 2)] sw1
            [rate=slow] sw1:1 -- hs1:eth0
            """);

        JsonNode tree = mapper.readTree(json.write(topology));

        assertThat(tree.get("environment").get("kernel").asText()).isEqualTo("4.4");
        assertThat(tree.get("nodes")).hasSize(2);
        assertThat(tree.get("nodes").get(0).get("id").asText()).isEqualTo("sw1");
        assertThat(tree.get("nodes").get(0).get("attributes").get("ports").get(1).asInt()).isEqualTo(2);
        assertThat(tree.get("ports").get(1).get("node").asText()).isEqualTo("hs1");
        assertThat(tree.get("ports").get(1).get("port").asText()).isEqualTo("eth0");
        assertThat(tree.get("links").get(0).get("endpoints").get(0).asText()).isEqualTo("sw1:1");
        assertThat(tree.get("links").get(0).get("attributes").get("rate").asText()).isEqualTo("slow");
    }

    @Test
    void write_injectionResult_keysByPath() throws Exception {
        Path file = Path.of("/suite/test_ping.py");
        InjectionResult result = new InjectionResult(Map.of(file, new FileInjection(
            Map.of("kernel", "5.0"),
            Map.of("sw1", Map.of("image", "ops")))));

        JsonNode tree = mapper.readTree(json.write(result));

        JsonNode entry = tree.get(file.toString());
        assertThat(entry.get("environment").get("kernel").asText()).isEqualTo("5.0");
        assertThat(entry.get("elements").get("sw1").get("image").asText()).isEqualTo("ops");
    }
}
