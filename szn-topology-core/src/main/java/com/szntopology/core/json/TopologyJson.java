package com.szntopology.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.szntopology.core.TopologyException;
import com.szntopology.core.model.FileInjection;
import com.szntopology.core.model.InjectionResult;
import com.szntopology.core.model.Link;
import com.szntopology.core.model.Node;
import com.szntopology.core.model.Port;
import com.szntopology.core.model.Topology;

import java.util.Map;

/**
 * Renders topologies and injection results as JSON.
 *
 * <p>A topology renders as:
 * <pre>{@code
 * {
 *   "environment": {"kernel": "3.13.0-77-generic"},
 *   "nodes": [{"id": "sw1", "attributes": {"type": "switch"}}],
 *   "ports": [{"node": "sw1", "port": "1", "attributes": {}}],
 *   "links": [{"endpoints": ["sw1:1", "hs1:1"], "attributes": {}}]
 * }
 * }</pre>
 *
 * <p>An injection result renders as an object keyed by absolute file path,
 * each holding {@code environment} and {@code elements}.
 */
public class TopologyJson {

    private final ObjectMapper objectMapper;

    public TopologyJson() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public TopologyJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toTree(Topology topology) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("environment", attributes(topology.environment()));

        ArrayNode nodes = root.putArray("nodes");
        for (Node node : topology.nodes()) {
            ObjectNode entry = nodes.addObject();
            entry.put("id", node.id());
            entry.set("attributes", attributes(node.attributes()));
        }

        ArrayNode ports = root.putArray("ports");
        for (Port port : topology.ports()) {
            ObjectNode entry = ports.addObject();
            entry.put("node", port.node());
            entry.put("port", port.label());
            entry.set("attributes", attributes(port.attributes()));
        }

        ArrayNode links = root.putArray("links");
        for (Link link : topology.links()) {
            ObjectNode entry = links.addObject();
            entry.putArray("endpoints")
                .add(link.first().key())
                .add(link.second().key());
            entry.set("attributes", attributes(link.attributes()));
        }
        return root;
    }

    public ObjectNode toTree(InjectionResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        result.files().forEach((file, injection) -> root.set(file.toString(), toTree(injection)));
        return root;
    }

    public ObjectNode toTree(FileInjection injection) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.set("environment", attributes(injection.environment()));
        ObjectNode elements = entry.putObject("elements");
        injection.elements().forEach((key, attributes) -> elements.set(key, attributes(attributes)));
        return entry;
    }

    /**
     * Writes a topology as JSON text.
     */
    public String write(Topology topology) {
        return write(toTree(topology));
    }

    /**
     * Writes an injection result as JSON text.
     */
    public String write(InjectionResult result) {
        return write(toTree(result));
    }

    private String write(ObjectNode tree) {
        try {
            return objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new TopologyException("Unable to serialize to JSON: " + e.getOriginalMessage(), e);
        }
    }

    private ObjectNode attributes(Map<String, Object> attributes) {
        return objectMapper.valueToTree(attributes);
    }
}
