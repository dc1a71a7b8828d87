package com.szntopology.core.model;

import com.szntopology.core.util.Attributes;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The result of parsing an SZN document.
 *
 * <p>Nodes and ports are unique by identity, links are not. All sequences keep
 * the order in which their elements were first declared.
 *
 * @param environment topology-wide attributes
 * @param nodes nodes in declaration order
 * @param ports ports in declaration order
 * @param links links in declaration order
 */
public record Topology(
    Map<String, Object> environment,
    List<Node> nodes,
    List<Port> ports,
    List<Link> links
) {
    public Topology {
        environment = Attributes.freeze(environment);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        ports = ports == null ? List.of() : List.copyOf(ports);
        links = links == null ? List.of() : List.copyOf(links);
    }

    /**
     * Returns an empty topology.
     */
    public static Topology empty() {
        return new Topology(Map.of(), List.of(), List.of(), List.of());
    }

    public Optional<Node> node(String id) {
        return nodes.stream().filter(node -> node.id().equals(id)).findFirst();
    }

    public Optional<Port> port(Endpoint endpoint) {
        return ports.stream().filter(port -> port.endpoint().equals(endpoint)).findFirst();
    }

    /**
     * Returns the elements of one kind, in declaration order.
     *
     * @param kind element kind
     * @return nodes, ports or links
     */
    public List<? extends Element> elements(ElementKind kind) {
        return switch (kind) {
            case NODES -> nodes;
            case PORTS -> ports;
            case LINKS -> links;
        };
    }
}
