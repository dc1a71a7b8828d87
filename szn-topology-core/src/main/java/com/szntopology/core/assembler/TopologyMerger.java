package com.szntopology.core.assembler;

import com.szntopology.core.model.Element;
import com.szntopology.core.model.FileInjection;
import com.szntopology.core.model.Link;
import com.szntopology.core.model.Node;
import com.szntopology.core.model.Port;
import com.szntopology.core.model.Topology;
import com.szntopology.core.util.Attributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Overlays injected attributes onto a parsed topology before it is built.
 *
 * <p>Each element takes the injected attributes stored under its key: keys
 * it already has are updated in place, new keys are appended. The input
 * topology is left untouched.
 */
public class TopologyMerger {

    private static final Logger log = LoggerFactory.getLogger(TopologyMerger.class);

    /**
     * Returns a copy of {@code topology} with the injection applied.
     *
     * @param topology parsed topology
     * @param injection attributes resolved for the topology's file, may be {@code null}
     * @return merged topology
     */
    public Topology merge(Topology topology, FileInjection injection) {
        if (injection == null) {
            return topology;
        }

        List<Node> nodes = topology.nodes().stream()
            .map(node -> new Node(node.id(), overlay(node, injection)))
            .toList();
        List<Port> ports = topology.ports().stream()
            .map(port -> new Port(port.endpoint(), overlay(port, injection)))
            .toList();
        List<Link> links = topology.links().stream()
            .map(link -> new Link(link.first(), link.second(), overlay(link, injection)))
            .toList();

        reportUnmatched(topology, injection);

        return new Topology(
            Attributes.overlay(topology.environment(), injection.environment()),
            nodes, ports, links);
    }

    private static Map<String, Object> overlay(Element element, FileInjection injection) {
        return Attributes.overlay(element.attributes(), injection.attributesFor(element.key()));
    }

    private static void reportUnmatched(Topology topology, FileInjection injection) {
        if (!log.isDebugEnabled()) {
            return;
        }
        Set<String> known = new HashSet<>();
        topology.nodes().forEach(node -> known.add(node.key()));
        topology.ports().forEach(port -> known.add(port.key()));
        topology.links().forEach(link -> known.add(link.key()));
        injection.elements().keySet().stream()
            .filter(key -> !known.contains(key))
            .forEach(key -> log.debug("Injected element {} is not part of the topology, ignoring it", key));
    }
}
