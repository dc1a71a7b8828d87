package com.szntopology.core.assembler;

import com.szntopology.core.model.Endpoint;
import com.szntopology.core.model.Link;
import com.szntopology.core.model.Node;
import com.szntopology.core.model.Port;
import com.szntopology.core.model.Topology;
import com.szntopology.core.parser.Statement;
import com.szntopology.core.parser.SznSemanticException;
import com.szntopology.core.util.Attributes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the canonical {@link Topology} from parsed statements.
 *
 * <p>Nodes and ports are upserted: redeclaring one merges its attributes into
 * the existing entry, later values winning. Ports and links create the nodes
 * and ports they reference with empty attributes when those are not declared
 * yet, so no reference is left dangling. Links are always appended.
 */
public class TopologyAssembler {

    /**
     * Assembles statements in source order.
     *
     * @param statements parsed statements
     * @return the assembled topology
     * @throws SznSemanticException if more than one environment block is present
     */
    public Topology assemble(List<Statement> statements) {
        Assembly assembly = new Assembly();
        for (Statement statement : statements) {
            if (statement instanceof Statement.Nodes nodes) {
                nodes.nodes().forEach(id -> assembly.upsertNode(id, nodes.attributes()));
            } else if (statement instanceof Statement.Ports ports) {
                for (Endpoint endpoint : ports.ports()) {
                    assembly.upsertNode(endpoint.node(), Map.of());
                    assembly.upsertPort(endpoint, ports.attributes());
                }
            } else if (statement instanceof Statement.Links links) {
                for (Statement.Connection connection : links.links()) {
                    assembly.addLink(connection, links.attributes());
                }
            } else if (statement instanceof Statement.Environment environment) {
                assembly.setEnvironment(environment);
            }
        }
        return assembly.toTopology();
    }

    private static final class Assembly {
        private Map<String, Object> environment;
        private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
        private final Map<Endpoint, Map<String, Object>> ports = new LinkedHashMap<>();
        private final List<Link> links = new ArrayList<>();

        void upsertNode(String id, Map<String, Object> attributes) {
            Attributes.merge(nodes.computeIfAbsent(id, key -> new LinkedHashMap<>()), attributes);
        }

        void upsertPort(Endpoint endpoint, Map<String, Object> attributes) {
            Attributes.merge(ports.computeIfAbsent(endpoint, key -> new LinkedHashMap<>()), attributes);
        }

        void addLink(Statement.Connection connection, Map<String, Object> attributes) {
            for (Endpoint endpoint : List.of(connection.first(), connection.second())) {
                upsertNode(endpoint.node(), Map.of());
                upsertPort(endpoint, Map.of());
            }
            links.add(new Link(connection.first(), connection.second(), attributes));
        }

        void setEnvironment(Statement.Environment statement) {
            if (environment != null) {
                throw new SznSemanticException(
                    "Multiple declaration of environment attributes: " + statement.attributes(),
                    statement.line());
            }
            environment = new LinkedHashMap<>(statement.attributes());
        }

        Topology toTopology() {
            List<Node> nodeList = new ArrayList<>();
            nodes.forEach((id, attributes) -> nodeList.add(new Node(id, attributes)));
            List<Port> portList = new ArrayList<>();
            ports.forEach((endpoint, attributes) -> portList.add(new Port(endpoint, attributes)));
            return new Topology(environment, nodeList, portList, links);
        }
    }
}
