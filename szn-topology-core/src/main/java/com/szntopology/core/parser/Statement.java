package com.szntopology.core.parser;

import com.szntopology.core.model.Endpoint;
import com.szntopology.core.util.Attributes;

import java.util.List;
import java.util.Map;

/**
 * One top-level SZN statement, in the order it appeared in the source.
 *
 * <p>The attribute block of a statement, if any, applies to every element
 * named by it.
 */
public interface Statement {

    /**
     * 1-based line the statement starts on.
     */
    int line();

    Map<String, Object> attributes();

    /**
     * {@code [attrs] sw1 sw2}
     */
    record Nodes(int line, Map<String, Object> attributes, List<String> nodes) implements Statement {
        public Nodes {
            attributes = Attributes.freeze(attributes);
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * {@code [attrs] sw1:1 sw2:a}
     */
    record Ports(int line, Map<String, Object> attributes, List<Endpoint> ports) implements Statement {
        public Ports {
            attributes = Attributes.freeze(attributes);
            ports = List.copyOf(ports);
        }
    }

    /**
     * {@code [attrs] sw1:1 -- hs1:1}, possibly with more than one link.
     */
    record Links(int line, Map<String, Object> attributes, List<Connection> links) implements Statement {
        public Links {
            attributes = Attributes.freeze(attributes);
            links = List.copyOf(links);
        }
    }

    /**
     * A bare attribute block.
     */
    record Environment(int line, Map<String, Object> attributes) implements Statement {
        public Environment {
            attributes = Attributes.freeze(attributes);
        }
    }

    /**
     * The two endpoints of one link inside a {@link Links} statement.
     */
    record Connection(Endpoint first, Endpoint second) {
    }
}
