package com.szntopology.core.model;

import java.util.Map;

/**
 * A node, port or link of a parsed topology.
 *
 * <p>Every element has a display string, its {@link #key()}, which is also the
 * key used for it in attribute injection results.
 */
public interface Element {

    /**
     * Returns the canonical display string of this element.
     *
     * @return {@code node}, {@code node:port} or {@code node1:port1 -- node2:port2}
     */
    String key();

    /**
     * Returns the attributes of this element in declaration order.
     *
     * @return unmodifiable attribute map
     */
    Map<String, Object> attributes();
}
