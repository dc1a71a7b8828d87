package com.szntopology.core.model;

import com.szntopology.core.util.Attributes;

import java.util.Map;
import java.util.Objects;

/**
 * A topology node.
 *
 * @param id unique node identifier
 * @param attributes node attributes in declaration order
 */
public record Node(String id, Map<String, Object> attributes) implements Element {

    public Node {
        Objects.requireNonNull(id, "id must not be null");
        attributes = Attributes.freeze(attributes);
    }

    @Override
    public String key() {
        return id;
    }
}
