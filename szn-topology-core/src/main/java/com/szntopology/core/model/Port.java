package com.szntopology.core.model;

import com.szntopology.core.util.Attributes;

import java.util.Map;
import java.util.Objects;

/**
 * A port owned by exactly one node.
 *
 * @param endpoint port identity
 * @param attributes port attributes in declaration order
 */
public record Port(Endpoint endpoint, Map<String, Object> attributes) implements Element {

    public Port {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        attributes = Attributes.freeze(attributes);
    }

    public String node() {
        return endpoint.node();
    }

    public String label() {
        return endpoint.port();
    }

    @Override
    public String key() {
        return endpoint.key();
    }
}
