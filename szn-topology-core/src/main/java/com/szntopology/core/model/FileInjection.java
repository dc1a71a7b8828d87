package com.szntopology.core.model;

import com.szntopology.core.util.Attributes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes to inject into the topology of a single file.
 *
 * @param environment environment attributes to overlay
 * @param elements overlay attributes keyed by element display string
 */
public record FileInjection(Map<String, Object> environment, Map<String, Map<String, Object>> elements) {

    public FileInjection {
        environment = Attributes.freeze(environment);
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (elements != null) {
            elements.forEach((key, attributes) -> copy.put(key, Attributes.freeze(attributes)));
        }
        elements = Collections.unmodifiableMap(copy);
    }

    public static FileInjection empty() {
        return new FileInjection(Map.of(), Map.of());
    }

    /**
     * Returns the overlay for one element.
     *
     * @param key element display string
     * @return attributes to inject, empty if the element is not targeted
     */
    public Map<String, Object> attributesFor(String key) {
        return elements.getOrDefault(key, Map.of());
    }
}
