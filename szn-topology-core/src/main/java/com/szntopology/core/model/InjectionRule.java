package com.szntopology.core.model;

import com.szntopology.core.util.Attributes;

import java.util.List;
import java.util.Map;

/**
 * One entry of an attribute injection specification.
 *
 * @param files file glob patterns, absolute or relative to the search paths
 * @param environment environment attributes to inject into every matched file
 * @param modifiers element modifiers, applied in order
 */
public record InjectionRule(List<String> files, Map<String, Object> environment, List<Modifier> modifiers) {

    public InjectionRule {
        files = List.copyOf(files);
        environment = Attributes.freeze(environment);
        modifiers = List.copyOf(modifiers);
    }
}
