package com.szntopology.core.model;

import com.szntopology.core.util.Attributes;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One modifier of an injection rule: which elements to select and which
 * attributes to apply to them.
 *
 * @param kind element kind the selectors apply to
 * @param selectors name globs or {@code attribute=value} patterns
 * @param attributes attributes to merge into every selected element
 */
public record Modifier(ElementKind kind, List<String> selectors, Map<String, Object> attributes) {

    public Modifier {
        Objects.requireNonNull(kind, "kind must not be null");
        selectors = List.copyOf(selectors);
        attributes = Attributes.freeze(attributes);
    }
}
