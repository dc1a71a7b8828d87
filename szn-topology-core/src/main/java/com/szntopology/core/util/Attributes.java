package com.szntopology.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Helpers for ordered attribute sets.
 *
 * <p>An attribute set is a {@code Map<String, Object>} with insertion order.
 * Values are {@link Integer}, {@link Long}, {@link Double}, {@link Boolean},
 * {@link String} or a {@link List} of those.
 */
public final class Attributes {

    private Attributes() {
        // Utility class
    }

    /**
     * Returns an unmodifiable, order-preserving copy of the given attributes.
     *
     * @param attributes attributes to copy, {@code null} is treated as empty
     * @return frozen copy
     */
    public static Map<String, Object> freeze(Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Merges {@code update} into {@code target}.
     *
     * <p>Existing keys keep their position and take the new value; new keys
     * are appended in the order they appear in {@code update}.
     *
     * @param target mutable attribute set, updated in place
     * @param update attributes to apply
     * @return {@code target}
     */
    public static Map<String, Object> merge(Map<String, Object> target, Map<String, Object> update) {
        if (update != null) {
            target.putAll(update);
        }
        return target;
    }

    /**
     * Returns a new mutable attribute set holding {@code base} overlaid with {@code update}.
     */
    public static Map<String, Object> overlay(Map<String, Object> base, Map<String, Object> update) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (base != null) {
            result.putAll(base);
        }
        return merge(result, update);
    }

    /**
     * Renders an attribute value as text for regex matching.
     *
     * <p>Lists render as {@code [a, b]}, {@code null} as an empty string.
     *
     * @param value attribute value
     * @return text form
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return list.stream()
                .map(Attributes::stringify)
                .collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }

    private static Object freezeValue(Object value) {
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        return value;
    }
}
