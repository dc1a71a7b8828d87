package com.szntopology.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The kinds of topology elements a selector can target.
 */
public enum ElementKind {
    NODES("nodes"),
    PORTS("ports"),
    LINKS("links");

    private final String key;

    ElementKind(String key) {
        this.key = key;
    }

    /**
     * Returns the name used for this kind in injection specifications.
     *
     * @return {@code nodes}, {@code ports} or {@code links}
     */
    public String key() {
        return key;
    }

    /**
     * Looks up a kind by its specification name.
     *
     * @param key kind name as written in an injection file
     * @return the matching kind, or empty if the name is unknown
     */
    public static Optional<ElementKind> fromKey(String key) {
        return Arrays.stream(values())
            .filter(kind -> kind.key.equals(key))
            .findFirst();
    }
}
