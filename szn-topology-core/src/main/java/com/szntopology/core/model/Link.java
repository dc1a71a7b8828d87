package com.szntopology.core.model;

import com.szntopology.core.util.Attributes;

import java.util.Map;
import java.util.Objects;

/**
 * A link between two endpoints.
 *
 * <p>Links are kept in declaration order and are never deduplicated. Use
 * {@link #identifier()} when two links must compare equal regardless of the
 * order their endpoints were written in.
 *
 * @param first endpoint written on the left of {@code --}
 * @param second endpoint written on the right of {@code --}
 * @param attributes link attributes in declaration order
 */
public record Link(Endpoint first, Endpoint second, Map<String, Object> attributes) implements Element {

    public static final String SEPARATOR = " -- ";

    public Link {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        attributes = Attributes.freeze(attributes);
    }

    @Override
    public String key() {
        return first.key() + SEPARATOR + second.key();
    }

    /**
     * Returns the order-independent identity of this link: both endpoint keys
     * sorted lexicographically and joined by {@code " -- "}.
     *
     * @return canonical link identifier
     */
    public String identifier() {
        return first.compareTo(second) <= 0
            ? first.key() + SEPARATOR + second.key()
            : second.key() + SEPARATOR + first.key();
    }
}
