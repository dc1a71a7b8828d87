package com.szntopology.core.model;

import java.util.Objects;

/**
 * Identity of a port: the owning node plus the port label.
 *
 * @param node owning node identifier
 * @param port port label, an identifier or a bare number kept as text
 */
public record Endpoint(String node, String port) implements Comparable<Endpoint> {

    public Endpoint {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(port, "port must not be null");
    }

    /**
     * Parses the {@code node:port} display form.
     *
     * @param text endpoint text, surrounding blanks are ignored
     * @return the endpoint
     * @throws IllegalArgumentException if the text has no single {@code :} separator
     */
    public static Endpoint parse(String text) {
        String[] parts = text.trim().split(":", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("Invalid endpoint: " + text);
        }
        return new Endpoint(parts[0].trim(), parts[1].trim());
    }

    /**
     * Returns the display form {@code node:port}.
     */
    public String key() {
        return node + ":" + port;
    }

    @Override
    public int compareTo(Endpoint other) {
        return key().compareTo(other.key());
    }

    @Override
    public String toString() {
        return key();
    }
}
