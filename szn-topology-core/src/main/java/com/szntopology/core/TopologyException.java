package com.szntopology.core;

/**
 * Base class of all errors raised while parsing SZN text or resolving
 * attribute injection specifications.
 */
public class TopologyException extends RuntimeException {

    public TopologyException(String message) {
        super(message);
    }

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
