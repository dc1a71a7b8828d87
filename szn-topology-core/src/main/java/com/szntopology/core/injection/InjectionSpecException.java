package com.szntopology.core.injection;

import com.szntopology.core.TopologyException;

/**
 * Thrown when an attribute injection file is not valid JSON or lacks a
 * required key such as {@code files}, {@code modifiers} or {@code attributes}.
 */
public class InjectionSpecException extends TopologyException {

    public InjectionSpecException(String message) {
        super(message);
    }

    public InjectionSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
