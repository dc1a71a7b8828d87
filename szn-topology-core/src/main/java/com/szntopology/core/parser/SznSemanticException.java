package com.szntopology.core.parser;

import com.szntopology.core.TopologyException;

/**
 * Thrown for well-formed input that is not allowed, such as a second
 * environment block or an unknown selector target kind.
 */
public class SznSemanticException extends TopologyException {

    private final int lineNumber;

    public SznSemanticException(String message) {
        this(message, 0);
    }

    /**
     * @param message error description
     * @param lineNumber 1-based line the error was found on, 0 if not tied to a line
     */
    public SznSemanticException(String message, int lineNumber) {
        super(lineNumber > 0 ? message + " (line #" + lineNumber + ")" : message);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
