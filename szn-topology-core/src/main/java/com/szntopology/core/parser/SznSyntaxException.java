package com.szntopology.core.parser;

import com.szntopology.core.TopologyException;

/**
 * Thrown when SZN text cannot be tokenized or does not have the shape of any
 * statement. Parsing stops at the first such error.
 */
public class SznSyntaxException extends TopologyException {

    private final int lineNumber;
    private final String rawLine;
    private final String detail;

    /**
     * @param lineNumber 1-based number of the offending line
     * @param rawLine the offending line as written
     * @param detail what the grammar expected or rejected
     * @param cause underlying recognition error, may be {@code null}
     */
    public SznSyntaxException(int lineNumber, String rawLine, String detail, Throwable cause) {
        super("Unable to parse line #" + lineNumber + ": \"" + rawLine + "\" (" + detail + ")", cause);
        this.lineNumber = lineNumber;
        this.rawLine = rawLine;
        this.detail = detail;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String rawLine() {
        return rawLine;
    }

    public String detail() {
        return detail;
    }
}
