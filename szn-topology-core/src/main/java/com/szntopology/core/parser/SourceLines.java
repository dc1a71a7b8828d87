package com.szntopology.core.parser;

/**
 * Raw lines of a source text, addressed by 1-based line number.
 */
final class SourceLines {

    private final String[] lines;

    SourceLines(String text) {
        this.lines = text.split("\\R", -1);
    }

    /**
     * Returns the raw text of a line, or an empty string when out of range.
     */
    String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.length) {
            return "";
        }
        return lines[lineNumber - 1];
    }
}
