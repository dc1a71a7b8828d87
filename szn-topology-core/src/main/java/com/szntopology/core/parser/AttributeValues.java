package com.szntopology.core.parser;

/**
 * Coercion of SZN literal text into typed attribute values.
 */
public final class AttributeValues {

    private AttributeValues() {
        // Utility class
    }

    /**
     * Coerces a numeric literal.
     *
     * <p>Integers become {@link Integer}, or {@link Long} when they do not fit.
     * Anything that fails integer parsing is retried as a {@link Double}.
     *
     * @param text literal text including an optional sign
     * @return the number
     * @throws NumberFormatException if the text is not numeric at all
     */
    public static Number number(String text) {
        String normalized = text.startsWith("+") ? text.substring(1) : text;
        try {
            long value = Long.parseLong(normalized);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        } catch (NumberFormatException e) {
            return Double.parseDouble(normalized);
        }
    }

    /**
     * Coerces a bare identifier: {@code true} and {@code false} in any case
     * become booleans, anything else stays a string.
     *
     * @param text identifier text
     * @return boolean or string value
     */
    public static Object identifier(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        return text;
    }

    /**
     * Strips the delimiters of a double-quoted literal. No escape processing
     * is done.
     *
     * @param text literal text including both quotes
     * @return the quoted content
     */
    public static String quoted(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
