package com.szntopology.core.python;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the value of a top-level string constant from a Python module without
 * executing it.
 *
 * <p>Test modules declare their topology as a module-level string:
 * <pre>{@code
 * TOPOLOGY = """
 * [type=host] hs1
 * hs1:1 -- sw1:1
 * """
 * }</pre>
 *
 * <p>The source is scanned token by token so that assignments inside strings,
 * comments, brackets or indented blocks are never mistaken for the constant.
 * The value may be any string literal form Python accepts: single, double or
 * triple quotes, {@code r}, {@code u} and {@code b} prefixes, and implicit
 * concatenation of adjacent literals, optionally wrapped in parentheses.
 * Escape sequences of non-raw literals are decoded. Any other right-hand
 * side (names, calls, f-strings, {@code +}) is not a constant and yields
 * nothing.
 *
 * <p>The first top-level assignment to the name wins.
 */
public class PythonConstantExtractor {

    private static final Logger log = LoggerFactory.getLogger(PythonConstantExtractor.class);

    public static final String DEFAULT_VARIABLE = "TOPOLOGY";

    /**
     * Matches {@code NAME =} or {@code NAME: annotation =} at a statement start.
     * Captures: (1) assigned name.
     */
    private static final Pattern ASSIGNMENT = Pattern.compile(
        "([A-Za-z_]\\w*)[ \\t]*(?::[^=\\n]*)?=(?!=)"
    );

    private static final String STRING_PREFIX_CHARS = "rRuUbBfF";
    private static final String OPENING_BRACKETS = "([{";
    private static final String CLOSING_BRACKETS = ")]}";

    private final String variable;

    public PythonConstantExtractor() {
        this(DEFAULT_VARIABLE);
    }

    /**
     * @param variable name of the module-level constant to read
     */
    public PythonConstantExtractor(String variable) {
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }

    /**
     * Extracts the constant from a Python file.
     *
     * @param file Python source file
     * @return the constant's string value, or empty if it is absent or not a string literal
     * @throws IOException if the file cannot be read
     */
    public Optional<String> extract(Path file) throws IOException {
        Optional<String> value = extractFromSource(Files.readString(file));
        if (value.isEmpty()) {
            log.debug("No string constant {} found in {}", variable, file);
        }
        return value;
    }

    /**
     * Extracts the constant from Python source text.
     *
     * @param source module source
     * @return the constant's string value, or empty if it is absent or not a string literal
     */
    public Optional<String> extractFromSource(String source) {
        int length = source.length();
        int depth = 0;
        boolean statementStart = true;
        int i = 0;

        while (i < length) {
            char c = source.charAt(i);

            if (statementStart && depth == 0) {
                statementStart = false;
                Matcher matcher = ASSIGNMENT.matcher(source).region(i, length);
                if (matcher.lookingAt() && matcher.group(1).equals(variable)) {
                    return literalValue(source, matcher.end());
                }
            }

            if (c == '#') {
                i = skipComment(source, i);
            } else if (isStringStart(source, i)) {
                i = skipString(source, i);
            } else if (c == '\\' && isLineBreak(source, i + 1)) {
                i = skipLineBreak(source, i + 1);
            } else {
                if (OPENING_BRACKETS.indexOf(c) >= 0) {
                    depth++;
                } else if (CLOSING_BRACKETS.indexOf(c) >= 0) {
                    depth = Math.max(0, depth - 1);
                } else if (c == '\n' && depth == 0) {
                    statementStart = true;
                }
                i++;
            }
        }
        return Optional.empty();
    }

    /**
     * Reads the right-hand side of the assignment, which must consist of
     * string literals only and end the statement.
     */
    private Optional<String> literalValue(String source, int start) {
        int length = source.length();
        int pos = skipBlanks(source, start, false);
        boolean parenthesized = pos < length && source.charAt(pos) == '(';
        if (parenthesized) {
            pos++;
        }

        StringBuilder value = new StringBuilder();
        int literals = 0;
        while (true) {
            pos = skipBlanks(source, pos, parenthesized);
            if (pos >= length || !isStringStart(source, pos)) {
                break;
            }
            StringLiteral literal = readString(source, pos);
            if (literal == null) {
                log.debug("{} is not assigned a plain string literal", variable);
                return Optional.empty();
            }
            value.append(literal.value());
            pos = literal.end();
            literals++;
        }

        if (parenthesized) {
            if (pos >= length || source.charAt(pos) != ')') {
                return Optional.empty();
            }
            pos = skipBlanks(source, pos + 1, false);
        }

        if (literals == 0 || !isStatementEnd(source, pos)) {
            log.debug("{} is not assigned a plain string literal", variable);
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    private static boolean isStatementEnd(String source, int pos) {
        if (pos >= source.length()) {
            return true;
        }
        char c = source.charAt(pos);
        return c == '\n' || c == '\r' || c == '#' || c == ';';
    }

    private static int skipBlanks(String source, int pos, boolean acrossLines) {
        int length = source.length();
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '\\' && isLineBreak(source, pos + 1)) {
                pos = skipLineBreak(source, pos + 1);
            } else if (acrossLines && (c == '\n' || c == '\r')) {
                pos++;
            } else if (acrossLines && c == '#') {
                pos = skipComment(source, pos);
            } else {
                break;
            }
        }
        return pos;
    }

    private static int skipComment(String source, int pos) {
        int newline = source.indexOf('\n', pos);
        return newline < 0 ? source.length() : newline;
    }

    private static boolean isLineBreak(String source, int pos) {
        return pos < source.length() && (source.charAt(pos) == '\n' || source.charAt(pos) == '\r');
    }

    private static int skipLineBreak(String source, int pos) {
        if (source.startsWith("\r\n", pos)) {
            return pos + 2;
        }
        return pos + 1;
    }

    private static boolean isStringStart(String source, int pos) {
        if (pos > 0 && isIdentifierChar(source.charAt(pos - 1))) {
            return false;
        }
        int quote = pos;
        while (quote < source.length() && quote - pos < 2
            && STRING_PREFIX_CHARS.indexOf(source.charAt(quote)) >= 0) {
            quote++;
        }
        return quote < source.length() && (source.charAt(quote) == '"' || source.charAt(quote) == '\'');
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int skipString(String source, int pos) {
        StringLiteral literal = scanString(source, pos);
        return literal.end();
    }

    /**
     * Reads a literal and decodes it, or returns {@code null} for f-strings
     * and unterminated literals.
     */
    private static StringLiteral readString(String source, int pos) {
        StringLiteral literal = scanString(source, pos);
        if (!literal.terminated() || literal.prefix().toLowerCase().contains("f")) {
            return null;
        }
        boolean raw = literal.prefix().toLowerCase().contains("r");
        String value = raw ? literal.value() : unescape(literal.value());
        return new StringLiteral(literal.prefix(), value, literal.end(), true);
    }

    /**
     * Finds the bounds of a literal starting at {@code pos}. The returned value
     * is the undecoded body between the quotes.
     */
    private static StringLiteral scanString(String source, int pos) {
        int length = source.length();
        int quoteStart = pos;
        while (STRING_PREFIX_CHARS.indexOf(source.charAt(quoteStart)) >= 0) {
            quoteStart++;
        }
        String prefix = source.substring(pos, quoteStart);
        char quote = source.charAt(quoteStart);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), quoteStart);
        String delimiter = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);

        int bodyStart = quoteStart + delimiter.length();
        int i = bodyStart;
        while (i < length) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (source.startsWith(delimiter, i)) {
                return new StringLiteral(prefix, source.substring(bodyStart, i), i + delimiter.length(), true);
            } else if (!triple && c == '\n') {
                break;
            } else {
                i++;
            }
        }
        int end = Math.min(i, length);
        return new StringLiteral(prefix, source.substring(bodyStart, end), end, false);
    }

    /**
     * Decodes Python escape sequences. Unknown escapes are kept verbatim.
     */
    static String unescape(String body) {
        StringBuilder out = new StringBuilder(body.length());
        int length = body.length();
        int i = 0;
        while (i < length) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= length) {
                out.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> { }
                case '\r' -> {
                    if (i < length && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case 'x' -> i = appendCodePoint(out, body, i, 2, "\\x");
                case 'u' -> i = appendCodePoint(out, body, i, 4, "\\u");
                case 'U' -> i = appendCodePoint(out, body, i, 8, "\\U");
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < length && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        out.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        out.append('\\').append(next);
                    }
                }
            }
        }
        return out.toString();
    }

    private static int appendCodePoint(StringBuilder out, String body, int start, int digits, String escape) {
        int end = start + digits;
        if (end <= body.length()) {
            try {
                out.appendCodePoint(Integer.parseInt(body.substring(start, end), 16));
                return end;
            } catch (IllegalArgumentException e) {
                log.debug("Invalid escape {}{} kept verbatim", escape, body.substring(start, end));
            }
        }
        out.append(escape);
        return start;
    }

    private record StringLiteral(String prefix, String value, int end, boolean terminated) {
    }
}
