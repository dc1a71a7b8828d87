package com.szntopology.core.util;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard matching on plain strings.
 *
 * <p>Supports {@code *} (any run of characters), {@code ?} (one character),
 * {@code [abc]} and {@code [a-z]} character classes, and {@code [!abc]}
 * negated classes. An unterminated {@code [} matches itself. Matching is
 * against the whole string and is case-sensitive.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern pattern;

    private GlobPattern(String glob) {
        this.glob = glob;
        this.pattern = Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    /**
     * Compiles a glob.
     *
     * @param glob wildcard expression
     * @return compiled glob
     */
    public static GlobPattern compile(String glob) {
        return new GlobPattern(glob);
    }

    /**
     * Convenience method for one-off matches.
     */
    public static boolean matches(String glob, String text) {
        return compile(glob).matches(text);
    }

    /**
     * Tests a string against this glob.
     *
     * @param text candidate string
     * @return true if the whole string matches
     */
    public boolean matches(String text) {
        return pattern.matcher(text).matches();
    }

    public String glob() {
        return glob;
    }

    @Override
    public String toString() {
        return glob;
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!') {
                        j++;
                    }
                    if (j < n && glob.charAt(j) == ']') {
                        j++;
                    }
                    while (j < n && glob.charAt(j) != ']') {
                        j++;
                    }
                    if (j >= n) {
                        regex.append("\\[");
                    } else {
                        String body = glob.substring(i, j);
                        i = j + 1;
                        regex.append('[');
                        if (body.startsWith("!")) {
                            regex.append('^');
                            body = body.substring(1);
                        }
                        regex.append(escapeClassBody(body));
                        regex.append(']');
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }

    private static String escapeClassBody(String body) {
        StringBuilder escaped = new StringBuilder();
        for (int k = 0; k < body.length(); k++) {
            char c = body.charAt(k);
            boolean rangeDash = c == '-' && k > 0 && k < body.length() - 1;
            if (c == '\\' || c == '[' || c == ']' || c == '^' || c == '&' || (c == '-' && !rangeDash)) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
