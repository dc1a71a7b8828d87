package com.szntopology.core.selector;

import com.szntopology.core.model.Element;
import com.szntopology.core.model.Endpoint;
import com.szntopology.core.model.Link;
import com.szntopology.core.model.Port;
import com.szntopology.core.parser.SznSemanticException;
import com.szntopology.core.util.Attributes;
import com.szntopology.core.util.GlobPattern;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled element selector.
 *
 * <p>A selector containing an unescaped {@code =} is an attribute selector:
 * both sides are regular expressions matched from the start of the attribute
 * key and of the value's text (prefix semantics, like {@link java.util.regex.Matcher#lookingAt()}).
 * Any other selector is a shell glob on the element's display string. Port and
 * link globs written as {@code node:port} or {@code a:1 -- b:2} are matched
 * part by part, ignoring blanks.
 */
public abstract class Selector {

    private final String text;

    private Selector(String text) {
        this.text = text;
    }

    /**
     * Compiles a selector string.
     *
     * @param text selector as written in an injection file
     * @return compiled selector
     * @throws SznSemanticException if an attribute selector holds an invalid regex
     */
    public static Selector compile(String text) {
        int separator = unescapedEquals(text);
        if (separator >= 0) {
            return new AttributeSelector(text, text.substring(0, separator), text.substring(separator + 1));
        }
        return new NameSelector(text, text.replace("\\=", "="));
    }

    /**
     * Tests one element.
     *
     * @param element candidate element
     * @return true if the element is selected
     */
    public abstract boolean matches(Element element);

    /**
     * Returns true for {@code attribute=value} selectors.
     */
    public abstract boolean isAttributeSelector();

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }

    private static int unescapedEquals(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '=') {
                return i;
            }
        }
        return -1;
    }

    private static final class AttributeSelector extends Selector {
        private final Pattern keyPattern;
        private final Pattern valuePattern;

        AttributeSelector(String text, String keyRegex, String valueRegex) {
            super(text);
            try {
                this.keyPattern = Pattern.compile(keyRegex);
                this.valuePattern = Pattern.compile(valueRegex);
            } catch (PatternSyntaxException e) {
                throw new SznSemanticException("Invalid attribute selector \"" + text + "\": " + e.getDescription());
            }
        }

        @Override
        public boolean matches(Element element) {
            for (Map.Entry<String, Object> attribute : element.attributes().entrySet()) {
                if (keyPattern.matcher(attribute.getKey()).lookingAt()
                    && valuePattern.matcher(Attributes.stringify(attribute.getValue())).lookingAt()) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean isAttributeSelector() {
            return true;
        }
    }

    private static final class NameSelector extends Selector {
        private final GlobPattern whole;
        private final EndpointGlob endpoint;
        private final EndpointGlob first;
        private final EndpointGlob second;

        NameSelector(String text, String glob) {
            super(text);
            this.whole = GlobPattern.compile(glob.trim());
            this.endpoint = glob.contains(":") && !glob.contains("--") ? EndpointGlob.of(glob) : null;
            String compact = glob.replaceAll("\\s+", "");
            int link = compact.indexOf("--");
            if (link >= 0) {
                this.first = EndpointGlob.of(compact.substring(0, link));
                this.second = EndpointGlob.of(compact.substring(link + 2));
            } else {
                this.first = null;
                this.second = null;
            }
        }

        @Override
        public boolean matches(Element element) {
            if (element instanceof Port port && endpoint != null) {
                return endpoint.matches(port.endpoint());
            }
            if (element instanceof Link link && first != null) {
                return first.matches(link.first()) && second.matches(link.second());
            }
            return whole.matches(element.key());
        }

        @Override
        public boolean isAttributeSelector() {
            return false;
        }
    }

    private record EndpointGlob(GlobPattern node, GlobPattern port) {

        static EndpointGlob of(String text) {
            String trimmed = text.trim();
            int colon = trimmed.indexOf(':');
            if (colon < 0) {
                return new EndpointGlob(GlobPattern.compile(trimmed), GlobPattern.compile("*"));
            }
            return new EndpointGlob(
                GlobPattern.compile(trimmed.substring(0, colon).trim()),
                GlobPattern.compile(trimmed.substring(colon + 1).trim()));
        }

        boolean matches(Endpoint endpoint) {
            return node.matches(endpoint.node()) && port.matches(endpoint.port());
        }
    }
}
