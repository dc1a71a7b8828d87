package com.szntopology.core.injection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.szntopology.core.model.ElementKind;
import com.szntopology.core.model.InjectionRule;
import com.szntopology.core.model.Modifier;
import com.szntopology.core.parser.SznSemanticException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads attribute injection specifications from JSON.
 *
 * <p><b>Format:</b>
 * <pre>{@code
 * [
 *   {
 *     "files": ["pathto/*", "another/foo*.py"],
 *     "environment": {"kernel": "4.4"},
 *     "modifiers": [
 *       {"nodes": ["sw1", "type=host"], "attributes": {"image": "ubuntu"}},
 *       {"ports": ["sw1:1"], "attributes": {"state": "down"}},
 *       {"links": ["sw1:1 -- sw2:1"], "attributes": {"rate": "slow"}}
 *     ]
 *   }
 * ]
 * }</pre>
 *
 * <p>The whole file is validated before anything else happens. Structural
 * problems raise {@link InjectionSpecException}. A modifier key that is not a
 * known element kind raises {@link SznSemanticException}. A modifier naming
 * several kinds is split into one {@link Modifier} per kind, in the order
 * nodes, ports, links.
 */
public class InjectionSpecLoader {

    private static final Logger log = LoggerFactory.getLogger(InjectionSpecLoader.class);

    private static final String FILES = "files";
    private static final String MODIFIERS = "modifiers";
    private static final String ATTRIBUTES = "attributes";
    private static final String ENVIRONMENT = "environment";
    private static final Set<String> IGNORED_MODIFIER_KEYS = Set.of(ATTRIBUTES, "comment");

    private static final TypeReference<LinkedHashMap<String, Object>> ATTRIBUTE_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public InjectionSpecLoader() {
        this(new ObjectMapper());
    }

    public InjectionSpecLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a specification file.
     *
     * @param specFile path to the JSON file
     * @return rules in file order
     * @throws IOException if the file cannot be read
     * @throws InjectionSpecException if the content is malformed
     */
    public List<InjectionRule> load(Path specFile) throws IOException {
        log.debug("Loading attribute injection file: {}", specFile);
        return parse(Files.readString(specFile));
    }

    /**
     * Parses specification JSON.
     *
     * @param json specification content
     * @return rules in document order
     * @throws InjectionSpecException if the content is malformed
     */
    public List<InjectionRule> parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InjectionSpecException("Malformed attribute injection file: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new InjectionSpecException("Attribute injection file must contain a JSON array of rules");
        }

        List<InjectionRule> rules = new ArrayList<>();
        for (int index = 0; index < root.size(); index++) {
            rules.add(parseRule(root.get(index), index));
        }
        log.debug("Loaded {} attribute injection rules", rules.size());
        return rules;
    }

    private InjectionRule parseRule(JsonNode rule, int index) {
        String where = "rule #" + (index + 1);
        if (!rule.isObject()) {
            throw new InjectionSpecException(where + " must be a JSON object");
        }

        List<String> files = stringList(rule.get(FILES), where + " \"" + FILES + "\"");

        JsonNode modifiersNode = rule.get(MODIFIERS);
        if (modifiersNode == null || !modifiersNode.isArray()) {
            throw new InjectionSpecException(where + " requires a \"" + MODIFIERS + "\" array");
        }
        List<Modifier> modifiers = new ArrayList<>();
        for (int m = 0; m < modifiersNode.size(); m++) {
            modifiers.addAll(parseModifier(modifiersNode.get(m), where + " modifier #" + (m + 1)));
        }

        Map<String, Object> environment = Map.of();
        JsonNode environmentNode = rule.get(ENVIRONMENT);
        if (environmentNode != null && !environmentNode.isNull()) {
            environment = attributeMap(environmentNode, where + " \"" + ENVIRONMENT + "\"");
        }

        return new InjectionRule(files, environment, modifiers);
    }

    private List<Modifier> parseModifier(JsonNode modifier, String where) {
        if (!modifier.isObject()) {
            throw new InjectionSpecException(where + " must be a JSON object");
        }

        JsonNode attributesNode = modifier.get(ATTRIBUTES);
        if (attributesNode == null) {
            throw new InjectionSpecException(where + " requires an \"" + ATTRIBUTES + "\" object");
        }
        Map<String, Object> attributes = attributeMap(attributesNode, where + " \"" + ATTRIBUTES + "\"");

        Map<ElementKind, List<String>> selectors = new EnumMap<>(ElementKind.class);
        Iterator<String> names = modifier.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (IGNORED_MODIFIER_KEYS.contains(name)) {
                continue;
            }
            ElementKind kind = ElementKind.fromKey(name)
                .orElseThrow(() -> new SznSemanticException(
                    "Unknown selector target kind \"" + name + "\" in " + where
                        + ", expected one of nodes, ports or links"));
            selectors.put(kind, stringList(modifier.get(name), where + " \"" + name + "\""));
        }
        if (selectors.isEmpty()) {
            throw new SznSemanticException(where + " does not name any nodes, ports or links");
        }

        List<Modifier> result = new ArrayList<>();
        selectors.forEach((kind, list) -> result.add(new Modifier(kind, list, attributes)));
        return result;
    }

    private Map<String, Object> attributeMap(JsonNode node, String where) {
        if (!node.isObject()) {
            throw new InjectionSpecException(where + " must be a JSON object");
        }
        return objectMapper.convertValue(node, ATTRIBUTE_MAP);
    }

    private static List<String> stringList(JsonNode node, String where) {
        if (node == null || !node.isArray()) {
            throw new InjectionSpecException(where + " must be a JSON array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new InjectionSpecException(where + " must only contain strings");
            }
            values.add(item.asText());
        }
        return values;
    }
}
