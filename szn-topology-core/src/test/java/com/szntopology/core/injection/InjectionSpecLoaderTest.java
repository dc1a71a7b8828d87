package com.szntopology.core.injection;

import com.szntopology.core.model.ElementKind;
import com.szntopology.core.model.InjectionRule;
import com.szntopology.core.model.Modifier;
import com.szntopology.core.parser.SznSemanticException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link InjectionSpecLoader}.
 */
class InjectionSpecLoaderTest {

    private final InjectionSpecLoader loader = new InjectionSpecLoader();

    @Test
    void parse_validSpec_returnsRulesInOrder() {
        List<InjectionRule> rules = loader.parse("""
            [
                {
                    "files": ["pathto/*", "another/foo*.py"],
                    "environment": {"kernel": "4.4"},
                    "modifiers": [
                        {"nodes": ["sw1", "type=host"], "attributes": {"image": "ubuntu", "cpus": 2}},
                        {"links": ["sw1:1 -- sw2:1"], "comment": "slow link", "attributes": {"rate": "slow"}}
                    ]
                },
                {
                    "files": ["*.szn"],
                    "modifiers": []
                }
            ]
            """);

        assertThat(rules).hasSize(2);
        InjectionRule first = rules.get(0);
        assertThat(first.files()).containsExactly("pathto/*", "another/foo*.py");
        assertThat(first.environment()).containsExactly(entry("kernel", "4.4"));
        assertThat(first.modifiers()).extracting(Modifier::kind)
            .containsExactly(ElementKind.NODES, ElementKind.LINKS);
        assertThat(first.modifiers().get(0).selectors()).containsExactly("sw1", "type=host");
        assertThat(first.modifiers().get(0).attributes())
            .containsExactly(entry("image", "ubuntu"), entry("cpus", 2));
        assertThat(rules.get(1).environment()).isEmpty();
        assertThat(rules.get(1).modifiers()).isEmpty();
    }

    @Test
    void parse_modifierWithSeveralKinds_isSplitInKindOrder() {
        List<InjectionRule> rules = loader.parse("""
            [{"files": ["*"], "modifiers": [
                {"links": ["*"], "nodes": ["sw1"], "ports": ["sw1:*"], "attributes": {"x": true}}
            ]}]
            """);

        assertThat(rules.get(0).modifiers()).extracting(Modifier::kind)
            .containsExactly(ElementKind.NODES, ElementKind.PORTS, ElementKind.LINKS);
        assertThat(rules.get(0).modifiers()).allSatisfy(modifier ->
            assertThat(modifier.attributes()).containsExactly(entry("x", true)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"files\": []}",
        "[{\"modifiers\": []}]",
        "[{\"files\": \"*\", \"modifiers\": []}]",
        "[{\"files\": [1], \"modifiers\": []}]",
        "[{\"files\": [\"*\"]}]",
        "[{\"files\": [\"*\"], \"modifiers\": [{\"nodes\": [\"sw1\"]}]}]",
        "[{\"files\": [\"*\"], \"modifiers\": [{\"nodes\": [\"sw1\"], \"attributes\": []}]}]",
        "[{\"files\": [\"*\"], \"environment\": \"x\", \"modifiers\": []}]",
        "[\"rule\"]",
        "not json"
    })
    void parse_malformedSpec_throwsSpecException(String json) {
        assertThatThrownBy(() -> loader.parse(json)).isInstanceOf(InjectionSpecException.class);
    }

    @Test
    void parse_unknownKind_throwsSemanticException() {
        assertThatThrownBy(() -> loader.parse("""
            [{"files": ["*"], "modifiers": [{"devices": ["sw1"], "attributes": {}}]}]
            """))
            .isInstanceOf(SznSemanticException.class)
            .hasMessageContaining("devices");
    }

    @Test
    void parse_modifierWithoutTarget_throwsSemanticException() {
        assertThatThrownBy(() -> loader.parse("""
            [{"files": ["*"], "modifiers": [{"attributes": {"a": 1}}]}]
            """))
            .isInstanceOf(SznSemanticException.class);
    }

    @Test
    void load_readsFile(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("attributes.json"),
            "[{\"files\": [\"*\"], \"modifiers\": [{\"nodes\": [\"*\"], \"attributes\": {\"a\": 1.5}}]}]");

        List<InjectionRule> rules = loader.load(file);

        assertThat(rules.get(0).modifiers().get(0).attributes()).containsExactly(entry("a", 1.5));
    }
}
