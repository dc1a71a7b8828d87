package com.szntopology.core.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Link} and {@link Endpoint}.
 */
class LinkTest {

    @Test
    void key_keepsDeclaredOrientation() {
        Link link = new Link(Endpoint.parse("sw1:1"), Endpoint.parse("hs1:a"), Map.of());

        assertThat(link.key()).isEqualTo("sw1:1 -- hs1:a");
    }

    @Test
    void identifier_isIndependentOfOrientation() {
        Link forward = new Link(Endpoint.parse("sw1:1"), Endpoint.parse("hs1:a"), Map.of());
        Link reverse = new Link(Endpoint.parse("hs1:a"), Endpoint.parse("sw1:1"), Map.of("x", 1));

        assertThat(forward.identifier()).isEqualTo("hs1:a -- sw1:1");
        assertThat(reverse.identifier()).isEqualTo(forward.identifier());
    }

    @Test
    void attributes_areFrozen() {
        Link link = new Link(Endpoint.parse("a:1"), Endpoint.parse("b:1"), null);

        assertThat(link.attributes()).isEmpty();
        assertThatThrownBy(() -> link.attributes().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void endpointParse_rejectsMalformedText() {
        assertThat(Endpoint.parse(" sw1 : 2 ")).isEqualTo(new Endpoint("sw1", "2"));
        assertThatThrownBy(() -> Endpoint.parse("sw1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Endpoint.parse("a:b:c")).isInstanceOf(IllegalArgumentException.class);
    }
}
