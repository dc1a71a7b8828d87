package com.szntopology.core.selector;

import com.szntopology.core.model.Element;
import com.szntopology.core.model.ElementKind;
import com.szntopology.core.model.Topology;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves selectors against the elements of a topology.
 *
 * <p>Results always follow the topology's declaration order. A link declared
 * twice is selected twice by {@link #select}, {@link #selectAll} keeps one
 * copy of equal elements.
 *
 * <pre>{@code
 * SelectorMatcher matcher = new SelectorMatcher();
 * matcher.select("type=switch", topology, ElementKind.NODES);   // sw1, sw2
 * matcher.select("sw*", topology, ElementKind.NODES);           // sw1, sw2
 * matcher.select("sw1:1 -- hs*:*", topology, ElementKind.LINKS);
 * }</pre>
 */
public class SelectorMatcher {

    /**
     * Tests a single element against a selector.
     */
    public boolean matches(String selector, Element element) {
        return Selector.compile(selector).matches(element);
    }

    /**
     * Returns the elements of one kind selected by a selector.
     *
     * @param selector glob or {@code attribute=value} selector
     * @param topology topology to search
     * @param kind element kind to search
     * @return matching elements in declaration order
     */
    public List<Element> select(String selector, Topology topology, ElementKind kind) {
        return select(Selector.compile(selector), topology, kind);
    }

    /**
     * Returns the union of the elements selected by several selectors.
     *
     * <p>Elements appear in the order of the first selector that picked them.
     *
     * @param selectors selector strings
     * @param topology topology to search
     * @param kind element kind to search
     * @return matching elements without duplicates
     */
    public List<Element> selectAll(List<String> selectors, Topology topology, ElementKind kind) {
        Set<Element> result = new LinkedHashSet<>();
        for (String selector : selectors) {
            result.addAll(select(selector, topology, kind));
        }
        return new ArrayList<>(result);
    }

    private List<Element> select(Selector selector, Topology topology, ElementKind kind) {
        List<Element> result = new ArrayList<>();
        for (Element element : topology.elements(kind)) {
            if (selector.matches(element)) {
                result.add(element);
            }
        }
        return result;
    }
}
