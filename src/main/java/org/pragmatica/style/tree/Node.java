package org.pragmatica.style.tree;

import java.util.List;
import java.util.Map;

/**
 * Document tree node - either a run of text or an element owning its children.
 */
public sealed interface Node {

    /**
     * Children in document order. Always empty for text.
     */
    List<Node> children();

    static Node text(String content) {
        return new Text(content);
    }

    static Node element(String tagName, Map<String, String> attributes, List<Node> children) {
        return new Element(new ElementData(tagName, attributes), children);
    }

    /**
     * Text run - everything between two tags.
     */
    record Text(String content) implements Node {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * Element with its tag data and child nodes.
     */
    record Element(ElementData data, List<Node> children) implements Node {
        public Element {
            children = List.copyOf(children);
        }

        public String tagName() {
            return data.tagName();
        }
    }
}
