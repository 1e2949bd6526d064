package org.pragmatica.style.cascade;

import org.pragmatica.style.css.Value;
import org.pragmatica.style.tree.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document node paired with its resolved properties. Children mirror the source node's children.
 */
public record StyledNode(Node node, Map<String, Value> properties, List<StyledNode> children) {
    public StyledNode {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        children = List.copyOf(children);
    }

    public Optional<Value> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    /**
     * Number of nodes in this subtree, including this one.
     */
    public int size() {
        int count = 1;
        for (var child : children) {
            count += child.size();
        }
        return count;
    }
}
