package org.pragmatica.style.css;

import java.util.List;

/**
 * Rules in source order. The order breaks cascade ties between rules of equal specificity.
 */
public record Stylesheet(List<Rule> rules) {
    public Stylesheet {
        rules = List.copyOf(rules);
    }

    public static Stylesheet empty() {
        return new Stylesheet(List.of());
    }
}
