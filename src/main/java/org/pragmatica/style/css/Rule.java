package org.pragmatica.style.css;

import java.util.List;

/**
 * Selector list and declaration block. Selectors are OR-matched; declarations keep source order.
 */
public record Rule(List<Selector> selectors, List<Declaration> declarations) {
    public Rule {
        selectors = List.copyOf(selectors);
        declarations = List.copyOf(declarations);
    }
}
