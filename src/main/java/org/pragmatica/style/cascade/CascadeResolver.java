package org.pragmatica.style.cascade;

import org.pragmatica.style.css.Rule;
import org.pragmatica.style.css.Selector;
import org.pragmatica.style.css.Stylesheet;
import org.pragmatica.style.css.Value;
import org.pragmatica.style.tree.ElementData;
import org.pragmatica.style.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves element properties by selector matching and cascade.
 *
 * <p>Matching rules are ordered by ascending specificity; equal specificity keeps stylesheet order.
 * Declarations are then folded in that order, so later writes win. All methods are pure and may be
 * called concurrently on independent subtrees.
 */
public final class CascadeResolver {
    private static final Logger log = LoggerFactory.getLogger(CascadeResolver.class);

    private CascadeResolver() {}

    /**
     * Whether the element satisfies every constraint of the selector.
     */
    public static boolean matches(ElementData element, Selector selector) {
        if (selector.tag().isPresent() && !selector.tag().get().equals(element.tagName())) {
            return false;
        }
        if (selector.id().isPresent() && !selector.id().equals(element.id())) {
            return false;
        }
        return element.classes().containsAll(selector.classes());
    }

    /**
     * Rules applying to the element, in stylesheet order. Each rule appears at most once, weighted by
     * the first selector in its list that matches.
     */
    public static List<MatchedRule> matchingRules(ElementData element, Stylesheet stylesheet) {
        var matched = new ArrayList<MatchedRule>();
        for (var rule : stylesheet.rules()) {
            for (var selector : rule.selectors()) {
                if (matches(element, selector)) {
                    matched.add(new MatchedRule(selector.specificity(), rule));
                    break;
                }
            }
        }
        return matched;
    }

    /**
     * Resolved properties of one element.
     */
    public static Map<String, Value> cascade(ElementData element, Stylesheet stylesheet) {
        var rules = matchingRules(element, stylesheet);
        // List.sort is stable: equal specificity keeps source order
        rules.sort(Comparator.comparing(MatchedRule::specificity));

        log.trace("Element <{}> matched {} rule(s)", element.tagName(), rules.size());

        var properties = new LinkedHashMap<String, Value>();
        for (var matched : rules) {
            apply(matched.rule(), properties);
        }
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Styled tree with the same shape as the given document tree.
     */
    public static StyledNode styleTree(Node node, Stylesheet stylesheet) {
        if (node instanceof Node.Element element) {
            var children = new ArrayList<StyledNode>(element.children().size());
            for (var child : element.children()) {
                children.add(styleTree(child, stylesheet));
            }
            return new StyledNode(node, cascade(element.data(), stylesheet), children);
        }
        return new StyledNode(node, Map.of(), List.of());
    }

    private static void apply(Rule rule, Map<String, Value> properties) {
        for (var declaration : rule.declarations()) {
            properties.put(declaration.name(), declaration.value());
        }
    }
}
