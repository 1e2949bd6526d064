package org.pragmatica.style.cascade;

import org.pragmatica.style.css.Rule;
import org.pragmatica.style.css.Specificity;

/**
 * A rule that applies to an element, weighted by the first of its selectors that matched.
 */
public record MatchedRule(Specificity specificity, Rule rule) {}
