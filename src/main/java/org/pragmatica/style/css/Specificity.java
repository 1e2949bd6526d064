package org.pragmatica.style.css;

import java.util.Comparator;

/**
 * Selector precedence weight. Compared lexicographically: ids, then classes, then tags.
 */
public record Specificity(int ids, int classes, int tags) implements Comparable<Specificity> {
    public static final Specificity ZERO = new Specificity(0, 0, 0);

    private static final Comparator<Specificity> ORDER = Comparator.comparingInt(Specificity::ids)
                                                                   .thenComparingInt(Specificity::classes)
                                                                   .thenComparingInt(Specificity::tags);

    public Specificity {
        if (ids < 0 || classes < 0 || tags < 0) {
            throw new IllegalArgumentException("Specificity components must not be negative: "
                                               + ids + "," + classes + "," + tags);
        }
    }

    @Override
    public int compareTo(Specificity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + ids + "," + classes + "," + tags + ")";
    }
}
