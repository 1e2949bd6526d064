package org.pragmatica.style.css;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Simple selector: {@code tag? (#id)? (.class)*}. Class tokens are matched as a required set.
 */
public record Selector(Optional<String> tag, Optional<String> id, List<String> classes) {
    public static final Selector UNIVERSAL = new Selector(Optional.empty(), Optional.empty(), List.of());

    public Selector {
        classes = List.copyOf(classes);
    }

    public static Selector ofTag(String tag) {
        return new Selector(Optional.of(tag), Optional.empty(), List.of());
    }

    public static Selector ofId(String id) {
        return new Selector(Optional.empty(), Optional.of(id), List.of());
    }

    public static Selector ofClasses(String... classes) {
        return new Selector(Optional.empty(), Optional.empty(), List.of(classes));
    }

    public Specificity specificity() {
        return new Specificity(id.isPresent() ? 1 : 0,
                               new HashSet<>(classes).size(),
                               tag.isPresent() ? 1 : 0);
    }
}
