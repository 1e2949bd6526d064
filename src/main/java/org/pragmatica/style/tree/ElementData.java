package org.pragmatica.style.tree;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tag name and attributes of an element. Attribute names are unique.
 */
public record ElementData(String tagName, Map<String, String> attributes) {
    public static final String ID_ATTRIBUTE = "id";
    public static final String CLASS_ATTRIBUTE = "class";

    public ElementData {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ElementData of(String tagName) {
        return new ElementData(tagName, Map.of());
    }

    /**
     * Value of the {@code id} attribute, if present.
     */
    public Optional<String> id() {
        return Optional.ofNullable(attributes.get(ID_ATTRIBUTE));
    }

    /**
     * Tokens of the {@code class} attribute separated by {@link Character#isWhitespace} runs; empty if the attribute is absent.
     */
    public Set<String> classes() {
        var value = attributes.get(CLASS_ATTRIBUTE);
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        var tokens = new LinkedHashSet<>(Arrays.asList(value.strip().split("\\p{javaWhitespace}+")));
        return Collections.unmodifiableSet(tokens);
    }
}
