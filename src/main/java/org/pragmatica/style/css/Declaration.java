package org.pragmatica.style.css;

/**
 * A single {@code name: value;} pair.
 */
public record Declaration(String name, Value value) {}
