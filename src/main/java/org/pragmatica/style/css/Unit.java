package org.pragmatica.style.css;

/**
 * Size units. Values are stored as written and never resolved.
 */
public enum Unit {
    PX("px"),
    PERCENT("%"),
    EM("em"),
    REM("rem"),
    NONE("");

    private final String suffix;

    Unit(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }
}
