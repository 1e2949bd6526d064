package org.pragmatica.style.error;

/**
 * Thrown when markup or stylesheet text is rejected. The whole input is rejected; no partial result exists.
 */
public final class ParseException extends RuntimeException {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    /**
     * Diagnostic pointing at the offending character.
     */
    public Diagnostic diagnostic() {
        return Diagnostic.of(error);
    }
}
