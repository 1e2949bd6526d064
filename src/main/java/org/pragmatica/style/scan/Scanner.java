package org.pragmatica.style.scan;

import org.pragmatica.style.error.ParseError;
import org.pragmatica.style.error.ParseException;
import org.pragmatica.style.tree.SourceLocation;

import java.util.function.IntPredicate;

/**
 * Cursor over immutable text, shared by the markup and stylesheet parsers.
 * Only moves forward.
 */
public final class Scanner {

    private final String input;

    private int pos;
    private int line;
    private int column;

    private Scanner(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static Scanner of(String input) {
        return new Scanner(input);
    }

    // === Position ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return SourceLocation.at(line, column, pos);
    }

    public boolean atEnd() {
        return pos >= input.length();
    }

    // === Character Access ===

    /**
     * Current character, without consuming it.
     *
     * @throws ParseException with {@link ParseError.OutOfBounds} at end of input
     */
    public char peek() {
        ensureNotAtEnd();
        return input.charAt(pos);
    }

    public boolean startsWith(String prefix) {
        return input.startsWith(prefix, pos);
    }

    /**
     * Consume and return the current character.
     *
     * @throws ParseException with {@link ParseError.OutOfBounds} at end of input
     */
    public char advance() {
        ensureNotAtEnd();
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    /**
     * Consume characters while the predicate holds. Never fails; the result may be empty.
     */
    public String consumeWhile(IntPredicate predicate) {
        int start = pos;
        while (!atEnd() && predicate.test(input.charAt(pos))) {
            advance();
        }
        return input.substring(start, pos);
    }

    public void skipWhitespace() {
        consumeWhile(Character::isWhitespace);
    }

    private void ensureNotAtEnd() {
        if (atEnd()) {
            throw new ParseException(new ParseError.OutOfBounds(location()));
        }
    }
}
