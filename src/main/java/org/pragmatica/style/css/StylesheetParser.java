package org.pragmatica.style.css;

import org.pragmatica.style.error.ParseError;
import org.pragmatica.style.error.ParseException;
import org.pragmatica.style.scan.Scanner;
import org.pragmatica.style.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for minimal stylesheets: {@code selector[, selector...] { prop: value; ... }}.
 *
 * <p>Selectors have no combinators, pseudo-classes or attribute tests. Declaration values are raw text
 * up to the next {@code ;}, classified by {@link #parseValue(String)}.
 */
public final class StylesheetParser {
    private static final Pattern NUMBER = Pattern.compile("[0-9]+(\\.[0-9]*)?([eE][+-]?[0-9]+)?");
    // Tested in order: "rem" must win over "em"
    private static final List<Unit> SUFFIX_ORDER = List.of(Unit.PX, Unit.PERCENT, Unit.REM, Unit.EM);
    private static final int COLOR_LENGTH = 7;

    private final Scanner scanner;

    private StylesheetParser(String text) {
        this.scanner = Scanner.of(text);
    }

    /**
     * Parse stylesheet text into rules, keeping source order.
     *
     * @throws ParseException if the text does not follow the grammar
     */
    public static Stylesheet parse(String text) {
        return new StylesheetParser(text).parseStylesheet();
    }

    /**
     * Classify a raw declaration value by its leading character.
     *
     * @throws ParseException with {@link ParseError.InvalidColor} or {@link ParseError.InvalidNumber}
     */
    public static Value parseValue(String raw) {
        return parseValue(raw, SourceLocation.START);
    }

    private static Value parseValue(String raw, SourceLocation location) {
        if (raw.startsWith("#")) {
            return parseColor(raw, location);
        }
        if (!raw.isEmpty() && isDigit(raw.charAt(0))) {
            return parseSize(raw, location);
        }
        return Value.keyword(raw);
    }

    private static Value parseColor(String raw, SourceLocation location) {
        if (raw.length() != COLOR_LENGTH) {
            throw new ParseException(new ParseError.InvalidColor(location, raw));
        }
        for (int i = 1; i < COLOR_LENGTH; i++) {
            if (!isHexDigit(raw.charAt(i))) {
                throw new ParseException(new ParseError.InvalidColor(location, raw));
            }
        }
        return Value.color(Integer.parseInt(raw.substring(1, 3), 16),
                           Integer.parseInt(raw.substring(3, 5), 16),
                           Integer.parseInt(raw.substring(5, 7), 16));
    }

    private static Value parseSize(String raw, SourceLocation location) {
        var unit = Unit.NONE;
        for (var candidate : SUFFIX_ORDER) {
            if (raw.endsWith(candidate.suffix())) {
                unit = candidate;
                break;
            }
        }
        var number = raw.substring(0, raw.length() - unit.suffix().length());
        if (!NUMBER.matcher(number).matches()) {
            throw new ParseException(new ParseError.InvalidNumber(location, raw));
        }
        return Value.size(Double.parseDouble(number), unit);
    }

    private Stylesheet parseStylesheet() {
        var rules = new ArrayList<Rule>();

        while (true) {
            scanner.skipWhitespace();
            if (scanner.atEnd()) {
                return new Stylesheet(rules);
            }
            rules.add(parseRule());
        }
    }

    private Rule parseRule() {
        var selectors = parseSelectorList();
        scanner.skipWhitespace();
        var declarations = parseDeclarationBlock();
        return new Rule(selectors, declarations);
    }

    private List<Selector> parseSelectorList() {
        var selectors = new ArrayList<Selector>();

        while (true) {
            scanner.skipWhitespace();
            selectors.add(parseSelector());
            scanner.skipWhitespace();
            if (scanner.atEnd() || scanner.peek() != ',') {
                return selectors;
            }
            scanner.advance();
        }
    }

    /**
     * Any character other than {@code #}, {@code .} or an identifier start ends the selector.
     * A repeated id overwrites; only the first tag token is kept.
     */
    private Selector parseSelector() {
        Optional<String> tag = Optional.empty();
        Optional<String> id = Optional.empty();
        var classes = new ArrayList<String>();

        while (!scanner.atEnd()) {
            char c = scanner.peek();
            if (c == '#') {
                scanner.advance();
                id = Optional.of(parseIdentifier());
            } else if (c == '.') {
                scanner.advance();
                classes.add(parseIdentifier());
            } else if (isIdentifierStart(c)) {
                var name = parseIdentifier();
                if (tag.isEmpty()) {
                    tag = Optional.of(name);
                }
            } else {
                break;
            }
        }
        return new Selector(tag, id, classes);
    }

    private List<Declaration> parseDeclarationBlock() {
        if (scanner.atEnd()) {
            throw new ParseException(new ParseError.UnexpectedEof(scanner.location(), "'{'"));
        }
        if (scanner.peek() != '{') {
            throw malformedDeclaration("expected '{' after selector list, found '" + scanner.peek() + "'");
        }
        scanner.advance();

        var declarations = new ArrayList<Declaration>();
        while (true) {
            scanner.skipWhitespace();
            if (scanner.atEnd()) {
                throw new ParseException(new ParseError.UnterminatedBlock(scanner.location()));
            }
            if (scanner.peek() == '}') {
                scanner.advance();
                return declarations;
            }
            declarations.add(parseDeclaration());
        }
    }

    private Declaration parseDeclaration() {
        var name = parseIdentifier();
        if (name.isEmpty()) {
            throw malformedDeclaration("expected property name");
        }

        scanner.skipWhitespace();
        if (scanner.atEnd() || scanner.peek() != ':') {
            throw malformedDeclaration("expected ':' after '" + name + "'");
        }
        scanner.advance();
        scanner.skipWhitespace();

        var valueLocation = scanner.location();
        var raw = scanner.consumeWhile(c -> c != ';');
        if (scanner.atEnd()) {
            throw malformedDeclaration("expected ';' after value of '" + name + "'");
        }
        scanner.advance();

        var value = raw.stripTrailing();
        if (value.isEmpty()) {
            throw new ParseException(new ParseError.MalformedDeclaration(valueLocation, "missing value for '" + name + "'"));
        }
        return new Declaration(name, parseValue(value, valueLocation));
    }

    private String parseIdentifier() {
        return scanner.consumeWhile(c -> isIdentifierStart(c) || isDigit(c) || c == '-' || c == '_');
    }

    private ParseException malformedDeclaration(String reason) {
        return new ParseException(new ParseError.MalformedDeclaration(scanner.location(), reason));
    }

    private static boolean isIdentifierStart(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(int c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
