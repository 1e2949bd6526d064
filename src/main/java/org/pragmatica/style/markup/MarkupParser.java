package org.pragmatica.style.markup;

import org.pragmatica.style.error.ParseError;
import org.pragmatica.style.error.ParseException;
import org.pragmatica.style.scan.Scanner;
import org.pragmatica.style.tree.Node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for minimal markup: {@code <name attr="v">...</name>} and text runs.
 *
 * <p>There are no entities, comments or self-closing tags. Every opened element needs an exactly
 * matching closing tag. Only one top-level node is parsed; wrap siblings in a synthetic root.
 */
public final class MarkupParser {

    private final Scanner scanner;

    private MarkupParser(String text) {
        this.scanner = Scanner.of(text);
    }

    /**
     * Parse markup text into a document tree.
     *
     * @throws ParseException if the text does not follow the grammar
     */
    public static Node parse(String text) {
        return new MarkupParser(text).parseNode();
    }

    private Node parseNode() {
        scanner.skipWhitespace();
        requireInput("element or text");
        return scanner.peek() == '<'
               ? parseElement()
               : parseText();
    }

    private Node parseText() {
        return Node.text(scanner.consumeWhile(c -> c != '<'));
    }

    private String parseTagName() {
        return scanner.consumeWhile(MarkupParser::isAsciiAlphanumeric);
    }

    private Node parseElement() {
        var start = scanner.location();
        scanner.advance();
        // skip <

        var tagName = parseTagName();
        if (tagName.isEmpty()) {
            throw new ParseException(new ParseError.UnclosedOrMismatchedTag(
                start, "tag name", scanner.atEnd() ? "<" : "<" + scanner.peek()));
        }

        var attributes = parseAttributes();
        scanner.advance();
        // skip >

        var children = parseElements(tagName);

        var closing = "</" + tagName + ">";
        if (!scanner.startsWith(closing)) {
            var location = scanner.location();
            var found = scanner.consumeWhile(c -> c != '>');
            throw new ParseException(new ParseError.UnclosedOrMismatchedTag(
                location, "'" + closing + "'", scanner.atEnd() ? found : found + ">"));
        }
        for (int i = 0; i < closing.length(); i++) {
            scanner.advance();
        }

        return Node.element(tagName, attributes, children);
    }

    /**
     * Attributes up to, but not including, the closing {@code >} of the open tag.
     * A repeated name overwrites the earlier value.
     */
    private Map<String, String> parseAttributes() {
        var attributes = new LinkedHashMap<String, String>();

        while (true) {
            scanner.skipWhitespace();
            requireInput("'>'");
            if (scanner.peek() == '>') {
                return attributes;
            }
            var attribute = parseAttribute();
            attributes.put(attribute.getKey(), attribute.getValue());
        }
    }

    private Map.Entry<String, String> parseAttribute() {
        var name = parseTagName();
        if (name.isEmpty()) {
            throw malformedAttribute("expected attribute name");
        }

        requireInput("'='");
        if (scanner.peek() != '=') {
            throw malformedAttribute("expected '=' after '" + name + "'");
        }
        scanner.advance();

        requireInput("opening quote");
        char quote = scanner.peek();
        if (quote != '"' && quote != '\'') {
            throw malformedAttribute("expected opening quote for '" + name + "'");
        }
        scanner.advance();

        var value = scanner.consumeWhile(MarkupParser::isAttributeValueChar);

        requireInput("closing quote");
        if (scanner.peek() != quote) {
            throw malformedAttribute("expected closing " + quote + " for '" + name + "'");
        }
        scanner.advance();

        return Map.entry(name, value);
    }

    private List<Node> parseElements(String openTagName) {
        var children = new ArrayList<Node>();

        while (true) {
            scanner.skipWhitespace();
            requireInput("'</" + openTagName + ">'");
            if (scanner.startsWith("</")) {
                return children;
            }
            children.add(parseNode());
        }
    }

    private void requireInput(String expected) {
        if (scanner.atEnd()) {
            throw new ParseException(new ParseError.UnexpectedEof(scanner.location(), expected));
        }
    }

    private ParseException malformedAttribute(String reason) {
        return new ParseException(new ParseError.MalformedAttribute(scanner.location(), reason));
    }

    private static boolean isAsciiAlphanumeric(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    private static boolean isAttributeValueChar(int c) {
        return isAsciiAlphanumeric(c) || Character.isWhitespace(c) || c == '-' || c == '_';
    }
}
