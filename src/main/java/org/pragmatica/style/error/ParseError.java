package org.pragmatica.style.error;

import org.pragmatica.style.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    /**
     * Short stable code identifying the error kind.
     */
    String code();

    String message();

    /**
     * Suggestion shown under a rendered diagnostic.
     */
    String help();

    /**
     * Scanner operation invoked at or past the end of input.
     */
    record OutOfBounds(SourceLocation location) implements ParseError {
        @Override
        public String code() {
            return "E0001";
        }

        @Override
        public String message() {
            return "Read past end of input at " + location;
        }

        @Override
        public String help() {
            return "check atEnd() before reading";
        }
    }

    /**
     * Input ended before a required terminator.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String code() {
            return "E0002";
        }

        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }

        @Override
        public String help() {
            return "the input is truncated";
        }
    }

    record MalformedAttribute(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String code() {
            return "E0003";
        }

        @Override
        public String message() {
            return "Malformed attribute at " + location + ": " + reason;
        }

        @Override
        public String help() {
            return "attributes are written as name=\"value\" or name='value'";
        }
    }

    /**
     * Closing tag does not match the open tag, or no tag name follows {@code <}.
     */
    record UnclosedOrMismatchedTag(
    SourceLocation location,
    String expected,
    String found) implements ParseError {
        @Override
        public String code() {
            return "E0004";
        }

        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }

        @Override
        public String help() {
            return "every element needs an explicit closing tag with the same name";
        }
    }

    record InvalidColor(
    SourceLocation location,
    String raw) implements ParseError {
        @Override
        public String code() {
            return "E0005";
        }

        @Override
        public String message() {
            return "Invalid color '" + raw + "' at " + location;
        }

        @Override
        public String help() {
            return "colors are written as '#' followed by exactly six hex digits";
        }
    }

    record InvalidNumber(
    SourceLocation location,
    String raw) implements ParseError {
        @Override
        public String code() {
            return "E0006";
        }

        @Override
        public String message() {
            return "Invalid number '" + raw + "' at " + location;
        }

        @Override
        public String help() {
            return "sizes are a number optionally followed by px, %, rem or em";
        }
    }

    record MalformedDeclaration(
    SourceLocation location,
    String reason) implements ParseError {
        @Override
        public String code() {
            return "E0007";
        }

        @Override
        public String message() {
            return "Malformed declaration at " + location + ": " + reason;
        }

        @Override
        public String help() {
            return "declarations are written as name: value;";
        }
    }

    /**
     * Declaration block without its closing brace.
     */
    record UnterminatedBlock(SourceLocation location) implements ParseError {
        @Override
        public String code() {
            return "E0008";
        }

        @Override
        public String message() {
            return "Unterminated declaration block at " + location + ", expected '}'";
        }

        @Override
        public String help() {
            return "close the block with '}'";
        }
    }
}
