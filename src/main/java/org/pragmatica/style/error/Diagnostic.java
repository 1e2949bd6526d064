package org.pragmatica.style.error;

import org.pragmatica.style.tree.SourceLocation;

/**
 * Rendering of a rejected input, pointing at the character where parsing stopped.
 *
 * <p>Example output:
 * <pre>
 * error[E0004]: Unexpected '&lt;/span&gt;' at 1:6, expected '&lt;/div&gt;'
 *   --> page.html:1:6
 *   |
 * 1 | &lt;div&gt;&lt;/span&gt;
 *   |      ^
 *   |
 *   = help: every element needs an explicit closing tag with the same name
 * </pre>
 *
 * @param code     Error code (e.g., "E0004")
 * @param message  Error message
 * @param location Where parsing stopped
 * @param help     Suggestion printed under the source line
 */
public record Diagnostic(String code, String message, SourceLocation location, String help) {

    public static Diagnostic of(ParseError error) {
        return new Diagnostic(error.code(), error.message(), error.location(), error.help());
    }

    /**
     * Format against the rejected text.
     *
     * @param source   The rejected markup or stylesheet text
     * @param filename Name shown after {@code -->}, may be null
     */
    public String format(String source, String filename) {
        var lines = source.split("\n", -1);
        var line = location.line() <= lines.length ? lines[location.line() - 1] : "";
        var gutter = " ".repeat(String.valueOf(location.line()).length());

        var sb = new StringBuilder();
        sb.append("error[").append(code).append("]: ").append(message).append("\n");
        sb.append("  --> ").append(position(filename)).append("\n");
        sb.append(gutter).append(" |\n");
        sb.append(location.line()).append(" | ").append(line).append("\n");
        sb.append(gutter).append(" | ").append(" ".repeat(location.column() - 1)).append("^\n");
        sb.append(gutter).append(" |\n");
        sb.append(gutter).append(" = help: ").append(help).append("\n");
        return sb.toString();
    }

    /**
     * Single-line form, e.g. {@code style.css:2:9: error: ...}.
     */
    public String formatSimple(String filename) {
        return position(filename) + ": error: " + message;
    }

    private String position(String filename) {
        var position = location.line() + ":" + location.column();
        return filename == null ? position : filename + ":" + position;
    }
}
