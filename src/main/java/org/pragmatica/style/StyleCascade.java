package org.pragmatica.style;

import org.pragmatica.style.cascade.CascadeResolver;
import org.pragmatica.style.cascade.StyledNode;
import org.pragmatica.style.css.Stylesheet;
import org.pragmatica.style.css.StylesheetParser;
import org.pragmatica.style.error.ParseException;
import org.pragmatica.style.markup.MarkupParser;
import org.pragmatica.style.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing markup and stylesheets and resolving styles.
 *
 * <p>Example usage:
 * <pre>{@code
 * var root = StyleCascade.parseMarkup("<div id=\"x\" class=\"a b\"><p>hi</p></div>");
 * var sheet = StyleCascade.parseStylesheet("#x { display: block; } .a { color: red; }");
 *
 * var styled = StyleCascade.resolveStyles(root, sheet);
 * styled.property("display"); // Keyword[text=block]
 * }</pre>
 */
public final class StyleCascade {
    private static final Logger log = LoggerFactory.getLogger(StyleCascade.class);

    private StyleCascade() {}

    /**
     * Parse markup text into a document tree with a single root.
     *
     * @throws ParseException if the text is rejected
     */
    public static Node parseMarkup(String text) {
        var root = MarkupParser.parse(text);
        log.debug("Parsed markup: {} characters", text.length());
        return root;
    }

    /**
     * Parse stylesheet text into its ordered rules.
     *
     * @throws ParseException if the text is rejected
     */
    public static Stylesheet parseStylesheet(String text) {
        var stylesheet = StylesheetParser.parse(text);
        log.debug("Parsed stylesheet: {} rule(s)", stylesheet.rules().size());
        return stylesheet;
    }

    /**
     * Resolve the properties of every node. Never fails for parsed inputs.
     */
    public static StyledNode resolveStyles(Node root, Stylesheet stylesheet) {
        var styled = CascadeResolver.styleTree(root, stylesheet);
        if (log.isDebugEnabled()) {
            log.debug("Resolved styles for {} node(s) against {} rule(s)", styled.size(), stylesheet.rules().size());
        }
        return styled;
    }
}
