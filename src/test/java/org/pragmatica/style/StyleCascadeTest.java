package org.pragmatica.style;

import org.junit.jupiter.api.Test;
import org.pragmatica.style.css.Unit;
import org.pragmatica.style.css.Value;
import org.pragmatica.style.error.ParseError;
import org.pragmatica.style.error.ParseException;
import org.pragmatica.style.tree.Node;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: markup and stylesheet text in, styled tree out.
 */
class StyleCascadeTest {

    @Test
    void resolveStyles_idBeatsClass_andNestedElementStyledSeparately() {
        var root = StyleCascade.parseMarkup("<div id=\"x\" class=\"a b\"><p>hi</p></div>");
        var sheet = StyleCascade.parseStylesheet("#x{display:block;} .a{color:red;} p{color:blue;}");

        var styled = StyleCascade.resolveStyles(root, sheet);

        assertEquals(Map.of("display", Value.keyword("block"), "color", Value.keyword("red")), styled.properties());

        var paragraph = styled.children().get(0);
        assertEquals(Map.of("color", Value.keyword("blue")), paragraph.properties());
        assertEquals(Node.text("hi"), paragraph.children().get(0).node());
        assertTrue(paragraph.children().get(0).properties().isEmpty());
    }

    @Test
    void resolveStyles_equalSpecificity_sourceOrderBreaksTie() {
        var styled = StyleCascade.resolveStyles(StyleCascade.parseMarkup("<a></a>"),
                                                StyleCascade.parseStylesheet("a{color:red;} a{color:blue;}"));

        assertEquals(Value.keyword("blue"), styled.property("color").orElseThrow());
    }

    @Test
    void resolveStyles_idSelectorNeverMatchesElementWithoutId() {
        var styled = StyleCascade.resolveStyles(StyleCascade.parseMarkup("<p class=\"x\">text</p>"),
                                                StyleCascade.parseStylesheet("#x { color: red; } .x { margin: 4px; }"));

        assertThat(styled.properties()).containsOnlyKeys("margin");
        assertEquals(Value.size(4, Unit.PX), styled.property("margin").orElseThrow());
    }

    @Test
    void resolveStyles_selectorListIsOrMatched() {
        var root = StyleCascade.parseMarkup("""
            <body>
                <h1>a</h1>
                <h2>b</h2>
                <h3>c</h3>
            </body>
            """);
        var sheet = StyleCascade.parseStylesheet("h1, h3 { font-size: 2em; }");

        var styled = StyleCascade.resolveStyles(root, sheet);

        assertEquals(Value.size(2, Unit.EM), styled.children().get(0).property("font-size").orElseThrow());
        assertTrue(styled.children().get(1).properties().isEmpty());
        assertEquals(Value.size(2, Unit.EM), styled.children().get(2).property("font-size").orElseThrow());
    }

    @Test
    void resolveStyles_emptyStylesheet_leavesEveryNodeUnstyled() {
        var root = StyleCascade.parseMarkup("<div><span>x</span></div>");

        var styled = StyleCascade.resolveStyles(root, StyleCascade.parseStylesheet(""));

        assertTrue(styled.properties().isEmpty());
        assertTrue(styled.children().get(0).properties().isEmpty());
        assertEquals(3, styled.size());
    }

    @Test
    void resolveStyles_propertiesAreImmutable() {
        var styled = StyleCascade.resolveStyles(StyleCascade.parseMarkup("<a></a>"),
                                                StyleCascade.parseStylesheet("a { color: red; }"));

        assertThrows(UnsupportedOperationException.class,
                     () -> styled.properties().put("color", Value.keyword("blue")));
    }

    @Test
    void parseMarkup_rejectsWholeInputOnError() {
        var ex = assertThrows(ParseException.class,
                              () -> StyleCascade.parseMarkup("<div><p>ok</p><span></div>"));

        assertInstanceOf(ParseError.UnclosedOrMismatchedTag.class, ex.error());
    }

    @Test
    void parseStylesheet_rejectsWholeInputOnError() {
        var ex = assertThrows(ParseException.class,
                              () -> StyleCascade.parseStylesheet("a { color: red; } b { width: 1zz; }"));

        assertInstanceOf(ParseError.InvalidNumber.class, ex.error());
    }
}
