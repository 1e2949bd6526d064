package org.pragmatica.style.tree;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ElementDataTest {

    @Test
    void id_absent_isEmpty() {
        assertTrue(ElementData.of("div").id().isEmpty());
    }

    @Test
    void id_present_returnsValue() {
        assertEquals("main", new ElementData("div", Map.of("id", "main")).id().orElseThrow());
    }

    @Test
    void classes_splitOnWhitespaceRuns() {
        var data = new ElementData("div", Map.of("class", "  r u\t s\nt "));

        assertThat(data.classes()).containsExactly("r", "u", "s", "t");
    }

    @Test
    void classes_splitOnNonAsciiWhitespace() {
        var data = new ElementData("div", Map.of("class", "a\u2003b"));

        assertThat(data.classes()).containsExactly("a", "b");
    }

    @Test
    void classes_absentOrBlank_isEmpty() {
        assertTrue(ElementData.of("div").classes().isEmpty());
        assertTrue(new ElementData("div", Map.of("class", "   ")).classes().isEmpty());
    }

    @Test
    void attributes_areImmutable() {
        var data = new ElementData("div", Map.of("id", "x"));

        assertThrows(UnsupportedOperationException.class, () -> data.attributes().put("id", "y"));
    }
}
