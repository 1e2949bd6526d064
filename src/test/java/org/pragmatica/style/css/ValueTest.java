package org.pragmatica.style.css;

import org.junit.jupiter.api.Test;
import org.pragmatica.style.error.ParseError;
import org.pragmatica.style.error.ParseException;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    private static ParseError valueFailure(String raw) {
        return assertThrows(ParseException.class, () -> StylesheetParser.parseValue(raw)).error();
    }

    @Test
    void parseValue_hashLed_producesColor() {
        assertEquals(Value.color(0, 0, 0), StylesheetParser.parseValue("#000000"));
        assertEquals(Value.color(18, 52, 86), StylesheetParser.parseValue("#123456"));
        assertEquals(Value.color(171, 205, 239), StylesheetParser.parseValue("#abcdef"));
        assertEquals(Value.color(171, 205, 239), StylesheetParser.parseValue("#ABCDEF"));
    }

    @Test
    void parseValue_badColor_failsInvalidColor() {
        assertInstanceOf(ParseError.InvalidColor.class, valueFailure("#123"));
        assertInstanceOf(ParseError.InvalidColor.class, valueFailure("#1111111"));
        assertInstanceOf(ParseError.InvalidColor.class, valueFailure("#zyxwvu"));
        assertInstanceOf(ParseError.InvalidColor.class, valueFailure("#\uFF11\uFF12\uFF13\uFF14\uFF15\uFF16"));
        assertInstanceOf(ParseError.InvalidColor.class, valueFailure("#\u0661\u0662\u0663\u0664\u0665\u0666"));
    }

    @Test
    void parseValue_digitLed_producesSizeWithUnit() {
        assertEquals(Value.size(10.0, Unit.PX), StylesheetParser.parseValue("10px"));
        assertEquals(Value.size(43.0, Unit.PERCENT), StylesheetParser.parseValue("43%"));
        assertEquals(Value.size(1.4, Unit.EM), StylesheetParser.parseValue("1.4em"));
        assertEquals(Value.size(0.1, Unit.REM), StylesheetParser.parseValue("0.1rem"));
        assertEquals(Value.size(10000.0, Unit.NONE), StylesheetParser.parseValue("10000"));
        assertEquals(Value.size(1.0, Unit.PX), StylesheetParser.parseValue("1.px"));
        assertEquals(Value.size(1.0, Unit.NONE), StylesheetParser.parseValue("1."));
    }

    @Test
    void parseValue_digitLedGarbage_failsInvalidNumber() {
        assertInstanceOf(ParseError.InvalidNumber.class, valueFailure("1hogehogepx"));
        assertInstanceOf(ParseError.InvalidNumber.class, valueFailure("1ab"));
        assertInstanceOf(ParseError.InvalidNumber.class, valueFailure("1.2.3px"));
        assertInstanceOf(ParseError.InvalidNumber.class, valueFailure("1\uFF11px"));
        assertInstanceOf(ParseError.InvalidNumber.class, valueFailure("0x10"));
    }

    @Test
    void parseValue_otherLeadingCharacter_producesKeyword() {
        assertEquals(Value.keyword("red"), StylesheetParser.parseValue("red"));
        assertEquals(Value.keyword("solid 1px"), StylesheetParser.parseValue("solid 1px"));
        assertEquals(Value.keyword("-5px"), StylesheetParser.parseValue("-5px"));
    }

    @Test
    void toCss_rendersStylesheetText() {
        assertEquals("10px", Value.size(10, Unit.PX).toCss());
        assertEquals("1.5em", Value.size(1.5, Unit.EM).toCss());
        assertEquals("43%", Value.size(43, Unit.PERCENT).toCss());
        assertEquals("7", Value.size(7, Unit.NONE).toCss());
        assertEquals("#0a0bff", Value.color(10, 11, 255).toCss());
        assertEquals("block", Value.keyword("block").toCss());
    }

    @Test
    void color_channelOutOfRange_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Value.color(256, 0, 0));
    }
}
