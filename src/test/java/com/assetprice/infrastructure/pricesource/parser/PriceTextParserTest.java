package com.assetprice.infrastructure.pricesource.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PriceTextParserTest {

    static Stream<Arguments> amounts() {
        return Stream.of(
                Arguments.of("¥9,812,345", "9812345"),
                Arguments.of("9,812,345円", "9812345"),
                Arguments.of("￥１２，３４５", "12345"),
                Arguments.of("US$ 175.50", "175.50"),
                Arguments.of("$1,234.5 USD", "1234.5"),
                Arguments.of("13,521 円/g", "13521"),
                Arguments.of("+35円 (+0.12%)", "35"),
                Arguments.of("-1,234", "-1234"),
                Arguments.of("−42.5", "-42.5"),
                Arguments.of("基準価額 28,031円", "28031"),
                Arguments.of("0", "0")
        );
    }

    @ParameterizedTest
    @MethodSource("amounts")
    void testParseAmount(String text, String expected) {
        ParseResult result = PriceTextParser.parseAmount(text);

        assertTrue(result.isParsed(), () -> "expected a value for " + text + " but got " + result);
        assertEquals(new BigDecimal(expected), result.toOptional().orElseThrow());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "abc", "---", "価格未定", "1,2,3abc", "1,2345"})
    void testParseAmount_Malformed_ReturnsFailed(String text) {
        ParseResult result = PriceTextParser.parseAmount(text);

        assertInstanceOf(ParseResult.Failed.class, result);
        assertEquals(text, ((ParseResult.Failed) result).rawText());
    }

    @Test
    void testParseAmount_HugeNumber_DoesNotThrow() {
        String text = "9".repeat(500);

        ParseResult result = PriceTextParser.parseAmount(text);

        assertEquals(new BigDecimal(text), result.toOptional().orElseThrow());
    }

    @Test
    void testParsePercent() {
        assertEquals(new BigDecimal("1.23"), PriceTextParser.parsePercent("+1.23%").toOptional().orElseThrow());
        assertEquals(new BigDecimal("-0.5"), PriceTextParser.parsePercent("-0.5％").toOptional().orElseThrow());
        assertEquals(new BigDecimal("2"), PriceTextParser.parsePercent("前日比 +12,345 (2 %)").toOptional().orElseThrow());
    }

    @Test
    void testParsePercent_ThousandsSeparator() {
        assertEquals(new BigDecimal("1234.5"), PriceTextParser.parsePercent("1,234.5%").toOptional().orElseThrow());
        assertEquals(new BigDecimal("-1234"), PriceTextParser.parsePercent("-1,234 %").toOptional().orElseThrow());
    }

    @Test
    void testParsePercent_MisplacedSeparator_ReturnsFailed() {
        assertFalse(PriceTextParser.parsePercent("1,2345%").isParsed());
        assertFalse(PriceTextParser.parsePercent("1.2.5%").isParsed());
    }

    @Test
    void testParsePercent_NoPercentage_ReturnsFailed() {
        ParseResult result = PriceTextParser.parsePercent("+12,345");

        assertFalse(result.isParsed());
        assertEquals("no percentage found", ((ParseResult.Failed) result).reason());
    }

    @Test
    void testOrElseThrow_MapsFailure() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () ->
                PriceTextParser.parseAmount("n/a").orElseThrow(failed -> new IllegalStateException(failed.reason())));

        assertEquals("no amount found", ex.getMessage());
    }
}
