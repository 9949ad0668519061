package org.pragmatica.combinator.text;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.error.ParseException;
import org.pragmatica.combinator.parser.ParseOptions;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.combinator.Parsing.parse;
import static org.pragmatica.combinator.text.Numbers.*;

class NumbersTest {

    // === digit ===

    @Test
    void digit_returnsNumericValue() {
        assertEquals(1, parse(digit(), "1"));
        assertEquals(7, parse(digit(), "7"));
    }

    @Test
    void digit_acceptsRadix() {
        assertEquals(15, parse(digit(16), "f"));
        assertEquals(35, parse(digit(36), "z"));
    }

    @Test
    void digit_nonDigit_failsWithInvalidDigit() {
        var error = assertThrows(ParseException.class, () -> parse(digit(), "a")).error();

        assertEquals(List.of("invalid digit"), error.messages());
    }

    @Test
    void digit_acceptsUpperCaseLetters() {
        assertEquals(10, parse(digit(16), "A"));
        assertEquals(35, parse(digit(36), "Z"));
    }

    @Test
    void digit_nonAsciiDigit_failsWithInvalidDigit() {
        var error = assertThrows(ParseException.class, () -> parse(digit(), "\u0663")).error();

        assertEquals(List.of("invalid digit"), error.messages());
    }

    @Test
    void digit_emptyInput_failsWithEof() {
        var error = assertThrows(ParseException.class, () -> parse(digit(), "")).error();

        assertEquals("eof", error.type());
    }

    // === naturalNumber ===

    @Test
    void naturalNumber_parsesUnsignedNumber() {
        assertEquals(1234L, parse(naturalNumber(), "1234"));
        assertEquals(0L, parse(naturalNumber(), "0"));
    }

    @Test
    void naturalNumber_stopsAtFirstNonDigit() {
        assertEquals(12L, parse(naturalNumber(), "12ab"));
    }

    @Test
    void naturalNumber_sign_isRejected() {
        assertThrows(ParseException.class, () -> parse(naturalNumber(), "-123"));
    }

    @Test
    void naturalNumber_nonAsciiDigits_areRejected() {
        // ARABIC-INDIC DIGIT THREE, FULLWIDTH DIGIT FOUR
        assertThrows(ParseException.class, () -> parse(naturalNumber(), "\u0663\uFF14"));
        assertEquals(1L, parse(naturalNumber(), "1\uFF14"));
    }

    @Test
    void naturalNumber_acceptsRadix() {
        assertEquals(255L, parse(naturalNumber(16), "ff"));
        assertEquals(5L, parse(naturalNumber(2), "101"));
    }

    @Test
    void naturalNumber_tooLarge_failsWithOutOfRange() {
        var outcome = parse(naturalNumber(), "99999999999999999999", ParseOptions.DEFAULT.withThrowOnError(false));

        assertTrue(outcome.isFailure());
        assertThat(outcome.error().messages()).containsExactly("number out of range");
    }

    @Test
    void naturalNumber_maxLong_isAccepted() {
        assertEquals(Long.MAX_VALUE, parse(naturalNumber(), String.valueOf(Long.MAX_VALUE)));
    }

    // === integer ===

    @Test
    void integer_parsesOptionalSign() {
        assertEquals(1234L, parse(integer(), "1234"));
        assertEquals(1234L, parse(integer(), "+1234"));
        assertEquals(-1234L, parse(integer(), "-1234"));
    }

    @Test
    void integer_minLong_isAccepted() {
        assertEquals(Long.MIN_VALUE, parse(integer(), String.valueOf(Long.MIN_VALUE)));
        assertEquals(Long.MIN_VALUE, parse(integer(16), "-8000000000000000"));
    }

    @Test
    void integer_beyondLongRange_failsWithOutOfRange() {
        var noThrow = ParseOptions.DEFAULT.withThrowOnError(false);

        assertThat(parse(integer(), "-9223372036854775809", noThrow).error().messages())
            .containsExactly("number out of range");
        assertThat(parse(integer(), "+9223372036854775808", noThrow).error().messages())
            .containsExactly("number out of range");
    }

    @Test
    void integer_negativeZero_isZero() {
        assertEquals(0L, parse(integer(), "-0"));
    }

    @Test
    void integer_acceptsRadix() {
        assertEquals(-255L, parse(integer(16), "-ff"));
    }

    @Test
    void integer_signWithoutDigits_fails() {
        assertThrows(ParseException.class, () -> parse(integer(), "-"));
        assertThrows(ParseException.class, () -> parse(integer(), "+x"));
    }

    @Test
    void integer_invalidRadix_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> integer(0));
    }
}
