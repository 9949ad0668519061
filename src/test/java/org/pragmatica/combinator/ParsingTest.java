package org.pragmatica.combinator;

import org.junit.jupiter.api.Test;
import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.error.ParseException;
import org.pragmatica.combinator.parser.ParseOptions;
import org.pragmatica.combinator.parser.ParseOutcome;
import org.pragmatica.combinator.parser.Parser;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.pragmatica.combinator.parser.Combinators.and;
import static org.pragmatica.combinator.parser.Combinators.followedBy;
import static org.pragmatica.combinator.parser.Primitives.*;
import static org.pragmatica.combinator.text.Characters.string;

class ParsingTest {

    private static final ParseOptions NO_THROW = ParseOptions.DEFAULT.withThrowOnError(false);

    private static ParseError errorOf(Parser<?> parser, String input) {
        return Parsing.parse(parser, input, NO_THROW).error();
    }

    // === Result contract ===

    @Test
    void parse_returnsParserValue() {
        var result = new Object();

        assertSame(result, Parsing.parse(value(result), ""));
    }

    @Test
    void parse_doesNotRequireWholeInput() {
        assertEquals("foo", Parsing.parse(string("foo"), "foobar"));
    }

    @Test
    void parse_withEof_requiresWholeInput() {
        assertThrows(ParseException.class, () -> Parsing.parse(followedBy(string("foo"), eof()), "foobar"));
        assertEquals("foo", Parsing.parse(followedBy(string("foo"), eof()), "foo"));
    }

    @Test
    void parse_throwOnErrorOff_returnsError() {
        var outcome = Parsing.parse(fail("nop"), "", NO_THROW);

        assertTrue(outcome.isFailure());
        assertEquals(List.of("nop"), outcome.error().messages());
    }

    @Test
    void parse_throwOnErrorOn_throws() {
        var options = ParseOptions.DEFAULT.withThrowOnError(true);

        var exception = assertThrows(ParseException.class, () -> Parsing.parse(fail("nop"), "", options));

        assertEquals(List.of("nop"), exception.error().messages());
        assertEquals("1:1: nop", exception.getMessage());
    }

    @Test
    void parse_withoutOptions_throwsByDefault() {
        assertThrows(ParseException.class, () -> Parsing.parse(fail("nop"), ""));
    }

    @Test
    void parse_throwOnErrorOff_successReturnsValue() {
        var outcome = Parsing.parse(token(), "a", NO_THROW);

        assertTrue(outcome.isSuccess());
        assertEquals('a', outcome.value());
        assertThat(outcome.fold(ParseError::message, String::valueOf)).isEqualTo("a");
    }

    // === Positions ===

    @Test
    void errorLine_isReported() {
        assertEquals(1, errorOf(token(), "").position().line());
        assertEquals(2, errorOf(and(token(), token()), "\n").position().line());
    }

    @Test
    void errorColumn_isReported() {
        assertEquals(1, errorOf(fail(), "").position().column());
        assertEquals(2, errorOf(and(token(), fail()), "ab").position().column());

        var parser = and(token(), token(), token(), token(), fail());
        assertEquals(2, errorOf(parser, "\na\nbcde").position().column());
    }

    @Test
    void fileName_isAttachedToPositions() {
        var error = errorOf(token(), "");
        var named = Parsing.parse(token(), "", NO_THROW.withFileName("input.txt")).error();

        assertTrue(error.position().sourceName().isEmpty());
        assertEquals("input.txt", named.position().name());
        assertEquals("input.txt:1:1: unexpected eof", named.message());
    }

    @Test
    void userState_seedsParseState() {
        var outcome = Parsing.parse(userState(), "", NO_THROW.withUserState("seed"));

        assertEquals("seed", outcome.value());
    }

    // === Builder ===

    @Test
    void builder_defaultsToReturningFailures() {
        var outcome = Parsing.builder(token()).parse("");

        assertTrue(outcome.isFailure());
        assertEquals("eof", outcome.error().type());
    }

    @Test
    void builder_passesOptions() {
        var builder = Parsing.builder(and(updateUserState(s -> s + "!"), userState()))
                             .fileName("script.txt")
                             .userState("hi");

        ParseOutcome<Object> outcome = builder.parse("");

        assertEquals("hi!", outcome.value());
        assertEquals("script.txt", builder.options().fileName());
    }

    @Test
    void builder_throwOnError_throws() {
        var builder = Parsing.builder(token()).throwOnError(true);

        assertThrows(ParseException.class, () -> builder.parse(""));
    }

    @Test
    void parse_parserIsReusable() {
        var parser = string("ab");

        assertEquals("ab", Parsing.parse(parser, "ab"));
        assertEquals("ab", Parsing.parse(parser, "abc"));
        assertTrue(Parsing.parse(parser, "b", NO_THROW).isFailure());
    }
}
