package org.pragmatica.combinator.text;

import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.Primitives;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

import static org.pragmatica.combinator.parser.Combinators.and;
import static org.pragmatica.combinator.parser.Combinators.bind;
import static org.pragmatica.combinator.parser.Combinators.oneOrMore;
import static org.pragmatica.combinator.parser.Combinators.sequence;
import static org.pragmatica.combinator.parser.Primitives.token;
import static org.pragmatica.combinator.parser.Primitives.value;

/**
 * Character and string parsers.
 */
public final class Characters {
    private Characters() {}

    private static final String WHITESPACE = " \t\n\r";

    /**
     * Next token, if it satisfies {@code predicate}.
     */
    public static Parser<Character> satisfies(Predicate<? super Character> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return bind(token(), c -> predicate.test(c)
                                  ? value(c)
                                  : Primitives.<Character>fail("token does not match predicate"));
    }

    /**
     * Concatenation of the list produced by {@code parser}.
     */
    public static Parser<String> stringOf(Parser<? extends List<?>> parser) {
        return bind(parser, parts -> {
            var sb = new StringBuilder();
            parts.forEach(sb::append);
            return value(sb.toString());
        });
    }

    public static Parser<Character> character(char expected) {
        return satisfies(c -> c == expected);
    }

    /**
     * Next token if it is one of {@code chars}.
     */
    public static Parser<Character> oneOf(String chars) {
        Objects.requireNonNull(chars, "chars");
        return satisfies(c -> chars.indexOf(c) >= 0);
    }

    /**
     * Next token if it is none of {@code chars}.
     */
    public static Parser<Character> noneOf(String chars) {
        Objects.requireNonNull(chars, "chars");
        return satisfies(c -> chars.indexOf(c) < 0);
    }

    /**
     * Matches {@code text} unit by unit and returns it.
     */
    public static Parser<String> string(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return value("");
        }

        return sequence(steps -> {
            for (int i = 0; i < text.length(); i++) {
                if (steps.run(character(text.charAt(i))).isFailure()) {
                    return steps.abort();
                }
            }
            return value(text);
        });
    }

    public static Parser<Character> digitCharacter() {
        return digitCharacter(10);
    }

    /**
     * A character which is a digit in the given radix: {@code 0-9}, then {@code a-z} or {@code A-Z}
     * for radixes above 10. Digits outside of ASCII are not accepted.
     */
    public static Parser<Character> digitCharacter(int radix) {
        checkRadix(radix);
        return satisfies(c -> digitValue(c, radix) >= 0);
    }

    /**
     * One of space, tab, line feed or carriage return.
     */
    public static Parser<Character> space() {
        return oneOf(WHITESPACE);
    }

    /**
     * One or more whitespace characters, always returns a single space.
     */
    public static Parser<String> spaces() {
        return and(oneOrMore(space()), value(" "));
    }

    /**
     * One or more tokens as a string.
     */
    public static Parser<String> text() {
        return text(token());
    }

    /**
     * One or more matches of {@code parser} as a string.
     */
    public static Parser<String> text(Parser<?> parser) {
        return stringOf(oneOrMore(parser));
    }

    /**
     * Value of an ASCII digit in the given radix, or -1 if {@code c} is not one.
     */
    static int digitValue(char c, int radix) {
        int value;
        if (c >= '0' && c <= '9') {
            value = c - '0';
        } else if (c >= 'a' && c <= 'z') {
            value = c - 'a' + 10;
        } else if (c >= 'A' && c <= 'Z') {
            value = c - 'A' + 10;
        } else {
            return -1;
        }
        return value < radix ? value : -1;
    }

    static void checkRadix(int radix) {
        if (radix < Character.MIN_RADIX || radix > Character.MAX_RADIX) {
            throw new IllegalArgumentException("Radix " + radix + " outside of "
                                               + Character.MIN_RADIX + ".." + Character.MAX_RADIX);
        }
    }
}
