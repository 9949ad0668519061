package org.pragmatica.combinator.text;

import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.Primitives;

import static org.pragmatica.combinator.parser.Combinators.bind;
import static org.pragmatica.combinator.parser.Combinators.maybe;
import static org.pragmatica.combinator.parser.Combinators.oneOrMore;
import static org.pragmatica.combinator.parser.Combinators.sequence;
import static org.pragmatica.combinator.parser.Primitives.token;
import static org.pragmatica.combinator.parser.Primitives.value;
import static org.pragmatica.combinator.text.Characters.checkRadix;
import static org.pragmatica.combinator.text.Characters.digitCharacter;
import static org.pragmatica.combinator.text.Characters.digitValue;
import static org.pragmatica.combinator.text.Characters.oneOf;
import static org.pragmatica.combinator.text.Characters.stringOf;

/**
 * Numeric parsers. Radix defaults to 10.
 */
public final class Numbers {
    private Numbers() {}

    public static Parser<Integer> digit() {
        return digit(10);
    }

    /**
     * A single digit, as its numeric value.
     */
    public static Parser<Integer> digit(int radix) {
        checkRadix(radix);

        return sequence(steps -> {
            var c = steps.run(token());
            if (c.isFailure()) {
                return steps.abort();
            }

            var digit = digitValue(c.value(), radix);
            return digit < 0
                   ? Primitives.<Integer>fail("invalid digit")
                   : value(digit);
        });
    }

    public static Parser<Long> naturalNumber() {
        return naturalNumber(10);
    }

    /**
     * Unsigned number without decimal places.
     */
    public static Parser<Long> naturalNumber(int radix) {
        checkRadix(radix);

        return bind(digits(radix), digits -> parseLong(digits, radix));
    }

    public static Parser<Long> integer() {
        return integer(10);
    }

    /**
     * Number with optional {@code +} or {@code -} sign.
     */
    public static Parser<Long> integer(int radix) {
        checkRadix(radix);
        var sign = maybe(oneOf("+-"));
        var magnitude = digits(radix);

        // Converted with the sign attached so that Long.MIN_VALUE is in range
        return sequence(steps -> {
            var signStep = steps.run(sign);
            var digitsStep = steps.run(magnitude);
            if (digitsStep.isFailure()) {
                return steps.abort();
            }

            var negative = signStep.value()
                                   .filter(c -> c == '-')
                                   .isPresent();
            return parseLong(negative ? "-" + digitsStep.value() : digitsStep.value(), radix);
        });
    }

    private static Parser<String> digits(int radix) {
        return stringOf(oneOrMore(digitCharacter(radix)));
    }

    private static Parser<Long> parseLong(String digits, int radix) {
        try {
            return value(Long.parseLong(digits, radix));
        } catch (NumberFormatException e) {
            return Primitives.fail("number out of range");
        }
    }
}
