package org.pragmatica.combinator.parser;

import java.util.function.Function;

/**
 * Parser - a pure function from one parse state to the next.
 *
 * <p>Implementations must not modify the state they receive and must have no side effects
 * other than computing the next state. A failed result state carries an error and its value
 * is ignored.
 */
@FunctionalInterface
public interface Parser<T> {

    /**
     * Run this parser against {@code state}.
     */
    ParseState<T> apply(ParseState<?> state);

    /**
     * Run this parser, then the parser produced from its value.
     * See {@link Combinators#bind(Parser, Function)}.
     */
    default <R> Parser<R> bind(Function<? super T, ? extends Parser<R>> continuation) {
        return Combinators.bind(this, continuation);
    }

    /**
     * Transform the value of this parser.
     */
    default <R> Parser<R> map(Function<? super T, ? extends R> mapper) {
        return Combinators.bind(this, value -> Primitives.value(mapper.apply(value)));
    }
}
