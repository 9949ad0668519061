package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;

import java.util.function.Function;

/**
 * Result of running a parser to completion - either a value or an error.
 */
public sealed interface ParseOutcome<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Parsed value. Throws {@link IllegalStateException} for failures.
     */
    T value();

    /**
     * Parse error. Throws {@link IllegalStateException} for successes.
     */
    ParseError error();

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    static <T> ParseOutcome<T> from(ParseState<T> state) {
        return state.error()
                    .<ParseOutcome<T>>map(Failure::new)
                    .orElseGet(() -> new Success<>(state.value()));
    }

    /**
     * Successful parse.
     */
    record Success<T>(T value) implements ParseOutcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public ParseError error() {
            throw new IllegalStateException("Successful parse has no error");
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    /**
     * Failed parse.
     */
    record Failure<T>(ParseError error) implements ParseOutcome<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Failed parse has no value: " + error.message());
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
