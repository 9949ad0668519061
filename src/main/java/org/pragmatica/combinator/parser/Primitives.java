package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ErrorType;
import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.source.SourcePosition;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Primitive parsers - the only parsers that read raw input or create an error from nothing.
 * Everything else is composed from these in {@link Combinators}.
 */
public final class Primitives {
    private Primitives() {}

    public static final String DEFAULT_FAILURE_MESSAGE = "parser error";

    /**
     * Always succeeds with {@code value} without consuming input. Clears any error on the incoming state.
     */
    public static <T> Parser<T> value(T value) {
        return state -> state.withValue(value);
    }

    /**
     * Always succeeds with the "no value" marker, {@link Optional#empty()}.
     */
    public static <T> Parser<Optional<T>> value() {
        return value(Optional.empty());
    }

    public static <T> Parser<T> fail() {
        return fail(DEFAULT_FAILURE_MESSAGE, ErrorType.FAILURE);
    }

    public static <T> Parser<T> fail(String message) {
        return fail(message, ErrorType.FAILURE);
    }

    /**
     * Always fails at the current position without consuming input. The new error is merged onto
     * an error already present on the incoming state, so repeated failures accumulate messages.
     *
     * @param message failure message, {@value #DEFAULT_FAILURE_MESSAGE} when {@code null}
     * @param type    error type tag, {@link ErrorType#FAILURE} when {@code null}
     */
    public static <T> Parser<T> fail(String message, String type) {
        var effectiveMessage = message == null ? DEFAULT_FAILURE_MESSAGE : message;
        var effectiveType = type == null ? ErrorType.FAILURE : type;

        return state -> {
            var error = ParseError.of(state.position(), effectiveMessage, effectiveType);
            return state.withError(ParseError.merge(state.error().orElse(null), error));
        };
    }

    /**
     * Consumes a single input unit and returns it. Fails with {@code "unexpected eof"} on empty input.
     */
    public static Parser<Character> token() {
        return state -> state.isAtEnd()
                        ? Primitives.<Character>fail("unexpected eof", ErrorType.EOF).apply(state)
                        : state.advance();
    }

    /**
     * Succeeds with {@code true} at end of input, never consumes.
     */
    public static Parser<Boolean> eof() {
        return state -> state.isAtEnd()
                        ? state.withValue(Boolean.TRUE)
                        : Primitives.<Boolean>fail("expected an eof", ErrorType.EXPECTATION).apply(state);
    }

    /**
     * Succeeds with the current position, never consumes.
     */
    public static Parser<SourcePosition> position() {
        return state -> state.withValue(state.position());
    }

    /**
     * Succeeds with the current user state, never consumes.
     */
    public static Parser<Object> userState() {
        return state -> state.withValue(state.userState());
    }

    /**
     * Succeeds with the current user state cast to {@code type}; fails if the user state is of another type.
     */
    public static <U> Parser<U> userState(Class<U> type) {
        Objects.requireNonNull(type, "type");
        return state -> {
            var current = state.userState();
            if (current != null && !type.isInstance(current)) {
                return Primitives.<U>fail("user state is not a " + type.getSimpleName()).apply(state);
            }
            return state.withValue(type.cast(current));
        };
    }

    /**
     * Replaces the user state with {@code update(current)} and succeeds with the new user state.
     */
    public static Parser<Object> updateUserState(Function<Object, ?> update) {
        Objects.requireNonNull(update, "update");
        return state -> {
            Object updated = update.apply(state.userState());
            return state.withUserState(updated)
                        .withValue(updated);
        };
    }
}
