package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.source.SourcePosition;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot threaded through parsers. Every parser turns one state into a new one,
 * states are never modified in place.
 *
 * <p>The remaining input is the suffix of {@code input} starting at {@code offset}.
 * When {@code error} is present the parser failed and {@code value} must be ignored.
 */
public record ParseState<T>(
    T value,
    String input,
    int offset,
    SourcePosition position,
    Object userState,
    Optional<ParseError> error
) {

    public ParseState {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(error, "error");
        if (offset < 0 || offset > input.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside of input of length " + input.length());
        }
    }

    public static <T> ParseState<T> initial(String input, ParseOptions options) {
        return new ParseState<>(null,
                                input,
                                0,
                                SourcePosition.start(options.fileName()),
                                options.userState(),
                                Optional.empty());
    }

    public static <T> ParseState<T> initial(String input) {
        return initial(input, ParseOptions.DEFAULT);
    }

    // === Status ===

    public boolean failed() {
        return error.isPresent();
    }

    public boolean succeeded() {
        return error.isEmpty();
    }

    // === Input access ===

    public boolean isAtEnd() {
        return offset >= input.length();
    }

    public char peek() {
        return input.charAt(offset);
    }

    public String remainingInput() {
        return input.substring(offset);
    }

    // === Functional updates ===

    /**
     * Successful state with {@code newValue}, any error cleared.
     */
    public <R> ParseState<R> withValue(R newValue) {
        return new ParseState<>(newValue, input, offset, position, userState, Optional.empty());
    }

    /**
     * Failed state carrying {@code newError}.
     */
    public <R> ParseState<R> withError(ParseError newError) {
        return new ParseState<>(null, input, offset, position, userState, Optional.of(newError));
    }

    public ParseState<T> withUserState(Object newUserState) {
        return new ParseState<>(value, input, offset, position, newUserState, error);
    }

    /**
     * Same failed state typed for a different value, used to propagate failures through combinators.
     */
    public <R> ParseState<R> propagate() {
        if (error.isEmpty()) {
            throw new IllegalStateException("Only failed states can be propagated");
        }
        return new ParseState<>(null, input, offset, position, userState, error);
    }

    /**
     * Consume one input unit; the consumed unit becomes the value.
     */
    public ParseState<Character> advance() {
        var unit = peek();
        return new ParseState<>(unit, input, offset + 1, position.advance(unit), userState, Optional.empty());
    }

    @Override
    public String toString() {
        return error.map(e -> "ParseState[failed " + e.message() + "]")
                    .orElseGet(() -> "ParseState[" + position + ", value=" + value + "]");
    }
}
