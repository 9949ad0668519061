package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;

/**
 * Result of a single step of {@link Combinators#sequence(java.util.function.Function)}.
 */
public sealed interface Step<R> {

    boolean isFailure();

    default boolean isSuccess() {
        return !isFailure();
    }

    /**
     * Value produced by the step. Reading the value of a failed step is a programming error,
     * builders check {@link #isFailure()} first and return early.
     */
    R value();

    /**
     * Step whose parser succeeded.
     */
    record Completed<R>(R value) implements Step<R> {
        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Step whose parser failed, or which was skipped because an earlier step failed.
     */
    record Aborted<R>(ParseError error) implements Step<R> {
        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public R value() {
            throw new IllegalStateException("Step failed, check isFailure() before reading its value: "
                                            + error.message());
        }
    }
}
