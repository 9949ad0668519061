package org.pragmatica.combinator.parser;

/**
 * Handle passed to a {@link Combinators#sequence(java.util.function.Function) sequence} builder.
 * Each {@link #run(Parser)} continues from the state left by the previous step.
 *
 * <p>Once a step fails, the sequence as a whole fails with that step's state: later {@code run}
 * calls are skipped without running their parsers and the parser returned by the builder is ignored.
 * Builders return early on failure:
 * <pre>{@code
 * sequence(steps -> {
 *     var first = steps.run(token());
 *     if (first.isFailure()) {
 *         return steps.abort();
 *     }
 *     var second = steps.run(token());
 *     if (second.isFailure()) {
 *         return steps.abort();
 *     }
 *     return value("" + second.value() + first.value());
 * });
 * }</pre>
 */
public interface Steps {

    /**
     * Run {@code parser} against the current state of the sequence.
     */
    <R> Step<R> run(Parser<R> parser);

    /**
     * Whether one of the steps has failed.
     */
    boolean failed();

    /**
     * Parser to return from the builder when giving up. After a failed step the sequence yields
     * that step's failure; otherwise the sequence fails with {@code "sequence aborted"}.
     */
    <T> Parser<T> abort();
}
