package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.pragmatica.combinator.parser.Primitives.fail;

/**
 * Combinators - parsers built from other parsers.
 *
 * <p>Failures are ordinary states carrying an error. A failure propagates until an enclosing
 * {@link #or}, {@link #maybe} or {@link #not} recovers from it by retrying from the state
 * it started with.
 *
 * <p>Combinators over many parsers loop over them instead of nesting calls, so stack depth
 * does not grow with the length of the input.
 */
public final class Combinators {
    private Combinators() {}

    // === Binding ===

    /**
     * Run {@code parser}, then the parser returned by {@code continuation} for its value.
     * If {@code parser} fails, the failure is returned as is and {@code continuation} is not called.
     */
    public static <T, R> Parser<R> bind(Parser<T> parser, Function<? super T, ? extends Parser<R>> continuation) {
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(continuation, "continuation");

        return state -> {
            var next = parser.apply(state);
            if (next.failed()) {
                return next.propagate();
            }
            return continuation.apply(next.value())
                               .apply(next);
        };
    }

    // === Sequencing ===

    /**
     * Run all parsers one after another, failing on the first failure. The value is the value of the
     * last parser. Fixed arities cover the common cases, longer chains use {@link #and(List, Parser)}.
     */
    public static <T> Parser<T> and(Parser<T> only) {
        return Objects.requireNonNull(only, "parser");
    }

    public static <T> Parser<T> and(Parser<?> p1, Parser<T> last) {
        return and(List.of(p1), last);
    }

    public static <T> Parser<T> and(Parser<?> p1, Parser<?> p2, Parser<T> last) {
        return and(List.of(p1, p2), last);
    }

    public static <T> Parser<T> and(Parser<?> p1, Parser<?> p2, Parser<?> p3, Parser<T> last) {
        return and(List.of(p1, p2, p3), last);
    }

    public static <T> Parser<T> and(Parser<?> p1, Parser<?> p2, Parser<?> p3, Parser<?> p4, Parser<T> last) {
        return and(List.of(p1, p2, p3, p4), last);
    }

    /**
     * Run {@code leading} for their effect, then {@code last}, whose value becomes the result.
     */
    public static <T> Parser<T> and(List<? extends Parser<?>> leading, Parser<T> last) {
        Objects.requireNonNull(last, "last");
        var chain = copyOf(leading);

        if (chain.isEmpty()) {
            return last;
        }

        return state -> {
            var current = runAll(chain, state);
            return current.failed()
                   ? current.propagate()
                   : last.apply(current);
        };
    }

    /**
     * Run {@code parser}, then {@code more} for their effect only. The value is the value of {@code parser}.
     */
    public static <T> Parser<T> followedBy(Parser<T> parser, Parser<?>... more) {
        Objects.requireNonNull(parser, "parser");
        var trailing = copyOf(Arrays.asList(more));

        if (trailing.isEmpty()) {
            return parser;
        }

        return state -> {
            var result = parser.apply(state);
            if (result.failed()) {
                return result;
            }

            var current = runAll(trailing, result);
            return current.failed()
                   ? current.propagate()
                   : current.withValue(result.value());
        };
    }

    /**
     * Composes parsers in straight-line code. The builder gets a {@link Steps} handle, runs parsers
     * through it and returns the parser that produces the final value. The first failing step ends the
     * sequence with that step's failure, see {@link Steps}.
     */
    public static <T> Parser<T> sequence(Function<? super Steps, ? extends Parser<T>> builder) {
        Objects.requireNonNull(builder, "builder");

        return state -> {
            var steps = new ThreadedSteps(state);
            var last = builder.apply(steps);

            if (steps.failed()) {
                return steps.current().propagate();
            }
            return Objects.requireNonNull(last, "sequence builder returned null")
                          .apply(steps.current());
        };
    }

    // === Alternation ===

    /**
     * Try alternatives in order, each against the state {@code or} started with. The first success wins.
     * When all fail, the last failure is returned with the errors of every alternative merged.
     */
    @SafeVarargs
    public static <T> Parser<T> or(Parser<T>... alternatives) {
        return or(Arrays.asList(alternatives));
    }

    public static <T> Parser<T> or(List<? extends Parser<T>> alternatives) {
        var choices = nonEmptyCopy(alternatives);

        if (choices.size() == 1) {
            return choices.get(0);
        }

        return state -> {
            ParseError errors = null;
            ParseState<T> attempt = null;

            for (var alternative : choices) {
                attempt = alternative.apply(state);
                if (attempt.succeeded()) {
                    return attempt;
                }
                errors = ParseError.merge(errors, attempt.error().orElseThrow());
            }
            return attempt.withError(errors);
        };
    }

    /**
     * Value of {@code parser} if it succeeds, otherwise {@link Optional#empty()} without consuming input.
     */
    public static <T> Parser<Optional<T>> maybe(Parser<T> parser) {
        Parser<Optional<T>> present = parser.map(Optional::ofNullable);
        return or(present, Primitives.value());
    }

    /**
     * Negative lookahead: succeeds with {@code true} when {@code parser} fails. Never consumes input.
     */
    public static Parser<Boolean> not(Parser<?> parser) {
        Objects.requireNonNull(parser, "parser");

        return state -> parser.apply(state).failed()
                        ? state.withValue(Boolean.TRUE)
                        : Primitives.<Boolean>fail("expected parser to fail").apply(state);
    }

    /**
     * {@code and(not(parser), next)}: succeeds only if {@code parser} fails and {@code next} succeeds.
     */
    public static <T> Parser<T> unless(Parser<?> parser, Parser<T> next) {
        return and(not(parser), next);
    }

    /**
     * {@code and(not(parser), leading..., last)} for longer chains.
     */
    public static <T> Parser<T> unless(Parser<?> parser, List<? extends Parser<?>> leading, Parser<T> last) {
        var chain = new ArrayList<Parser<?>>(leading.size() + 1);
        chain.add(not(parser));
        chain.addAll(leading);
        return and(chain, last);
    }

    // === Repetition ===

    /**
     * Apply {@code parser} until it fails and collect its values. Always succeeds; the resulting state
     * is the one left by the last successful application. Repetition also stops after an application
     * that succeeds without consuming input.
     */
    public static <T> Parser<List<T>> zeroOrMore(Parser<T> parser) {
        Objects.requireNonNull(parser, "parser");

        return state -> {
            var values = new ArrayList<T>();
            ParseState<?> last = state;

            while (true) {
                var next = parser.apply(last);
                if (next.failed()) {
                    break;
                }
                values.add(next.value());

                var progressed = next.offset() > last.offset();
                last = next;
                if (!progressed) {
                    break;
                }
            }
            return last.withValue(Collections.unmodifiableList(values));
        };
    }

    /**
     * Like {@link #zeroOrMore(Parser)}, but {@code parser} must succeed at least once.
     */
    public static <T> Parser<List<T>> oneOrMore(Parser<T> parser) {
        var rest = zeroOrMore(parser);
        return bind(parser, first -> rest.map(more -> prepend(first, more)));
    }

    /**
     * One {@code parser} match followed by any number of {@code separator parser} pairs.
     * The value is the list of {@code parser} values.
     */
    public static <T> Parser<List<T>> separatedBy(Parser<T> parser, Parser<?> separator) {
        Objects.requireNonNull(separator, "separator");

        Parser<T> separated = and(separator, parser);
        var rest = zeroOrMore(separated);
        return bind(parser, first -> rest.map(more -> prepend(first, more)));
    }

    // === Recursion ===

    /**
     * Parser created on first use. Allows recursive grammars to refer to parsers not built yet.
     */
    public static <T> Parser<T> lazy(Supplier<? extends Parser<T>> supplier) {
        return new LazyParser<>(Objects.requireNonNull(supplier, "supplier"));
    }

    // === Helpers ===

    private static <T> List<T> prepend(T first, List<T> rest) {
        var values = new ArrayList<T>(rest.size() + 1);
        values.add(first);
        values.addAll(rest);
        return Collections.unmodifiableList(values);
    }

    /**
     * Applies parsers in order, stopping at the first failed state.
     */
    private static ParseState<?> runAll(List<? extends Parser<?>> parsers, ParseState<?> state) {
        ParseState<?> current = state;
        for (var parser : parsers) {
            current = parser.apply(current);
            if (current.failed()) {
                break;
            }
        }
        return current;
    }

    private static <P extends Parser<?>> List<P> nonEmptyCopy(List<? extends P> parsers) {
        List<P> copy = copyOf(parsers);
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("At least one parser is required");
        }
        return copy;
    }

    private static <P extends Parser<?>> List<P> copyOf(List<? extends P> parsers) {
        Objects.requireNonNull(parsers, "parsers");
        var copy = new ArrayList<P>(parsers.size());
        for (var parser : parsers) {
            copy.add(Objects.requireNonNull(parser, "parser"));
        }
        return List.copyOf(copy);
    }

    /**
     * Per-application state of a sequence. Never shared between parser runs.
     */
    private static final class ThreadedSteps implements Steps {
        private ParseState<?> current;

        private ThreadedSteps(ParseState<?> initial) {
            this.current = initial;
        }

        ParseState<?> current() {
            return current;
        }

        @Override
        public <R> Step<R> run(Parser<R> parser) {
            if (current.failed()) {
                return new Step.Aborted<>(current.error().orElseThrow());
            }

            var next = parser.apply(current);
            current = next;

            return next.error()
                       .<Step<R>>map(Step.Aborted::new)
                       .orElseGet(() -> new Step.Completed<>(next.value()));
        }

        @Override
        public boolean failed() {
            return current.failed();
        }

        @Override
        public <T> Parser<T> abort() {
            return fail("sequence aborted");
        }
    }

    private static final class LazyParser<T> implements Parser<T> {
        private final Supplier<? extends Parser<T>> supplier;
        private volatile Parser<T> resolved;

        private LazyParser(Supplier<? extends Parser<T>> supplier) {
            this.supplier = supplier;
        }

        @Override
        public ParseState<T> apply(ParseState<?> state) {
            return resolve().apply(state);
        }

        private Parser<T> resolve() {
            var parser = resolved;
            if (parser == null) {
                synchronized (this) {
                    parser = resolved;
                    if (parser == null) {
                        parser = Objects.requireNonNull(supplier.get(), "lazy parser supplier returned null");
                        resolved = parser;
                    }
                }
            }
            return parser;
        }
    }
}
