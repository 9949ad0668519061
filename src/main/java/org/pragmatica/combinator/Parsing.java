package org.pragmatica.combinator;

import org.pragmatica.combinator.error.ParseException;
import org.pragmatica.combinator.parser.ParseOptions;
import org.pragmatica.combinator.parser.ParseOutcome;
import org.pragmatica.combinator.parser.ParseState;
import org.pragmatica.combinator.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for running parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var csvRow = Combinators.separatedBy(Characters.text(Characters.noneOf(",\n")), Characters.character(','));
 *
 * List<String> fields = Parsing.parse(csvRow, "a,b,c");
 *
 * var outcome = Parsing.builder(csvRow)
 *                      .fileName("data.csv")
 *                      .throwOnError(false)
 *                      .parse("a,b,c");
 * }</pre>
 *
 * <p>Parsing does not require the whole input to be consumed; end the grammar with
 * {@link org.pragmatica.combinator.parser.Primitives#eof()} for that.
 */
public final class Parsing {
    private static final Logger log = LoggerFactory.getLogger(Parsing.class);

    private Parsing() {}

    /**
     * Run {@code parser} on {@code input} and return its value.
     *
     * @throws ParseException if the parser fails
     */
    public static <T> T parse(Parser<T> parser, String input) {
        return parse(parser, input, ParseOptions.DEFAULT).value();
    }

    /**
     * Run {@code parser} on {@code input}.
     *
     * @return the outcome; a failure is returned only when {@link ParseOptions#throwOnError()} is off
     * @throws ParseException if the parser fails and {@link ParseOptions#throwOnError()} is on
     */
    public static <T> ParseOutcome<T> parse(Parser<T> parser, String input, ParseOptions options) {
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(options, "options");

        log.trace("Parsing {} characters of {}", input.length(), sourceName(options));

        var outcome = ParseOutcome.from(parser.apply(ParseState.initial(input, options)));

        if (outcome.isFailure()) {
            var error = outcome.error();
            log.debug("Parse of {} failed at {} [{}]: {}",
                      sourceName(options), error.position(), error.type(), error.messages());

            if (options.throwOnError()) {
                throw new ParseException(error);
            }
        } else {
            log.trace("Parse of {} succeeded", sourceName(options));
        }
        return outcome;
    }

    /**
     * Create a builder for parsing with custom options.
     */
    public static <T> Builder<T> builder(Parser<T> parser) {
        return new Builder<>(parser);
    }

    private static String sourceName(ParseOptions options) {
        return options.fileName() == null ? "<input>" : options.fileName();
    }

    public static final class Builder<T> {
        private final Parser<T> parser;
        private boolean throwOnError = false;
        private String fileName;
        private Object userState;

        private Builder(Parser<T> parser) {
            this.parser = Objects.requireNonNull(parser, "parser");
        }

        public Builder<T> throwOnError(boolean enabled) {
            this.throwOnError = enabled;
            return this;
        }

        public Builder<T> fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder<T> userState(Object userState) {
            this.userState = userState;
            return this;
        }

        public ParseOptions options() {
            return new ParseOptions(throwOnError, fileName, userState);
        }

        public ParseOutcome<T> parse(String input) {
            return Parsing.parse(parser, input, options());
        }
    }
}
