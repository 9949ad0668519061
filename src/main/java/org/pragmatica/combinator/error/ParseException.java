package org.pragmatica.combinator.error;

/**
 * Raised by the entry point when a parse fails and the caller asked for errors to be thrown.
 */
public final class ParseException extends RuntimeException {

    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
