package org.pragmatica.combinator.error;

/**
 * Built-in error type tags. Tags are plain strings, callers may use their own via
 * {@link org.pragmatica.combinator.parser.Primitives#fail(String, String)}.
 */
public final class ErrorType {
    private ErrorType() {}

    /**
     * Generic failure, the default tag.
     */
    public static final String FAILURE = "failure";

    /**
     * Input exhausted where a token was required.
     */
    public static final String EOF = "eof";

    /**
     * A specific construct (e.g. end of input) was required and not found.
     */
    public static final String EXPECTATION = "expectation";
}
