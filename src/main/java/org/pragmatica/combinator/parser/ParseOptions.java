package org.pragmatica.combinator.parser;

/**
 * Parse options.
 *
 * @param throwOnError raise {@link org.pragmatica.combinator.error.ParseException} on failure instead of returning it
 * @param fileName     source name attached to positions, may be {@code null}
 * @param userState    initial user state, may be {@code null}
 */
public record ParseOptions(
    boolean throwOnError,
    String fileName,
    Object userState
) {
    public static final ParseOptions DEFAULT = new ParseOptions(
        true,
        null,
        null
    );

    public ParseOptions withThrowOnError(boolean throwOnError) {
        return new ParseOptions(throwOnError, fileName, userState);
    }

    public ParseOptions withFileName(String fileName) {
        return new ParseOptions(throwOnError, fileName, userState);
    }

    public ParseOptions withUserState(Object userState) {
        return new ParseOptions(throwOnError, fileName, userState);
    }
}
