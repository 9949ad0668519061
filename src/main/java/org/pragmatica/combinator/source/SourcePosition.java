package org.pragmatica.combinator.source;

import java.util.Optional;

/**
 * A position in source text (line and column, both 1-based) with an optional source name.
 * The offset counts input units consumed from the start of input.
 */
public record SourcePosition(String name, int line, int column, int offset) {

    public static final SourcePosition START = new SourcePosition(null, 1, 1, 0);

    public SourcePosition {
        if (line < 1 || column < 1 || offset < 0) {
            throw new IllegalArgumentException("Invalid position " + line + ":" + column + " at offset " + offset);
        }
    }

    public static SourcePosition start(String name) {
        return new SourcePosition(name, 1, 1, 0);
    }

    public static SourcePosition at(int line, int column, int offset) {
        return new SourcePosition(null, line, column, offset);
    }

    public Optional<String> sourceName() {
        return Optional.ofNullable(name);
    }

    /**
     * Position after consuming {@code unit}.
     */
    public SourcePosition advance(char unit) {
        return unit == '\n'
               ? new SourcePosition(name, line + 1, 1, offset + 1)
               : new SourcePosition(name, line, column + 1, offset + 1);
    }

    @Override
    public String toString() {
        return name == null
               ? line + ":" + column
               : name + ":" + line + ":" + column;
    }
}
