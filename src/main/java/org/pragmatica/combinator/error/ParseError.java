package org.pragmatica.combinator.error;

import org.pragmatica.combinator.source.SourcePosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parse failure: position, accumulated messages and a type tag.
 *
 * <p>Example of {@link #format(String)} output:
 * <pre>
 * error[eof]: unexpected eof
 *   --> input.txt:2:3
 *    |
 *  2 | ab
 *    |   ^
 *    |
 * </pre>
 *
 * @param position where the failure was detected
 * @param messages failure messages, oldest first
 * @param type     classification tag, see {@link ErrorType}
 */
public record ParseError(SourcePosition position, List<String> messages, String type) {

    public ParseError {
        Objects.requireNonNull(position, "position");
        messages = List.copyOf(messages);
        type = type == null ? ErrorType.FAILURE : type;
    }

    public static ParseError of(SourcePosition position, String message, String type) {
        return new ParseError(position, List.of(message), type);
    }

    public static ParseError of(SourcePosition position, String message) {
        return of(position, message, ErrorType.FAILURE);
    }

    /**
     * An error without messages counts as no error when merging.
     */
    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Merge two errors. Either side may be {@code null}. If one side is absent or empty the other
     * one is returned as is. Otherwise messages are concatenated ({@code existing} first) and the
     * result takes position and type of {@code next}, the most recently produced error.
     */
    public static ParseError merge(ParseError existing, ParseError next) {
        if (existing == null || existing.isEmpty()) {
            return next == null ? existing : next;
        }
        if (next == null || next.isEmpty()) {
            return existing;
        }
        var merged = new ArrayList<String>(existing.messages.size() + next.messages.size());
        merged.addAll(existing.messages);
        merged.addAll(next.messages);
        return new ParseError(next.position, merged, next.type);
    }

    public ParseError merge(ParseError next) {
        return merge(this, next);
    }

    /**
     * Single line description, e.g. {@code "2:3: unexpected eof"}.
     */
    public String message() {
        return position + ": " + (messages.isEmpty() ? "parse error" : String.join(", ", messages));
    }

    /**
     * Format this error against the parsed source, pointing at the failing column.
     */
    public String format(String source) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var header = messages.isEmpty() ? "parse error" : messages.get(0);

        sb.append("error[").append(type).append("]: ").append(header).append("\n");
        sb.append("  --> ").append(position).append("\n");

        int gutterWidth = String.valueOf(position.line()).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");

        if (position.line() <= lines.length) {
            var lineContent = lines[position.line() - 1];
            sb.append(String.format("%" + gutterWidth + "d", position.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(gutter).append("| ")
              .append(" ".repeat(position.column() - 1))
              .append("^\n");
        }

        sb.append(gutter).append("|\n");

        for (int i = 1; i < messages.size(); i++) {
            sb.append(gutter).append("= ").append(messages.get(i)).append("\n");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return "ParseError[" + type + "] " + message();
    }
}
