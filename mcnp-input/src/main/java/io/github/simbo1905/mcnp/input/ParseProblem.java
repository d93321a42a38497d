package io.github.simbo1905.mcnp.input;

import java.util.Objects;

/// One queued grammar or lexical failure inside a record.
///
/// @param message what went wrong
/// @param token the offending token, or null when the record ended before the grammar was satisfied
/// @param line one based line within the record
/// @param column zero based column within that line
public record ParseProblem(String message, Token token, int line, int column) {

    public ParseProblem {
        Objects.requireNonNull(message, "message");
    }

    /// A problem caused by running out of tokens.
    public static ParseProblem prematureEnd(String message) {
        return new ParseProblem(message, null, 0, 0);
    }

    public static ParseProblem at(String message, Token token) {
        Objects.requireNonNull(token, "token");
        return new ParseProblem(message, token, token.line(), token.column());
    }
}
