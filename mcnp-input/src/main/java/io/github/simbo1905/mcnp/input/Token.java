package io.github.simbo1905.mcnp.input;

import java.util.Objects;

/// One classified lexeme of a record.
///
/// @param type the token class
/// @param text the source text, case preserved
/// @param offset offset of the first character in the record text
/// @param line one based line within the record
/// @param column zero based column within that line
public record Token(TokenType type, String text, int offset, int line, int column) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenType wanted) {
        return type == wanted;
    }

    /// Case insensitive comparison of the source text.
    public boolean textIs(String wanted) {
        return text.equalsIgnoreCase(wanted);
    }
}
