package io.github.simbo1905.mcnp.input;

/// Classes of lexeme produced by the [Lexer].
public enum TokenType {
    SPACE,
    COMMENT,
    DOLLAR_COMMENT,
    SOURCE_COMMENT,
    TALLY_COMMENT,
    NUMBER,
    /// A number whose value is exactly zero.
    NULL,
    ZAID,
    THERMAL_LAW,
    /// Digits followed by letters that are not a shortcut, e.g. the `80c` of `nlib=80c`.
    NUMBER_WORD,
    TEXT,
    KEYWORD,
    PARTICLE,
    PARTICLE_SPECIAL,
    SURFACE_TYPE,
    FILE_PATH,
    REPEAT,
    NUM_REPEAT,
    JUMP,
    NUM_JUMP,
    INTERPOLATE,
    NUM_INTERPOLATE,
    LOG_INTERPOLATE,
    NUM_LOG_INTERPOLATE,
    NUM_MULTIPLY,
    LPAREN,
    RPAREN,
    COLON,
    AMPERSAND,
    COMPLEMENT,
    EQUALS,
    ASTERISK,
    PLUS,
    COMMA;

    /// Layout tokens that become [PaddingNode] content.
    public boolean isPadding() {
        return this == SPACE || this == COMMENT || this == DOLLAR_COMMENT;
    }

    public boolean isComment() {
        return this == COMMENT || this == DOLLAR_COMMENT;
    }

    /// The shortcut this token spells, or null.
    public Shortcut shortcut() {
        switch (this) {
            case REPEAT:
            case NUM_REPEAT:
                return Shortcut.REPEAT;
            case JUMP:
            case NUM_JUMP:
                return Shortcut.JUMP;
            case INTERPOLATE:
            case NUM_INTERPOLATE:
                return Shortcut.INTERPOLATE;
            case LOG_INTERPOLATE:
            case NUM_LOG_INTERPOLATE:
                return Shortcut.LOG_INTERPOLATE;
            case NUM_MULTIPLY:
                return Shortcut.MULTIPLY;
            default:
                return null;
        }
    }

    static TokenType ofShortcut(Shortcut shortcut, boolean counted) {
        return switch (shortcut) {
            case REPEAT -> counted ? NUM_REPEAT : REPEAT;
            case JUMP -> counted ? NUM_JUMP : JUMP;
            case INTERPOLATE -> counted ? NUM_INTERPOLATE : INTERPOLATE;
            case LOG_INTERPOLATE -> counted ? NUM_LOG_INTERPOLATE : LOG_INTERPOLATE;
            case MULTIPLY -> NUM_MULTIPLY;
        };
    }
}
