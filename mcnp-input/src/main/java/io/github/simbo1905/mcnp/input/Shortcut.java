package io.github.simbo1905.mcnp.input;

import java.util.regex.Pattern;

/// The shorthand notations that stand in for runs of values.
public enum Shortcut {
    REPEAT("r", Pattern.compile("\\d*r", Pattern.CASE_INSENSITIVE)),
    JUMP("j", Pattern.compile("\\d*j", Pattern.CASE_INSENSITIVE)),
    INTERPOLATE("i", Pattern.compile("\\d*i", Pattern.CASE_INSENSITIVE)),
    LOG_INTERPOLATE("ilog", Pattern.compile("\\d*i?log", Pattern.CASE_INSENSITIVE)),
    MULTIPLY("m", Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:e?[+-]?\\d+)?m", Pattern.CASE_INSENSITIVE));

    private final String letter;
    private final Pattern word;

    Shortcut(String letter, Pattern word) {
        this.letter = letter;
        this.word = word;
    }

    /// The default letter(s) written when no original token gives a case to follow.
    public String letter() {
        return letter;
    }

    public boolean isInterpolate() {
        return this == INTERPOLATE || this == LOG_INTERPOLATE;
    }

    /// The shortcut a whole word spells, or null when the word is not a shortcut.
    public static Shortcut ofWord(String text) {
        for (Shortcut shortcut : values()) {
            if (shortcut.word.matcher(text).matches()) {
                return shortcut;
            }
        }
        return null;
    }
}
