package io.github.simbo1905.mcnp.input;

/// Fixed layout constants of the card format.
public final class InputConstants {

    /// Tab stops are expanded to this many columns before a line is read.
    public static final int TAB_SIZE = 8;

    /// Columns 1-5 decide whether a line starts a new record; continuation lines are indented this far.
    public static final int CONTINUE_INDENT = 5;

    /// Highest code point accepted verbatim when non-ASCII replacement is on.
    public static final int ASCII_CEILING = 127;

    private InputConstants() {}
}
