package io.github.simbo1905.mcnp.input;

import java.util.Objects;

/// A non-fatal advisory raised while reading or writing an input.
///
/// @param kind what happened
/// @param message human readable description
/// @param original the original text involved, may be empty
/// @param replacement the text that replaced it, may be empty
public record InputWarning(Kind kind, String message, String original, String replacement) {

    public enum Kind {
        /// A line was longer than the version allows and was cut.
        LINE_OVERRUN,
        /// A reformatted value is wider than the column it came from.
        LINE_EXPANSION,
        /// A record line was wrapped onto a continuation line on output.
        LINE_WRAPPED,
        /// Content after the data block was ignored.
        EXTRA_BLOCK,
        /// A malformed record was kept as raw text because check mode is on.
        DOWNGRADED_ERROR
    }

    public InputWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        original = original == null ? "" : original;
        replacement = replacement == null ? "" : replacement;
    }

    public static InputWarning of(Kind kind, String message) {
        return new InputWarning(kind, message, "", "");
    }
}
