package io.github.simbo1905.mcnp.input;

import java.util.Objects;

/// Settings for reading and writing one input deck.
///
/// - `version` decides the line length.
/// - `checkInput` downgrades malformed records to [InputWarning.Kind#DOWNGRADED_ERROR] warnings.
/// - `replaceNonAscii` replaces every character above [InputConstants#ASCII_CEILING] with a space.
public record InputOptions(McnpVersion version, boolean checkInput, boolean replaceNonAscii) {

    public InputOptions {
        Objects.requireNonNull(version, "version");
    }

    public static InputOptions defaults() {
        return new InputOptions(McnpVersion.fromSystemProperty(), false, true);
    }

    public InputOptions withVersion(McnpVersion newVersion) {
        return new InputOptions(newVersion, checkInput, replaceNonAscii);
    }

    public InputOptions withCheckInput(boolean check) {
        return new InputOptions(version, check, replaceNonAscii);
    }

    public InputOptions withReplaceNonAscii(boolean replace) {
        return new InputOptions(version, checkInput, replace);
    }
}
