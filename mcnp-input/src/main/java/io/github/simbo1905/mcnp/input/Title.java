package io.github.simbo1905.mcnp.input;

import java.util.Objects;

/// The one line problem title.
public record Title(String text) {

    public Title {
        Objects.requireNonNull(text, "text");
    }

    public String format(McnpVersion version) {
        return Message.cut(text, version.lineLength() - 1);
    }
}
