package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The optional `MESSAGE:` block at the top of an input: command line options for the code.
///
/// @param lines the message text; the first line without its `MESSAGE:` prefix
public record Message(List<String> lines) {

    public static final String PREFIX = "MESSAGE: ";

    public Message {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
    }

    /// The block as written: the prefixed first line, the other lines, then the closing blank line.
    public List<String> format(McnpVersion version) {
        final int width = version.lineLength();
        final var out = new ArrayList<String>();
        for (int i = 0; i < lines.size(); i++) {
            out.add(i == 0
                    ? PREFIX + cut(lines.get(0), width - 10)
                    : cut(lines.get(i), width - 1));
        }
        if (lines.isEmpty()) {
            out.add(PREFIX.strip());
        }
        out.add("");
        return out;
    }

    static String cut(String text, int width) {
        return text.length() <= width ? text : text.substring(0, width);
    }
}
