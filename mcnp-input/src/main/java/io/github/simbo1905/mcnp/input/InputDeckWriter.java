package io.github.simbo1905.mcnp.input;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Writes an [InputDeck] back out for one MCNP version: message, title, the cell block, a blank
/// line, the surface block, a blank line, then the data block.
public final class InputDeckWriter {

    private static final Logger LOG = Logger.getLogger(InputDeckWriter.class.getName());

    private final McnpVersion version;

    public InputDeckWriter(McnpVersion version) {
        this.version = Objects.requireNonNull(version, "version");
    }

    public List<String> lines(InputDeck deck) {
        final var out = new ArrayList<String>();
        deck.messageBlock().ifPresent(message -> out.addAll(message.format(version)));
        out.add(deck.title().format(version));
        append(out, deck.cells());
        out.add("");
        append(out, deck.surfaces());
        out.add("");
        append(out, deck.data());
        StructuredLog.fine(LOG, "deck_written", "lines", out.size(), "version", version);
        return out;
    }

    private void append(List<String> out, List<ParsedRecord> records) {
        for (ParsedRecord record : records) {
            out.addAll(record.format(version));
        }
    }

    /// The deck as text, each line ended by a newline.
    public String toText(InputDeck deck) {
        final var text = new StringBuilder();
        for (String line : lines(deck)) {
            text.append(line).append('\n');
        }
        return text.toString();
    }

    public void write(InputDeck deck, Writer writer) throws IOException {
        writer.write(toText(deck));
        writer.flush();
    }

    public void write(InputDeck deck, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(deck, writer);
        }
    }
}
