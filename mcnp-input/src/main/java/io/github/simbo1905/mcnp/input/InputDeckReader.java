package io.github.simbo1905.mcnp.input;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads an input into an [InputDeck].
///
/// By default the first record that does not parse stops the read. With
/// [InputOptions#checkInput()] set, a malformed record is kept as raw text and reported as a
/// [InputWarning.Kind#DOWNGRADED_ERROR] warning instead. [UnsupportedFeatureException] always
/// stops the read.
public final class InputDeckReader {

    private static final Logger LOG = Logger.getLogger(InputDeckReader.class.getName());

    private final InputOptions options;
    private final RecordParser parser = new RecordParser();

    public InputDeckReader(InputOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public InputDeckReader() {
        this(InputOptions.defaults());
    }

    /// @throws IOException if the file, or a file it reads in, cannot be read
    public InputDeck read(Path path) throws IOException {
        return read(InputFile.of(path));
    }

    /// Reads text held in memory under `name`.
    public InputDeck read(String name, String text) {
        try {
            return read(InputFile.ofText(name, text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// @throws IOException if the file, or a file it reads in, cannot be read
    public InputDeck read(InputFile file) throws IOException {
        final InputWarnings.Captured<InputDeck> captured;
        try {
            captured = InputWarnings.capture(() -> {
                try {
                    return readRecords(file);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        final var partial = captured.value();
        final var deck = new InputDeck(partial.message(), partial.title(), partial.cells(), partial.surfaces(),
                partial.data(), captured.warnings());
        StructuredLog.fine(LOG, "deck_read", "source", file.name(), "cells", deck.cells().size(),
                "surfaces", deck.surfaces().size(), "data", deck.data().size(), "warnings", deck.warnings().size());
        return deck;
    }

    private InputDeck readRecords(InputFile file) throws IOException {
        final var reader = new BlockReader(file, options);
        final Map<BlockType, List<ParsedRecord>> blocks = new EnumMap<>(BlockType.class);
        for (BlockType block : BlockType.values()) {
            blocks.put(block, new ArrayList<>());
        }
        while (reader.hasNext()) {
            final InputRecord record = reader.next();
            blocks.get(record.blockType()).add(parse(record));
        }
        return new InputDeck(reader.message().orElse(null), reader.title(), blocks.get(BlockType.CELL),
                blocks.get(BlockType.SURFACE), blocks.get(BlockType.DATA), List.of());
    }

    private ParsedRecord parse(InputRecord record) {
        try {
            return parser.parse(record);
        } catch (MalformedInputException e) {
            if (!options.checkInput()) {
                throw e;
            }
            InputWarnings.warn(new InputWarning(InputWarning.Kind.DOWNGRADED_ERROR, e.getMessage(),
                    record.text(), record.text()));
            return ParsedRecord.raw(record);
        }
    }
}
