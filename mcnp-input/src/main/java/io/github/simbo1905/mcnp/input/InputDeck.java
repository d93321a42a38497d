package io.github.simbo1905.mcnp.input;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A whole input: the optional message, the title and the parsed records of each block, with the
/// warnings raised while reading them.
///
/// @param message the `MESSAGE:` block, or null when the input has none
/// @param title the title line
/// @param cells records of the cell block
/// @param surfaces records of the surface block
/// @param data records of the data block
/// @param warnings every warning raised while the deck was read
public record InputDeck(Message message, Title title, List<ParsedRecord> cells, List<ParsedRecord> surfaces,
                        List<ParsedRecord> data, List<InputWarning> warnings) {

    public InputDeck {
        Objects.requireNonNull(title, "title");
        cells = List.copyOf(cells);
        surfaces = List.copyOf(surfaces);
        data = List.copyOf(data);
        warnings = List.copyOf(warnings);
    }

    public Optional<Message> messageBlock() {
        return Optional.ofNullable(message);
    }

    public List<ParsedRecord> records(BlockType block) {
        switch (block) {
            case CELL:
                return cells;
            case SURFACE:
                return surfaces;
            default:
                return data;
        }
    }
}
