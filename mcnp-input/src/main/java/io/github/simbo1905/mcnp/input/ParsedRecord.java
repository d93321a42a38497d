package io.github.simbo1905.mcnp.input;

import java.util.List;
import java.util.Objects;

/// A record with the syntax tree its grammar built.
///
/// A record kept as raw text, because it failed to parse while errors were being downgraded, has
/// no tree and is written back exactly as read.
///
/// @param record the source record
/// @param kind the grammar used, null for a raw record
/// @param tree the syntax tree, null for a raw record
public record ParsedRecord(InputRecord record, RecordKind kind, SyntaxNode tree) {

    public ParsedRecord {
        Objects.requireNonNull(record, "record");
        if ((kind == null) != (tree == null)) {
            throw new IllegalArgumentException("kind and tree must both be set or both be null");
        }
    }

    /// A record that is kept but not understood.
    public static ParsedRecord raw(InputRecord record) {
        return new ParsedRecord(record, null, null);
    }

    public boolean isRaw() {
        return tree == null;
    }

    /// The output lines for `version`: the tree's text with dangling `$` comments closed off, then
    /// wrapped to the version's line length.
    public List<String> format(McnpVersion version) {
        if (tree == null) {
            return record.lines();
        }
        tree.checkForGraveyardComments(false);
        return LineWrapper.wrap(tree.format(), version);
    }
}
