package io.github.simbo1905.mcnp.input;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/// One logical record: its physical lines after continuation joining, the block it belongs to
/// and where it came from.
///
/// @param lines the lines, trailing whitespace removed
/// @param blockType the block the record was read in
/// @param source the name of the file or stream
/// @param lineNumber one based number of the first line in the source
public record InputRecord(List<String> lines, BlockType blockType, String source, int lineNumber) {

    private static final Pattern READ = Pattern.compile("read(\\s.*)?", Pattern.DOTALL);

    public InputRecord {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        Objects.requireNonNull(blockType, "blockType");
        Objects.requireNonNull(source, "source");
    }

    /// A record made from text, for records built in code rather than read from a file.
    public static InputRecord of(BlockType blockType, String text) {
        return new InputRecord(List.of(text.split("\n", -1)), blockType, "<text>", 1);
    }

    /// The lines joined with newlines.
    public String text() {
        return String.join("\n", lines);
    }

    /// Whether every line is a `c` comment line.
    public boolean isCommentOnly() {
        return lines.stream().allMatch(CommentNode::isCommentLine);
    }

    /// Whether this record is a `READ` directive naming another file to splice in.
    public boolean isReadDirective() {
        for (String line : lines) {
            if (CommentNode.isCommentLine(line)) {
                continue;
            }
            return READ.matcher(line.strip().toLowerCase(Locale.ROOT)).matches();
        }
        return false;
    }
}
