package io.github.simbo1905.mcnp.input;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Reads the physical lines of an input into records, one block after another.
///
/// The optional message and the title are read when the reader is created. Records are then
/// produced lazily. A blank line ends a block; anything after the third block is ignored with a
/// warning. A line starts a new record when one of its first five columns is used, the previous
/// line did not end with ` &`, it is not a comment and the record so far holds more than comments.
///
/// `READ FILE=name` records are not returned. The named file is read after the file that named
/// it is finished, starting in the block the directive was in; files it names are read in turn
/// before the next sibling.
public final class BlockReader implements Iterator<InputRecord> {

    private static final Logger LOG = Logger.getLogger(BlockReader.class.getName());

    private final InputOptions options;
    private final int width;
    private final RecordParser parser = new RecordParser();
    private final Deque<Source> stack = new ArrayDeque<>();
    private Message message;
    private Title title;
    private InputRecord next;

    /// @throws IOException if the file cannot be read
    public BlockReader(InputFile file, InputOptions options) throws IOException {
        Objects.requireNonNull(file, "file");
        this.options = Objects.requireNonNull(options, "options");
        this.width = options.version().lineLength();
        final List<String> lines = file.readLines(options.replaceNonAscii());
        final int start = readFrontMatter(lines);
        stack.push(new Source(file, lines, start, BlockType.CELL));
        StructuredLog.fine(LOG, "input_opened", "source", file.name(), "lines", lines.size(),
                "message", message != null, "version", options.version());
    }

    private int readFrontMatter(List<String> lines) {
        int i = 0;
        if (!lines.isEmpty() && lines.get(0).toUpperCase(Locale.ROOT).startsWith("MESSAGE:")) {
            final var body = new ArrayList<String>();
            final String first = lines.get(0).substring("MESSAGE:".length());
            body.add(first.startsWith(" ") ? first.substring(1) : first);
            i = 1;
            while (i < lines.size() && !lines.get(i).isBlank()) {
                body.add(lines.get(i).stripTrailing());
                i++;
            }
            i++;
            message = new Message(body);
        }
        if (i < lines.size()) {
            title = new Title(lines.get(i).stripTrailing());
            i++;
        } else {
            title = new Title("");
        }
        return i;
    }

    public Optional<Message> message() {
        return Optional.ofNullable(message);
    }

    public Title title() {
        return title;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    /// @throws UncheckedIOException if an included file cannot be read
    /// @throws UnsupportedFeatureException for the vertical input format
    @Override
    public InputRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final InputRecord record = next;
        next = null;
        return record;
    }

    private InputRecord advance() {
        while (!stack.isEmpty()) {
            final Source source = stack.peek();
            final InputRecord record = source.nextRecord();
            if (record == null) {
                final InputRecord directive = source.pending.poll();
                if (directive == null) {
                    stack.pop();
                } else {
                    stack.push(open(source, directive));
                }
                continue;
            }
            if (record.isReadDirective()) {
                source.pending.add(record);
                continue;
            }
            return record;
        }
        return null;
    }

    private Source open(Source parent, InputRecord directive) {
        final ParsedRecord parsed = parser.parse(directive, RecordKind.READ);
        final String fileName = ReadGrammar.fileName(parsed.tree());
        final InputFile file = parent.file.include(fileName);
        if (parent.file.includedFrom(file.path())) {
            throw new MalformedInputException(directive, "The file " + fileName + " includes itself.");
        }
        StructuredLog.fine(LOG, "read_file", "file", file.name(), "from", parent.file.name(),
                "block", directive.blockType());
        try {
            return new Source(file, file.readLines(options.replaceNonAscii()), 0, directive.blockType());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file.name() + " named in " + directive.source()
                    + ", line " + directive.lineNumber(), e);
        }
    }

    /// Reading state of one file.
    private final class Source {
        private final InputFile file;
        private final List<String> lines;
        private final Deque<InputRecord> pending = new ArrayDeque<>();
        private final List<String> current = new ArrayList<>();
        private int index;
        private int blockCounter;
        private BlockType block;
        private int currentStart;
        private boolean continueInput;
        private boolean hasNonComments;
        private boolean extraWarned;

        Source(InputFile file, List<String> lines, int start, BlockType block) {
            this.file = file;
            this.lines = lines;
            this.index = start;
            this.block = block;
            this.blockCounter = block.ordinal();
        }

        InputRecord nextRecord() {
            while (index < lines.size()) {
                final int lineNumber = index + 1;
                String line = lines.get(index++);
                if (line.isBlank()) {
                    final InputRecord record = flush();
                    endBlock();
                    if (record != null) {
                        return record;
                    }
                    continue;
                }
                if (blockCounter >= BlockType.values().length) {
                    if (!extraWarned) {
                        extraWarned = true;
                        InputWarnings.warn(new InputWarning(InputWarning.Kind.EXTRA_BLOCK,
                                "Content after the data block of " + file.name() + " at line " + lineNumber
                                        + " was ignored.", line, ""));
                    }
                    continue;
                }
                final boolean comment = CommentNode.isCommentLine(line);
                final String head = line.substring(0, Math.min(line.length(), InputConstants.CONTINUE_INDENT));
                InputRecord record = null;
                if (!head.isBlank() && !continueInput && !comment && hasNonComments && !current.isEmpty()) {
                    record = flush();
                }
                if (!comment && head.contains("#")) {
                    throw new UnsupportedFeatureException("Vertical Input format is not allowed: "
                            + file.name() + ", line " + lineNumber);
                }
                line = truncate(line, comment);
                final String trimmed = line.stripTrailing();
                continueInput = trimmed.endsWith(" &");
                hasNonComments = hasNonComments || !comment;
                if (current.isEmpty()) {
                    currentStart = lineNumber;
                }
                current.add(trimmed);
                if (record != null) {
                    return record;
                }
            }
            final InputRecord record = flush();
            if (record == null && index == lines.size()) {
                index++;
                StructuredLog.fine(LOG, "input_finished", "source", file.name(), "block", block);
            }
            return record;
        }

        private void endBlock() {
            blockCounter++;
            hasNonComments = false;
            if (blockCounter < BlockType.values().length) {
                block = BlockType.values()[blockCounter];
            }
            StructuredLog.fine(LOG, "block_end", "source", file.name(), "blocks", blockCounter);
        }

        private String truncate(String line, boolean comment) {
            if (line.length() <= width || comment) {
                return line;
            }
            final int dollar = line.indexOf('$');
            if (dollar >= 0 && dollar < width) {
                return line;
            }
            final String cut = line.substring(0, width);
            InputWarnings.warn(new InputWarning(InputWarning.Kind.LINE_OVERRUN,
                    "The line exceeded the allowed line length of " + width + " for MCNP " + options.version()
                            + " in " + file.name() + ".", line, cut));
            return cut;
        }

        private InputRecord flush() {
            if (current.isEmpty()) {
                return null;
            }
            final var record = new InputRecord(current, block, file.name(), currentStart);
            current.clear();
            continueInput = false;
            StructuredLog.finer(LOG, "record_read", "source", file.name(), "line", record.lineNumber(),
                    "block", record.blockType(), "lines", record.lines().size());
            return record;
        }
    }
}
