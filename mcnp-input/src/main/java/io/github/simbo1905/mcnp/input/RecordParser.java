package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Lexes and parses single records.
///
/// Lexical problems and the point where the grammar got stuck are collected; the record is
/// accepted only when none were found.
public final class RecordParser {

    private static final Logger LOG = Logger.getLogger(RecordParser.class.getName());

    /// Parses a record with the grammar [Grammars#forRecord] picks.
    /// @throws ParsingException if the record does not match its grammar
    /// @throws MalformedInputException if it matches but breaks a local rule, e.g. a duplicate parameter
    /// @throws UnsupportedFeatureException for recognised syntax that is not supported
    public ParsedRecord parse(InputRecord record) {
        return parse(record, Grammars.forRecord(record));
    }

    public ParsedRecord parse(InputRecord record, RecordKind kind) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(kind, "kind");
        final var lexed = new Lexer(LexerProfile.forBlock(record.blockType())).lex(record.text());
        final var cursor = new TokenCursor(lexed.tokens());
        final SyntaxNode tree = kind.grammar().parse(cursor, record);
        final var problems = new ArrayList<>(lexed.problems());
        problems.addAll(cursor.problems());
        if (tree == null || !cursor.atEnd()) {
            problems.add(cursor.stuck("The " + kind.name().toLowerCase(Locale.ROOT).replace('_', ' ')
                    + " record does not follow its syntax."));
        }
        if (!problems.isEmpty()) {
            StructuredLog.fine(LOG, "record_rejected", "kind", kind, "source", record.source(),
                    "line", record.lineNumber(), "problems", problems.size());
            final String block = record.blockType().name().toLowerCase(Locale.ROOT);
            throw new ParsingException(record, "Error parsing the " + block + " block input.", problems);
        }
        StructuredLog.fine(LOG, "record_parsed", "kind", kind, "source", record.source(), "line", record.lineNumber());
        return new ParsedRecord(record, kind, tree);
    }
}
