package io.github.simbo1905.mcnp.input;

import java.util.Map;
import java.util.logging.Logger;

/// Chooses the grammar for a record from its block and, in the data block, from the prefix of
/// its classifier.
public final class Grammars {

    private static final Logger LOG = Logger.getLogger(Grammars.class.getName());

    private static final Map<String, RecordKind> DATA_KINDS = Map.of(
            "m", RecordKind.MATERIAL,
            "mt", RecordKind.THERMAL,
            "f", RecordKind.TALLY,
            "fm", RecordKind.TALLY,
            "fs", RecordKind.TALLY_SEGMENT,
            "sdef", RecordKind.PARAM_ONLY);

    private static final ClassifierGrammar CLASSIFIER = new ClassifierGrammar();

    private Grammars() {}

    public static RecordKind forRecord(InputRecord record) {
        if (record.isCommentOnly()) {
            return RecordKind.COMMENT;
        }
        if (record.isReadDirective()) {
            return RecordKind.READ;
        }
        return switch (record.blockType()) {
            case CELL -> RecordKind.CELL;
            case SURFACE -> RecordKind.SURFACE;
            case DATA -> dataKind(record);
        };
    }

    private static RecordKind dataKind(InputRecord record) {
        final var lexed = new Lexer(LexerProfile.DATA).lex(record.text());
        final SyntaxNode tree = CLASSIFIER.parse(new TokenCursor(lexed.tokens()), record);
        if (tree == null) {
            return RecordKind.DATA;
        }
        final String prefix = tree.get("classifier", ClassifierNode.class).prefixText();
        final RecordKind kind = DATA_KINDS.getOrDefault(prefix, RecordKind.DATA);
        StructuredLog.finer(LOG, "data_kind", "prefix", prefix, "kind", kind);
        return kind;
    }
}
