package io.github.simbo1905.mcnp.input;

import java.util.Map;

/// What a record is, which decides the grammar that parses it.
public enum RecordKind {
    /// Only comment lines, as found at the end of a block.
    COMMENT((cursor, record) -> {
        final PaddingNode padding = new CommonRules(cursor, record).padding();
        return padding == null ? null : new SyntaxNode("comment", Map.of("padding", padding));
    }),
    CELL(new CellGrammar()),
    SURFACE(new SurfaceGrammar()),
    /// A data record with no dedicated grammar.
    DATA(new DataGrammar()),
    MATERIAL(new MaterialGrammar()),
    THERMAL(new ThermalGrammar()),
    TALLY(new TallyGrammar(false)),
    TALLY_SEGMENT(new TallyGrammar(true)),
    PARAM_ONLY(new ParamOnlyGrammar()),
    READ(new ReadGrammar());

    private final Grammar grammar;

    RecordKind(Grammar grammar) {
        this.grammar = grammar;
    }

    public Grammar grammar() {
        return grammar;
    }
}
