package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// `[padding] number material geometry [parameters]`, e.g. `10 1 -2.7 -1 2 imp:n=1`.
///
/// The material is either `0` for void, or a material number followed by its density.
public final class CellGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new GeometryRules(cursor, record);
        final PaddingNode start = rules.paddingOrEmpty();
        final ValueNode number = rules.identifierPhrase(false);
        if (number == null) {
            return null;
        }
        final Token next = cursor.peek();
        if (next != null && next.is(TokenType.KEYWORD) && next.textIs("like")) {
            throw new UnsupportedFeatureException("The LIKE n BUT feature is not supported: " + record.text());
        }
        final SyntaxNode material = material(rules);
        if (material == null) {
            return null;
        }
        final GeometryTree geometry = rules.geometry();
        if (geometry == null) {
            return null;
        }
        ParametersNode parameters = rules.parameters(() -> rules.parameter(() -> {
            final ListNode numbers = rules.parentheticalSequence();
            return numbers != null ? numbers : rules.textPhrase();
        }));
        if (parameters == null) {
            parameters = new ParametersNode();
        }
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.put("start_pad", start);
        nodes.put("cell_num", number);
        nodes.put("material", material);
        nodes.put("geometry", geometry);
        nodes.put("parameters", parameters);
        return new SyntaxNode("cell", nodes);
    }

    private static SyntaxNode material(GeometryRules rules) {
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        final ValueNode voidMaterial = rules.phrase(ValueType.INTEGER, TokenType.NULL);
        if (voidMaterial != null) {
            nodes.put("mat_number", voidMaterial);
            nodes.put("density", new ValueNode(null, ValueType.REAL));
            return new SyntaxNode("material", nodes);
        }
        final int mark = rules.cursor.mark();
        final ValueNode number = rules.identifierPhrase(false);
        final ValueNode density = number == null ? null : rules.numericalPhrase();
        if (density == null) {
            rules.cursor.reset(mark);
            return null;
        }
        nodes.put("mat_number", number);
        nodes.put("density", density);
        return new SyntaxNode("material", nodes);
    }
}
