package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// `mtN law ...`, e.g. `mt1 lwtr.10t`.
public final class ThermalGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new DataRules(cursor, record);
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        if (!rules.introduction(nodes, false)) {
            return null;
        }
        final var laws = new ListNode("thermal scatterings");
        ValueNode law;
        while ((law = rules.phrase(ValueType.TEXT, TokenType.THERMAL_LAW, TokenType.TEXT)) != null) {
            laws.append(law, true);
        }
        nodes.put("data", laws);
        return new SyntaxNode("thermal", nodes);
    }
}
