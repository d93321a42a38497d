package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// Any data record without a dedicated grammar: `classifier [keyword] data [parameters]`.
///
/// The data is kept as a flat list of numbers, shortcuts, words and particles, so records the
/// library knows nothing about still round trip.
public final class DataGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new DataRules(cursor, record);
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        if (!rules.introduction(nodes, true)) {
            return null;
        }
        nodes.put("data", rules.mixedData("data", false));
        nodes.put("parameters", rules.mixedParameters(false));
        return new SyntaxNode("data", nodes);
    }
}
