package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// Records made only of keyword parameters, such as `sdef pos=0 0 0 erg=d1 par=n`.
public final class ParamOnlyGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new DataRules(cursor, record);
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        if (!rules.introduction(nodes, false)) {
            return null;
        }
        nodes.put("parameters", rules.mixedParameters(true));
        return new SyntaxNode("source", nodes);
    }
}
