package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// `mN isotope fraction ... [parameters]`, e.g. `m1 1001.80c 2 8016.80c 1 nlib=80c`.
///
/// An isotope may be written with a library suffix (`1001.80c`) or as a bare number (`1001`).
public final class MaterialGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new DataRules(cursor, record);
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        if (!rules.introduction(nodes, false)) {
            return null;
        }
        final var isotopes = new IsotopesNode("isotope list");
        while (!cursor.atEnd()) {
            final int mark = cursor.mark();
            final ValueNode isotope = rules.phrase(ValueType.TEXT, TokenType.ZAID, TokenType.NUMBER);
            final ValueNode fraction = isotope == null ? null : rules.numericalPhrase();
            if (fraction == null) {
                cursor.reset(mark);
                break;
            }
            isotopes.append(isotope, fraction);
        }
        nodes.put("data", isotopes);
        final ParametersNode parameters = rules.parameters(() -> rules.parameter(rules::parameterValue));
        nodes.put("parameters", parameters == null ? new ParametersNode() : parameters);
        return new SyntaxNode("material", nodes);
    }
}
