package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// Reads only the leading classifier of a data record. Used to decide which grammar parses the
/// rest; the tokens after the classifier are left alone.
public final class ClassifierGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new CommonRules(cursor, record);
        final PaddingNode start = rules.paddingOrEmpty();
        final ClassifierNode classifier = rules.classifier();
        if (classifier == null) {
            return null;
        }
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.put("start_pad", start);
        nodes.put("classifier", classifier);
        return new SyntaxNode("data input classifier", nodes);
    }
}
