package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// Tallies and their companions: `f4:n 1 2 (3 4) T`, `fm4 (1 -1 -2)` and the segment form
/// `fs4 -1 -2 T C`.
///
/// The bins keep their parentheses as punctuation. The trailing `T` (total) and, for segments,
/// `C` (cumulative) flags are kept apart from the bins.
public final class TallyGrammar implements Grammar {

    private final boolean segment;

    public TallyGrammar(boolean segment) {
        this.segment = segment;
    }

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new DataRules(cursor, record);
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        if (!rules.introduction(nodes, false)) {
            return null;
        }
        final var bins = new ListNode("tally");
        int depth = 0;
        while (!cursor.atEnd()) {
            final Token token = cursor.peek();
            final boolean level = token.is(TokenType.PARTICLE_SPECIAL) && "<".equals(token.text());
            if (token.is(TokenType.LPAREN) || level || depth > 0 && token.is(TokenType.RPAREN)) {
                cursor.next();
                depth += token.is(TokenType.LPAREN) ? 1 : token.is(TokenType.RPAREN) ? -1 : 0;
                final var punctuation = new PaddingNode(token.text());
                final PaddingNode after = rules.padding();
                if (after != null) {
                    punctuation.appendAll(after);
                }
                bins.append(punctuation, true);
                continue;
            }
            if (!rules.sequenceItem(bins)) {
                break;
            }
        }
        if (depth != 0) {
            cursor.problem(cursor.stuck("Unbalanced parentheses in tally."));
        }
        nodes.put("tally", bins);
        final var end = new ListNode("tally end");
        ValueNode flag;
        while (end.nodes().size() < (segment ? 2 : 1)
                && (flag = segment
                        ? rules.phrase(ValueType.TEXT, TokenType.PARTICLE, TokenType.TEXT)
                        : rules.phrase(ValueType.TEXT, TokenType.PARTICLE)) != null) {
            end.append(flag, true);
        }
        nodes.put("end", end);
        return new SyntaxNode("tally", nodes);
    }
}
