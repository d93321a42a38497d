package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// `[padding] [*|+]number [transform] type numbers`, e.g. `*3 2 c/z 0 0 1.5`.
public final class SurfaceGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new CommonRules(cursor, record);
        final PaddingNode start = rules.paddingOrEmpty();
        final SyntaxNode surfaceNumber = surfaceNumber(rules);
        if (surfaceNumber == null) {
            return null;
        }
        ValueNode pointer = rules.identifierPhrase(false);
        if (pointer == null) {
            pointer = new ValueNode(null, ValueType.INTEGER);
        }
        final ValueNode type = rules.phrase(ValueType.TEXT, TokenType.SURFACE_TYPE);
        if (type == null) {
            return null;
        }
        ListNode data = rules.numberSequence();
        if (data == null) {
            data = new ListNode("number sequence");
        }
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.put("start_pad", start);
        nodes.put("surface_num", surfaceNumber);
        nodes.put("pointer", pointer);
        nodes.put("surface_type", type);
        nodes.put("data", data);
        return new SyntaxNode("surface", nodes);
    }

    private static SyntaxNode surfaceNumber(CommonRules rules) {
        final TokenCursor cursor = rules.cursor;
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        final Token modifier = cursor.acceptAny(TokenType.ASTERISK, TokenType.PLUS);
        final Token number = cursor.peek();
        if (modifier == null && number != null && number.is(TokenType.NUMBER) && number.text().startsWith("+")
                && FortranNumbers.parseInteger(number.text()).isPresent()) {
            cursor.next();
            nodes.put("modifier", new ValueNode("+", ValueType.TEXT));
            nodes.put("number", new ValueNode(number.text().substring(1), ValueType.INTEGER, rules.padding()));
            return new SyntaxNode("surface_number", nodes);
        }
        final ValueNode value = rules.identifierPhrase(false);
        if (value == null) {
            return null;
        }
        nodes.put("modifier", modifier == null
                ? new ValueNode(null, ValueType.TEXT)
                : new ValueNode(modifier.text(), ValueType.TEXT));
        nodes.put("number", value);
        return new SyntaxNode("surface_number", nodes);
    }
}
