package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;

/// `READ FILE=name [NOECHO]`: splices another file into the input.
public final class ReadGrammar implements Grammar {

    @Override
    public SyntaxNode parse(TokenCursor cursor, InputRecord record) {
        final var rules = new CommonRules(cursor, record);
        final PaddingNode start = rules.paddingOrEmpty();
        final Token keyword = cursor.peek();
        if (keyword == null || !keyword.is(TokenType.KEYWORD) || !keyword.textIs("read")) {
            return null;
        }
        cursor.next();
        final PaddingNode padding = rules.padding();
        if (padding == null) {
            return null;
        }
        ParametersNode parameters = rules.parameters(() -> {
            final SyntaxNode flag = flag(rules);
            return flag != null ? flag : rules.parameter(rules::fileName);
        });
        if (parameters == null) {
            return null;
        }
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.put("start_pad", start);
        nodes.put("keyword", new ValueNode(keyword.text(), ValueType.TEXT));
        nodes.put("padding", padding);
        nodes.put("parameters", parameters);
        return new SyntaxNode("read", nodes);
    }

    /// A bare switch such as `NOECHO`.
    private static SyntaxNode flag(CommonRules rules) {
        final Token token = rules.cursor.peek();
        if (token == null || !(token.is(TokenType.KEYWORD) || token.is(TokenType.TEXT))
                || !(token.textIs("noecho") || token.textIs("echo"))) {
            return null;
        }
        final ClassifierNode classifier = rules.classifierPhrase();
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.put("classifier", classifier);
        nodes.put("seperator", new PaddingNode());
        nodes.put("data", new ValueNode(null, ValueType.TEXT));
        return new SyntaxNode(classifier.prefixText(), nodes);
    }

    /// The name of the file a parsed read record points at.
    /// @throws IllegalArgumentException if the record names no file
    public static String fileName(SyntaxNode tree) {
        final ParametersNode parameters = tree.get("parameters", ParametersNode.class);
        final SyntaxNode file = parameters.get("file");
        if (file == null) {
            throw new IllegalArgumentException("READ without FILE=: " + tree.format());
        }
        return file.get("data", ValueNode.class).textValue();
    }
}
