package io.github.simbo1905.mcnp.input;

import java.util.Map;

import static io.github.simbo1905.mcnp.input.TokenType.ASTERISK;
import static io.github.simbo1905.mcnp.input.TokenType.FILE_PATH;
import static io.github.simbo1905.mcnp.input.TokenType.KEYWORD;
import static io.github.simbo1905.mcnp.input.TokenType.NUMBER_WORD;
import static io.github.simbo1905.mcnp.input.TokenType.PARTICLE;
import static io.github.simbo1905.mcnp.input.TokenType.PARTICLE_SPECIAL;
import static io.github.simbo1905.mcnp.input.TokenType.PLUS;
import static io.github.simbo1905.mcnp.input.TokenType.SURFACE_TYPE;
import static io.github.simbo1905.mcnp.input.TokenType.TEXT;
import static io.github.simbo1905.mcnp.input.TokenType.THERMAL_LAW;
import static io.github.simbo1905.mcnp.input.TokenType.ZAID;

/// Productions of data block records: the `classifier [keyword]` introduction and the mixed
/// lists of numbers, words and particles that follow it.
class DataRules extends CommonRules {

    DataRules(TokenCursor cursor, InputRecord record) {
        super(cursor, record);
    }

    /// Puts `start_pad`, `classifier` and `keyword` into `nodes`.
    /// @return false when the record does not start with a classifier
    boolean introduction(Map<String, SyntaxNodeBase> nodes, boolean allowKeyword) {
        final PaddingNode start = paddingOrEmpty();
        final ClassifierNode classifier = classifierPhrase();
        if (classifier == null) {
            return false;
        }
        nodes.put("start_pad", start);
        nodes.put("classifier", classifier);
        if (!allowKeyword) {
            return true;
        }
        final int mark = cursor.mark();
        final Token keyword = cursor.accept(KEYWORD);
        final PaddingNode after = keyword == null ? null : padding();
        if (keyword != null && after == null && !cursor.atEnd()) {
            cursor.reset(mark);
            nodes.put("keyword", new ValueNode(null, ValueType.TEXT));
        } else {
            nodes.put("keyword", keyword == null
                    ? new ValueNode(null, ValueType.TEXT)
                    : new ValueNode(keyword.text(), ValueType.TEXT, after));
        }
        return true;
    }

    /// Numbers, shortcuts, words and particles up to the first parameter.
    ListNode mixedData(String name, boolean stopAtKeyword) {
        final var list = new ListNode(name);
        while (!cursor.atEnd()) {
            if (parameterAhead() || stopAtKeyword && cursor.at(KEYWORD)) {
                break;
            }
            if (sequenceItem(list)) {
                continue;
            }
            final ValueNode word = phrase(ValueType.TEXT, TEXT, KEYWORD, PARTICLE, PARTICLE_SPECIAL, ZAID,
                    THERMAL_LAW, NUMBER_WORD, SURFACE_TYPE, FILE_PATH, ASTERISK, PLUS);
            if (word == null) {
                break;
            }
            list.append(word, true);
        }
        return list;
    }

    /// Parameters whose values are mixed data, e.g. `fmesh4:n geom=xyz origin=-10 -10 -10`.
    ParametersNode mixedParameters(boolean keywordsOnly) {
        final ParametersNode parameters = parameters(() -> {
            final Token first = cursor.peek();
            if (keywordsOnly && (first == null || !first.is(KEYWORD))) {
                return null;
            }
            return parameter(() -> {
                final ListNode values = mixedData("data", keywordsOnly);
                return values.nodes().isEmpty() ? null : values;
            });
        });
        return parameters == null ? new ParametersNode() : parameters;
    }
}
