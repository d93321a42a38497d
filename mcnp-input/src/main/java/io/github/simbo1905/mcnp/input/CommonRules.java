package io.github.simbo1905.mcnp.input;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static io.github.simbo1905.mcnp.input.TokenType.AMPERSAND;
import static io.github.simbo1905.mcnp.input.TokenType.ASTERISK;
import static io.github.simbo1905.mcnp.input.TokenType.COLON;
import static io.github.simbo1905.mcnp.input.TokenType.COMMA;
import static io.github.simbo1905.mcnp.input.TokenType.COMMENT;
import static io.github.simbo1905.mcnp.input.TokenType.COMPLEMENT;
import static io.github.simbo1905.mcnp.input.TokenType.DOLLAR_COMMENT;
import static io.github.simbo1905.mcnp.input.TokenType.EQUALS;
import static io.github.simbo1905.mcnp.input.TokenType.KEYWORD;
import static io.github.simbo1905.mcnp.input.TokenType.NULL;
import static io.github.simbo1905.mcnp.input.TokenType.NUMBER;
import static io.github.simbo1905.mcnp.input.TokenType.NUMBER_WORD;
import static io.github.simbo1905.mcnp.input.TokenType.PARTICLE;
import static io.github.simbo1905.mcnp.input.TokenType.PARTICLE_SPECIAL;
import static io.github.simbo1905.mcnp.input.TokenType.PLUS;
import static io.github.simbo1905.mcnp.input.TokenType.SOURCE_COMMENT;
import static io.github.simbo1905.mcnp.input.TokenType.SPACE;
import static io.github.simbo1905.mcnp.input.TokenType.TALLY_COMMENT;
import static io.github.simbo1905.mcnp.input.TokenType.TEXT;
import static io.github.simbo1905.mcnp.input.TokenType.THERMAL_LAW;
import static io.github.simbo1905.mcnp.input.TokenType.ZAID;

/// Productions shared by every record grammar: padding, phrases, number sequences with their
/// shortcuts, classifiers, particle lists and parameters.
///
/// A rule either consumes its tokens and returns a node, or leaves the cursor where it was and
/// returns null. Problems that do not stop the parse, such as a repeat with nothing to repeat,
/// are queued on the cursor.
class CommonRules {

    private static final Logger LOG = Logger.getLogger(CommonRules.class.getName());

    protected final TokenCursor cursor;
    protected final InputRecord record;
    private Token lastPrefix;

    CommonRules(TokenCursor cursor, InputRecord record) {
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.record = record;
    }

    /// Whitespace, comments and `&` continuation marks. A run cannot begin with `&`.
    PaddingNode padding() {
        if (!cursor.atAny(SPACE, COMMENT, DOLLAR_COMMENT)) {
            return null;
        }
        final var padding = new PaddingNode();
        Token token;
        while ((token = cursor.acceptAny(SPACE, COMMENT, DOLLAR_COMMENT, AMPERSAND)) != null) {
            padding.append(token.text(), token.type().isComment());
        }
        return padding;
    }

    /// Padding, or an empty node where there is none.
    PaddingNode paddingOrEmpty() {
        final PaddingNode padding = padding();
        return padding == null ? new PaddingNode() : padding;
    }

    ValueNode phrase(ValueType type, TokenType... types) {
        final Token token = cursor.acceptAny(types);
        if (token == null) {
            return null;
        }
        return new ValueNode(token.text(), type, padding());
    }

    /// A non zero number as a real.
    ValueNode numberPhrase() {
        return phrase(ValueType.REAL, NUMBER);
    }

    /// Any number, zero included, as a real.
    ValueNode numericalPhrase() {
        return phrase(ValueType.REAL, NUMBER, NULL);
    }

    /// A whole number such as a cell or surface number. Zero is accepted when `allowZero` is set.
    ValueNode identifierPhrase(boolean allowZero) {
        final Token token = cursor.peek();
        if (token == null || !(token.is(NUMBER) || allowZero && token.is(NULL))
                || FortranNumbers.parseInteger(token.text()).isEmpty()) {
            return null;
        }
        cursor.next();
        return new ValueNode(token.text(), ValueType.INTEGER, padding());
    }

    ValueNode textPhrase() {
        return phrase(ValueType.TEXT, TEXT, NUMBER_WORD, ZAID, THERMAL_LAW);
    }

    /// Numbers and shortcuts, e.g. `1 2 3R 4 2I 7 J`.
    ListNode numberSequence() {
        final var list = new ListNode("number sequence");
        while (sequenceItem(list)) {
            // each item appends itself
        }
        return list.nodes().isEmpty() ? null : list;
    }

    /// Appends the next number or shortcut to `list`.
    /// @return false when the next token starts neither
    boolean sequenceItem(ListNode list) {
        final Token token = cursor.peek();
        if (token == null) {
            return false;
        }
        final Shortcut shortcut = token.type().shortcut();
        if (shortcut == Shortcut.JUMP) {
            cursor.next();
            final ShortcutNode jump = ShortcutNode.jump(token.text());
            jump.setEndPadding(padding());
            list.append(jump, true);
            return true;
        }
        if (shortcut != null) {
            cursor.next();
            shortcut(list, token, shortcut);
            return true;
        }
        final ValueNode value = numericalPhrase();
        if (value == null) {
            return false;
        }
        list.append(value, true);
        return true;
    }

    private void shortcut(ListNode list, Token token, Shortcut type) {
        final List<SyntaxNodeBase> nodes = list.nodes();
        final SyntaxNodeBase last = nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
        final SyntaxNodeBase start = last instanceof PaddingNode ? null : last;
        try {
            final ShortcutNode node;
            switch (type) {
                case REPEAT:
                    node = ShortcutNode.repeat(token.text(), start);
                    node.setEndPadding(padding());
                    break;
                case MULTIPLY:
                    node = ShortcutNode.multiply(token.text(), start);
                    node.setEndPadding(padding());
                    break;
                default:
                    final PaddingNode middle = paddingOrEmpty();
                    final ValueNode end = numericalPhrase();
                    if (end == null) {
                        cursor.problem(ParseProblem.at("Interpolate requires a value after it.", token));
                        return;
                    }
                    node = ShortcutNode.interpolate(token.text(), start, middle, end, false);
                    break;
            }
            if (start instanceof ValueNode) {
                list.remove(start);
            }
            list.append(node, true);
            StructuredLog.finer(LOG, "shortcut_parsed", "word", token.text(), "members", node.members().size());
        } catch (IllegalArgumentException e) {
            cursor.problem(ParseProblem.at(e.getMessage(), token));
        }
    }

    /// `[*] prefix [number] [:particles]`, e.g. `*tr2`, `imp:n,p` or `f4:n`.
    ClassifierNode classifier() {
        final int mark = cursor.mark();
        final var node = new ClassifierNode();
        final Token modifier = cursor.peek();
        if (modifier != null && (modifier.is(ASTERISK) || modifier.is(PLUS)
                || modifier.is(PARTICLE_SPECIAL) && ("*".equals(modifier.text()) || "+".equals(modifier.text())))) {
            cursor.next();
            node.setModifier(new ValueNode(modifier.text(), ValueType.TEXT));
        }
        final Token prefix = cursor.acceptAny(TEXT, KEYWORD, PARTICLE, SOURCE_COMMENT, TALLY_COMMENT);
        if (prefix == null) {
            cursor.reset(mark);
            return null;
        }
        lastPrefix = prefix;
        node.setPrefix(new ValueNode(prefix.text(), ValueType.TEXT));
        final Token number = cursor.peek();
        if (number != null && (number.is(NUMBER) || number.is(NULL))
                && FortranNumbers.parseInteger(number.text()).isPresent()) {
            cursor.next();
            node.setNumber(new ValueNode(number.text(), ValueType.INTEGER));
        }
        if (cursor.at(COLON)) {
            node.setParticles(particles());
        }
        return node;
    }

    /// The token that started the last classifier this rule set read.
    Token lastPrefix() {
        return lastPrefix;
    }

    /// A classifier with the padding after it.
    ClassifierNode classifierPhrase() {
        final ClassifierNode node = classifier();
        if (node != null) {
            node.setPadding(padding());
        }
        return node;
    }

    private ParticleNode particles() {
        final int mark = cursor.mark();
        final var text = new StringBuilder(cursor.next().text());
        Token part = particle();
        if (part == null) {
            cursor.reset(mark);
            return null;
        }
        text.append(part.text());
        while (cursor.at(COMMA)) {
            final int beforeComma = cursor.mark();
            final Token comma = cursor.next();
            part = particle();
            if (part == null) {
                cursor.reset(beforeComma);
                break;
            }
            text.append(comma.text()).append(part.text());
        }
        try {
            return new ParticleNode("particles", text.toString());
        } catch (IllegalArgumentException e) {
            cursor.problem(ParseProblem.at(e.getMessage(), part));
            return null;
        }
    }

    private Token particle() {
        final Token token = cursor.peek();
        if (token == null) {
            return null;
        }
        final boolean single = token.text().length() == 1 && (token.is(TEXT) || token.is(KEYWORD));
        if (token.is(PARTICLE) || token.is(PARTICLE_SPECIAL) || token.is(COMPLEMENT)
                || token.is(ASTERISK) || token.is(PLUS) || single) {
            return cursor.next();
        }
        return null;
    }

    /// The layout between a parameter name and its value: padding, `=`, or both.
    PaddingNode separator() {
        final PaddingNode before = padding();
        final Token equals = cursor.accept(EQUALS);
        if (equals == null) {
            return before;
        }
        final var separator = new PaddingNode();
        if (before != null) {
            separator.appendAll(before);
        }
        separator.append(equals.text());
        final PaddingNode after = padding();
        if (after != null) {
            separator.appendAll(after);
        }
        return separator;
    }

    /// `classifier separator value`, e.g. `imp:n=1` or `vol 2.5`.
    SyntaxNode parameter(Supplier<? extends SyntaxNodeBase> value) {
        final int mark = cursor.mark();
        final ClassifierNode classifier = classifier();
        if (classifier == null) {
            return null;
        }
        final PaddingNode separator = separator();
        if (separator == null) {
            cursor.reset(mark);
            return null;
        }
        final SyntaxNodeBase data = value.get();
        if (data == null) {
            cursor.reset(mark);
            return null;
        }
        final var nodes = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.put("classifier", classifier);
        nodes.put("seperator", separator);
        nodes.put("data", data);
        return new SyntaxNode(classifier.prefixText(), nodes);
    }

    /// The usual parameter value: numbers, or one word.
    SyntaxNodeBase parameterValue() {
        final ListNode numbers = numberSequence();
        return numbers != null ? numbers : textPhrase();
    }

    /// One or more parameters; null when there is none.
    /// @throws RedundantParameterException if a key repeats
    ParametersNode parameters(Supplier<SyntaxNode> rule) {
        final var parameters = new ParametersNode();
        SyntaxNode parameter;
        while ((parameter = rule.get()) != null) {
            parameters.append(parameter, record);
        }
        return parameters.size() == 0 ? null : parameters;
    }

    /// Whether a `name=value` parameter, or a keyword with a value, starts here.
    boolean parameterAhead() {
        final int mark = cursor.mark();
        try {
            if (classifier() == null) {
                return false;
            }
            final boolean keyword = lastPrefix.is(KEYWORD);
            final PaddingNode padding = padding();
            if (cursor.at(EQUALS)) {
                return true;
            }
            return keyword && padding != null && !cursor.atEnd() && !cursor.at(KEYWORD);
        } finally {
            cursor.reset(mark);
        }
    }

    /// A file name made of every token up to the next padding, e.g. `../inc/cells.i`.
    ValueNode fileName() {
        final var text = new StringBuilder();
        Token token;
        while ((token = cursor.peek()) != null && !token.type().isPadding() && !token.is(EQUALS)) {
            text.append(cursor.next().text());
        }
        if (text.length() == 0) {
            return null;
        }
        return new ValueNode(text.toString(), ValueType.TEXT, padding());
    }
}
