package io.github.simbo1905.mcnp.input;

import java.util.List;

import static io.github.simbo1905.mcnp.input.TokenType.COLON;
import static io.github.simbo1905.mcnp.input.TokenType.COMPLEMENT;
import static io.github.simbo1905.mcnp.input.TokenType.LPAREN;
import static io.github.simbo1905.mcnp.input.TokenType.NUMBER;
import static io.github.simbo1905.mcnp.input.TokenType.RPAREN;

/// Productions for cell geometry and for the parenthesised number lists of cell parameters.
///
/// Union (`:`) binds loosest, then intersection by juxtaposition, then complement (`#`).
/// Parentheses group. A shortcut after an intersection run, as in `1 2R`, extends the run.
class GeometryRules extends CommonRules {

    GeometryRules(TokenCursor cursor, InputRecord record) {
        super(cursor, record);
    }

    /// A whole geometry. A single half space comes back wrapped in a shift node.
    GeometryTree geometry() {
        final SyntaxNodeBase expression = expression();
        if (expression instanceof ValueNode value) {
            return GeometryTree.shift(value);
        }
        return (GeometryTree) expression;
    }

    private SyntaxNodeBase expression() {
        SyntaxNodeBase left = term();
        if (left == null) {
            return null;
        }
        while (cursor.at(COLON)) {
            final int mark = cursor.mark();
            final var operator = new PaddingNode(cursor.next().text());
            final PaddingNode after = padding();
            if (after != null) {
                operator.appendAll(after);
            }
            final SyntaxNodeBase right = term();
            if (right == null) {
                cursor.reset(mark);
                break;
            }
            left = GeometryTree.union(left, operator, right);
        }
        return left;
    }

    private SyntaxNodeBase term() {
        SyntaxNodeBase left = factor();
        if (left == null) {
            return null;
        }
        while (!cursor.atEnd()) {
            final Token token = cursor.peek();
            if (token.type().shortcut() != null) {
                final SyntaxNodeBase extended = shortcutTerm(left);
                if (extended == null) {
                    break;
                }
                left = extended;
                continue;
            }
            final PaddingNode padding = padding();
            if (padding != null) {
                final SyntaxNodeBase right = factor();
                if (right != null) {
                    left = GeometryTree.intersection(left, padding, right);
                } else {
                    attachPadding(left, padding);
                }
                continue;
            }
            final SyntaxNodeBase adjacent = factory();
            if (adjacent == null) {
                break;
            }
            left = GeometryTree.intersection(left, new PaddingNode(), adjacent);
        }
        return left;
    }

    private SyntaxNodeBase factor() {
        final int mark = cursor.mark();
        final Token hash = cursor.accept(COMPLEMENT);
        if (hash == null) {
            return factory();
        }
        final SyntaxNodeBase inner = factory();
        if (inner == null) {
            cursor.reset(mark);
            return null;
        }
        return GeometryTree.complement(new PaddingNode(hash.text()), inner);
    }

    private SyntaxNodeBase factory() {
        final Token number = cursor.accept(NUMBER);
        if (number != null) {
            return new ValueNode(number.text(), ValueType.REAL);
        }
        final int mark = cursor.mark();
        final Token open = cursor.accept(LPAREN);
        if (open == null) {
            return null;
        }
        final var start = new PaddingNode(open.text());
        final PaddingNode after = padding();
        if (after != null) {
            start.appendAll(after);
        }
        final SyntaxNodeBase inner = expression();
        final Token close = inner == null ? null : cursor.accept(RPAREN);
        if (close == null) {
            cursor.reset(mark);
            return null;
        }
        final SyntaxNodeBase wrapped = inner instanceof ValueNode value ? GeometryTree.shift(value) : inner;
        return GeometryTree.group(start, wrapped, new PaddingNode(close.text()));
    }

    private SyntaxNodeBase shortcutTerm(SyntaxNodeBase left) {
        final int mark = cursor.mark();
        final Token token = cursor.next();
        final Shortcut type = token.type().shortcut();
        if (type == Shortcut.JUMP) {
            cursor.reset(mark);
            return null;
        }
        final SyntaxNodeBase start = startOf(left);
        try {
            final ShortcutNode shortcut;
            switch (type) {
                case REPEAT:
                    shortcut = ShortcutNode.repeat(token.text(), start);
                    break;
                case MULTIPLY:
                    shortcut = ShortcutNode.multiply(token.text(), start);
                    break;
                default:
                    final PaddingNode middle = paddingOrEmpty();
                    final Token end = cursor.accept(NUMBER);
                    if (end == null) {
                        cursor.problem(ParseProblem.at("Interpolate requires a value after it.", token));
                        return left;
                    }
                    final ValueNode last = new ValueNode(end.text(), ValueType.REAL, padding());
                    shortcut = ShortcutNode.interpolate(token.text(), start, middle, last, true);
                    break;
            }
            return GeometryTree.withShortcut(left, shortcut);
        } catch (IllegalArgumentException e) {
            cursor.problem(ParseProblem.at(e.getMessage(), token));
            return left;
        }
    }

    private static SyntaxNodeBase startOf(SyntaxNodeBase left) {
        if (left instanceof GeometryTree tree) {
            final ShortcutNode previous = tree.shortcut();
            if (previous != null) {
                final List<ValueNode> members = previous.members();
                if (!members.isEmpty() && tree.lastLeaf() == members.get(members.size() - 1)) {
                    return previous;
                }
            }
            return tree.lastLeaf();
        }
        return left;
    }

    /// Hangs padding that no operand follows on the last thing written in `node`.
    static void attachPadding(SyntaxNodeBase node, PaddingNode padding) {
        if (node instanceof ValueNode value) {
            if (value.padding() == null) {
                value.setPadding(padding);
            } else {
                value.padding().appendAll(padding);
            }
            return;
        }
        final var tree = (GeometryTree) node;
        if (tree.shortcut() != null || tree.operator() == Operator.GROUP) {
            tree.appendEndPadding(padding);
        } else if (tree.right() != null) {
            attachPadding(tree.right(), padding);
        } else {
            attachPadding(tree.left(), padding);
        }
    }

    /// A parameter value made of numbers, parenthesised groups and `:` ranges, such as
    /// `1 (2 0 0)` for a fill with a transform or `0:1 0:1 0:0 1 2 3 4` for a lattice fill.
    ListNode parentheticalSequence() {
        final var list = new ListNode("number sequence");
        int depth = 0;
        while (!cursor.atEnd()) {
            if (cursor.at(LPAREN) || cursor.at(COLON) || depth > 0 && cursor.at(RPAREN)) {
                final Token token = cursor.next();
                if (token.is(LPAREN)) {
                    depth++;
                } else if (token.is(RPAREN)) {
                    depth--;
                }
                final var punctuation = new PaddingNode(token.text());
                final PaddingNode after = padding();
                if (after != null) {
                    punctuation.appendAll(after);
                }
                list.append(punctuation, true);
                continue;
            }
            if (!sequenceItem(list)) {
                break;
            }
        }
        if (depth != 0) {
            cursor.problem(cursor.stuck("Unbalanced parentheses."));
        }
        return list.nodes().isEmpty() ? null : list;
    }
}
