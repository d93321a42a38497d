package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.GeometryTree;
import io.github.simbo1905.mcnp.input.Operator;
import io.github.simbo1905.mcnp.input.PaddingNode;
import io.github.simbo1905.mcnp.input.SyntaxNodeBase;
import io.github.simbo1905.mcnp.input.ValueNode;

import java.util.logging.Logger;

/// Writes a [HalfSpace] tree back into geometry syntax before it is formatted.
///
/// 1. A union directly under an intersection, and anything but a cell or a group directly under a
///    complement, is put in parentheses.
/// 2. Nodes made in code get default punctuation: a space for an intersection, ` : ` for a union,
///    `#` for a complement.
/// 3. A node read from the input whose operator has changed keeps its layout and comments; only the
///    `:` or space that marks the operator is swapped.
///
/// Nodes whose operator has not changed are reused as they are, so an unchanged geometry formats
/// to exactly the text it was read from.
public final class GeometrySynchronizer {

    private static final Logger LOG = Logger.getLogger(GeometrySynchronizer.class.getName());

    static final String INTERSECTION_TEXT = " ";
    static final String UNION_TEXT = " : ";

    private GeometrySynchronizer() {}

    /// @param current the geometry the tree was read from, or null; its wrapper is reused when
    ///                the tree is a single half space
    /// @return the geometry to put in the cell
    public static GeometryTree synchronize(HalfSpace root, GeometryTree current) {
        final SyntaxNodeBase oldEnd = current == null ? null : trailingHolder(current);
        addParentheses(root);
        final SyntaxNodeBase written = write(root);
        final GeometryTree result;
        if (written instanceof ValueNode value) {
            if (current != null && current.operator() == Operator.SHIFT) {
                current.setLeft(value);
                result = current;
            } else {
                result = GeometryTree.shift(value);
            }
        } else {
            result = (GeometryTree) written;
        }
        if (oldEnd != null) {
            moveTrailingPadding(oldEnd, trailingHolder(result));
        }
        return result;
    }

    /// The node whose padding ends the geometry text: the last leaf, or a group or shortcut chain
    /// closing it.
    static SyntaxNodeBase trailingHolder(SyntaxNodeBase node) {
        if (!(node instanceof GeometryTree tree)) {
            return node;
        }
        if (tree.operator() == Operator.GROUP || tree.shortcut() != null || tree.endPadding() != null) {
            return tree;
        }
        return trailingHolder(tree.right() != null ? tree.right() : tree.left());
    }

    /// Moves the layout that separated the old geometry from what follows it onto the new end,
    /// so that an edited geometry still stands apart from the cell's parameters.
    private static void moveTrailingPadding(SyntaxNodeBase oldEnd, SyntaxNodeBase newEnd) {
        if (oldEnd == newEnd) {
            return;
        }
        final PaddingNode trailing;
        if (oldEnd instanceof ValueNode value) {
            trailing = value.padding();
            value.setPadding(null);
        } else {
            final var tree = (GeometryTree) oldEnd;
            final PaddingNode end = tree.endPadding();
            if (end == null) {
                return;
            }
            // a group keeps its closing parenthesis
            trailing = end.cut(tree.operator() == Operator.GROUP ? Math.min(1, end.size()) : 0);
        }
        if (trailing == null || trailing.size() == 0) {
            return;
        }
        LOG.finer(() -> "event=trailing_padding_moved text=" + trailing.format().replace("\n", "\\n"));
        if (newEnd instanceof ValueNode leaf) {
            final PaddingNode existing = leaf.padding();
            if (existing == null || existing.comments().isEmpty()) {
                leaf.setPadding(trailing);
            } else {
                existing.appendAll(trailing);
            }
        } else {
            ((GeometryTree) newEnd).appendEndPadding(trailing);
        }
    }

    static void addParentheses(HalfSpace tree) {
        if (tree instanceof UnitHalfSpace) {
            return;
        }
        addParentheses(tree.left());
        if (tree.right() != null) {
            addParentheses(tree.right());
        }
        if (tree.operator() == Operator.INTERSECTION) {
            if (isUnion(tree.left())) {
                tree.setLeft(grouped(tree.left()));
            }
            if (isUnion(tree.right())) {
                tree.setRight(grouped(tree.right()));
            }
        } else if (tree.operator() == Operator.COMPLEMENT) {
            final HalfSpace inner = tree.left();
            final boolean cell = inner instanceof UnitHalfSpace unit && unit.isCell();
            if (!cell && inner.operator() != Operator.GROUP) {
                tree.setLeft(grouped(inner));
            }
        }
    }

    private static boolean isUnion(HalfSpace tree) {
        return !(tree instanceof UnitHalfSpace) && tree.operator() == Operator.UNION;
    }

    private static HalfSpace grouped(HalfSpace tree) {
        LOG.finer(() -> "event=parentheses_added tree=" + tree);
        return new HalfSpace(tree, Operator.GROUP, null);
    }

    private static SyntaxNodeBase write(HalfSpace tree) {
        if (tree instanceof UnitHalfSpace unit) {
            return unit.updateValue();
        }
        final SyntaxNodeBase left = write(tree.left());
        final SyntaxNodeBase right = tree.right() == null ? null : write(tree.right());
        final GeometryTree node = tree.node();
        if (node != null && node.operator() == tree.operator()) {
            node.setLeft(left);
            if (right != null) {
                node.setRight(right);
            }
            return node;
        }
        final GeometryTree made;
        switch (tree.operator()) {
            case INTERSECTION:
                made = GeometryTree.intersection(left, punctuation(node, Operator.INTERSECTION), right);
                break;
            case UNION:
                made = GeometryTree.union(left, punctuation(node, Operator.UNION), right);
                break;
            case COMPLEMENT:
                made = GeometryTree.complement(new PaddingNode(Operator.COMPLEMENT.symbol()), left);
                break;
            default:
                made = GeometryTree.group(new PaddingNode("("), left, new PaddingNode(")"));
                break;
        }
        if (node != null && node.endPadding() != null && HalfSpace.isBinary(tree.operator())) {
            made.appendEndPadding(node.endPadding());
        }
        LOG.finer(() -> "event=geometry_node_written operator=" + tree.operator() + " reused=" + (node != null));
        tree.setNode(made);
        return made;
    }

    private static PaddingNode punctuation(GeometryTree old, Operator operator) {
        if (old == null || !HalfSpace.isBinary(old.operator()) || old.operatorPadding() == null) {
            return new PaddingNode(operator == Operator.UNION ? UNION_TEXT : INTERSECTION_TEXT);
        }
        return switchPunctuation(old.operatorPadding(), operator);
    }

    /// The layout of `old` with the operator mark changed to suit `operator`. Comments are kept.
    static PaddingNode switchPunctuation(PaddingNode old, Operator operator) {
        final var ret = new PaddingNode();
        boolean placed = operator != Operator.UNION;
        for (PaddingNode.Fragment fragment : old.fragments()) {
            if (!(fragment instanceof PaddingNode.Text text)) {
                ret.append(fragment);
                continue;
            }
            String value = text.text().replace(':', ' ');
            if (!placed && !text.isNewline() && value.indexOf(' ') >= 0) {
                int at = value.length() / 2;
                if (value.charAt(at) != ' ') {
                    at = value.indexOf(' ');
                }
                value = value.substring(0, at) + ':' + value.substring(at + 1);
                placed = true;
            }
            ret.append(value);
        }
        if (!placed) {
            final var withMark = new PaddingNode(":");
            withMark.appendAll(ret);
            return withMark;
        }
        if (operator == Operator.INTERSECTION && ret.format().isEmpty()) {
            return new PaddingNode(INTERSECTION_TEXT);
        }
        return ret;
    }
}
