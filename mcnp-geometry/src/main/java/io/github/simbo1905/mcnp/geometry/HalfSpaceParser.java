package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.GeometryTree;
import io.github.simbo1905.mcnp.input.Operator;
import io.github.simbo1905.mcnp.input.SyntaxNodeBase;
import io.github.simbo1905.mcnp.input.ValueNode;

import java.util.Objects;
import java.util.logging.Logger;

/// Builds the [HalfSpace] tree of a parsed cell geometry.
///
/// Each tree node keeps the syntax it came from, so an unchanged tree writes back the text it was
/// read from. A number directly under `#` is a cell; any other number is a surface. The wrapper the
/// parser puts around a lone number is dropped.
public final class HalfSpaceParser {

    private static final Logger LOG = Logger.getLogger(HalfSpaceParser.class.getName());

    private HalfSpaceParser() {}

    /// @throws IllegalArgumentException if a leaf is not a positive whole number
    public static HalfSpace parse(GeometryTree tree) {
        Objects.requireNonNull(tree, "tree");
        final HalfSpace ret = build(tree);
        LOG.finer(() -> "event=geometry_parsed leaves=" + ret.size() + " depth=" + ret.depth());
        return ret;
    }

    private static HalfSpace build(GeometryTree tree) {
        final boolean isCell = tree.operator() == Operator.COMPLEMENT;
        final HalfSpace left = side(tree.left(), isCell);
        if (tree.operator() == Operator.SHIFT) {
            return left;
        }
        final HalfSpace right = tree.right() == null ? null : side(tree.right(), false);
        return new HalfSpace(left, tree.operator(), right, tree);
    }

    private static HalfSpace side(SyntaxNodeBase node, boolean isCell) {
        if (node instanceof ValueNode value) {
            return UnitHalfSpace.parse(value, isCell);
        }
        return build((GeometryTree) node);
    }
}
