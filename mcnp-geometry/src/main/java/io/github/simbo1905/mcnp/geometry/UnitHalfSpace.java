package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.NodeCopier;
import io.github.simbo1905.mcnp.input.ValueNode;
import io.github.simbo1905.mcnp.input.ValueType;

import java.util.List;

/// One side of a divider: the positive or negative side of a surface, or a cell.
///
/// A cell is only ever used complemented, so a cell leaf always sits under a complement and its
/// side is always positive. The divider is held by number.
public final class UnitHalfSpace extends HalfSpace {

    private int divider;
    private boolean side;
    private final boolean isCell;
    private ValueNode node;

    /// @param side true for the positive side; ignored for cells
    /// @param node the value the leaf was read from, or null
    public UnitHalfSpace(int divider, boolean side, boolean isCell, ValueNode node) {
        if (divider <= 0) {
            throw new IllegalArgumentException("A divider number must be positive: " + divider);
        }
        this.divider = divider;
        this.side = side;
        this.isCell = isCell;
        this.node = node;
    }

    /// The given side of surface `number`.
    public static UnitHalfSpace surface(int number, boolean side) {
        return new UnitHalfSpace(number, side, false, null);
    }

    /// Cell `number`, complemented: the space outside that cell.
    public static HalfSpace cell(int number) {
        return new UnitHalfSpace(number, true, true, null).complement();
    }

    /// Reads a leaf of a geometry. The value is marked as a signed identifier, so its sign is
    /// carried as the side.
    /// @throws IllegalArgumentException if the value is not a whole positive number
    public static UnitHalfSpace parse(ValueNode value, boolean isCell) {
        if (!value.isNegatableIdentifier()) {
            value.setNegatableIdentifier(true);
        }
        if (!value.hasValue()) {
            throw new IllegalArgumentException("A half space needs a number: " + value);
        }
        final boolean side = isCell || !Boolean.TRUE.equals(value.isNegative());
        return new UnitHalfSpace(Math.toIntExact(value.longValue()), side, isCell, value);
    }

    public int divider() {
        return divider;
    }

    public void setDivider(int divider) {
        if (divider <= 0) {
            throw new IllegalArgumentException("A divider number must be positive: " + divider);
        }
        this.divider = divider;
    }

    /// True for the positive side of a surface, and always for a cell.
    public boolean side() {
        return isCell || side;
    }

    /// @throws IllegalStateException for a cell, which has no sides
    public void setSide(boolean side) {
        if (isCell) {
            throw new IllegalStateException("A cell has no side to choose; complement it instead");
        }
        this.side = side;
    }

    public boolean isCell() {
        return isCell;
    }

    /// The value this leaf was read from or last written to, or null.
    public ValueNode valueNode() {
        return node;
    }

    /// Writes the divider and side into the leaf's value, making a value first if there is none.
    /// @return the value
    ValueNode updateValue() {
        if (node == null) {
            node = new ValueNode(null, ValueType.INTEGER, null, true);
            node.setNegatableIdentifier(true);
        }
        node.setValue((long) divider);
        node.setNegative(!side());
        return node;
    }

    @Override
    public void setLeft(HalfSpace left) {
        throw new UnsupportedOperationException("A unit half space has no sides");
    }

    @Override
    public void setRight(HalfSpace right) {
        throw new UnsupportedOperationException("A unit half space has no sides");
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    void collectLeaves(List<UnitHalfSpace> out) {
        out.add(this);
    }

    @Override
    boolean sameAs(HalfSpace other) {
        final var unit = (UnitHalfSpace) other;
        return isCell == unit.isCell && divider == unit.divider && side() == unit.side();
    }

    @Override
    UnitHalfSpace copyWith(NodeCopier copier) {
        final var ret = new UnitHalfSpace(divider, side, isCell, copier.copy(node));
        cell().ifPresent(ret::setCell);
        return ret;
    }

    @Override
    public String toString() {
        if (isCell) {
            return Integer.toString(divider);
        }
        return (side ? "+" : "-") + divider;
    }
}
