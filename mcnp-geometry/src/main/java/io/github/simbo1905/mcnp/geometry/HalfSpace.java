package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.GeometryTree;
import io.github.simbo1905.mcnp.input.NodeCopier;
import io.github.simbo1905.mcnp.input.Operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/// A node of constructive solid geometry: an intersection, union, complement or parenthesised
/// group of half spaces. The leaves are [UnitHalfSpace]s.
///
/// ```
/// final HalfSpace shell = UnitHalfSpace.surface(1, false).and(UnitHalfSpace.surface(2, true));
/// final HalfSpace outside = shell.complement().or(UnitHalfSpace.cell(5));
/// ```
///
/// Combining never shares a subtree between two parents: [#and(HalfSpace)] and
/// [#or(HalfSpace)] always allocate a new parent, and the operands must not already belong to
/// another tree.
///
/// The cell a tree belongs to is held as the cell number, not as a reference to the cell.
public sealed class HalfSpace permits UnitHalfSpace {

    private HalfSpace left;
    private Operator operator;
    private HalfSpace right;
    private GeometryTree node;
    private Integer cell;

    /// @param right the right side; must be null for a complement or group and set otherwise
    /// @param node the syntax the tree was read from, or null for a tree made in code
    /// @throws IllegalArgumentException if `operator` is the shift wrapper or `right` does not fit it
    public HalfSpace(HalfSpace left, Operator operator, HalfSpace right, GeometryTree node) {
        this.left = Objects.requireNonNull(left, "left");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.right = right;
        this.node = node;
        checkShape(operator, right);
    }

    public HalfSpace(HalfSpace left, Operator operator, HalfSpace right) {
        this(left, operator, right, null);
    }

    /// For leaves, which have no operator and no sides.
    HalfSpace() {
    }

    private static void checkShape(Operator operator, HalfSpace right) {
        switch (operator) {
            case INTERSECTION:
            case UNION:
                if (right == null) {
                    throw new IllegalArgumentException("Both sides are required for " + operator);
                }
                break;
            case COMPLEMENT:
            case GROUP:
                if (right != null) {
                    throw new IllegalArgumentException("A " + operator + " has only one side");
                }
                break;
            default:
                throw new IllegalArgumentException("Not a set operator: " + operator);
        }
    }

    public HalfSpace left() {
        return left;
    }

    /// The right side, or null for a complement or group.
    public HalfSpace right() {
        return right;
    }

    public Operator operator() {
        return operator;
    }

    public void setLeft(HalfSpace left) {
        this.left = Objects.requireNonNull(left, "left");
        bind(left, cell);
    }

    /// @throws IllegalStateException for a complement or group
    public void setRight(HalfSpace right) {
        if (this.right == null) {
            throw new IllegalStateException("A " + operator + " has no right side");
        }
        this.right = Objects.requireNonNull(right, "right");
        bind(right, cell);
    }

    /// Switches between intersection and union. The punctuation written for this node changes
    /// the next time the geometry is synchronised; any comments around it stay.
    /// @throws IllegalArgumentException if either operator is not a union or an intersection
    public void setOperator(Operator operator) {
        if (!isBinary(this.operator) || !isBinary(operator)) {
            throw new IllegalArgumentException("Only a union and an intersection can be switched: "
                    + this.operator + " to " + operator);
        }
        this.operator = operator;
    }

    static boolean isBinary(Operator operator) {
        return operator == Operator.INTERSECTION || operator == Operator.UNION;
    }

    /// The syntax this node was read from or last written to, or null.
    public GeometryTree node() {
        return node;
    }

    void setNode(GeometryTree node) {
        this.node = node;
    }

    /// The number of the cell this geometry belongs to.
    public OptionalInt cell() {
        return cell == null ? OptionalInt.empty() : OptionalInt.of(cell);
    }

    void setCell(Integer cell) {
        this.cell = cell;
        if (left != null) {
            left.setCell(cell);
        }
        if (right != null) {
            right.setCell(cell);
        }
    }

    private static void bind(HalfSpace tree, Integer cell) {
        if (cell != null) {
            tree.setCell(cell);
        }
    }

    /// A new intersection of this and `other`.
    public HalfSpace and(HalfSpace other) {
        return combine(Operator.INTERSECTION, other);
    }

    /// A new union of this and `other`.
    public HalfSpace or(HalfSpace other) {
        return combine(Operator.UNION, other);
    }

    public HalfSpace complement() {
        final var ret = new HalfSpace(this, Operator.COMPLEMENT, null);
        bind(ret, cell);
        return ret;
    }

    /// This tree in parentheses.
    public HalfSpace group() {
        final var ret = new HalfSpace(this, Operator.GROUP, null);
        bind(ret, cell);
        return ret;
    }

    private HalfSpace combine(Operator op, HalfSpace other) {
        Objects.requireNonNull(other, "other");
        final var ret = new HalfSpace(this, op, other);
        bind(ret, cell);
        return ret;
    }

    /// Intersects `other` into this tree in place and returns the tree to use from now on.
    ///
    /// Where this is already an intersection the operand is grafted onto the right-most
    /// intersection, so a run of calls deepens the tree by one level each and never rebuilds it.
    /// Anything else is wrapped in a new intersection, which is returned.
    public HalfSpace andAssign(HalfSpace other) {
        return assign(Operator.INTERSECTION, other);
    }

    /// The union counterpart of [#andAssign(HalfSpace)].
    public HalfSpace orAssign(HalfSpace other) {
        return assign(Operator.UNION, other);
    }

    private HalfSpace assign(Operator op, HalfSpace other) {
        Objects.requireNonNull(other, "other");
        if (operator != op) {
            return combine(op, other);
        }
        HalfSpace parent = this;
        while (parent.right.operator == op) {
            parent = parent.right;
        }
        parent.right = parent.right.combine(op, other);
        bind(parent.right, cell);
        return this;
    }

    /// The number of unit half spaces in this tree.
    public int size() {
        return left.size() + (right == null ? 0 : right.size());
    }

    /// The number of levels below and including this node.
    public int depth() {
        return 1 + Math.max(left.depth(), right == null ? 0 : right.depth());
    }

    /// The unit half spaces from left to right.
    public List<UnitHalfSpace> leaves() {
        final var ret = new ArrayList<UnitHalfSpace>();
        collectLeaves(ret);
        return ret;
    }

    void collectLeaves(List<UnitHalfSpace> out) {
        left.collectLeaves(out);
        if (right != null) {
            right.collectLeaves(out);
        }
    }

    /// Whether `other` describes the same geometry written the same way: equal operators, the
    /// same shape and equal leaves. Parentheses are looked through.
    /// @throws IllegalArgumentException if one is a unit half space and the other is not
    public boolean sameGeometry(HalfSpace other) {
        Objects.requireNonNull(other, "other");
        final HalfSpace a = ungrouped(this);
        final HalfSpace b = ungrouped(other);
        if (a.getClass() != b.getClass()) {
            throw new IllegalArgumentException("A " + a.getClass().getSimpleName()
                    + " cannot be compared to a " + b.getClass().getSimpleName());
        }
        return a.sameAs(b);
    }

    boolean sameAs(HalfSpace other) {
        if (operator != other.operator || (right == null) != (other.right == null)) {
            return false;
        }
        if (!left.sameGeometry(other.left)) {
            return false;
        }
        return right == null || right.sameGeometry(other.right);
    }

    private static HalfSpace ungrouped(HalfSpace tree) {
        HalfSpace ret = tree;
        while (ret.operator == Operator.GROUP) {
            ret = ret.left;
        }
        return ret;
    }

    /// A copy of this tree pointing at the copies `copier` made of its syntax nodes.
    HalfSpace copyWith(NodeCopier copier) {
        final var ret = new HalfSpace(left.copyWith(copier), operator,
                right == null ? null : right.copyWith(copier), copier.copy(node));
        ret.cell = cell;
        return ret;
    }

    @Override
    public String toString() {
        switch (operator) {
            case COMPLEMENT:
                return "#" + left;
            case GROUP:
                return "(" + left + ")";
            default:
                return "(" + left + (operator == Operator.UNION ? ":" : " ") + right + ")";
        }
    }
}
