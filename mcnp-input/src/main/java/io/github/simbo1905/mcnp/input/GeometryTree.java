package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A binary tree of constructive solid geometry as written in a cell.
///
/// The children are kept in written order under the keys `start_pad`, `operator`, `left`,
/// `right` and `end_pad`; [#left()] and [#right()] read from the same map so that there is a
/// single source of truth for the tree and its text.
///
/// A shortcut such as `1 2R` in a geometry becomes a chain of implicit intersections. The root
/// of the chain keeps the [ShortcutNode] and, while the chain is untouched and its values still
/// follow the shortcut's rule, prints the shorthand instead of the expanded values.
public final class GeometryTree implements SyntaxNodeBase {

    public static final String START_PAD = "start_pad";
    public static final String LEFT = "left";
    public static final String OPERATOR = "operator";
    public static final String RIGHT = "right";
    public static final String END_PAD = "end_pad";

    private final String name;
    private final LinkedHashMap<String, SyntaxNodeBase> nodes;
    private final Operator operator;
    private ShortcutNode shortcut;
    private SyntaxNodeBase chainBase;
    private boolean shortcutMember;

    public GeometryTree(String name, Map<String, ? extends SyntaxNodeBase> nodes, Operator operator) {
        this.name = Objects.requireNonNull(name, "name");
        this.nodes = new LinkedHashMap<>(Objects.requireNonNull(nodes, "nodes"));
        this.operator = Objects.requireNonNull(operator, "operator");
        if (!(this.nodes.get(LEFT) instanceof ValueNode || this.nodes.get(LEFT) instanceof GeometryTree)) {
            throw new IllegalArgumentException("A geometry tree needs a value or tree on its left: " + this.nodes);
        }
    }

    public static GeometryTree union(SyntaxNodeBase left, PaddingNode operator, SyntaxNodeBase right) {
        return binary("union", Operator.UNION, left, operator, right);
    }

    public static GeometryTree intersection(SyntaxNodeBase left, PaddingNode operator, SyntaxNodeBase right) {
        return binary("intersection", Operator.INTERSECTION, left, operator, right);
    }

    private static GeometryTree binary(String name, Operator operator, SyntaxNodeBase left, PaddingNode padding, SyntaxNodeBase right) {
        final var map = new LinkedHashMap<String, SyntaxNodeBase>();
        map.put(LEFT, left);
        map.put(OPERATOR, padding == null ? new PaddingNode() : padding);
        map.put(RIGHT, Objects.requireNonNull(right, "right"));
        return new GeometryTree(name, map, operator);
    }

    public static GeometryTree complement(PaddingNode operator, SyntaxNodeBase inner) {
        final var map = new LinkedHashMap<String, SyntaxNodeBase>();
        map.put(OPERATOR, operator);
        map.put(LEFT, inner);
        return new GeometryTree("complement", map, Operator.COMPLEMENT);
    }

    public static GeometryTree group(PaddingNode open, SyntaxNodeBase inner, PaddingNode close) {
        final var map = new LinkedHashMap<String, SyntaxNodeBase>();
        map.put(START_PAD, open);
        map.put(LEFT, inner);
        map.put(END_PAD, close);
        return new GeometryTree("geom parens", map, Operator.GROUP);
    }

    /// Wraps a lone half space so that every geometry has a tree at its root.
    public static GeometryTree shift(ValueNode leaf) {
        final var map = new LinkedHashMap<String, SyntaxNodeBase>();
        map.put(LEFT, leaf);
        return new GeometryTree("shift", map, Operator.SHIFT);
    }

    /// Extends `term` with the values of `shortcut` as a chain of implicit intersections.
    /// @param term the geometry written before the shortcut; its last leaf is the shortcut's start
    public static GeometryTree withShortcut(SyntaxNodeBase term, ShortcutNode shortcut) {
        final List<ValueNode> members = shortcut.members();
        SyntaxNodeBase left = term;
        GeometryTree tree = null;
        for (int i = shortcut.startBorrowed() ? 0 : 1; i < members.size(); i++) {
            tree = intersection(left, new PaddingNode(), members.get(i));
            tree.shortcutMember = true;
            left = tree;
        }
        if (tree == null) {
            throw new IllegalArgumentException("A shortcut in a geometry must add at least one half space: " + shortcut);
        }
        tree.shortcut = shortcut;
        tree.chainBase = term;
        return tree;
    }

    @Override
    public String name() {
        return name;
    }

    public Operator operator() {
        return operator;
    }

    public SyntaxNodeBase left() {
        return nodes.get(LEFT);
    }

    /// The right side, or null for a complement, group or shift.
    public SyntaxNodeBase right() {
        return nodes.get(RIGHT);
    }

    public void setLeft(SyntaxNodeBase node) {
        nodes.put(LEFT, Objects.requireNonNull(node, "node"));
    }

    /// @throws IllegalStateException if this kind of tree has no right side
    public void setRight(SyntaxNodeBase node) {
        if (!nodes.containsKey(RIGHT)) {
            throw new IllegalStateException("A " + operator + " tree has no right side");
        }
        nodes.put(RIGHT, Objects.requireNonNull(node, "node"));
    }

    /// The text written for the operator: `:` for a union, layout for an intersection, `#` for a
    /// complement. Null for groups and shifts.
    public PaddingNode operatorPadding() {
        return nodes.get(OPERATOR) instanceof PaddingNode padding ? padding : null;
    }

    public void setOperatorPadding(PaddingNode padding) {
        if (!nodes.containsKey(OPERATOR)) {
            throw new IllegalStateException("A " + operator + " tree has no operator text");
        }
        nodes.put(OPERATOR, Objects.requireNonNull(padding, "padding"));
    }

    public PaddingNode startPadding() {
        return nodes.get(START_PAD) instanceof PaddingNode padding ? padding : null;
    }

    public PaddingNode endPadding() {
        return nodes.get(END_PAD) instanceof PaddingNode padding ? padding : null;
    }

    /// Adds layout after this tree, joining any that is already there.
    public void appendEndPadding(PaddingNode padding) {
        final PaddingNode existing = endPadding();
        if (existing == null) {
            nodes.put(END_PAD, padding);
        } else {
            existing.appendAll(padding);
        }
    }

    public Map<String, SyntaxNodeBase> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /// The shortcut this tree is the root of, or null.
    public ShortcutNode shortcut() {
        return shortcut;
    }

    /// Whether this tree is one of the implicit intersections a shortcut expanded into.
    public boolean isShortcutMember() {
        return shortcutMember;
    }

    /// The half space leaves from left to right.
    public List<ValueNode> leaves() {
        final var ret = new ArrayList<ValueNode>();
        collectLeaves(this, ret);
        return ret;
    }

    private static void collectLeaves(SyntaxNodeBase node, List<ValueNode> out) {
        if (node instanceof ValueNode value) {
            out.add(value);
        } else if (node instanceof GeometryTree tree) {
            collectLeaves(tree.left(), out);
            if (tree.right() != null) {
                collectLeaves(tree.right(), out);
            }
        }
    }

    /// The rightmost leaf.
    public ValueNode lastLeaf() {
        SyntaxNodeBase node = this;
        while (node instanceof GeometryTree tree) {
            node = tree.right() != null ? tree.right() : tree.left();
        }
        return (ValueNode) node;
    }

    private boolean chainIntact() {
        final List<ValueNode> members = shortcut.members();
        SyntaxNodeBase node = this;
        for (int i = members.size() - 1; i >= (shortcut.startBorrowed() ? 0 : 1); i--) {
            if (!(node instanceof GeometryTree tree) || !tree.shortcutMember
                    || tree.operator != Operator.INTERSECTION || tree.right() != members.get(i)
                    || tree.operatorPadding() == null || tree.operatorPadding().size() > 0) {
                return false;
            }
            node = tree.left();
        }
        if (node != chainBase) {
            return false;
        }
        if (shortcut.startBorrowed()) {
            return true;
        }
        final ValueNode base = chainBase instanceof GeometryTree tree ? tree.lastLeaf() : (ValueNode) chainBase;
        return base == members.get(0);
    }

    @Override
    public String format() {
        if (shortcut != null && chainIntact() && shortcut.isConsistent()) {
            final PaddingNode end = endPadding();
            return chainBase.format() + shortcut.formatSuffix() + (end == null ? "" : end.format());
        }
        final var sb = new StringBuilder();
        for (Map.Entry<String, SyntaxNodeBase> entry : nodes.entrySet()) {
            final SyntaxNodeBase node = entry.getValue();
            if (node == null) {
                continue;
            }
            if (OPERATOR.equals(entry.getKey()) && shortcutMember && node.size() == 0
                    && (sb.length() == 0 || !Character.isWhitespace(sb.charAt(sb.length() - 1)))) {
                sb.append(' ');
                continue;
            }
            sb.append(node.format());
        }
        return sb.toString();
    }

    @Override
    public List<CommentNode> comments() {
        final var ret = new ArrayList<CommentNode>();
        for (SyntaxNodeBase node : nodes.values()) {
            if (node != null) {
                ret.addAll(node.comments());
            }
        }
        return ret;
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        final var ret = new ArrayList<SyntaxNodeBase>();
        for (SyntaxNodeBase node : nodes.values()) {
            if (node != null) {
                ret.addAll(node.flatten());
            }
        }
        return ret;
    }

    @Override
    public int size() {
        return nodes.size();
    }

    private SyntaxNodeBase trailingNode() {
        final var values = new ArrayList<>(nodes.values());
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        final SyntaxNodeBase node = trailingNode();
        return node == null ? List.of() : node.trailingComment();
    }

    @Override
    public void deleteTrailingComment() {
        final SyntaxNodeBase node = trailingNode();
        if (node != null) {
            node.deleteTrailingComment();
        }
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        if (!nodes.isEmpty() && extra != null) {
            nodes.values().iterator().next().grabBeginningComment(extra);
        }
    }

    @Override
    public GeometryTree copyWith(NodeCopier copier) {
        final var copied = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.forEach((key, node) -> copied.put(key, copier.copy(node)));
        final var copy = new GeometryTree(name, copied, operator);
        copy.shortcut = copier.copy(shortcut);
        copy.chainBase = copier.copy(chainBase);
        copy.shortcutMember = shortcutMember;
        return copy;
    }

    @Override
    public String toString() {
        return "Geometry: (" + left() + " " + operator + " " + right() + ")";
    }
}
