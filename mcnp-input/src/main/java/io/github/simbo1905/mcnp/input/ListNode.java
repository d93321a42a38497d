package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// An ordered run of values. Shortcuts are kept as [ShortcutNode]s, and iteration expands them
/// into the values they stand for. Parenthesised lists (fill, transform) also hold the
/// parentheses as [PaddingNode]s.
public sealed class ListNode implements SyntaxNodeBase permits ShortcutNode {

    private static final Logger LOG = Logger.getLogger(ListNode.class.getName());

    private final String name;
    private final List<SyntaxNodeBase> nodes = new ArrayList<>();
    private final List<ShortcutNode> shortcuts = new ArrayList<>();

    public ListNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String name() {
        return name;
    }

    /// The direct children: values, shortcuts and punctuation.
    public List<SyntaxNodeBase> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<ShortcutNode> shortcuts() {
        return Collections.unmodifiableList(shortcuts);
    }

    public void append(SyntaxNodeBase node) {
        append(node, false);
    }

    /// Appends a child. While parsing, a preceding value without whitespace after it is marked so
    /// that no space is inserted on output.
    public void append(SyntaxNodeBase node, boolean fromParsing) {
        Objects.requireNonNull(node, "node");
        if (!(node instanceof ValueNode || node instanceof ShortcutNode || node instanceof PaddingNode)) {
            throw new IllegalArgumentException("A list holds values, shortcuts and padding. " + node + " given.");
        }
        if (fromParsing && !nodes.isEmpty()) {
            final var items = items();
            if (!items.isEmpty() && items.get(items.size() - 1) instanceof ValueNode last
                    && (last.padding() == null || !last.padding().hasSpace())) {
                last.setNeverPad(true);
            }
        }
        if (node instanceof ShortcutNode shortcut) {
            shortcuts.add(shortcut);
        }
        nodes.add(node);
    }

    /// Removes a direct child.
    public boolean remove(SyntaxNodeBase node) {
        shortcuts.remove(node);
        return nodes.remove(node);
    }

    /// Children with every shortcut expanded into its values.
    public List<SyntaxNodeBase> items() {
        final var ret = new ArrayList<SyntaxNodeBase>();
        for (SyntaxNodeBase node : nodes) {
            if (node instanceof ShortcutNode shortcut) {
                ret.addAll(shortcut.members());
            } else {
                ret.add(node);
            }
        }
        return ret;
    }

    /// The values of this list with shortcuts expanded, punctuation left out.
    public List<ValueNode> values() {
        final var ret = new ArrayList<ValueNode>();
        for (SyntaxNodeBase item : items()) {
            if (item instanceof ValueNode value) {
                ret.add(value);
            }
        }
        return ret;
    }

    /// The expanded item at `index`; negative indices count from the end.
    /// @throws IndexOutOfBoundsException if there is no such item
    public SyntaxNodeBase get(int index) {
        final var items = items();
        final int at = index < 0 ? items.size() + index : index;
        if (at < 0 || at >= items.size()) {
            throw new IndexOutOfBoundsException(index + " not in ListNode");
        }
        return items.get(at);
    }

    /// A new list holding the expanded items from `start` (inclusive) to `stop` (exclusive) every `step`.
    /// Negative bounds count from the end; a negative step walks backwards and returns the items in that order.
    public ListNode slice(Integer start, Integer stop, int step) {
        if (step == 0) {
            throw new IllegalArgumentException("slice step cannot be zero");
        }
        final var items = items();
        final int size = items.size();
        final var ret = new ListNode(name + "_slice");
        if (step > 0) {
            int from = start == null ? 0 : clamp(start, size, 0);
            int to = stop == null ? size : clamp(stop, size, 0);
            for (int i = from; i < to; i += step) {
                ret.append(items.get(i));
            }
        } else {
            int from = start == null ? size - 1 : clamp(start, size, -1);
            int to = stop == null ? -1 : clamp(stop, size, -1);
            for (int i = Math.min(from, size - 1); i > to; i += step) {
                ret.append(items.get(i));
            }
        }
        return ret;
    }

    private static int clamp(int index, int size, int floor) {
        int at = index < 0 ? index + size : index;
        if (at < floor) {
            at = floor;
        }
        return Math.min(at, size);
    }

    /// Whether any expanded value equals `value` under [ValueNode#valueEquals].
    public boolean contains(Object value) {
        for (ValueNode node : values()) {
            if (node.valueEquals(value)) {
                return true;
            }
        }
        return false;
    }

    /// Compares the expanded values with `other`, element by element.
    public boolean valuesEqual(List<?> other) {
        final var mine = values();
        if (mine.size() != other.size()) {
            return false;
        }
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i).valueEquals(other.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        final int length = nodes.size();
        for (int i = 0; i < length; i++) {
            final SyntaxNodeBase node = nodes.get(i);
            final boolean followed = i < length - 1 && !(nodes.get(i + 1) instanceof PaddingNode);
            if (node instanceof ValueNode value && value.padding() == null && followed && !value.neverPad()) {
                value.setPadding(new PaddingNode(" "));
            }
            if (node instanceof ShortcutNode shortcut) {
                sb.append(shortcut.format());
                // separator only; a rebuild may leave this shortcut last
                if (followed && !shortcut.endsInPadding()) {
                    sb.append(' ');
                }
            } else {
                sb.append(node.format());
            }
        }
        return sb.toString();
    }

    /// Rebuilds this list from a wholly new sequence of values while keeping as much of the
    /// original shorthand as still applies.
    ///
    /// Each old shortcut is anchored at the first of its members still present. From there it
    /// takes back its contiguous surviving members and any new values next to them that fit its
    /// rule. Values that were plain before stay plain. Unclaimed runs of missing values become
    /// new jumps, and a new jump at the very end is dropped. A shortcut left with too few values
    /// to mean anything is spelled out as plain values.
    /// @throws IllegalStateException if this list holds punctuation such as parentheses
    public void updateWithNewValues(List<ValueNode> newValues) {
        Objects.requireNonNull(newValues, "newValues");
        for (SyntaxNodeBase node : nodes) {
            if (node instanceof PaddingNode) {
                throw new IllegalStateException("A list holding punctuation cannot be rebuilt from values: " + name);
            }
        }
        if (newValues.isEmpty()) {
            nodes.clear();
            shortcuts.clear();
            return;
        }
        final List<ValueNode> values = distinct(newValues);
        final int n = values.size();
        final Map<ValueNode, ShortcutNode> oldOwner = new IdentityHashMap<>();
        final Set<ValueNode> oldPlain = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SyntaxNodeBase node : nodes) {
            if (node instanceof ShortcutNode shortcut) {
                for (ValueNode member : shortcut.members()) {
                    oldOwner.put(member, shortcut);
                }
            } else if (node instanceof ValueNode value) {
                oldPlain.add(value);
            }
        }
        final ShortcutNode[] owner = new ShortcutNode[n];
        final boolean[] fresh = new boolean[n];
        for (int i = 0; i < n; i++) {
            final ValueNode value = values.get(i);
            fresh[i] = !oldOwner.containsKey(value) && !oldPlain.contains(value);
        }

        final Set<ShortcutNode> anchored = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int a = 0; a < n; a++) {
            final ShortcutNode shortcut = oldOwner.get(values.get(a));
            if (shortcut == null || owner[a] != null || !anchored.add(shortcut)) {
                continue;
            }
            shortcut.beginReconcile();
            final ShortcutNode before = a > 0 ? owner[a - 1] : null;
            if (!shortcut.absorb(values.get(a), true, before)) {
                StructuredLog.finer(LOG, "shortcut_dropped", "list", name, "shortcut", shortcut.type(), "index", a);
                continue;
            }
            owner[a] = shortcut;
            int k = a + 1;
            while (k < n && owner[k] == null
                    && (oldOwner.get(values.get(k)) == shortcut || fresh[k])
                    && shortcut.absorb(values.get(k), true, null)) {
                owner[k] = shortcut;
                k++;
            }
            for (int j = a - 1; j >= 0 && owner[j] == null && fresh[j]; j--) {
                if (!shortcut.absorb(values.get(j), false, null)) {
                    break;
                }
                owner[j] = shortcut;
            }
            StructuredLog.finer(LOG, "shortcut_anchored", "list", name, "shortcut", shortcut.type(),
                    "index", a, "members", shortcut.members().size());
        }

        splitOffRemainders(values, owner, oldOwner);
        claimOrphanJumps(values, owner);

        final var rebuilt = new ArrayList<SyntaxNodeBase>();
        dissolveDegenerate(values, owner, rebuilt);

        nodes.clear();
        shortcuts.clear();
        for (SyntaxNodeBase node : rebuilt) {
            append(node);
        }
        if (!nodes.isEmpty() && nodes.get(nodes.size() - 1) instanceof ShortcutNode end
                && end.type() == Shortcut.JUMP && end.isSynthetic()) {
            nodes.remove(nodes.size() - 1);
            shortcuts.remove(end);
        }
    }

    private static List<ValueNode> distinct(List<ValueNode> newValues) {
        final Set<ValueNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        final var ret = new ArrayList<ValueNode>(newValues.size());
        for (ValueNode value : newValues) {
            Objects.requireNonNull(value, "values must not be null");
            ret.add(seen.add(value) ? value : new NodeCopier().copy(value));
        }
        return ret;
    }

    /// Surviving members of a repeat or jump that were cut off from their shortcut by an edit
    /// form a shortcut of their own.
    private void splitOffRemainders(List<ValueNode> values, ShortcutNode[] owner, Map<ValueNode, ShortcutNode> oldOwner) {
        int i = 0;
        while (i < values.size()) {
            final ShortcutNode origin = owner[i] == null ? oldOwner.get(values.get(i)) : null;
            if (origin == null || (origin.type() != Shortcut.REPEAT && origin.type() != Shortcut.JUMP)) {
                i++;
                continue;
            }
            final ShortcutNode split = origin.splitOff();
            int k = i;
            while (k < values.size() && owner[k] == null && oldOwner.get(values.get(k)) == origin
                    && split.absorb(values.get(k), true, null)) {
                owner[k] = split;
                k++;
            }
            i = Math.max(k, i + 1);
        }
    }

    private static void claimOrphanJumps(List<ValueNode> values, ShortcutNode[] owner) {
        ShortcutNode current = null;
        for (int i = 0; i < values.size(); i++) {
            if (owner[i] != null) {
                current = null;
                continue;
            }
            if (values.get(i).hasValue()) {
                current = null;
                continue;
            }
            if (current == null) {
                current = ShortcutNode.synthetic(Shortcut.JUMP);
            }
            if (current.absorb(values.get(i), true, null)) {
                owner[i] = current;
            }
        }
    }

    /// Lays the owners out in order, spelling out shortcuts that no longer hold enough values.
    private static void dissolveDegenerate(List<ValueNode> values, ShortcutNode[] owner, List<SyntaxNodeBase> out) {
        boolean changed = true;
        while (changed) {
            changed = false;
            out.clear();
            ShortcutNode previous = null;
            for (int i = 0; i < values.size(); i++) {
                final ShortcutNode shortcut = owner[i];
                if (shortcut == null) {
                    out.add(values.get(i));
                    previous = null;
                    continue;
                }
                if (i > 0 && owner[i - 1] == shortcut) {
                    continue;
                }
                if (!shortcut.finishReconcile(previous)) {
                    StructuredLog.finer(LOG, "shortcut_dissolved", "shortcut", shortcut.type(), "index", i);
                    for (int j = i; j < values.size() && owner[j] == shortcut; j++) {
                        owner[j] = null;
                    }
                    changed = true;
                    break;
                }
                out.add(shortcut);
                previous = shortcut;
            }
        }
    }

    @Override
    public List<CommentNode> comments() {
        final var ret = new ArrayList<CommentNode>();
        for (SyntaxNodeBase node : nodes) {
            ret.addAll(node.comments());
        }
        return ret;
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        final var ret = new ArrayList<SyntaxNodeBase>();
        for (SyntaxNodeBase node : nodes) {
            ret.addAll(node.flatten());
        }
        return ret;
    }

    @Override
    public int size() {
        return nodes.size();
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        return nodes.isEmpty() ? List.of() : nodes.get(nodes.size() - 1).trailingComment();
    }

    @Override
    public void deleteTrailingComment() {
        if (!nodes.isEmpty()) {
            nodes.get(nodes.size() - 1).deleteTrailingComment();
        }
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        if (!nodes.isEmpty() && extra != null) {
            nodes.get(0).grabBeginningComment(extra);
        }
    }

    @Override
    public ListNode copyWith(NodeCopier copier) {
        final var copy = new ListNode(name);
        for (SyntaxNodeBase node : nodes) {
            copy.append(copier.copy(node));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "(list: " + name + ", " + nodes + ")";
    }
}
