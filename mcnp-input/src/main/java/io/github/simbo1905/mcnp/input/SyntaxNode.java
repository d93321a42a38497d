package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// An inner node holding named children in source order, e.g. a cell's `identifier`, `material`,
/// `geometry` and `parameters`. The order of the children is the order they are written in.
public final class SyntaxNode implements SyntaxNodeBase {

    private final String name;
    private final LinkedHashMap<String, SyntaxNodeBase> nodes;

    public SyntaxNode(String name, Map<String, ? extends SyntaxNodeBase> nodes) {
        this.name = Objects.requireNonNull(name, "name");
        this.nodes = new LinkedHashMap<>(Objects.requireNonNull(nodes, "nodes"));
    }

    @Override
    public String name() {
        return name;
    }

    /// The child under `key`, or null when there is none.
    public SyntaxNodeBase get(String key) {
        return nodes.get(key);
    }

    /// The child under `key` cast to the expected node type.
    /// @throws IllegalArgumentException if the child is missing or of another type
    public <T extends SyntaxNodeBase> T get(String key, Class<T> type) {
        final SyntaxNodeBase node = nodes.get(key);
        if (!type.isInstance(node)) {
            throw new IllegalArgumentException(key + " in " + name + " is not a " + type.getSimpleName() + ": " + node);
        }
        return type.cast(node);
    }

    public boolean contains(String key) {
        return nodes.containsKey(key);
    }

    /// Replaces the child under `key`, or adds it at the end.
    public void put(String key, SyntaxNodeBase node) {
        nodes.put(key, node);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public Map<String, SyntaxNodeBase> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    /// The value of the leaf under `key`.
    /// @throws IllegalArgumentException if that child is not a value leaf
    public Object getValue(String key) {
        if (nodes.get(key) instanceof ValueNode value) {
            return value.value();
        }
        throw new IllegalArgumentException(key + " is not a value leaf node");
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        for (SyntaxNodeBase node : nodes.values()) {
            if (node == null || (node instanceof ValueNode value && !value.hasValue())) {
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
        for (int i = values.size() - 1; i >= 0; i--) {
            final SyntaxNodeBase node = values.get(i);
            if (node == null) {
                continue;
            }
            if (node instanceof ValueNode value) {
                if (value.hasValue()) {
                    return node;
                }
            } else if (node.size() > 0) {
                return node;
            }
        }
        return null;
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
        if (nodes.isEmpty() || extra == null) {
            return;
        }
        final SyntaxNodeBase head = nodes.values().iterator().next();
        if (head != null) {
            head.grabBeginningComment(extra);
        }
    }

    @Override
    public SyntaxNode copyWith(NodeCopier copier) {
        final var copied = new LinkedHashMap<String, SyntaxNodeBase>();
        nodes.forEach((key, node) -> copied.put(key, copier.copy(node)));
        return new SyntaxNode(name, copied);
    }

    @Override
    public String toString() {
        return "(Node: " + name + ": " + nodes + ")";
    }
}
