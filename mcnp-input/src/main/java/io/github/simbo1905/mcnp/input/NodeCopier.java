package io.github.simbo1905.mcnp.input;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/// Deep copies a syntax tree while remembering which copy belongs to which original.
///
/// A node reachable through more than one path is copied once. After the copy the table translates
/// any reference into the old tree into the matching node of the new one.
public final class NodeCopier {

    private final Map<SyntaxNodeBase, SyntaxNodeBase> table = new IdentityHashMap<>();

    @SuppressWarnings("unchecked")
    public <T extends SyntaxNodeBase> T copy(T node) {
        if (node == null) {
            return null;
        }
        final var known = table.get(node);
        if (known != null) {
            return (T) known;
        }
        final T copy = (T) node.copyWith(this);
        table.put(node, copy);
        return copy;
    }

    /// The copy made of `original`, if it has been copied.
    @SuppressWarnings("unchecked")
    public <T extends SyntaxNodeBase> Optional<T> translated(T original) {
        return Optional.ofNullable((T) table.get(original));
    }

    public int size() {
        return table.size();
    }
}
