package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// The `key=value` pairs that end a cell or data record, in written order.
///
/// Each parameter is a [SyntaxNode] with the children `classifier`, `seperator` and `data`. It is
/// stored under its case folded prefix and particle list, e.g. `imp:n,p`; the particles are
/// folded into a fixed order so `imp:p,n` names the same parameter.
public final class ParametersNode implements SyntaxNodeBase {

    private final LinkedHashMap<String, SyntaxNode> nodes = new LinkedHashMap<>();
    private final Set<SyntaxNode> defaults = Collections.newSetFromMap(new IdentityHashMap<>());

    @Override
    public String name() {
        return "parameters";
    }

    /// The key a parameter is stored under.
    public static String keyOf(SyntaxNode parameter) {
        final ClassifierNode classifier = parameter.get("classifier", ClassifierNode.class);
        return classifier.prefixText()
                + (classifier.particles() == null ? "" : classifier.particles().canonical());
    }

    /// Folds a user supplied key, e.g. `IMP:P,N`, into the stored form `imp:n,p`.
    public static String normalizeKey(String key) {
        final String lower = key.toLowerCase(Locale.ROOT);
        final int colon = lower.indexOf(':');
        if (colon < 0) {
            return lower;
        }
        try {
            return lower.substring(0, colon) + new ParticleNode("key", lower.substring(colon)).canonical();
        } catch (IllegalArgumentException e) {
            return lower;
        }
    }

    public void append(SyntaxNode parameter) {
        append(parameter, null);
    }

    /// Adds a parameter parsed from `record`.
    /// @throws RedundantParameterException if the key is already present
    public void append(SyntaxNode parameter, InputRecord record) {
        Objects.requireNonNull(parameter, "parameter");
        final String key = keyOf(parameter);
        if (nodes.containsKey(key)) {
            throw new RedundantParameterException(record, key, parameter.format().strip());
        }
        nodes.put(key, parameter);
    }

    /// Adds a parameter that was not in the input but filled in with a default value. Default
    /// parameters never hold the record's trailing comment.
    public void appendDefault(SyntaxNode parameter) {
        append(parameter);
        defaults.add(parameter);
    }

    public SyntaxNode get(String key) {
        return nodes.get(normalizeKey(key));
    }

    public boolean contains(String key) {
        return nodes.containsKey(normalizeKey(key));
    }

    public SyntaxNode remove(String key) {
        final SyntaxNode removed = nodes.remove(normalizeKey(key));
        if (removed != null) {
            defaults.remove(removed);
        }
        return removed;
    }

    public Map<String, SyntaxNode> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        for (SyntaxNode node : nodes.values()) {
            sb.append(node.format());
        }
        return sb.toString();
    }

    @Override
    public List<CommentNode> comments() {
        final var ret = new ArrayList<CommentNode>();
        for (SyntaxNode node : nodes.values()) {
            ret.addAll(node.comments());
        }
        return ret;
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        final var ret = new ArrayList<SyntaxNodeBase>();
        for (SyntaxNode node : nodes.values()) {
            ret.addAll(node.flatten());
        }
        return ret;
    }

    @Override
    public int size() {
        return nodes.size();
    }

    private SyntaxNode lastParsed() {
        final var values = new ArrayList<>(nodes.values());
        for (int i = values.size() - 1; i >= 0; i--) {
            if (!defaults.contains(values.get(i))) {
                return values.get(i);
            }
        }
        return null;
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        final SyntaxNode node = lastParsed();
        return node == null ? List.of() : node.trailingComment();
    }

    @Override
    public void deleteTrailingComment() {
        final SyntaxNode node = lastParsed();
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
    public ParametersNode copyWith(NodeCopier copier) {
        final var copy = new ParametersNode();
        nodes.forEach((key, node) -> {
            final SyntaxNode copied = copier.copy(node);
            copy.nodes.put(key, copied);
            if (defaults.contains(node)) {
                copy.defaults.add(copied);
            }
        });
        return copy;
    }

    @Override
    public String toString() {
        return "(Parameters, " + nodes + ")";
    }
}
