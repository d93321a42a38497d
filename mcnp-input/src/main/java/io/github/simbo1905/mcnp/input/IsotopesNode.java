package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// The isotope and fraction pairs of a material, e.g. `1001.80c 2 8016.80c 1`.
public final class IsotopesNode implements SyntaxNodeBase {

    /// One isotope with its atom or mass fraction.
    public record Entry(ValueNode isotope, ValueNode fraction) {
        public Entry {
            Objects.requireNonNull(isotope, "isotope");
            Objects.requireNonNull(fraction, "fraction");
        }
    }

    private final String name;
    private final List<Entry> entries = new ArrayList<>();

    public IsotopesNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String name() {
        return name;
    }

    public void append(ValueNode isotope, ValueNode fraction) {
        entries.add(new Entry(isotope, fraction));
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        for (Entry entry : entries) {
            sb.append(entry.isotope().format()).append(entry.fraction().format());
        }
        return sb.toString();
    }

    @Override
    public List<CommentNode> comments() {
        final var ret = new ArrayList<CommentNode>();
        for (Entry entry : entries) {
            ret.addAll(entry.isotope().comments());
            ret.addAll(entry.fraction().comments());
        }
        return ret;
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        final var ret = new ArrayList<SyntaxNodeBase>();
        for (Entry entry : entries) {
            ret.add(entry.isotope());
            ret.add(entry.fraction());
        }
        return ret;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        return entries.isEmpty() ? List.of() : entries.get(entries.size() - 1).fraction().trailingComment();
    }

    @Override
    public void deleteTrailingComment() {
        if (!entries.isEmpty()) {
            entries.get(entries.size() - 1).fraction().deleteTrailingComment();
        }
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        // isotopes follow the classifier padding, which holds any leading comment
    }

    @Override
    public IsotopesNode copyWith(NodeCopier copier) {
        final var copy = new IsotopesNode(name);
        for (Entry entry : entries) {
            copy.append(copier.copy(entry.isotope()), copier.copy(entry.fraction()));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "(Isotopes: " + entries + ")";
    }
}
