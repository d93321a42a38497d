package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// The identifier that starts a data record: `[modifier]prefix[number][:particles]`, e.g. `M4`,
/// `F104:n,p`, `*TR2` or `IMP:n,e`, followed by its padding. None of the values carry padding
/// of their own.
public final class ClassifierNode implements SyntaxNodeBase {

    private ValueNode modifier;
    private ValueNode prefix;
    private ValueNode number;
    private ParticleNode particles;
    private PaddingNode padding;

    @Override
    public String name() {
        return "classifier";
    }

    /// A `*` or `+` changing the record's meaning, or null.
    public ValueNode modifier() {
        return modifier;
    }

    public void setModifier(ValueNode modifier) {
        this.modifier = modifier;
    }

    /// The text naming the record kind, e.g. `M` in `M4`.
    public ValueNode prefix() {
        return prefix;
    }

    public void setPrefix(ValueNode prefix) {
        this.prefix = prefix;
    }

    public ValueNode number() {
        return number;
    }

    public void setNumber(ValueNode number) {
        this.number = number;
    }

    public ParticleNode particles() {
        return particles;
    }

    public void setParticles(ParticleNode particles) {
        this.particles = particles;
    }

    /// The padding after the classifier.
    public PaddingNode padding() {
        return padding;
    }

    public void setPadding(PaddingNode padding) {
        this.padding = padding;
    }

    /// The case folded prefix, e.g. `imp`.
    public String prefixText() {
        return prefix == null ? "" : prefix.textValue().toLowerCase(Locale.ROOT);
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        if (modifier != null) {
            sb.append(modifier.format());
        }
        if (prefix != null) {
            sb.append(prefix.format());
        }
        if (number != null) {
            sb.append(number.format());
        }
        if (particles != null) {
            sb.append(particles.format());
        }
        if (padding != null) {
            sb.append(padding.format());
        }
        return sb.toString();
    }

    @Override
    public List<CommentNode> comments() {
        return padding == null ? List.of() : padding.comments();
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        final var ret = new ArrayList<SyntaxNodeBase>();
        if (modifier != null) {
            ret.add(modifier);
        }
        if (prefix != null) {
            ret.add(prefix);
        }
        if (number != null) {
            ret.add(number);
        }
        if (particles != null) {
            ret.add(particles);
        }
        if (padding != null) {
            ret.add(padding);
        }
        return ret;
    }

    @Override
    public int size() {
        return flatten().size();
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        return padding == null ? List.of() : padding.trailingComment();
    }

    @Override
    public void deleteTrailingComment() {
        if (padding != null) {
            padding.deleteTrailingComment();
        }
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        // the classifier starts the record; leading comments belong to the record padding
    }

    @Override
    public ClassifierNode copyWith(NodeCopier copier) {
        final var copy = new ClassifierNode();
        copy.modifier = copier.copy(modifier);
        copy.prefix = copier.copy(prefix);
        copy.number = copier.copy(number);
        copy.particles = copier.copy(particles);
        copy.padding = copier.copy(padding);
        return copy;
    }

    @Override
    public String toString() {
        return "(Classifier: mod: " + modifier + ", prefix: " + prefix + ", number: " + number
                + ", particles: " + particles + ", padding: " + padding + ")";
    }
}
