package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/// The particle list of a classifier, such as the `:n,p` of `imp:n,p`.
///
/// Particles keep the order they were written in; added particles go at the end. While the list
/// is unchanged the original text is written back as is, otherwise the designators are written in
/// the case most of the original letters used.
public final class ParticleNode implements SyntaxNodeBase {

    private final String name;
    private final String token;
    private final List<Particle> original;
    private final List<Particle> order = new ArrayList<>();

    /// @param token the particle list including its leading `:`
    /// @throws IllegalArgumentException if a designator is not a known particle
    public ParticleNode(String name, String token) {
        this.name = Objects.requireNonNull(name, "name");
        this.token = Objects.requireNonNull(token, "token");
        for (String chunk : token.replace(":", "").split(",")) {
            final Particle particle = Particle.ofSymbol(chunk);
            if (!order.contains(particle)) {
                order.add(particle);
            }
        }
        this.original = List.copyOf(order);
    }

    private ParticleNode(ParticleNode other) {
        this.name = other.name;
        this.token = other.token;
        this.original = other.original;
        this.order.addAll(other.order);
    }

    @Override
    public String name() {
        return name;
    }

    public String token() {
        return token;
    }

    public Set<Particle> particles() {
        return order.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(order));
    }

    /// The particles in written order.
    public List<Particle> ordered() {
        return Collections.unmodifiableList(order);
    }

    /// Replaces the particles. A list keeps its order; any other collection is written in the
    /// current order with newcomers appended in enum order.
    public void setParticles(Collection<Particle> particles) {
        Objects.requireNonNull(particles, "particles");
        if (particles instanceof List<Particle> list) {
            order.clear();
            for (Particle particle : list) {
                if (!order.contains(Objects.requireNonNull(particle, "particle"))) {
                    order.add(particle);
                }
            }
            return;
        }
        final Set<Particle> wanted = particles.isEmpty() ? EnumSet.noneOf(Particle.class) : EnumSet.copyOf(particles);
        order.retainAll(wanted);
        for (Particle particle : wanted) {
            if (!order.contains(particle)) {
                order.add(particle);
            }
        }
    }

    public void add(Particle particle) {
        if (!order.contains(Objects.requireNonNull(particle, "particle"))) {
            order.add(particle);
        }
    }

    public void remove(Particle particle) {
        order.remove(particle);
    }

    /// The particle list with the designators in enum order, lower case; used for parameter keys
    /// so that `imp:p,n` and `imp:n,p` name the same parameter.
    public String canonical() {
        return ":" + order.stream().sorted()
                .map(p -> p.symbol().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(","));
    }

    private boolean upperCase() {
        int total = 0;
        int upper = 0;
        for (int i = 0; i < token.length(); i++) {
            final char c = token.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
                total++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        return total > 0 && upper * 2 >= total;
    }

    @Override
    public String format() {
        if (order.equals(original)) {
            return token;
        }
        final boolean upper = upperCase();
        return ":" + order.stream()
                .map(p -> upper ? p.symbol().toUpperCase(Locale.ROOT) : p.symbol().toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(","));
    }

    @Override
    public List<CommentNode> comments() {
        return List.of();
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        return List.of(this);
    }

    @Override
    public int size() {
        return order.size();
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        return List.of();
    }

    @Override
    public void deleteTrailingComment() {
        // no padding of its own
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        // no padding of its own
    }

    @Override
    public ParticleNode copyWith(NodeCopier copier) {
        return new ParticleNode(this);
    }

    @Override
    public String toString() {
        return format();
    }
}
