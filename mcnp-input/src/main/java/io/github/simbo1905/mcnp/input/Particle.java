package io.github.simbo1905.mcnp.input;

import java.util.Locale;

/// Particle designators that may follow a `:` in a classifier, e.g. the `n` of `imp:n`.
public enum Particle {
    NEUTRON("N"),
    PHOTON("P"),
    ELECTRON("E"),
    NEGATIVE_MUON("|"),
    ANTI_NEUTRON("Q"),
    ELECTRON_NEUTRINO("U"),
    MUON_NEUTRINO("V"),
    POSITRON("F"),
    PROTON("H"),
    LAMBDA_BARYON("L"),
    POSITIVE_SIGMA_BARYON("+"),
    NEGATIVE_SIGMA_BARYON("-"),
    CASCADE("X"),
    NEGATIVE_CASCADE("Y"),
    OMEGA_BARYON("O"),
    POSITIVE_MUON("!"),
    ANTI_ELECTRON_NEUTRINO("<"),
    ANTI_MUON_NEUTRINO(">"),
    ANTI_PROTON("G"),
    POSITIVE_PION("/"),
    NEUTRAL_PION("Z"),
    POSITIVE_KAON("K"),
    KAON_SHORT("%"),
    KAON_LONG("^"),
    ANTI_LAMBDA_BARYON("B"),
    ANTI_POSITIVE_SIGMA_BARYON("_"),
    ANTI_NEGATIVE_SIGMA_BARYON("~"),
    ANTI_CASCADE("C"),
    POSITIVE_CASCADE("W"),
    ANTI_OMEGA("@"),
    DEUTERON("D"),
    TRITON("T"),
    HELION("S"),
    ALPHA_PARTICLE("A"),
    NEGATIVE_PION("*"),
    NEGATIVE_KAON("?"),
    HEAVY_ION("#");

    private final String symbol;

    Particle(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /// Looks a designator up, ignoring case.
    /// @throws IllegalArgumentException if the text is not a particle designator
    public static Particle ofSymbol(String text) {
        final String wanted = text.trim().toUpperCase(Locale.ROOT);
        for (Particle particle : values()) {
            if (particle.symbol.equals(wanted)) {
                return particle;
            }
        }
        throw new IllegalArgumentException("Not a particle designator: " + text);
    }
}
