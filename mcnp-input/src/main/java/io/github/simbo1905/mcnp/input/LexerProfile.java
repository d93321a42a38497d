package io.github.simbo1905.mcnp.input;

import java.util.Locale;
import java.util.Set;

/// The block dependent part of token classification.
///
/// The same word can mean different things per block: `p` is a photon in a cell's `imp:p` but a
/// plane in the surface block.
public enum LexerProfile {
    CELL(true, false, false, false),
    SURFACE(false, true, false, false),
    DATA(true, false, true, true);

    static final Set<String> KEYWORDS = Set.of(
            "read", "noecho", "file", "decode", "encode", "like", "but", "imp", "vol", "pwt", "ext",
            "fcl", "wwn", "dxc", "nonu", "pd", "tmp", "u", "trcl", "lat", "fill", "elpt", "cosy",
            "bflcl", "unc", "gas", "estep", "hstep", "nlib", "plib", "pnlib", "elib", "hlib", "alib",
            "slib", "tlib", "dlib", "cond", "refi", "refc", "refs", "no", "cel", "sur", "erg", "tme",
            "dir", "vec", "nrm", "pos", "rad", "axs", "x", "y", "z", "ccc", "ara", "wgt", "tr", "eff",
            "par", "dat", "loc", "bem", "bap");

    static final Set<String> SURFACE_TYPES = Set.of(
            "p", "px", "py", "pz", "so", "s", "sx", "sy", "sz", "c/x", "c/y", "c/z", "cx", "cy", "cz",
            "k/x", "k/y", "k/z", "kx", "ky", "kz", "sq", "gq", "tx", "ty", "tz", "x", "y", "z",
            "box", "rpp", "sph", "rcc", "rhp", "hex", "rec", "trc", "ell", "wed", "arb");

    private final boolean particles;
    private final boolean surfaceTypes;
    private final boolean specialParticles;
    private final boolean classifierComments;

    LexerProfile(boolean particles, boolean surfaceTypes, boolean specialParticles, boolean classifierComments) {
        this.particles = particles;
        this.surfaceTypes = surfaceTypes;
        this.specialParticles = specialParticles;
        this.classifierComments = classifierComments;
    }

    public static LexerProfile forBlock(BlockType block) {
        return switch (block) {
            case CELL -> CELL;
            case SURFACE -> SURFACE;
            case DATA -> DATA;
        };
    }

    /// Whether runs of particle punctuation such as `|` or `<` lex as one token.
    boolean specialParticles() {
        return specialParticles;
    }

    /// Whether `SCn` and `FCn` starting a line are source and tally comments.
    boolean classifierComments() {
        return classifierComments;
    }

    /// Classifies a word of letters that is not a shortcut.
    TokenType classifyWord(String word) {
        final String lower = word.toLowerCase(Locale.ROOT);
        TokenType type = KEYWORDS.contains(lower) ? TokenType.KEYWORD : TokenType.TEXT;
        if (particles && type == TokenType.TEXT && lower.length() == 1 && isParticle(lower)) {
            type = TokenType.PARTICLE;
        }
        if (surfaceTypes && SURFACE_TYPES.contains(lower)) {
            type = TokenType.SURFACE_TYPE;
        }
        return type;
    }

    private static boolean isParticle(String symbol) {
        for (Particle particle : Particle.values()) {
            if (particle.symbol().equalsIgnoreCase(symbol)) {
                return true;
            }
        }
        return false;
    }
}
