package io.github.simbo1905.mcnp.input;

/// Set operators of cell geometry.
public enum Operator {
    INTERSECTION("*"),
    UNION(":"),
    COMPLEMENT("#"),
    GROUP("()"),
    /// A single operand wrapped so that a bare number still parses as a geometry tree. Has no set meaning.
    SHIFT(">");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
