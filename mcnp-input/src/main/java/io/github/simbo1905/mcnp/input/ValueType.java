package io.github.simbo1905.mcnp.input;

/// The semantic type of a [ValueNode].
public enum ValueType {
    INTEGER,
    REAL,
    TEXT;

    public boolean isNumeric() {
        return this != TEXT;
    }
}
