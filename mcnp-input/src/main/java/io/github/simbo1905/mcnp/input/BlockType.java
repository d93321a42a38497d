package io.github.simbo1905.mcnp.input;

/// The three blank line separated sections of an input, in file order.
public enum BlockType {
    CELL,
    SURFACE,
    DATA
}
