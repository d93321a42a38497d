package io.github.simbo1905.mcnp.input;

/// Relative and absolute tolerance used whenever two numbers are compared.
/// Two values are close when `|a - b| <= max(relative * max(|a|, |b|), absolute)`.
public record Tolerance(double relative, double absolute) {

    public static final Tolerance DEFAULT = new Tolerance(1e-9, 0.0);

    public Tolerance {
        if (relative < 0.0 || absolute < 0.0 || Double.isNaN(relative) || Double.isNaN(absolute)) {
            throw new IllegalArgumentException("tolerances must be >= 0: rel=" + relative + " abs=" + absolute);
        }
    }

    public boolean isClose(double a, double b) {
        if (a == b) {
            return true;
        }
        if (Double.isInfinite(a) || Double.isInfinite(b) || Double.isNaN(a) || Double.isNaN(b)) {
            return false;
        }
        final double diff = Math.abs(b - a);
        return diff <= Math.abs(relative * b) || diff <= Math.abs(relative * a) || diff <= absolute;
    }
}
