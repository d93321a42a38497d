package io.github.simbo1905.mcnp.input;

import java.util.Map;
import java.util.Objects;

/// A three part MCNP version such as `6.2.0`, which decides the maximum line length of an input.
public record McnpVersion(int major, int minor, int patch) implements Comparable<McnpVersion> {

    /// System property that overrides the default version, e.g. `-Dmcnp.input.version=5.1.60`.
    public static final String VERSION_PROPERTY = "mcnp.input.version";

    public static final McnpVersion DEFAULT = new McnpVersion(6, 2, 0);

    private static final Map<McnpVersion, Integer> LINE_LENGTHS = Map.of(
            new McnpVersion(5, 1, 60), 80,
            new McnpVersion(6, 1, 0), 80,
            new McnpVersion(6, 2, 0), 128);

    public McnpVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version parts must be >= 0: " + major + "." + minor + "." + patch);
        }
    }

    /// Parses `major.minor[.patch]`.
    /// @throws IllegalArgumentException if the text is not a version
    public static McnpVersion parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var parts = text.trim().split("\\.");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Not an MCNP version: " + text);
        }
        try {
            final int major = Integer.parseInt(parts[0]);
            final int minor = Integer.parseInt(parts[1]);
            final int patch = parts.length == 3 ? Integer.parseInt(parts[2]) : 0;
            return new McnpVersion(major, minor, patch);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an MCNP version: " + text, e);
        }
    }

    /// The version named by [#VERSION_PROPERTY], or [#DEFAULT] when the property is unset.
    public static McnpVersion fromSystemProperty() {
        final var prop = System.getProperty(VERSION_PROPERTY);
        if (prop == null || prop.isBlank()) {
            return DEFAULT;
        }
        return parse(prop);
    }

    /// Maximum number of columns a line may use in this version.
    /// @throws UnsupportedFeatureException for versions older than 6.2.0 that are not in the table
    public int lineLength() {
        if (compareTo(DEFAULT) >= 0) {
            return LINE_LENGTHS.get(DEFAULT);
        }
        final var length = LINE_LENGTHS.get(this);
        if (length == null) {
            throw new UnsupportedFeatureException("MCNP version " + this + " is not supported");
        }
        return length;
    }

    @Override
    public int compareTo(McnpVersion other) {
        int cmp = Integer.compare(major, other.major);
        if (cmp == 0) {
            cmp = Integer.compare(minor, other.minor);
        }
        if (cmp == 0) {
            cmp = Integer.compare(patch, other.patch);
        }
        return cmp;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
