package io.github.simbo1905.mcnp.input;

/// Thrown for syntax that is recognised but deliberately not implemented, for example the
/// vertical input format or `LIKE n BUT` cells. It is never downgraded to a warning.
public class UnsupportedFeatureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnsupportedFeatureException(String message) {
        super(message);
    }
}
