package io.github.simbo1905.mcnp.input;

/// Thrown when a record gives the same parameter twice, e.g. `imp:n=1 imp:n=2`.
public class RedundantParameterException extends MalformedInputException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public RedundantParameterException(InputRecord record, String key, String newValue) {
        super(record, "Multiple values given for parameter: " + key + ". new_value given: " + newValue + ".");
        this.key = key;
    }

    /// The case folded parameter key that was repeated.
    public String key() {
        return key;
    }
}
