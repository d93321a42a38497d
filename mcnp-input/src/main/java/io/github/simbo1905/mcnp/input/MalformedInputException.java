package io.github.simbo1905.mcnp.input;

/// Thrown when a record is well formed at the token level but breaks a local rule of the input
/// format, such as a duplicated parameter or a shortcut that has nothing to repeat.
///
/// The record that failed is carried along so callers can report it without re-reading the source.
public class MalformedInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient InputRecord record;
    private final String reason;

    public MalformedInputException(InputRecord record, String reason) {
        super(formatMessage(record, reason));
        this.record = record;
        this.reason = reason;
    }

    public MalformedInputException(InputRecord record, String reason, Throwable cause) {
        super(formatMessage(record, reason), cause);
        this.record = record;
        this.reason = reason;
    }

    /// Used by subclasses that render their own message.
    protected MalformedInputException(InputRecord record, String reason, String renderedMessage) {
        super(renderedMessage);
        this.record = record;
        this.reason = reason;
    }

    /// The record that failed, or null when the failure was not tied to a record.
    public InputRecord record() {
        return record;
    }

    /// The message without the location suffix.
    public String reason() {
        return reason;
    }

    private static String formatMessage(InputRecord record, String reason) {
        if (record == null) {
            return reason;
        }
        return reason + "\n    " + record.source() + ", line " + record.lineNumber();
    }
}
