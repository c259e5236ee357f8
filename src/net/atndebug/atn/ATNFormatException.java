package net.atndebug.atn;

/**
 * The serialized data is not in a format this loader understands.
 * This covers unsupported versions and format identifiers, unknown
 * state, transition and action kinds, and truncated input.
 */
public class ATNFormatException extends ATNException {

    public ATNFormatException() {
        super();
    }

    public ATNFormatException(String message) {
        super(message);
    }

    public ATNFormatException(Throwable cause) {
        super(cause);
    }

    public ATNFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
