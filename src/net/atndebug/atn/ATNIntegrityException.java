package net.atndebug.atn;

/**
 * The serialized data decodes but describes an inconsistent graph.
 */
public class ATNIntegrityException extends ATNException {

    public ATNIntegrityException() {
        super();
    }

    public ATNIntegrityException(String message) {
        super(message);
    }

    public ATNIntegrityException(Throwable cause) {
        super(cause);
    }

    public ATNIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

}
