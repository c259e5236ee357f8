package net.atndebug.atn;

/**
 * Raised when a serialized ATN cannot be loaded.
 */
public class ATNException extends Exception {

    public ATNException() {
        super();
    }

    public ATNException(String message) {
        super(message);
    }

    public ATNException(Throwable cause) {
        super(cause);
    }

    public ATNException(String message, Throwable cause) {
        super(message, cause);
    }

}
