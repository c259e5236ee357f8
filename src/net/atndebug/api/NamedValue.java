package net.atndebug.api;

/**
 * A generic interface for marking objects with textual names.
 */
public interface NamedValue {

    /**
     * The name of this object.
     */
    String getName();

}
