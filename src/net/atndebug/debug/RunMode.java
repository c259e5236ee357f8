package net.atndebug.debug;

/**
 * How far the stepping interpreter runs before it stops again.
 */
public enum RunMode {
    NORMAL,
    // Stops at rule entries and at states that consume input.
    STEP_IN,
    STEP_OVER,
    STEP_OUT
}
