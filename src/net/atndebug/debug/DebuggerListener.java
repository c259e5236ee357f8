package net.atndebug.debug;

/**
 * Receives the notifications of a debugging session.
 * Notifications are delivered by EventQueue.deliverEvents(), never from
 * within a step call; calling back into the debugger from a handler is
 * allowed.
 */
public interface DebuggerListener {

    void onEnd();

    void onStopOnBreakpoint();

    void onStopOnStep();

    void onBreakpointValidated(BreakPoint breakPoint);

    /**
     * A diagnostic message; isError is true for syntax errors.
     */
    void onOutput(String message, String source, int line, int column,
                  boolean isError);

}
