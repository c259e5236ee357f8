package net.atndebug.debug;

public abstract class DebuggerAdapter implements DebuggerListener {

    public void onEnd() {}
    public void onStopOnBreakpoint() {}
    public void onStopOnStep() {}
    public void onBreakpointValidated(BreakPoint breakPoint) {}
    public void onOutput(String message, String source, int line,
                         int column, boolean isError) {}

}
