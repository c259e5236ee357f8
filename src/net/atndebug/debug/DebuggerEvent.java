package net.atndebug.debug;

import net.atndebug.util.Util;
import org.json.JSONObject;

/**
 * A queued notification of a debugging session.
 */
public class DebuggerEvent {

    public enum Type {
        END("end"),
        STOP_ON_BREAKPOINT("stopOnBreakpoint"),
        STOP_ON_STEP("stopOnStep"),
        BREAKPOINT_VALIDATED("breakpointValidated"),
        OUTPUT("output");

        private final String wireName;

        private Type(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        /**
         * Whether events of this type end a step call.
         */
        public boolean isStop() {
            return (this == END || this == STOP_ON_BREAKPOINT ||
                    this == STOP_ON_STEP);
        }
    }

    private final Type type;
    private final BreakPoint breakPoint;
    private final String message;
    private final String source;
    private final int line;
    private final int column;
    private final boolean error;

    protected DebuggerEvent(Type type, BreakPoint breakPoint, String message,
                            String source, int line, int column,
                            boolean error) {
        this.type = type;
        this.breakPoint = breakPoint;
        this.message = message;
        this.source = source;
        this.line = line;
        this.column = column;
        this.error = error;
    }

    public static DebuggerEvent end() {
        return new DebuggerEvent(Type.END, null, null, null, -1, -1, false);
    }

    public static DebuggerEvent stopOnBreakpoint() {
        return new DebuggerEvent(Type.STOP_ON_BREAKPOINT, null, null, null,
                                 -1, -1, false);
    }

    public static DebuggerEvent stopOnStep() {
        return new DebuggerEvent(Type.STOP_ON_STEP, null, null, null, -1, -1,
                                 false);
    }

    public static DebuggerEvent breakpointValidated(BreakPoint bp) {
        return new DebuggerEvent(Type.BREAKPOINT_VALIDATED, bp, null, null,
                                 -1, -1, false);
    }

    public static DebuggerEvent output(String message, String source,
                                       int line, int column, boolean error) {
        return new DebuggerEvent(Type.OUTPUT, null, message, source, line,
                                 column, error);
    }

    public String toString() {
        return String.format("%s@%h[type=%s,message=%s]",
            getClass().getName(), this, type, message);
    }

    public Type getType() {
        return type;
    }

    public BreakPoint getBreakPoint() {
        return breakPoint;
    }

    public String getMessage() {
        return message;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isError() {
        return error;
    }

    /**
     * Pass this event to the matching method of the given listener.
     */
    public void dispatch(DebuggerListener listener) {
        switch (type) {
            case END:
                listener.onEnd();
                break;
            case STOP_ON_BREAKPOINT:
                listener.onStopOnBreakpoint();
                break;
            case STOP_ON_STEP:
                listener.onStopOnStep();
                break;
            case BREAKPOINT_VALIDATED:
                listener.onBreakpointValidated(breakPoint);
                break;
            case OUTPUT:
                listener.onOutput(message, source, line, column, error);
                break;
        }
    }

    public JSONObject toJSON() {
        JSONObject ret = Util.createJSONObject("event", type.getWireName());
        switch (type) {
            case BREAKPOINT_VALIDATED:
                ret.put("breakpoint", breakPoint.toJSON());
                break;
            case OUTPUT:
                ret.put("message", message);
                ret.put("source", (source == null) ? JSONObject.NULL :
                                                     source);
                ret.put("line", line);
                ret.put("column", column);
                ret.put("isError", error);
                break;
            default:
                break;
        }
        return ret;
    }

}
