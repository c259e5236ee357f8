package net.atndebug.debug;

import net.atndebug.util.Util;
import org.json.JSONObject;

/**
 * A request to stop when the rule declared at some source line is
 * entered.
 * A breakpoint is validated once its line has been found to start a rule;
 * its line is then moved to the exact start of the rule declaration, and
 * it is bound to the rule's ATN start state.
 */
public class BreakPoint {

    private final int id;
    private final String source;
    private int line;
    private boolean validated;
    private int boundState;

    public BreakPoint(int id, String source, int line) {
        this.id = id;
        this.source = source;
        this.line = line;
        this.boundState = -1;
    }

    public String toString() {
        return String.format("%s@%h[id=%s,source=%s,line=%s,validated=%s]",
            getClass().getName(), this, id, source, line, validated);
    }

    public int getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public boolean isValidated() {
        return validated;
    }

    /**
     * The ATN state this breakpoint stops at, or -1 if not validated.
     */
    public int getBoundState() {
        return boundState;
    }

    void bind(int state, int snappedLine) {
        boundState = state;
        line = snappedLine;
        validated = true;
    }

    void unbind() {
        boundState = -1;
        validated = false;
    }

    public JSONObject toJSON() {
        return Util.createJSONObject("id", id, "source", source, "line",
                                     line, "validated", validated);
    }

}
