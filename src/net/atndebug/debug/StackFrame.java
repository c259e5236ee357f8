package net.atndebug.debug;

import java.util.Collections;
import java.util.List;
import net.atndebug.api.symbols.LexicalRange;
import net.atndebug.util.Util;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * A snapshot of a call frame handed out to hosts.
 */
public class StackFrame {

    private final String name;
    private final String source;
    private final List<LexicalRange> next;

    public StackFrame(String name, String source, List<LexicalRange> next) {
        this.name = name;
        this.source = source;
        this.next = Collections.unmodifiableList(next);
    }

    public String toString() {
        return String.format("%s@%h[name=%s,source=%s,next=%s]",
            getClass().getName(), this, name, source, next);
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    /**
     * The source ranges of the symbols the frame is about to reach.
     */
    public List<LexicalRange> getNext() {
        return next;
    }

    public JSONObject toJSON() {
        JSONArray ranges = new JSONArray();
        for (LexicalRange r : next) ranges.put(r.toString());
        return Util.createJSONObject("name", name, "source", source,
                                     "next", ranges);
    }

}
