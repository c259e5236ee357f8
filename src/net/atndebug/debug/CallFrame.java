package net.atndebug.debug;

import java.util.ArrayList;
import java.util.List;
import net.atndebug.api.symbols.Symbol;

/**
 * The debugger's record of an active rule invocation.
 * current holds the grammar symbols the invocation is positioned at and
 * next those it is about to reach; both are updated as the parse proceeds.
 */
public class CallFrame {

    private final String name;
    private final String source;
    private List<Symbol> current;
    private List<Symbol> next;

    public CallFrame(String name, String source, List<Symbol> initial) {
        this.name = name;
        this.source = source;
        this.current = new ArrayList<Symbol>(initial);
        this.next = new ArrayList<Symbol>(initial);
    }

    public String toString() {
        return String.format("%s@%h[name=%s,source=%s]",
                             getClass().getName(), this, name, source);
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public List<Symbol> getCurrent() {
        return current;
    }

    public List<Symbol> getNext() {
        return next;
    }

    /**
     * Make the next symbols current and install a new next set.
     */
    void advance(List<Symbol> newNext) {
        current = next;
        next = newNext;
    }

}
