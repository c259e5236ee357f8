package net.atndebug.debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers debugger notifications until the host asks for them.
 * Events are kept in emission order. Delivery takes a snapshot of the
 * queue first, so events queued by listeners during delivery wait for
 * the next round.
 */
public class EventQueue {

    private static final Logger LOGGER = Logger.getLogger("EventQueue");

    private final List<DebuggerEvent> pending;
    private final List<DebuggerListener> listeners;

    public EventQueue() {
        pending = new ArrayList<DebuggerEvent>();
        listeners = new ArrayList<DebuggerListener>();
    }

    public String toString() {
        return String.format("%s@%h[pending=%s,listeners=%s]",
            getClass().getName(), this, pending.size(), listeners.size());
    }

    public synchronized void addListener(DebuggerListener l) {
        listeners.add(l);
    }

    public synchronized void removeListener(DebuggerListener l) {
        listeners.remove(l);
    }

    public synchronized void post(DebuggerEvent event) {
        if (event == null)
            throw new NullPointerException("Event may not be null");
        pending.add(event);
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public synchronized List<DebuggerEvent> peekEvents() {
        return Collections.unmodifiableList(new ArrayList<DebuggerEvent>(
            pending));
    }

    public synchronized List<DebuggerEvent> drainEvents() {
        List<DebuggerEvent> ret = new ArrayList<DebuggerEvent>(pending);
        pending.clear();
        return ret;
    }

    /**
     * Dispatch all pending events to all listeners.
     * A listener failing is logged and does not stop delivery.
     * Returns the number of events delivered.
     */
    public int deliverEvents() {
        List<DebuggerEvent> events;
        List<DebuggerListener> targets;
        synchronized (this) {
            events = new ArrayList<DebuggerEvent>(pending);
            pending.clear();
            targets = new ArrayList<DebuggerListener>(listeners);
        }
        for (DebuggerEvent e : events) {
            for (DebuggerListener l : targets) {
                try {
                    e.dispatch(l);
                } catch (RuntimeException exc) {
                    LOGGER.log(Level.SEVERE, "Exception while delivering " +
                               e.getType() + " event", exc);
                }
            }
        }
        return events.size();
    }

}
