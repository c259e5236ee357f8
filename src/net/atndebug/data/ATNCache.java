package net.atndebug.data;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Keeps loaded grammar data around for reuse by later sessions.
 * Entries are keyed by grammar identity (usually the path of the grammar
 * file). One entry can serve any number of sessions, which share the
 * DFA caches of its ATNs; an entry must be invalidated when its grammar
 * changes.
 */
public class ATNCache {

    public interface Loader {

        InterpreterData load(String key) throws IOException;

    }

    private static final Logger LOGGER = Logger.getLogger("ATNCache");

    private final Map<String, InterpreterData> entries;

    public ATNCache() {
        entries = new HashMap<String, InterpreterData>();
    }

    public String toString() {
        return String.format("%s@%h[size=%s]", getClass().getName(), this,
                             size());
    }

    /**
     * Return the data cached for key, loading it first if necessary.
     * A failing loader leaves the cache unchanged.
     */
    public synchronized InterpreterData get(String key, Loader loader)
            throws IOException {
        InterpreterData ret = entries.get(key);
        if (ret != null) {
            LOGGER.fine("Cache hit for " + key);
            return ret;
        }
        LOGGER.fine("Cache miss for " + key);
        ret = loader.load(key);
        if (ret == null)
            throw new NullPointerException("Loader returned null for " +
                                           key);
        entries.put(key, ret);
        return ret;
    }

    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    /**
     * Drop the entry for key because the grammar has changed.
     */
    public synchronized void invalidate(String key) {
        if (entries.remove(key) != null)
            LOGGER.fine("Invalidated " + key);
    }

    public synchronized void release(String key) {
        entries.remove(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

}
