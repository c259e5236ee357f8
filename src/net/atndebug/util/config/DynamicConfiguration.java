package net.atndebug.util.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A configuration assembled from explicit values and fallback sources.
 * Explicit values (see put()) take precedence; otherwise, the sources are
 * consulted in the order they were added and the first non-null answer
 * wins. Answers from sources are not cached, so that changes to system
 * properties made after construction are observed.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(toEnvName(key));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public DynamicConfiguration(Map<String, String> values) {
        this();
        data.putAll(values);
    }

    public String toString() {
        return String.format("%s@%h[data=%s,sources=%s]",
            getClass().getName(), this, data, sources.size());
    }

    public Map<String, String> getData() {
        return Collections.unmodifiableMap(data);
    }

    public List<Configuration> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public String get(String key) {
        String ret = data.get(key);
        if (ret != null) return ret;
        for (Configuration src : sources) {
            ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    public void put(String key, String value) {
        if (value == null) {
            data.remove(key);
        } else {
            data.put(key, value);
        }
    }

    public void remove(String key) {
        data.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }

    public void removeSource(Configuration source) {
        sources.remove(source);
    }

    public static String toEnvName(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }

    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
