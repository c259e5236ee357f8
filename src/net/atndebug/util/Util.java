package net.atndebug.util;

import java.util.Collection;
import org.json.JSONArray;
import org.json.JSONObject;

public final class Util {

    private Util() {}

    /**
     * Create a JSONObject from alternating keys and values.
     * Keys must be strings; null values are stored as JSON nulls.
     */
    public static JSONObject createJSONObject(Object... params) {
        if (params.length % 2 == 1)
            throw new IllegalArgumentException("Invalid parameter amount " +
                "for createJSONObject()");
        JSONObject ret = new JSONObject();
        for (int i = 0; i < params.length; i += 2) {
            if (! (params[i] instanceof String))
                throw new IllegalArgumentException("Invalid parameter " +
                    "type for createJSONObject()");
            Object value = params[i + 1];
            ret.put((String) params[i], (value == null) ? JSONObject.NULL :
                                                          value);
        }
        return ret;
    }

    public static JSONArray createJSONArray(Collection<?> items) {
        JSONArray ret = new JSONArray();
        for (Object o : items) ret.put((o == null) ? JSONObject.NULL : o);
        return ret;
    }

}
