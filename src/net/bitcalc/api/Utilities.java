package net.bitcalc.api;

import org.json.JSONObject;

/**
 * Miscellaneous static utility methods.
 */
public final class Utilities {

    // Prevent construction.
    private Utilities() {}

    /**
     * Construct a JSONObject from the given key-value pairs.
     * The variadic argument array consists of pairs of strings and arbitrary
     * objects (in that order), which are added to the newly-made object.
     * Pairs whose value is null are skipped.
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
            if (params[i + 1] == null) continue;
            ret.put((String) params[i], params[i + 1]);
        }
        return ret;
    }

    /**
     * Return whether the string represents an affirmative value.
     * Intended to be more lenient than Boolean.parseBoolean(); accepts
     * inputs such as "1", "y", "yes", "on" (ignoring case) as true.
     */
    public static boolean isTrue(String s) {
        if (s == null) return false;
        return (Boolean.parseBoolean(s) || s.equalsIgnoreCase("1") ||
            s.equalsIgnoreCase("y") || s.equalsIgnoreCase("yes") ||
            s.equalsIgnoreCase("on"));
    }

}
