package org.sessionsync.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for the free-form values participants store in their state maps.
 * Values are JSON-like: maps, lists, sets, strings, numbers, booleans or null.
 */
public final class StateValues {

    /** Key under which a value may carry its own update timestamp. */
    public static final String TIMESTAMP_KEY = "timestamp";

    private StateValues() {}

    /**
     * Recursively copies maps and collections; scalars are returned as-is.
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            ((Map<Object, Object>) value).forEach((k, v) -> out.put(k, deepCopy(v)));
            return out;
        }
        if (value instanceof Set) {
            Set<Object> out = new LinkedHashSet<>();
            for (Object v : (Set<Object>) value) out.add(deepCopy(v));
            return out;
        }
        if (value instanceof Collection) {
            List<Object> out = new ArrayList<>();
            for (Object v : (Collection<Object>) value) out.add(deepCopy(v));
            return out;
        }
        return value;
    }

    /** Deep copy of a string-keyed map, preserving iteration order. */
    public static Map<String, Object> deepCopyMap(Map<String, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (map != null) {
            map.forEach((k, v) -> out.put(k, deepCopy(v)));
        }
        return out;
    }

    /**
     * Returns the timestamp embedded in a map value under {@link #TIMESTAMP_KEY},
     * or {@code fallback} when the value carries none.
     */
    public static double embeddedTimestamp(Object value, double fallback) {
        if (value instanceof Map) {
            Object ts = ((Map<?, ?>) value).get(TIMESTAMP_KEY);
            if (ts instanceof Number) {
                return ((Number) ts).doubleValue();
            }
        }
        return fallback;
    }
}
