package com.hookline.recordmodel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, null-tolerant immutable copies of decoded JSON values.
 *
 * <p>{@code Map.copyOf}/{@code List.copyOf} reject nulls, which JSON objects and arrays contain
 * routinely, so copies are wrapped in unmodifiable views of private collections instead.
 */
final class Immutables {

    private Immutables() {
        // utility class
    }

    /**
     * Returns an unmodifiable deep copy of a map, list or scalar. Scalars are returned unchanged.
     */
    static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            return freezeList(list);
        }
        return value;
    }

    static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>(Math.max(4, map.size() * 2));
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    static List<Object> freezeList(List<?> list) {
        List<Object> copy = new ArrayList<>(list.size());
        for (Object element : list) {
            copy.add(freeze(element));
        }
        return Collections.unmodifiableList(copy);
    }

    /** A new, empty, unmodifiable list; each absent optional list field gets its own. */
    static List<Object> emptyList() {
        return Collections.unmodifiableList(new ArrayList<>(0));
    }
}
