package com.hybridorm.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unwraps remote payloads that may or may not be wrapped in a {@code data} envelope.
 * <p>
 * {@code {"data": {...}}} and {@code {...}} yield the same entity map;
 * {@code {"data": [...]}} and {@code [...]} yield the same list.
 */
public final class Envelope {
    public static final String DATA_KEY = "data";

    private Envelope() {
    }

    /**
     * @return the entity map, or {@code null} when the body is not a map
     */
    public static Map<String, Object> entity(Object body) {
        if (!(body instanceof Map)) {
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) body;
        Object nested = map.get(DATA_KEY);
        if (nested instanceof Map) {
            return stringKeys((Map<?, ?>) nested);
        }
        return stringKeys(map);
    }

    /**
     * @return the list of entity maps, empty when the body holds no list; non-map elements are skipped
     */
    public static List<Map<String, Object>> collection(Object body) {
        Object items = body;
        if (body instanceof Map) {
            items = ((Map<?, ?>) body).get(DATA_KEY);
        }
        List<Map<String, Object>> result = new ArrayList<>();
        if (items instanceof List) {
            for (Object item : (List<?>) items) {
                if (item instanceof Map) {
                    result.add(stringKeys((Map<?, ?>) item));
                }
            }
        }
        return result;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }
}
