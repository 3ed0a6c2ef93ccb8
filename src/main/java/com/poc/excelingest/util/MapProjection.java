package com.poc.excelingest.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands model values into plain maps, lists, strings, numbers and booleans for JSON output.
 */
public final class MapProjection {

    /**
     * Implemented by models that have a stable map form.
     */
    public interface Projectable {
        Map<String, Object> toMap();
    }

    private MapProjection() {
    }

    public static Object expand(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Projectable) {
            return ((Projectable) value).toMap();
        }
        if (value instanceof Map) {
            return expandMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            Collection<?> collection = (Collection<?>) value;
            List<Object> list = new ArrayList<>(collection.size());
            for (Object item : collection) {
                list.add(expand(item));
            }
            return list;
        }
        if (value instanceof Object[]) {
            Object[] array = (Object[]) value;
            List<Object> list = new ArrayList<>(array.length);
            for (Object item : array) {
                list.add(expand(item));
            }
            return list;
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    public static Map<String, Object> expandMap(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((key, item) -> out.put(String.valueOf(key), expand(item)));
        return out;
    }
}
