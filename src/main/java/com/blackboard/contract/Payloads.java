package com.blackboard.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for reading and freezing fact payloads.
 */
public final class Payloads {

    private Payloads() {
    }

    /**
     * Deep copy into unmodifiable maps and lists, keeping insertion order.
     */
    public static Map<String, Object> freeze(Map<String, ?> payload) {
        if (payload == null || payload.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((key, value) -> copy.put(key, freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freezeValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(String.valueOf(key), freezeValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object nested : list) {
                copy.add(freezeValue(nested));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static String text(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value instanceof String text ? text : null;
    }

    /**
     * String entries of a list value; empty when the key is absent or not a list.
     */
    public static List<String> texts(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
            .filter(String.class::isInstance)
            .map(String.class::cast)
            .toList();
    }

    public static double number(Map<String, Object> payload, String key, double fallback) {
        Object value = payload.get(key);
        return value instanceof Number number ? number.doubleValue() : fallback;
    }

    public static boolean flag(Map<String, Object> payload, String key, boolean fallback) {
        Object value = payload.get(key);
        return value instanceof Boolean bool ? bool : fallback;
    }
}
