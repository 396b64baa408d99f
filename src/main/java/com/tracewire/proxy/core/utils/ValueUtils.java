package com.tracewire.proxy.core.utils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed values SnakeYAML produces for hook options and
 * hook state.
 */
public final class ValueUtils {

    private ValueUtils() {
        // Utility class
    }

    /**
     * Copies nested maps, collections and byte arrays. Other values are shared.
     * 
     * @param value A YAML value, may be {@code null}.
     * @return An independent copy.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(deepCopy(v)));
            return copy;
        }
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        return value;
    }

    /**
     * @param options Options, may be {@code null}.
     * @return An unmodifiable deep copy, empty when {@code options} is {@code null}.
     */
    public static Map<String, Object> immutableCopy(Map<String, Object> options) {
        if (options == null || options.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        options.forEach((k, v) -> copy.put(k, deepCopy(v)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Parses an integer from a number or a trimmed string.
     * 
     * @param value The value.
     * @return The integer, or {@code null} if it is not one or does not fit
     *         an {@code int}.
     */
    public static Integer toInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            return number < Integer.MIN_VALUE || number > Integer.MAX_VALUE ? null : (int) number;
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Integer.SIZE ? big.intValue() : null;
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * @param options  Hook options.
     * @param key      Option name.
     * @param fallback Value returned when the option is missing.
     * @return The option as string.
     */
    public static String optionString(Map<String, Object> options, String key, String fallback) {
        Object value = options.get(key);
        return value == null ? fallback : String.valueOf(value);
    }
}
