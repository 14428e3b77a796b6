package io.maestro.core.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Helpers for the structured key-value payloads that flow through the engine.
///
/// Payloads arrive from JSON and may legitimately contain `null` values, which
/// {@link Map#copyOf(Map)} rejects; these helpers copy while tolerating them.
public final class Payloads {

    private Payloads() {}

    /// Returns an unmodifiable, insertion-ordered copy of `source`.
    ///
    /// @param source map to copy, may be null
    /// @return unmodifiable copy, empty when `source` is null
    public static Map<String, Object> copy(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /// Reads a nested map value.
    ///
    /// @param source map to read from, not null
    /// @param key key to look up, not null
    /// @return the nested map with string keys, or empty map if absent or not a map
    @SuppressWarnings("unchecked")
    public static Map<String, Object> nested(Map<String, ?> source, String key) {
        Object value = source.get(key);
        if (value instanceof Map<?, ?> map) {
            return copy((Map<String, ?>) map);
        }
        return Map.of();
    }

    /// Reads a list value.
    ///
    /// @param source map to read from, not null
    /// @param key key to look up, not null
    /// @return the list, or empty list if absent or not a list
    public static List<?> list(Map<String, ?> source, String key) {
        Object value = source.get(key);
        if (value instanceof List<?> list) {
            return list;
        }
        return List.of();
    }

    /// Reads an integer value, accepting any {@link Number} or numeric string.
    ///
    /// @param source map to read from, not null
    /// @param key key to look up, not null
    /// @param defaultValue value returned when absent or unparseable
    /// @return the integer value
    public static int intValue(Map<String, ?> source, String key, int defaultValue) {
        Object value = source.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
