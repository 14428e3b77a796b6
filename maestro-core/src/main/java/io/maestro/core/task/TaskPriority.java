package io.maestro.core.task;

import java.util.Locale;

/// Dispatch priority of a task; higher priorities leave the queue first.
public enum TaskPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    /// Parses a priority name, case-insensitive.
    ///
    /// @param value priority name, may be null
    /// @param fallback value returned when `value` is null, blank or unknown
    /// @return the parsed priority
    public static TaskPriority parse(String value, TaskPriority fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
