package io.maestro.core.plan;

import io.maestro.core.task.TaskPriority;
import io.maestro.core.util.Payloads;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Caller-supplied limits and hints for one request.
///
/// @param maxTasks planner cap; portions beyond it are reported unroutable, null for no cap
/// @param timeout per-task execution deadline, null for the configured default
/// @param priority priority of every task of the request, null for `MEDIUM`
/// @param dependencies capability to the capabilities it must wait for, never null
/// @param tasks structured goal that bypasses keyword matching, never null (empty when unused)
public record RequestConstraints(
        Integer maxTasks,
        Duration timeout,
        TaskPriority priority,
        Map<String, List<String>> dependencies,
        List<StructuredTask> tasks) {

    public static final RequestConstraints NONE =
            new RequestConstraints(null, null, null, Map.of(), List.of());

    public RequestConstraints {
        if (maxTasks != null && maxTasks < 1) {
            throw new IllegalArgumentException("maxTasks must be positive: " + maxTasks);
        }
        dependencies = dependencies != null ? Map.copyOf(dependencies) : Map.of();
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public boolean isStructured() {
        return !tasks.isEmpty();
    }

    public RequestConstraints withMaxTasks(int limit) {
        return new RequestConstraints(limit, timeout, priority, dependencies, tasks);
    }

    public RequestConstraints withTimeout(Duration newTimeout) {
        return new RequestConstraints(maxTasks, newTimeout, priority, dependencies, tasks);
    }

    /// Reads constraints from a loosely typed key-value map, as received over the wire.
    ///
    /// Recognised keys: `maxTasks` (or `max_tasks`), `timeout` (seconds), `priority`,
    /// `dependencies` (map of capability to list of capabilities) and `tasks` (list of
    /// `{capability, input, dependsOn}`).
    ///
    /// @param source raw constraints, may be null
    /// @return parsed constraints, never null
    /// @throws IllegalArgumentException if a value has the wrong shape
    public static RequestConstraints fromMap(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return NONE;
        }
        int rawMax =
                Payloads.intValue(
                        source, "maxTasks", Payloads.intValue(source, "max_tasks", 0));
        Integer maxTasks = rawMax > 0 ? rawMax : null;
        int seconds = Payloads.intValue(source, "timeout", 0);
        Duration timeout = seconds > 0 ? Duration.ofSeconds(seconds) : null;
        Object rawPriority = source.get("priority");
        TaskPriority priority =
                TaskPriority.parse(rawPriority != null ? rawPriority.toString() : null, null);

        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Payloads.nested(source, "dependencies")
                .forEach(
                        (capability, value) ->
                                dependencies.put(
                                        capability.toLowerCase(Locale.ROOT),
                                        stringList(value, capability)));

        List<StructuredTask> tasks = new ArrayList<>();
        for (Object entry : Payloads.list(source, "tasks")) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Each structured task must be an object");
            }
            tasks.add(StructuredTask.fromMap(map));
        }
        return new RequestConstraints(maxTasks, timeout, priority, dependencies, tasks);
    }

    private static List<String> stringList(Object value, String key) {
        if (value instanceof String str) {
            return List.of(str.toLowerCase(Locale.ROOT));
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("dependencies." + key + " must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(String.valueOf(item).toLowerCase(Locale.ROOT));
        }
        return result;
    }

    /// One entry of a structured goal.
    ///
    /// @param capability required capability, not null
    /// @param input agent input, never null
    /// @param dependsOn indexes of earlier structured tasks this one waits for, never null
    public record StructuredTask(
            String capability, Map<String, Object> input, List<Integer> dependsOn) {

        public StructuredTask {
            if (capability == null || capability.isBlank()) {
                throw new IllegalArgumentException("Structured task requires a capability");
            }
            capability = capability.trim().toLowerCase(Locale.ROOT);
            input = Payloads.copy(input);
            dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        }

        @SuppressWarnings("unchecked")
        static StructuredTask fromMap(Map<?, ?> raw) {
            Map<String, Object> map = new LinkedHashMap<>();
            raw.forEach((k, v) -> map.put(String.valueOf(k), v));
            Object capability = map.get("capability");
            List<Integer> dependsOn = new ArrayList<>();
            for (Object index : Payloads.list(map, "dependsOn")) {
                if (!(index instanceof Number number)) {
                    throw new IllegalArgumentException("dependsOn must list task indexes");
                }
                dependsOn.add(number.intValue());
            }
            return new StructuredTask(
                    capability != null ? capability.toString() : null,
                    Payloads.nested(map, "input"),
                    dependsOn);
        }
    }
}
