package io.maestro.core.agent.standard;

import io.maestro.core.util.Payloads;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/// In-memory record keeping for the built-in handlers: creates numbered records and searches
/// them by a case-insensitive name fragment.
final class RecordBook {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Map<String, Object>> records = new ConcurrentHashMap<>();

    RecordBook(String prefix) {
        this.prefix = prefix;
    }

    String create(Map<String, Object> data) {
        String id = prefix + "-" + sequence.incrementAndGet();
        Map<String, Object> record = new LinkedHashMap<>(data);
        record.put("id", id);
        records.put(id, Payloads.copy(record));
        return id;
    }

    void seed(List<?> entries) {
        for (Object entry : entries) {
            if (entry instanceof Map<?, ?> map) {
                Map<String, Object> data = new LinkedHashMap<>();
                map.forEach((k, v) -> data.put(String.valueOf(k), v));
                create(data);
            }
        }
    }

    /// Returns `{id, name}` summaries whose name contains `query`, ordered by id sequence.
    List<Map<String, Object>> search(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<Map<String, Object>> result = new ArrayList<>();
        for (long i = 1; i <= sequence.get(); i++) {
            Map<String, Object> record = records.get(prefix + "-" + i);
            if (record == null) {
                continue;
            }
            String name = String.valueOf(record.getOrDefault("name", ""));
            if (name.toLowerCase(Locale.ROOT).contains(needle)) {
                Map<String, Object> summary = new LinkedHashMap<>();
                summary.put("id", record.get("id"));
                summary.put("name", name);
                result.add(summary);
            }
        }
        return result;
    }

    int size() {
        return records.size();
    }
}
