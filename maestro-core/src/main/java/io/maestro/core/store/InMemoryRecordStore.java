package io.maestro.core.store;

import io.maestro.core.MaestroConfig;
import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.orchestrator.RequestRecord;
import io.maestro.core.task.TaskSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// {@link RecordStore} that keeps the latest task and request records in memory.
///
/// Suitable for tests, single-process deployments and as the history side of stores that load
/// their agents from elsewhere.
///
/// ### History bound
/// At most `historyLimit` request records are kept. When a new request would exceed it, the
/// oldest finished request is evicted together with its tasks; while every kept request is
/// still in progress the oldest one goes. {@link #purgeFinished(Duration)} drops finished
/// requests by age.
public class InMemoryRecordStore implements RecordStore {

    public static final int DEFAULT_HISTORY_LIMIT = 10_000;

    private final List<AgentDefinition> agents = new CopyOnWriteArrayList<>();
    private volatile MaestroConfig config;
    private final int historyLimit;
    private final Map<String, TaskSnapshot> tasks = new ConcurrentHashMap<>();
    // Insertion-ordered, guarded by itself.
    private final Map<String, RequestRecord> requests = new LinkedHashMap<>();

    public InMemoryRecordStore() {
        this(List.of(), null);
    }

    public InMemoryRecordStore(List<AgentDefinition> agents, MaestroConfig config) {
        this(agents, config, DEFAULT_HISTORY_LIMIT);
    }

    /// Creates a store with a bounded request history.
    ///
    /// @param agents definitions returned by {@link #loadAgents()}, not null
    /// @param config settings returned by {@link #loadOrchestratorConfig()}, may be null
    /// @param historyLimit maximum number of request records kept, positive
    /// @throws IllegalArgumentException if `historyLimit` is not positive
    public InMemoryRecordStore(
            List<AgentDefinition> agents, MaestroConfig config, int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        }
        this.agents.addAll(agents);
        this.config = config;
        this.historyLimit = historyLimit;
    }

    @Override
    public List<AgentDefinition> loadAgents() {
        return List.copyOf(agents);
    }

    @Override
    public Optional<MaestroConfig> loadOrchestratorConfig() {
        return Optional.ofNullable(config);
    }

    @Override
    public void persistTask(TaskSnapshot task) {
        tasks.put(task.id(), task);
    }

    @Override
    public void persistRequest(RequestRecord request) {
        synchronized (requests) {
            requests.put(request.requestId(), request);
            while (requests.size() > historyLimit) {
                evict(oldestEvictable());
            }
        }
    }

    // Caller holds the requests lock.
    private RequestRecord oldestEvictable() {
        RequestRecord oldest = null;
        for (RequestRecord record : requests.values()) {
            if (oldest == null) {
                oldest = record;
            }
            if (record.finishedAt() != null) {
                return record;
            }
        }
        return oldest;
    }

    // Caller holds the requests lock.
    private void evict(RequestRecord record) {
        requests.remove(record.requestId());
        for (String taskId : record.taskIds()) {
            tasks.remove(taskId);
        }
    }

    /// Drops finished requests, and their tasks, that finished before `now - olderThan`.
    ///
    /// @param olderThan minimum age of a purged request, not null
    /// @return number of request records removed
    public int purgeFinished(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        int removed = 0;
        synchronized (requests) {
            Iterator<RequestRecord> it = requests.values().iterator();
            while (it.hasNext()) {
                RequestRecord record = it.next();
                if (record.finishedAt() != null && record.finishedAt().isBefore(cutoff)) {
                    it.remove();
                    for (String taskId : record.taskIds()) {
                        tasks.remove(taskId);
                    }
                    removed++;
                }
            }
        }
        return removed;
    }

    public void saveAgent(AgentDefinition definition) {
        agents.removeIf(existing -> existing.getId().equals(definition.getId()));
        agents.add(definition);
    }

    public void saveOrchestratorConfig(MaestroConfig newConfig) {
        this.config = newConfig;
    }

    public Optional<TaskSnapshot> findTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public Optional<RequestRecord> findRequest(String requestId) {
        synchronized (requests) {
            return Optional.ofNullable(requests.get(requestId));
        }
    }

    /// Returns the latest record of every task of a request, in plan order.
    public List<TaskSnapshot> tasksForRequest(String requestId) {
        List<TaskSnapshot> result = new ArrayList<>();
        for (TaskSnapshot task : tasks.values()) {
            if (task.requestId().equals(requestId)) {
                result.add(task);
            }
        }
        result.sort((a, b) -> Integer.compare(a.index(), b.index()));
        return result;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public int taskCount() {
        return tasks.size();
    }

    public int requestCount() {
        synchronized (requests) {
            return requests.size();
        }
    }
}
