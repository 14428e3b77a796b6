package io.maestro.core.task;

import io.maestro.core.exception.InvalidTransitionException;
import io.maestro.core.util.Payloads;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/// One unit of routed, executable work derived from a request.
///
/// Mutable; every state change goes through {@link TaskQueue}, which holds {@link #lock()}
/// while mutating. Readers outside the queue should work from {@link #snapshot()}.
///
/// ### Attempts
/// Each dispatch to an agent increments {@link #getAttempt()}. Completion and failure signals
/// carry the attempt they belong to, so a late signal from a superseded execution (timed out or
/// re-routed) is recognised as stale and rejected.
public final class Task {

    private final ReentrantLock lock = new ReentrantLock();

    private final String id;
    private final String requestId;
    private final int index;
    private final TaskSpec spec;
    private final List<String> dependencyIds;
    private final int maxAttempts;
    private final Instant createdAt;

    private volatile TaskState state = TaskState.PENDING;
    private volatile boolean terminal;
    private volatile String assignedAgentId;
    private Map<String, Object> output;
    private TaskError lastError;
    private int retryCount;
    private volatile int attempt;
    private volatile long enqueueSequence = -1;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant deadline;
    private final Set<String> excludedAgents = new LinkedHashSet<>();
    private final List<TaskError> failureHistory = new ArrayList<>();

    /// Creates a task in `PENDING`.
    ///
    /// @param id unique task identifier, not null
    /// @param requestId owning request identifier, not null
    /// @param index position in the request's plan, used for result ordering
    /// @param spec what to execute, not null
    /// @param dependencyIds ids of tasks that must complete first, not null
    /// @param maxAttempts retries allowed after the first execution
    public Task(
            String id,
            String requestId,
            int index,
            TaskSpec spec,
            List<String> dependencyIds,
            int maxAttempts) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.requestId = Objects.requireNonNull(requestId, "requestId must not be null");
        this.index = index;
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
        this.dependencyIds = List.copyOf(dependencyIds);
        this.maxAttempts = maxAttempts;
        this.createdAt = Instant.now();
    }

    ReentrantLock lock() {
        return lock;
    }

    /// Moves to `target`; caller must hold the lock.
    void transition(TaskState target) {
        if (terminal || !state.canTransitionTo(target)) {
            throw InvalidTransitionException.of("task " + id, describeState(), target);
        }
        state = target;
    }

    private String describeState() {
        return terminal && state == TaskState.FAILED ? "FAILED(terminal)" : state.name();
    }

    public String getId() {
        return id;
    }

    public String getRequestId() {
        return requestId;
    }

    public int getIndex() {
        return index;
    }

    public TaskSpec getSpec() {
        return spec;
    }

    public List<String> getDependencyIds() {
        return dependencyIds;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public TaskState getState() {
        return state;
    }

    /// Returns whether the task can no longer change state.
    ///
    /// @return `true` once completed, or failed with no retry remaining
    public boolean isTerminal() {
        return terminal;
    }

    /// Returns whether the task is pending but not yet admitted because of its dependencies.
    public boolean isWithheld() {
        return !terminal && state == TaskState.PENDING && enqueueSequence < 0;
    }

    public String getAssignedAgentId() {
        return assignedAgentId;
    }

    public Map<String, Object> getOutput() {
        return output;
    }

    public TaskError getLastError() {
        return lastError;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    Set<String> excludedAgents() {
        return excludedAgents;
    }

    long getEnqueueSequence() {
        return enqueueSequence;
    }

    void setEnqueueSequence(long enqueueSequence) {
        this.enqueueSequence = enqueueSequence;
    }

    void assign(String agentId) {
        this.assignedAgentId = agentId;
    }

    int startAttempt(Instant now, Instant newDeadline) {
        this.attempt++;
        this.startedAt = now;
        this.deadline = newDeadline;
        return attempt;
    }

    /// Invalidates the live attempt without starting a new one.
    void supersedeAttempt() {
        this.attempt++;
    }

    void succeed(Map<String, Object> result, Instant now) {
        this.output = Payloads.copy(result);
        this.finishedAt = now;
        this.deadline = null;
        this.terminal = true;
    }

    void recordFailure(TaskError error) {
        this.lastError = error;
        this.failureHistory.add(error);
        this.deadline = null;
    }

    void markTerminal(Instant now) {
        this.terminal = true;
        this.finishedAt = now;
    }

    /// Returns to the retry position; the failure stays only in the history.
    void prepareRetry() {
        this.retryCount++;
        this.lastError = null;
        this.assignedAgentId = null;
        this.excludedAgents.clear();
        this.enqueueSequence = -1;
    }

    /// Captures the current state; caller should hold the lock for a consistent view.
    ///
    /// @return snapshot, never null
    public TaskSnapshot snapshot() {
        return new TaskSnapshot(
                id,
                requestId,
                index,
                spec,
                state,
                terminal,
                assignedAgentId,
                output,
                lastError,
                retryCount,
                maxAttempts,
                attempt,
                dependencyIds,
                List.copyOf(failureHistory),
                createdAt,
                startedAt,
                finishedAt,
                deadline);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', capability='" + spec.capability() + "', state=" + state + "}";
    }
}
