package io.maestro.core.task;

import io.maestro.core.agent.RegisteredAgent;
import io.maestro.core.exception.DependencyUnmetException;
import io.maestro.core.exception.ErrorKind;
import io.maestro.core.exception.InvalidTransitionException;
import io.maestro.core.exception.OrchestratorException;
import io.maestro.core.routing.Router;
import io.maestro.core.store.RecordStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Holds every task of the engine and owns their state machine.
///
/// ### Contracts
/// - **Invariant**: at most one execution attempt is live per task; completion and failure
///   signals for any other attempt are rejected with {@link InvalidTransitionException}
/// - **Invariant**: `COMPLETED` and terminal `FAILED` are final
/// - **Invariant**: a task is only admitted for dispatch once every dependency is `COMPLETED`
/// - **Ordering**: dispatch order is priority (highest first), then enqueue order
///
/// Retries are scheduled on the shared scheduler after the {@link RetryPolicy} backoff; the
/// task sits in non-terminal `FAILED` during the delay.
///
/// @implNote Thread-safe. Transitions lock only the affected task. Listener notification and
/// record store writes happen after the lock is released.
public class TaskQueue {

    private static final Logger logger = Logger.getLogger(TaskQueue.class.getName());

    private static final Comparator<Task> DISPATCH_ORDER =
            Comparator.comparing((Task t) -> t.getSpec().priority())
                    .reversed()
                    .thenComparingLong(Task::getEnqueueSequence);

    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final RecordStore recordStore;

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, List<String>> tasksByRequest = new ConcurrentHashMap<>();
    private final ReentrantLock pendingLock = new ReentrantLock();
    private final TreeSet<Task> pending = new TreeSet<>(DISPATCH_ORDER);
    private final AtomicLong enqueueSequence = new AtomicLong();
    private final List<TaskListener> listeners = new CopyOnWriteArrayList<>();

    /// Creates a queue.
    ///
    /// @param retryPolicy backoff policy for failed tasks, not null
    /// @param scheduler executor for delayed retries, not null
    /// @param recordStore receives every task transition, not null
    public TaskQueue(
            RetryPolicy retryPolicy, ScheduledExecutorService scheduler, RecordStore recordStore) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
    }

    public void addListener(TaskListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /// Starts tracking a new `PENDING` task without admitting it for dispatch.
    ///
    /// @param task new task, not null
    /// @throws InvalidTransitionException if a task with the same id is already tracked
    public void track(Task task) {
        if (tasks.putIfAbsent(task.getId(), task) != null) {
            throw new InvalidTransitionException("Task already tracked: " + task.getId());
        }
        tasksByRequest
                .computeIfAbsent(task.getRequestId(), k -> new CopyOnWriteArrayList<>())
                .add(task.getId());
        persist(task.snapshot());
    }

    /// Admits a tracked `PENDING` task for dispatch.
    ///
    /// @param taskId task identifier, not null
    /// @return the enqueued task's snapshot, never null
    /// @throws DependencyUnmetException if any dependency is not `COMPLETED`
    /// @throws InvalidTransitionException if the task is unknown, not pending or already enqueued
    public TaskSnapshot enqueue(String taskId) {
        Task task = require(taskId);
        TaskSnapshot snapshot;
        task.lock().lock();
        try {
            if (task.isTerminal()
                    || task.getState() != TaskState.PENDING
                    || task.getEnqueueSequence() >= 0) {
                throw new InvalidTransitionException(
                        "Task " + taskId + " cannot be enqueued in state " + task.getState());
            }
            for (String dependencyId : task.getDependencyIds()) {
                Task dependency = tasks.get(dependencyId);
                if (dependency == null || dependency.getState() != TaskState.COMPLETED) {
                    throw new DependencyUnmetException(
                            "Task " + taskId + " depends on " + dependencyId
                                    + " which is not completed");
                }
            }
            admit(task);
            snapshot = task.snapshot();
        } finally {
            task.lock().unlock();
        }
        persist(snapshot);
        emit(TaskEvent.of(TaskEvent.Type.ENQUEUED, snapshot));
        return snapshot;
    }

    // Caller holds the task lock.
    private void admit(Task task) {
        task.setEnqueueSequence(enqueueSequence.incrementAndGet());
        pendingLock.lock();
        try {
            pending.add(task);
        } finally {
            pendingLock.unlock();
        }
    }

    /// Takes the next pending task and routes it.
    ///
    /// Tasks for which routing fails are recorded as failed (and retried per policy); the search
    /// continues with the next pending task.
    ///
    /// @param router agent selection, not null
    /// @return the routed task and its agent, or empty when nothing is dispatchable
    public Optional<Dispatch> dequeueForExecution(Router router) {
        while (true) {
            Task task = pollPending();
            if (task == null) {
                return Optional.empty();
            }
            Optional<Dispatch> dispatch = routeFromPending(task, router);
            if (dispatch.isPresent()) {
                return dispatch;
            }
        }
    }

    private Task pollPending() {
        pendingLock.lock();
        try {
            return pending.pollFirst();
        } finally {
            pendingLock.unlock();
        }
    }

    private Optional<Dispatch> routeFromPending(Task task, Router router) {
        List<TaskEvent> events = new ArrayList<>();
        Dispatch dispatch = null;
        Duration retryDelay = null;
        task.lock().lock();
        try {
            if (task.isTerminal() || task.getState() != TaskState.PENDING) {
                return Optional.empty();
            }
            try {
                RegisteredAgent agent =
                        router.route(task.getSpec(), Set.copyOf(task.excludedAgents()));
                task.transition(TaskState.ROUTED);
                task.assign(agent.getId());
                dispatch = new Dispatch(task.snapshot(), agent);
                events.add(TaskEvent.of(TaskEvent.Type.ROUTED, dispatch.task()));
            } catch (OrchestratorException e) {
                task.transition(TaskState.FAILED);
                retryDelay = recordFailure(task, TaskError.of(e.getKind(), e.getMessage()), events);
            }
        } finally {
            task.lock().unlock();
        }
        publish(events);
        scheduleRetry(task, retryDelay);
        return Optional.ofNullable(dispatch);
    }

    /// Moves a routed task to `RUNNING` and opens a new execution attempt.
    ///
    /// @param taskId task identifier, not null
    /// @param timeout execution deadline from now, null for none
    /// @return snapshot carrying the new attempt number, never null
    /// @throws InvalidTransitionException if the task is not `ROUTED`
    public TaskSnapshot markRunning(String taskId, Duration timeout) {
        Task task = require(taskId);
        TaskSnapshot snapshot;
        task.lock().lock();
        try {
            task.transition(TaskState.RUNNING);
            Instant now = Instant.now();
            task.startAttempt(now, timeout != null ? now.plus(timeout) : null);
            snapshot = task.snapshot();
        } finally {
            task.lock().unlock();
        }
        persist(snapshot);
        emit(TaskEvent.of(TaskEvent.Type.RUNNING, snapshot));
        return snapshot;
    }

    /// Completes the live attempt of a running task.
    ///
    /// @param taskId task identifier, not null
    /// @param attempt attempt the result belongs to
    /// @param output result payload, may be null
    /// @return the completed task's snapshot, never null
    /// @throws InvalidTransitionException if the task is not running or `attempt` is stale
    public TaskSnapshot complete(String taskId, int attempt, Map<String, Object> output) {
        Task task = require(taskId);
        TaskSnapshot snapshot;
        task.lock().lock();
        try {
            requireLiveAttempt(task, attempt, TaskState.COMPLETED);
            task.transition(TaskState.COMPLETED);
            task.succeed(output, Instant.now());
            snapshot = task.snapshot();
        } finally {
            task.lock().unlock();
        }
        persist(snapshot);
        emit(TaskEvent.of(TaskEvent.Type.COMPLETED, snapshot));
        return snapshot;
    }

    /// Completes the current attempt of a running task.
    ///
    /// @see #complete(String, int, Map)
    public TaskSnapshot complete(String taskId, Map<String, Object> output) {
        return complete(taskId, require(taskId).getAttempt(), output);
    }

    /// Fails the live attempt of a running task and applies the retry policy.
    ///
    /// @param taskId task identifier, not null
    /// @param attempt attempt the failure belongs to
    /// @param error what went wrong, not null
    /// @return snapshot after the failure, never null; {@link TaskSnapshot#terminal()} tells
    ///     whether a retry was scheduled
    /// @throws InvalidTransitionException if the task is not running or `attempt` is stale
    public TaskSnapshot fail(String taskId, int attempt, TaskError error) {
        Task task = require(taskId);
        List<TaskEvent> events = new ArrayList<>();
        Duration retryDelay;
        TaskSnapshot snapshot;
        task.lock().lock();
        try {
            requireLiveAttempt(task, attempt, TaskState.FAILED);
            task.transition(TaskState.FAILED);
            retryDelay = recordFailure(task, error, events);
            snapshot = task.snapshot();
        } finally {
            task.lock().unlock();
        }
        publish(events);
        scheduleRetry(task, retryDelay);
        return snapshot;
    }

    /// Fails the current attempt of a running task.
    ///
    /// @see #fail(String, int, TaskError)
    public TaskSnapshot fail(String taskId, TaskError error) {
        return fail(taskId, require(taskId).getAttempt(), error);
    }

    /// Re-routes a running task away from an agent that entered error state.
    ///
    /// The live attempt is superseded; if another agent is available the task returns to
    /// `ROUTED` on it, otherwise the task fails with the routing error and the retry policy
    /// applies.
    ///
    /// @param taskId task identifier, not null
    /// @param failedAgentId agent to move away from, not null
    /// @param router agent selection, not null
    /// @return the new dispatch, or empty if the task was not running on that agent or could
    ///     not be re-routed
    public Optional<Dispatch> reroute(String taskId, String failedAgentId, Router router) {
        Task task = require(taskId);
        List<TaskEvent> events = new ArrayList<>();
        Dispatch dispatch = null;
        Duration retryDelay = null;
        task.lock().lock();
        try {
            if (task.isTerminal()
                    || task.getState() != TaskState.RUNNING
                    || !failedAgentId.equals(task.getAssignedAgentId())) {
                return Optional.empty();
            }
            task.supersedeAttempt();
            task.excludedAgents().add(failedAgentId);
            try {
                RegisteredAgent agent =
                        router.route(task.getSpec(), Set.copyOf(task.excludedAgents()));
                task.transition(TaskState.ROUTED);
                task.assign(agent.getId());
                dispatch = new Dispatch(task.snapshot(), agent);
                events.add(TaskEvent.of(TaskEvent.Type.ROUTED, dispatch.task()));
            } catch (OrchestratorException e) {
                task.transition(TaskState.FAILED);
                retryDelay =
                        recordFailure(
                                task,
                                TaskError.of(e.getKind(), e.getMessage(), failedAgentId),
                                events);
            }
        } finally {
            task.lock().unlock();
        }
        logger.warning("Re-routing task " + taskId + " away from agent " + failedAgentId);
        publish(events);
        scheduleRetry(task, retryDelay);
        return Optional.ofNullable(dispatch);
    }

    /// Forces a non-terminal task into terminal `FAILED`.
    ///
    /// Used when stopping the engine and when a dependency failed. Any live attempt is
    /// superseded, so its later result is rejected.
    ///
    /// @param taskId task identifier, not null
    /// @param error recorded reason, not null
    /// @return `true` if the task was aborted, `false` if it was already terminal
    public boolean abort(String taskId, TaskError error) {
        Task task = require(taskId);
        TaskSnapshot snapshot;
        task.lock().lock();
        try {
            if (task.isTerminal()) {
                return false;
            }
            if (task.getState() != TaskState.FAILED) {
                task.transition(TaskState.FAILED);
            }
            removePending(task);
            task.supersedeAttempt();
            task.recordFailure(error);
            task.markTerminal(Instant.now());
            snapshot = task.snapshot();
        } finally {
            task.lock().unlock();
        }
        logger.fine("Aborted task " + taskId + ": " + error.message());
        persist(snapshot);
        emit(TaskEvent.of(TaskEvent.Type.FAILED, snapshot));
        return true;
    }

    private void removePending(Task task) {
        pendingLock.lock();
        try {
            pending.remove(task);
        } finally {
            pendingLock.unlock();
        }
    }

    // Caller holds the task lock and has moved the task to FAILED. Returns the retry delay,
    // or null when the failure is terminal.
    private Duration recordFailure(Task task, TaskError error, List<TaskEvent> events) {
        task.recordFailure(error);
        boolean retry =
                retryPolicy.shouldRetry(task.getRetryCount(), error.kind())
                        && task.getRetryCount() < task.getMaxAttempts();
        if (!retry) {
            task.markTerminal(Instant.now());
            events.add(TaskEvent.of(TaskEvent.Type.FAILED, task.snapshot()));
            logger.fine("Task " + task.getId() + " failed terminally: " + error.message());
            return null;
        }
        TaskSnapshot snapshot = task.snapshot();
        events.add(TaskEvent.of(TaskEvent.Type.FAILED, snapshot));
        events.add(TaskEvent.of(TaskEvent.Type.RETRY_SCHEDULED, snapshot));
        Duration delay = retryPolicy.backoff(task.getRetryCount());
        logger.warning(
                "Task "
                        + task.getId()
                        + " failed ("
                        + error.kind()
                        + "), retry "
                        + (task.getRetryCount() + 1)
                        + "/"
                        + task.getMaxAttempts()
                        + " in "
                        + delay.toMillis()
                        + "ms");
        return delay;
    }

    private void scheduleRetry(Task task, Duration delay) {
        if (delay == null) {
            return;
        }
        int expectedRetryCount = task.getRetryCount();
        try {
            scheduler.schedule(
                    () -> retry(task, expectedRetryCount), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Retry of task " + task.getId() + " rejected", e);
            abort(task.getId(), TaskError.of(ErrorKind.ORCHESTRATOR_STOPPED, "Retry rejected"));
        }
    }

    private void retry(Task task, int expectedRetryCount) {
        TaskSnapshot snapshot;
        task.lock().lock();
        try {
            if (task.isTerminal()
                    || task.getState() != TaskState.FAILED
                    || task.getRetryCount() != expectedRetryCount) {
                return;
            }
            task.transition(TaskState.PENDING);
            task.prepareRetry();
            admit(task);
            snapshot = task.snapshot();
        } finally {
            task.lock().unlock();
        }
        persist(snapshot);
        emit(TaskEvent.of(TaskEvent.Type.ENQUEUED, snapshot));
    }

    private void requireLiveAttempt(Task task, int attempt, TaskState target) {
        if (task.isTerminal() || task.getState() != TaskState.RUNNING) {
            throw InvalidTransitionException.of("task " + task.getId(), task.getState(), target);
        }
        if (task.getAttempt() != attempt) {
            throw new InvalidTransitionException(
                    "Stale signal for task "
                            + task.getId()
                            + ": attempt "
                            + attempt
                            + " superseded by "
                            + task.getAttempt());
        }
    }

    public Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /// Returns a consistent snapshot of one task.
    ///
    /// @param taskId task identifier, not null
    /// @return snapshot, or empty if unknown
    public Optional<TaskSnapshot> snapshot(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return Optional.empty();
        }
        task.lock().lock();
        try {
            return Optional.of(task.snapshot());
        } finally {
            task.lock().unlock();
        }
    }

    /// Returns the tasks of a request in plan order.
    ///
    /// @param requestId request identifier, not null
    /// @return tasks, never null
    public List<Task> tasksForRequest(String requestId) {
        List<String> ids = tasksByRequest.getOrDefault(requestId, List.of());
        List<Task> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            Task task = tasks.get(id);
            if (task != null) {
                result.add(task);
            }
        }
        result.sort(Comparator.comparingInt(Task::getIndex));
        return result;
    }

    /// Returns tasks that are running or routed.
    public List<Task> inFlight() {
        List<Task> result = new ArrayList<>();
        for (Task task : tasks.values()) {
            TaskState state = task.getState();
            if (!task.isTerminal() && (state == TaskState.RUNNING || state == TaskState.ROUTED)) {
                result.add(task);
            }
        }
        return result;
    }

    /// Returns all tasks that have not reached a terminal state.
    public List<Task> nonTerminal() {
        List<Task> result = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (!task.isTerminal()) {
                result.add(task);
            }
        }
        return result;
    }

    /// Counts tasks per lifecycle position. Read-only.
    ///
    /// @return depth, never null
    public QueueDepth depth() {
        int pendingCount = 0;
        int withheld = 0;
        int routed = 0;
        int running = 0;
        int retrying = 0;
        int completed = 0;
        int failed = 0;
        for (Task task : tasks.values()) {
            switch (task.getState()) {
                case PENDING -> {
                    if (task.getEnqueueSequence() >= 0) {
                        pendingCount++;
                    } else {
                        withheld++;
                    }
                }
                case ROUTED -> routed++;
                case RUNNING -> running++;
                case COMPLETED -> completed++;
                case FAILED -> {
                    if (task.isTerminal()) {
                        failed++;
                    } else {
                        retrying++;
                    }
                }
            }
        }
        return new QueueDepth(pendingCount, withheld, routed, running, retrying, completed, failed);
    }

    /// Drops the tasks of finished requests.
    ///
    /// A request is purged only when every one of its tasks is terminal and the last of them
    /// finished before `now - olderThan`. Tasks of a request still in progress are kept.
    ///
    /// @param olderThan minimum age of a purged request, not null
    /// @return number of tasks removed
    public int purgeTerminal(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        int removed = 0;
        for (Map.Entry<String, List<String>> entry : List.copyOf(tasksByRequest.entrySet())) {
            List<Task> siblings = tasksForRequest(entry.getKey());
            boolean finished =
                    siblings.stream()
                            .allMatch(
                                    task ->
                                            task.isTerminal()
                                                    && task.getFinishedAt() != null
                                                    && task.getFinishedAt().isBefore(cutoff));
            if (!finished) {
                continue;
            }
            for (Task task : siblings) {
                tasks.remove(task.getId());
                removed++;
            }
            tasksByRequest.remove(entry.getKey());
        }
        if (removed > 0) {
            logger.info("Purged " + removed + " terminal tasks");
        }
        return removed;
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new InvalidTransitionException("Unknown task: " + taskId);
        }
        return task;
    }

    private void publish(List<TaskEvent> events) {
        TaskSnapshot last = null;
        for (TaskEvent event : events) {
            if (event.task() != null && event.task() != last) {
                persist(event.task());
                last = event.task();
            }
        }
        for (TaskEvent event : events) {
            emit(event);
        }
    }

    private void persist(TaskSnapshot snapshot) {
        try {
            recordStore.persistTask(snapshot);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to persist task " + snapshot.id(), e);
        }
    }

    /// Delivers an event to every listener, isolating listener failures.
    ///
    /// @param event event to deliver, not null
    public void emit(TaskEvent event) {
        for (TaskListener listener : listeners) {
            try {
                listener.onTaskEvent(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Task listener failed on " + event.type(), e);
            }
        }
    }

    /// A task that has been routed to an agent and is ready to run.
    ///
    /// @param task task state after routing, not null
    /// @param agent selected agent, not null
    public record Dispatch(TaskSnapshot task, RegisteredAgent agent) {}
}
