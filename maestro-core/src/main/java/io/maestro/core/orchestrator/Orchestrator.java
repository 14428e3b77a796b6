package io.maestro.core.orchestrator;

import io.maestro.core.MaestroConfig;
import io.maestro.core.agent.AgentInvocation;
import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.AgentResponse;
import io.maestro.core.agent.AgentSnapshot;
import io.maestro.core.agent.AgentState;
import io.maestro.core.agent.RegisteredAgent;
import io.maestro.core.exception.AgentNotActiveException;
import io.maestro.core.exception.DependencyUnmetException;
import io.maestro.core.exception.ErrorKind;
import io.maestro.core.exception.InvalidTransitionException;
import io.maestro.core.exception.OrchestratorNotRunningException;
import io.maestro.core.plan.Plan;
import io.maestro.core.plan.PlanRequest;
import io.maestro.core.plan.Planner;
import io.maestro.core.plan.RequestConstraints;
import io.maestro.core.routing.Router;
import io.maestro.core.store.RecordStore;
import io.maestro.core.task.Task;
import io.maestro.core.task.TaskError;
import io.maestro.core.task.TaskEvent;
import io.maestro.core.task.TaskPriority;
import io.maestro.core.task.TaskQueue;
import io.maestro.core.task.TaskSnapshot;
import io.maestro.core.task.TaskSpec;
import io.maestro.core.task.TaskState;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Entry point of the engine: plans requests, drives their tasks through the queue and
/// aggregates the outcome.
///
/// ### Execution model
/// Agent invocations run on a bounded worker pool. Nothing waits on a shared thread: task
/// completion events release withheld dependents, and the last terminal task of a request
/// completes the request's {@link CompletableFuture}. {@link #processRequest} is the blocking
/// convenience that joins that future on the caller's own thread.
///
/// ### Contracts
/// - **Precondition**: requests are only accepted while `RUNNING`
/// - **Invariant**: a dependent task is enqueued only after all its dependencies completed; if a
///   dependency fails terminally, the dependent fails with `DEPENDENCY_FAILED`
/// - **Postcondition**: every accepted request ends with exactly one {@link RequestResult}
///
/// @implNote Thread-safe. Dispatch is serialized by a single lock; agent execution, retries and
/// deadlines run concurrently on the worker pool and the scheduler.
///
/// @see io.maestro.core.MaestroFactory for wiring
public class Orchestrator {

    private static final Logger logger = Logger.getLogger(Orchestrator.class.getName());

    private final AgentRegistry registry;
    private final TaskQueue queue;
    private final Planner planner;
    private final Router router;
    private final RecordStore recordStore;
    private final MaestroConfig config;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    private volatile OrchestratorState state = OrchestratorState.STOPPED;
    private final Object lifecycle = new Object();

    private final ReentrantLock dispatchLock = new ReentrantLock();
    private final AtomicBoolean pumpRequested = new AtomicBoolean();
    private final AtomicInteger executing = new AtomicInteger();

    private final ReentrantLock idleLock = new ReentrantLock();
    private final Condition idle = idleLock.newCondition();

    private final Map<String, RequestExecution> requests = new ConcurrentHashMap<>();
    private final Map<String, AgentExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> deadlines = new ConcurrentHashMap<>();

    private final Deque<RequestOutcome> recentOutcomes = new ArrayDeque<>();
    private final AtomicLong requestsProcessed = new AtomicLong();
    private final AtomicLong requestMillis = new AtomicLong();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();

    /// Creates an orchestrator in `STOPPED` state and subscribes it to queue and registry
    /// events.
    ///
    /// @param registry agent registry, not null
    /// @param queue task queue, not null
    /// @param planner goal decomposition, not null
    /// @param router agent selection, not null
    /// @param recordStore durable side-effects, not null
    /// @param config engine configuration, not null
    /// @param workers pool executing agent invocations, not null
    /// @param scheduler executor for deadlines, not null
    public Orchestrator(
            AgentRegistry registry,
            TaskQueue queue,
            Planner planner,
            Router router,
            RecordStore recordStore,
            MaestroConfig config,
            ExecutorService workers,
            ScheduledExecutorService scheduler) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");

        queue.addListener(this::onTaskEvent);
        registry.addStateListener(this::onAgentStateChange);
    }

    // -- Lifecycle ------------------------------------------------------------------------

    /// Starts accepting requests. Calling it while running has no effect.
    public void start() {
        synchronized (lifecycle) {
            if (state == OrchestratorState.RUNNING) {
                return;
            }
            state = OrchestratorState.RUNNING;
        }
        logger.info("Orchestrator started");
        pump();
    }

    /// Stops with the configured {@link StopPolicy}.
    ///
    /// @see #stop(StopPolicy)
    public void stop() {
        stop(config.getStopPolicy());
    }

    /// Stops accepting requests and settles in-flight work.
    ///
    /// With `DRAIN` the call returns once every non-terminal task has finished; if that takes
    /// longer than the drain timeout, the remainder is aborted. With `ABORT` every non-terminal
    /// task is failed immediately with `ORCHESTRATOR_STOPPED`. Either way, each affected request
    /// still receives its aggregated result.
    ///
    /// @param policy drain or abort, not null
    public void stop(StopPolicy policy) {
        synchronized (lifecycle) {
            if (state != OrchestratorState.RUNNING) {
                return;
            }
            state = OrchestratorState.STOPPING;
            logger.info("Stopping orchestrator (" + policy + ")");

            if (policy == StopPolicy.DRAIN && !awaitIdle(config.getDrainTimeout())) {
                logger.warning(
                        "Drain did not finish within "
                                + config.getDrainTimeout().toSeconds()
                                + "s, aborting remaining tasks");
                abortAll();
            } else if (policy == StopPolicy.ABORT) {
                abortAll();
            }
            state = OrchestratorState.STOPPED;
        }
        logger.info("Orchestrator stopped");
    }

    public OrchestratorState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == OrchestratorState.RUNNING;
    }

    private boolean awaitIdle(Duration timeout) {
        idleLock.lock();
        try {
            long remaining = timeout.toNanos();
            while (!queue.nonTerminal().isEmpty()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            idleLock.unlock();
        }
    }

    private void signalIdle() {
        idleLock.lock();
        try {
            idle.signalAll();
        } finally {
            idleLock.unlock();
        }
    }

    private void abortAll() {
        TaskError stopped = TaskError.of(ErrorKind.ORCHESTRATOR_STOPPED, "Orchestrator stopped");
        for (Task task : queue.nonTerminal()) {
            queue.abort(task.getId(), stopped);
        }
        for (String key : List.copyOf(executions.keySet())) {
            cancelExecution(key);
        }
        deadlines.values().forEach(deadline -> deadline.cancel(false));
        deadlines.clear();
    }

    // -- Requests -------------------------------------------------------------------------

    /// Plans a request and starts executing it.
    ///
    /// A goal that cannot be planned at all completes immediately with status `UNROUTABLE`.
    ///
    /// @param request goal, context and constraints, not null
    /// @return future completed with the aggregated result, never null
    /// @throws OrchestratorNotRunningException if the orchestrator is not running
    public CompletableFuture<RequestResult> submit(PlanRequest request) {
        return accept(request).result();
    }

    /// Plans a request, starts executing it and returns its identifier with the pending result.
    ///
    /// @param request goal, context and constraints, not null
    /// @return the accepted request, never null
    /// @throws OrchestratorNotRunningException if the orchestrator is not running
    public AcceptedRequest accept(PlanRequest request) {
        ensureRunning();
        Plan plan = planner.decompose(request, registry.knownCapabilities());
        return launch(request, plan);
    }

    /// Returns whether a request has been accepted and has not finished yet.
    ///
    /// @param requestId request identifier, not null
    /// @return `true` until the request's result is completed
    public boolean isInFlight(String requestId) {
        return requests.containsKey(requestId);
    }

    /// Processes a request and waits for its result.
    ///
    /// @param goal free-text goal, not null
    /// @param context caller and record context, may be null
    /// @param constraints planning and execution limits, may be null
    /// @return the aggregated result, never null
    /// @throws OrchestratorNotRunningException if the orchestrator is not running
    public RequestResult processRequest(
            String goal, Map<String, Object> context, RequestConstraints constraints) {
        return submit(new PlanRequest(goal, context, constraints)).join();
    }

    /// Runs one task on a specific agent, bypassing planner and router.
    ///
    /// The task goes through the normal queue lifecycle: retries, deadline and persistence
    /// apply.
    ///
    /// @param agentId target agent, not null
    /// @param payload agent input, may be null
    /// @param context caller context, may be null
    /// @return future completed with the single-task result, never null
    /// @throws OrchestratorNotRunningException if the orchestrator is not running
    /// @throws io.maestro.core.exception.AgentNotFoundException if no agent has this id
    /// @throws AgentNotActiveException if the agent is not active
    public CompletableFuture<RequestResult> submitToAgent(
            String agentId, Map<String, Object> payload, Map<String, Object> context) {
        ensureRunning();
        RegisteredAgent agent = registry.getOrThrow(agentId);
        if (!agent.isActive()) {
            throw new AgentNotActiveException(
                    "Agent " + agentId + " is not active (state: " + agent.getState() + ")");
        }

        Object goal = payload != null ? payload.get("goal") : null;
        String description =
                goal != null ? goal.toString() : "Direct execution on agent " + agentId;
        TaskSpec spec =
                new TaskSpec(
                        agent.getDefinition().getCapabilities().get(0),
                        payload,
                        List.of(),
                        TaskPriority.MEDIUM,
                        null,
                        agentId,
                        description);
        Plan plan = new Plan(List.of(spec), List.of(), agent.getDefinition().getType());
        return launch(new PlanRequest(description, context, RequestConstraints.NONE), plan)
                .result();
    }

    /// Blocking form of {@link #submitToAgent}.
    public RequestResult executeAgent(String agentId, Map<String, Object> payload) {
        return submitToAgent(agentId, payload, Map.of()).join();
    }

    private void ensureRunning() {
        if (state != OrchestratorState.RUNNING) {
            throw new OrchestratorNotRunningException(
                    "Orchestrator is not running (state: " + state + ")");
        }
    }

    private AcceptedRequest launch(PlanRequest request, Plan plan) {
        String requestId = "req-" + UUID.randomUUID();

        if (plan.isUnroutable()) {
            RequestResult result =
                    new RequestResult(
                            requestId,
                            request.goal(),
                            RequestResult.Status.UNROUTABLE,
                            plan.requestType(),
                            RequestResult.complexityOf(0),
                            List.of(),
                            List.of(),
                            plan.unroutablePortions(),
                            ErrorKind.UNROUTABLE,
                            "No portion of the goal could be routed to an agent",
                            0);
            RequestExecution execution = new RequestExecution(requestId, request, plan, List.of());
            execution.markFinished();
            persistRequest(
                    execution.record(RequestState.FAILED, result.status(), Instant.now()));
            recordOutcome(result, 0, 0);
            logger.info("Request " + requestId + " is unroutable");
            return new AcceptedRequest(requestId, CompletableFuture.completedFuture(result));
        }

        List<String> taskIds = new ArrayList<>();
        for (int i = 0; i < plan.tasks().size(); i++) {
            taskIds.add(requestId + "-" + (i + 1));
        }
        RequestExecution execution = new RequestExecution(requestId, request, plan, taskIds);
        requests.put(requestId, execution);

        List<String> roots = new ArrayList<>();
        for (int i = 0; i < plan.tasks().size(); i++) {
            TaskSpec spec = plan.tasks().get(i);
            if (spec.timeout() == null) {
                spec = spec.withTimeout(config.getDefaultTaskTimeout());
            }
            List<String> dependencyIds = new ArrayList<>();
            for (int dependency : spec.dependsOn()) {
                dependencyIds.add(taskIds.get(dependency));
            }
            queue.track(
                    new Task(
                            taskIds.get(i),
                            requestId,
                            i,
                            spec,
                            dependencyIds,
                            queue.getRetryPolicy().maxAttempts()));
            if (dependencyIds.isEmpty()) {
                roots.add(taskIds.get(i));
            }
        }
        persistRequest(execution.record(RequestState.IN_PROGRESS, null, null));
        logger.info(
                "Request "
                        + requestId
                        + " planned "
                        + taskIds.size()
                        + " tasks ("
                        + plan.unroutablePortions().size()
                        + " unroutable portions)");

        for (String root : roots) {
            queue.enqueue(root);
        }
        return new AcceptedRequest(requestId, execution.result());
    }

    // -- Dispatch -------------------------------------------------------------------------

    // Drains the pending set while worker capacity remains. Concurrent callers coalesce: a
    // caller that cannot take the lock leaves a request flag the lock holder re-checks.
    private void pump() {
        pumpRequested.set(true);
        if (dispatchLock.isHeldByCurrentThread()) {
            return;
        }
        while (pumpRequested.get() && dispatchLock.tryLock()) {
            try {
                pumpRequested.set(false);
                if (state == OrchestratorState.STOPPED) {
                    return;
                }
                while (executing.get() < config.getThreadPoolSize()) {
                    Optional<TaskQueue.Dispatch> dispatch = queue.dequeueForExecution(router);
                    if (dispatch.isEmpty()) {
                        break;
                    }
                    dispatch(dispatch.get());
                }
            } finally {
                dispatchLock.unlock();
            }
        }
    }

    private void dispatch(TaskQueue.Dispatch dispatch) {
        TaskSnapshot running;
        try {
            running = queue.markRunning(dispatch.task().id(), dispatch.task().spec().timeout());
        } catch (InvalidTransitionException e) {
            logger.fine("Task " + dispatch.task().id() + " left ROUTED before dispatch");
            return;
        }

        String key = executionKey(running);
        AgentExecution execution = new AgentExecution(() -> execute(running, dispatch.agent()));
        executing.incrementAndGet();
        executions.put(key, execution);
        try {
            workers.execute(execution);
        } catch (RejectedExecutionException e) {
            executions.remove(key);
            executing.decrementAndGet();
            logger.log(Level.WARNING, "Worker pool rejected task " + running.id(), e);
            queue.abort(
                    running.id(),
                    TaskError.of(ErrorKind.ORCHESTRATOR_STOPPED, "Worker pool rejected task"));
            return;
        }

        Duration timeout = running.spec().timeout();
        if (timeout != null) {
            try {
                deadlines.put(
                        key,
                        scheduler.schedule(
                                () -> onDeadline(running),
                                timeout.toMillis(),
                                TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException e) {
                logger.log(Level.WARNING, "Could not schedule deadline for " + running.id(), e);
            }
        }
    }

    private void execute(TaskSnapshot running, RegisteredAgent agent) {
        String taskId = running.id();
        int attempt = running.attempt();
        String key = executionKey(running);

        agent.executionStarted();
        long start = System.nanoTime();
        AgentResponse response;
        try {
            response = agent.getHandler().execute(invocationFor(running));
            if (response == null) {
                response = AgentResponse.Error.of("Agent returned no response");
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Agent " + agent.getId() + " threw on task " + taskId, e);
            response = AgentResponse.Error.from(e);
        }

        try {
            if (response instanceof AgentResponse.Success success) {
                agent.executionSucceeded(Duration.ofNanos(System.nanoTime() - start));
                queue.complete(taskId, attempt, success.output());
            } else if (response instanceof AgentResponse.Error error) {
                agent.executionFailed(error.message());
                queue.fail(
                        taskId,
                        attempt,
                        TaskError.of(ErrorKind.AGENT_FAILURE, error.message(), agent.getId()));
            }
        } catch (InvalidTransitionException e) {
            logger.warning("Discarding result of task " + taskId + ": " + e.getMessage());
        } finally {
            executions.remove(key);
            ScheduledFuture<?> deadline = deadlines.remove(key);
            if (deadline != null) {
                deadline.cancel(false);
            }
            executing.decrementAndGet();
            pump();
        }
    }

    private AgentInvocation invocationFor(TaskSnapshot running) {
        RequestExecution execution = requests.get(running.requestId());
        Map<String, Object> context =
                execution != null ? execution.request().context() : Map.of();

        Map<String, Object> dependencyOutputs = new LinkedHashMap<>();
        for (String dependencyId : running.dependencyIds()) {
            queue.snapshot(dependencyId)
                    .ifPresent(
                            dependency -> {
                                String outputKey =
                                        dependencyOutputs.containsKey(dependency.capability())
                                                ? dependency.id()
                                                : dependency.capability();
                                dependencyOutputs.put(outputKey, dependency.output());
                            });
        }
        return new AgentInvocation(
                running.id(),
                running.requestId(),
                running.capability(),
                running.spec().input(),
                context,
                dependencyOutputs,
                running.attempt());
    }

    private void onDeadline(TaskSnapshot running) {
        String key = executionKey(running);
        deadlines.remove(key);
        try {
            queue.fail(
                    running.id(),
                    running.attempt(),
                    TaskError.of(
                            ErrorKind.TASK_TIMEOUT,
                            "Task exceeded its deadline of "
                                    + running.spec().timeout().toMillis()
                                    + "ms",
                            running.assignedAgentId()));
            logger.warning("Task " + running.id() + " timed out on " + running.assignedAgentId());
            cancelExecution(key);
        } catch (InvalidTransitionException e) {
            logger.fine("Deadline of task " + running.id() + " passed after it finished");
        }
    }

    private static String executionKey(TaskSnapshot snapshot) {
        return snapshot.id() + "#" + snapshot.attempt();
    }

    // Interrupts a running execution, or releases the worker slot of one that never started.
    private void cancelExecution(String key) {
        AgentExecution execution = executions.remove(key);
        if (execution == null || !execution.cancelBeforeStart()) {
            return;
        }
        ScheduledFuture<?> deadline = deadlines.remove(key);
        if (deadline != null) {
            deadline.cancel(false);
        }
        executing.decrementAndGet();
        pump();
    }

    // -- Event handling -------------------------------------------------------------------

    private void onTaskEvent(TaskEvent event) {
        switch (event.type()) {
            case ENQUEUED -> pump();
            case COMPLETED -> {
                tasksCompleted.incrementAndGet();
                onTaskCompleted(event.task());
                signalIdle();
            }
            case FAILED -> {
                if (event.task().terminal()) {
                    tasksFailed.incrementAndGet();
                    onTaskFailed(event.task());
                    signalIdle();
                }
            }
            default -> {}
        }
    }

    private void onTaskCompleted(TaskSnapshot completed) {
        RequestExecution execution = requests.get(completed.requestId());
        if (execution == null) {
            return;
        }
        synchronized (execution) {
            for (Task task : queue.tasksForRequest(execution.requestId())) {
                if (task.isWithheld()
                        && task.getDependencyIds().contains(completed.id())
                        && dependenciesCompleted(task)) {
                    try {
                        queue.enqueue(task.getId());
                    } catch (InvalidTransitionException | DependencyUnmetException e) {
                        logger.fine("Task " + task.getId() + " not released: " + e.getMessage());
                    }
                }
            }
        }
        completeIfFinished(execution);
    }

    private boolean dependenciesCompleted(Task task) {
        for (String dependencyId : task.getDependencyIds()) {
            boolean completed =
                    queue.get(dependencyId)
                            .map(dependency -> dependency.getState() == TaskState.COMPLETED)
                            .orElse(false);
            if (!completed) {
                return false;
            }
        }
        return true;
    }

    private void onTaskFailed(TaskSnapshot failed) {
        RequestExecution execution = requests.get(failed.requestId());
        if (execution == null) {
            return;
        }
        for (Task task : queue.tasksForRequest(execution.requestId())) {
            if (!task.isTerminal() && task.getDependencyIds().contains(failed.id())) {
                queue.abort(
                        task.getId(),
                        TaskError.of(
                                ErrorKind.DEPENDENCY_FAILED,
                                "Dependency "
                                        + failed.id()
                                        + " ("
                                        + failed.capability()
                                        + ") failed"));
            }
        }
        completeIfFinished(execution);
    }

    private void onAgentStateChange(String agentId, AgentState from, AgentState to) {
        if (to != AgentState.ERROR) {
            return;
        }
        for (Task task : queue.inFlight()) {
            if (task.getState() != TaskState.RUNNING
                    || !agentId.equals(task.getAssignedAgentId())) {
                continue;
            }
            String key = task.getId() + "#" + task.getAttempt();
            cancelExecution(key);
            ScheduledFuture<?> deadline = deadlines.remove(key);
            if (deadline != null) {
                deadline.cancel(false);
            }
            queue.reroute(task.getId(), agentId, router).ifPresent(this::dispatch);
        }
    }

    // -- Aggregation ----------------------------------------------------------------------

    private void completeIfFinished(RequestExecution execution) {
        List<Task> tasks = queue.tasksForRequest(execution.requestId());
        for (Task task : tasks) {
            if (!task.isTerminal()) {
                return;
            }
        }
        if (!execution.markFinished()) {
            return;
        }

        List<TaskOutput> outputs = new ArrayList<>();
        List<TaskFailure> failures = new ArrayList<>();
        for (Task task : tasks) {
            TaskSnapshot snapshot = queue.snapshot(task.getId()).orElseThrow();
            if (snapshot.state() == TaskState.COMPLETED) {
                Duration duration = snapshot.executionDuration();
                outputs.add(
                        new TaskOutput(
                                snapshot.id(),
                                snapshot.index(),
                                snapshot.capability(),
                                snapshot.assignedAgentId(),
                                snapshot.output(),
                                duration != null ? duration.toMillis() : 0));
            } else {
                TaskError error = snapshot.lastError();
                failures.add(
                        new TaskFailure(
                                snapshot.id(),
                                snapshot.index(),
                                snapshot.capability(),
                                snapshot.assignedAgentId(),
                                error != null ? error.kind() : ErrorKind.AGENT_FAILURE,
                                error != null ? error.message() : "unknown failure",
                                snapshot.failureHistory().size()));
            }
        }

        Plan plan = execution.plan();
        RequestResult.Status status =
                failures.isEmpty() && plan.unroutablePortions().isEmpty()
                        ? RequestResult.Status.SUCCESS
                        : RequestResult.Status.PARTIAL_FAILURE;
        long elapsed = execution.elapsedMillis();
        RequestResult result =
                new RequestResult(
                        execution.requestId(),
                        execution.request().goal(),
                        status,
                        plan.requestType(),
                        RequestResult.complexityOf(tasks.size()),
                        outputs,
                        failures,
                        plan.unroutablePortions(),
                        null,
                        null,
                        elapsed);

        requests.remove(execution.requestId());
        RequestState requestState =
                failures.isEmpty() ? RequestState.COMPLETED : RequestState.FAILED;
        persistRequest(execution.record(requestState, status, Instant.now()));
        recordOutcome(result, tasks.size(), failures.size());
        logger.info(
                "Request "
                        + execution.requestId()
                        + " finished: "
                        + status
                        + " ("
                        + outputs.size()
                        + " completed, "
                        + failures.size()
                        + " failed)");

        execution.result().complete(result);
        queue.emit(TaskEvent.requestCompleted(execution.requestId()));
    }

    private void recordOutcome(RequestResult result, int taskCount, int failedCount) {
        requestsProcessed.incrementAndGet();
        requestMillis.addAndGet(result.durationMillis());
        RequestOutcome outcome =
                new RequestOutcome(
                        result.requestId(),
                        result.goal(),
                        result.status(),
                        taskCount,
                        failedCount,
                        result.durationMillis(),
                        Instant.now());
        synchronized (recentOutcomes) {
            recentOutcomes.addFirst(outcome);
            while (recentOutcomes.size() > config.getRecentOutcomeLimit()) {
                recentOutcomes.removeLast();
            }
        }
    }

    private void persistRequest(RequestRecord record) {
        try {
            recordStore.persistRequest(record);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to persist request " + record.requestId(), e);
        }
    }

    // -- Status ---------------------------------------------------------------------------

    /// Captures a read-only snapshot of agents, queue and recent outcomes.
    ///
    /// @return status, never null
    public OrchestratorStatus getStatus() {
        List<AgentSnapshot> agents =
                registry.all().stream().map(RegisteredAgent::snapshot).toList();
        long completed = tasksCompleted.get();
        long processed = completed + tasksFailed.get();
        double successRate = processed == 0 ? 0.0 : (completed * 100.0) / processed;
        long finished = requestsProcessed.get();
        double avgSeconds = finished == 0 ? 0.0 : requestMillis.get() / (double) finished / 1000.0;

        List<RequestOutcome> recent;
        synchronized (recentOutcomes) {
            recent = List.copyOf(recentOutcomes);
        }
        return new OrchestratorStatus(
                state,
                queue.depth(),
                requests.size(),
                agents,
                finished,
                processed,
                successRate,
                avgSeconds,
                recent,
                Instant.now());
    }

    public AgentRegistry getRegistry() {
        return registry;
    }

    public TaskQueue getQueue() {
        return queue;
    }

    /// Agent invocation submitted to the worker pool.
    ///
    /// Exactly one of {@link #run()} and {@link #cancelBeforeStart()} claims the execution, so
    /// the worker slot is released once: by the body's own cleanup, or by the canceller when the
    /// body never ran.
    private static final class AgentExecution extends FutureTask<Void> {

        private final AtomicBoolean claimed = new AtomicBoolean();

        AgentExecution(Runnable body) {
            super(body, null);
        }

        @Override
        public void run() {
            if (claimed.compareAndSet(false, true)) {
                super.run();
            }
        }

        /// Cancels the execution.
        ///
        /// @return `true` if the body never started and never will
        boolean cancelBeforeStart() {
            if (claimed.compareAndSet(false, true)) {
                cancel(false);
                return true;
            }
            cancel(true);
            return false;
        }
    }
}
