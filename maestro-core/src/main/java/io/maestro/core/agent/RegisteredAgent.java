package io.maestro.core.agent;

import io.maestro.core.exception.InvalidTransitionException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/// Registry entry pairing an {@link AgentDefinition} with its handler, operational state and
/// load/performance counters.
///
/// @implNote Thread-safe. State transitions are serialized on the entry's monitor; reads of the
/// state are lock-free so routing always observes the latest committed state.
public final class RegisteredAgent {

    private final long registrationOrder;
    private volatile AgentDefinition definition;
    private volatile AgentHandler handler;
    private volatile AgentState state = AgentState.INACTIVE;

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong responseNanos = new AtomicLong();
    private volatile Instant lastActivity;
    private volatile String lastError;

    RegisteredAgent(AgentDefinition definition, AgentHandler handler, long registrationOrder) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.registrationOrder = registrationOrder;
    }

    public String getId() {
        return definition.getId();
    }

    public AgentDefinition getDefinition() {
        return definition;
    }

    public AgentHandler getHandler() {
        return handler;
    }

    public AgentState getState() {
        return state;
    }

    public long getRegistrationOrder() {
        return registrationOrder;
    }

    /// Returns how many executions are currently in progress on this agent.
    public int getRunningCount() {
        return running.get();
    }

    public boolean isActive() {
        return state == AgentState.ACTIVE;
    }

    synchronized void update(AgentDefinition newDefinition, AgentHandler newHandler) {
        this.definition = newDefinition;
        this.handler = newHandler;
    }

    /// Applies a state transition under this entry's lock.
    ///
    /// @return the previous state
    /// @throws InvalidTransitionException if the graph does not permit the move
    synchronized AgentState transition(AgentState target) {
        AgentState current = state;
        if (!current.canTransitionTo(target)) {
            throw InvalidTransitionException.of("agent " + getId(), current, target);
        }
        state = target;
        return current;
    }

    /// Records the start of an execution on this agent.
    public void executionStarted() {
        running.incrementAndGet();
        lastActivity = Instant.now();
    }

    /// Records a successful execution.
    ///
    /// @param duration wall time of the execution, not null
    public void executionSucceeded(Duration duration) {
        running.decrementAndGet();
        completed.incrementAndGet();
        responseNanos.addAndGet(duration.toNanos());
        lastActivity = Instant.now();
    }

    /// Records a failed or abandoned execution.
    ///
    /// @param message failure description, may be null
    public void executionFailed(String message) {
        running.decrementAndGet();
        failed.incrementAndGet();
        lastError = message;
        lastActivity = Instant.now();
    }

    /// Captures a consistent-enough view of the entry for reporting.
    ///
    /// @return snapshot, never null
    public AgentSnapshot snapshot() {
        AgentDefinition def = definition;
        long ok = completed.get();
        long ko = failed.get();
        long total = ok + ko;
        double successRate = total == 0 ? 0.0 : (ok * 100.0) / total;
        double avgSeconds = ok == 0 ? 0.0 : responseNanos.get() / (double) ok / 1_000_000_000.0;
        return new AgentSnapshot(
                def.getId(),
                def.getName(),
                def.getType(),
                def.getDescription(),
                def.getCapabilities(),
                def.getPriority(),
                state,
                running.get(),
                total,
                ok,
                ko,
                successRate,
                avgSeconds,
                lastActivity,
                lastError,
                def.getConfiguration());
    }

    @Override
    public String toString() {
        return "RegisteredAgent{id='" + getId() + "', state=" + state + "}";
    }
}
