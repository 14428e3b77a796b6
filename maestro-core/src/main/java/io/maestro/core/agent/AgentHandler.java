package io.maestro.core.agent;

/// Execution entry point of an agent.
///
/// Handlers are looked up by agent type through {@link AgentFactory} or supplied directly to
/// {@link AgentRegistry#register(AgentDefinition, AgentHandler, boolean)}.
///
/// @implNote Implementations must be thread-safe. The same handler may execute several tasks
/// concurrently on different worker threads, and a running invocation may be interrupted when
/// its task times out or the orchestrator aborts.
@FunctionalInterface
public interface AgentHandler {

    /// Executes one task attempt.
    ///
    /// Throwing is treated exactly like returning {@link AgentResponse.Error}.
    ///
    /// @param invocation task input and context, not null
    /// @return the outcome, never null
    AgentResponse execute(AgentInvocation invocation);
}
