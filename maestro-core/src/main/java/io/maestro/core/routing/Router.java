package io.maestro.core.routing;

import io.maestro.core.agent.RegisteredAgent;
import io.maestro.core.exception.AgentNotActiveException;
import io.maestro.core.exception.AgentNotFoundException;
import io.maestro.core.exception.NoAgentAvailableException;
import io.maestro.core.task.TaskSpec;
import java.util.Set;

/// Assigns exactly one active agent to a task.
///
/// @see LoadAwareRouter for the standard implementation
@FunctionalInterface
public interface Router {

    /// Selects the agent that will execute `spec`.
    ///
    /// @param spec task to route, not null
    /// @param excludedAgentIds agents that must not be chosen (e.g. one that just failed), not null
    /// @return the selected agent, never null
    /// @throws NoAgentAvailableException if no eligible active agent declares the capability
    /// @throws AgentNotFoundException if the task is pinned to an unknown agent
    /// @throws AgentNotActiveException if the task is pinned to an agent that is not active
    RegisteredAgent route(TaskSpec spec, Set<String> excludedAgentIds);
}
