package io.maestro.core.routing;

import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.RegisteredAgent;
import io.maestro.core.exception.AgentNotActiveException;
import io.maestro.core.exception.NoAgentAvailableException;
import io.maestro.core.task.TaskSpec;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Routes to the best-priority active agent, breaking ties by current load.
///
/// ### Selection
/// 1. Candidates are `registry.resolve(capability)` minus the excluded agents
/// 2. Only the candidates sharing the lowest priority value are considered
/// 3. Among those, the agent with the fewest running executions wins
/// 4. Exact ties fall back to registration order
///
/// A spec pinned to an agent bypasses capability resolution; the pinned agent must exist and be
/// active.
///
/// @implNote Thread-safe. Reads live registry state on every call.
public class LoadAwareRouter implements Router {

    private static final Logger logger = Logger.getLogger(LoadAwareRouter.class.getName());

    private final AgentRegistry registry;

    public LoadAwareRouter(AgentRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public RegisteredAgent route(TaskSpec spec, Set<String> excludedAgentIds) {
        if (spec.pinnedAgentId() != null) {
            return routePinned(spec, excludedAgentIds);
        }

        List<RegisteredAgent> candidates =
                registry.resolve(spec.capability()).stream()
                        .filter(agent -> !excludedAgentIds.contains(agent.getId()))
                        .toList();
        if (candidates.isEmpty()) {
            throw new NoAgentAvailableException(
                    "No active agent for capability '" + spec.capability() + "'");
        }

        int bestPriority = candidates.get(0).getDefinition().getPriority();
        RegisteredAgent selected = candidates.get(0);
        for (RegisteredAgent candidate : candidates) {
            if (candidate.getDefinition().getPriority() != bestPriority) {
                break;
            }
            if (candidate.getRunningCount() < selected.getRunningCount()) {
                selected = candidate;
            }
        }

        logger.fine("Routed capability '" + spec.capability() + "' to " + selected.getId());
        return selected;
    }

    private RegisteredAgent routePinned(TaskSpec spec, Set<String> excludedAgentIds) {
        RegisteredAgent agent = registry.getOrThrow(spec.pinnedAgentId());
        if (excludedAgentIds.contains(agent.getId())) {
            throw new NoAgentAvailableException(
                    "Pinned agent " + agent.getId() + " is excluded after failure");
        }
        if (!agent.isActive()) {
            throw new AgentNotActiveException(
                    "Agent " + agent.getId() + " is not active (state: " + agent.getState() + ")");
        }
        return agent;
    }
}
