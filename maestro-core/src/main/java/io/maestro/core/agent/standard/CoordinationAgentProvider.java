package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentDefinition.StandardTypes;
import io.maestro.core.agent.AgentHandler;
import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.spi.AgentProvider;
import io.maestro.core.plan.Planner;
import java.util.Objects;

/// Supplies the `planner` and `router` agents, which inspect the engine itself and therefore
/// need the live registry and planner.
public class CoordinationAgentProvider implements AgentProvider {

    private final Planner planner;
    private final AgentRegistry registry;

    public CoordinationAgentProvider(Planner planner, AgentRegistry registry) {
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public String getName() {
        return "coordination";
    }

    @Override
    public boolean supports(String agentType) {
        return StandardTypes.PLANNER.equals(agentType) || StandardTypes.ROUTER.equals(agentType);
    }

    @Override
    public AgentHandler createHandler(AgentDefinition definition) {
        if (StandardTypes.PLANNER.equals(definition.getType())) {
            return new PlannerAgentHandler(definition, planner, registry);
        }
        return new RouterAgentHandler(definition, registry);
    }
}
