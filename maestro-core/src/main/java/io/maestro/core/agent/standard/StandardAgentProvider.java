package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentDefinition.StandardTypes;
import io.maestro.core.agent.AgentHandler;
import io.maestro.core.agent.spi.AgentProvider;
import java.util.Set;
import java.util.logging.Logger;

/// Supplies deterministic in-process handlers for the business agent types and `custom`.
///
/// Runs at priority 0 so that an integration provider for the same type replaces it.
///
/// @implNote Thread-safe. Each call creates a fresh handler with its own record book.
public class StandardAgentProvider implements AgentProvider {

    private static final Logger logger = Logger.getLogger(StandardAgentProvider.class.getName());

    private static final Set<String> SUPPORTED =
            Set.of(
                    StandardTypes.CRM,
                    StandardTypes.SALES,
                    StandardTypes.INVENTORY,
                    StandardTypes.ACCOUNTING,
                    StandardTypes.HR,
                    StandardTypes.CUSTOM);

    @Override
    public String getName() {
        return "standard";
    }

    @Override
    public boolean supports(String agentType) {
        return SUPPORTED.contains(agentType);
    }

    @Override
    public AgentHandler createHandler(AgentDefinition definition) {
        logger.fine("Creating standard handler for " + definition.getId());
        return switch (definition.getType()) {
            case StandardTypes.CRM -> new CrmAgentHandler(definition);
            case StandardTypes.SALES -> new SalesAgentHandler(definition);
            case StandardTypes.INVENTORY -> new InventoryAgentHandler(definition);
            case StandardTypes.ACCOUNTING -> new AccountingAgentHandler(definition);
            case StandardTypes.HR -> new HrAgentHandler(definition);
            default -> new CustomAgentHandler(definition);
        };
    }
}
