package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentDefinition.StandardTypes;
import io.maestro.core.agent.AgentInvocation;
import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.AgentResponse;
import io.maestro.core.agent.RegisteredAgent;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Router agent: names the active agent that would handle a request `type`.
///
/// Request types map to agent types (`crm_lead` to `crm`, `sales_order` to `sales`, and so on);
/// unknown request types fall back to `custom`.
public class RouterAgentHandler extends StandardAgentHandler {

    private static final Map<String, String> ROUTING_MAP =
            Map.of(
                    "crm_lead", StandardTypes.CRM,
                    "sales_order", StandardTypes.SALES,
                    "inventory_check", StandardTypes.INVENTORY,
                    "accounting_report", StandardTypes.ACCOUNTING,
                    "hr_employee", StandardTypes.HR);

    private final AgentRegistry registry;

    public RouterAgentHandler(AgentDefinition definition, AgentRegistry registry) {
        super(definition);
        this.registry = registry;
    }

    @Override
    public AgentResponse execute(AgentInvocation invocation) {
        if (Boolean.parseBoolean(invocation.inputString(FAIL_KEY))) {
            return super.execute(invocation);
        }
        String requestType = invocation.inputString("type");
        String targetType = ROUTING_MAP.getOrDefault(requestType, StandardTypes.CUSTOM);
        Optional<RegisteredAgent> target = registry.findActiveByType(targetType);

        Map<String, Object> output = new LinkedHashMap<>();
        if (target.isPresent()) {
            output.put("routed_to", target.get().getDefinition().getName());
            output.put("agent_id", target.get().getId());
            output.put("status", "routed");
        } else {
            output.put("status", "unrouted");
            output.put("error", "No agent found for type: " + requestType);
        }
        return AgentResponse.Success.of(output);
    }
}
