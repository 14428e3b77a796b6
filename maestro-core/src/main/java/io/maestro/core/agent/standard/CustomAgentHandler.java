package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentInvocation;
import io.maestro.core.agent.AgentResponse;
import java.util.LinkedHashMap;
import java.util.Map;

/// Fallback handler for `custom` agents and any type without a dedicated provider entry: echoes
/// the task data back.
public class CustomAgentHandler extends StandardAgentHandler {

    public CustomAgentHandler(AgentDefinition definition) {
        super(definition);
    }

    @Override
    public AgentResponse execute(AgentInvocation invocation) {
        if (Boolean.parseBoolean(invocation.inputString(FAIL_KEY))) {
            return super.execute(invocation);
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status", "custom_task_executed");
        output.put("data", invocation.input());
        return AgentResponse.Success.of(output);
    }
}
