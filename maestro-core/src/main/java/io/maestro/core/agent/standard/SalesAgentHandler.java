package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.util.Payloads;
import java.util.LinkedHashMap;
import java.util.Map;

/// Sales handler: `create_order`.
public class SalesAgentHandler extends StandardAgentHandler {

    private final RecordBook orders = new RecordBook("order");

    public SalesAgentHandler(AgentDefinition definition) {
        super(definition);

        action(
                "create_order",
                invocation -> {
                    String id = orders.create(Payloads.nested(invocation.input(), "order_data"));
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put("order_id", id);
                    output.put("status", "created");
                    return output;
                });
    }
}
