package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.util.Payloads;
import java.util.LinkedHashMap;
import java.util.Map;

/// CRM handler: `create_lead` and `search_leads`.
public class CrmAgentHandler extends StandardAgentHandler {

    private final RecordBook leads = new RecordBook("lead");

    public CrmAgentHandler(AgentDefinition definition) {
        super(definition);
        leads.seed(Payloads.list(definition.getConfiguration(), "leads"));

        action(
                "create_lead",
                invocation -> {
                    String id = leads.create(Payloads.nested(invocation.input(), "lead_data"));
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put("lead_id", id);
                    output.put("status", "created");
                    return output;
                });
        action(
                "search_leads",
                invocation -> {
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put("leads", leads.search(invocation.inputString("query")));
                    return output;
                });
    }
}
