package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.util.Payloads;
import java.util.Map;

/// HR handler: `search_employees` over the configuration's `employees` list.
public class HrAgentHandler extends StandardAgentHandler {

    private final RecordBook employees = new RecordBook("employee");

    public HrAgentHandler(AgentDefinition definition) {
        super(definition);
        employees.seed(Payloads.list(definition.getConfiguration(), "employees"));

        action(
                "search_employees",
                invocation ->
                        Map.of("employees", employees.search(invocation.inputString("query"))));
    }
}
