package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.util.Payloads;
import java.util.LinkedHashMap;
import java.util.Map;

/// Accounting handler: `create_invoice`.
public class AccountingAgentHandler extends StandardAgentHandler {

    private final RecordBook invoices = new RecordBook("invoice");

    public AccountingAgentHandler(AgentDefinition definition) {
        super(definition);

        action(
                "create_invoice",
                invocation -> {
                    String id =
                            invoices.create(Payloads.nested(invocation.input(), "invoice_data"));
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put("invoice_id", id);
                    output.put("status", "created");
                    return output;
                });
    }
}
