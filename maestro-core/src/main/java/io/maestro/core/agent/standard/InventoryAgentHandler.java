package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.util.Payloads;
import java.util.LinkedHashMap;
import java.util.Map;

/// Inventory handler: `check_stock`.
///
/// Quantities come from the agent configuration's `stock` map (product id to on-hand quantity);
/// unknown products report zero.
public class InventoryAgentHandler extends StandardAgentHandler {

    private final Map<String, Object> stock;

    public InventoryAgentHandler(AgentDefinition definition) {
        super(definition);
        this.stock = Payloads.nested(definition.getConfiguration(), "stock");

        action(
                "check_stock",
                invocation -> {
                    String productId = invocation.inputString("product_id");
                    int available = Payloads.intValue(stock, productId, 0);
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put("product_id", productId);
                    output.put("available_qty", available);
                    output.put("virtual_qty", available);
                    return output;
                });
    }
}
