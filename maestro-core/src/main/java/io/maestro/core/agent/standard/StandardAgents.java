package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentDefinition.StandardTypes;
import java.util.List;

/// The default agent set, registered when the record store provides none.
public final class StandardAgents {

    private StandardAgents() {}

    /// Returns one agent per standard type, with the conventional capability vocabulary.
    ///
    /// @return agent definitions in registration order, never null
    public static List<AgentDefinition> defaults() {
        return List.of(
                agent(
                        "planner-agent",
                        "Planner Agent",
                        StandardTypes.PLANNER,
                        "Plans and coordinates complex tasks",
                        "planning",
                        "coordination",
                        "task_breakdown"),
                agent(
                        "router-agent",
                        "Router Agent",
                        StandardTypes.ROUTER,
                        "Routes requests to appropriate specialized agents",
                        "routing",
                        "request_analysis",
                        "agent_selection"),
                agent(
                        "crm-agent",
                        "CRM Agent",
                        StandardTypes.CRM,
                        "Handles CRM-related tasks and operations",
                        "lead_management",
                        "opportunity_tracking",
                        "customer_analysis"),
                agent(
                        "sales-agent",
                        "Sales Agent",
                        StandardTypes.SALES,
                        "Handles sales-related tasks and operations",
                        "order_management",
                        "quotation_handling",
                        "sales_analysis"),
                agent(
                        "inventory-agent",
                        "Inventory Agent",
                        StandardTypes.INVENTORY,
                        "Handles inventory-related tasks and operations",
                        "stock_management",
                        "warehouse_operations",
                        "inventory_analysis"),
                agent(
                        "accounting-agent",
                        "Accounting Agent",
                        StandardTypes.ACCOUNTING,
                        "Handles accounting-related tasks and operations",
                        "invoice_management",
                        "financial_reporting",
                        "account_analysis"),
                agent(
                        "hr-agent",
                        "HR Agent",
                        StandardTypes.HR,
                        "Handles HR-related tasks and operations",
                        "employee_management",
                        "attendance_tracking",
                        "hr_analytics"));
    }

    // The type tag is always the first capability so the keyword planner can target it.
    private static AgentDefinition agent(
            String id, String name, String type, String description, String... extra) {
        String[] capabilities = new String[extra.length + 1];
        capabilities[0] = type;
        System.arraycopy(extra, 0, capabilities, 1, extra.length);
        return AgentDefinition.builder()
                .id(id)
                .name(name)
                .type(type)
                .description(description)
                .capabilities(capabilities)
                .build();
    }
}
