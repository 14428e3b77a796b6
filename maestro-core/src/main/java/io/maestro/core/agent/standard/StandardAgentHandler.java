package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentHandler;
import io.maestro.core.agent.AgentInvocation;
import io.maestro.core.agent.AgentResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/// Base class for the built-in business handlers.
///
/// Dispatches on the `action` input key to the actions registered by the subclass. An
/// unrecognised action yields `{"status": "unknown_action"}`; a missing action is acknowledged
/// with the goal text the planner attached. The input flag `fail=true` makes the handler report
/// an error, which lets callers exercise the retry path without a real backend.
///
/// @implNote Thread-safe as long as the registered actions are.
public abstract class StandardAgentHandler implements AgentHandler {

    private static final Logger logger = Logger.getLogger(StandardAgentHandler.class.getName());

    public static final String ACTION_KEY = "action";
    public static final String FAIL_KEY = "fail";

    protected final AgentDefinition definition;
    private final Map<String, Function<AgentInvocation, Map<String, Object>>> actions =
            new LinkedHashMap<>();

    protected StandardAgentHandler(AgentDefinition definition) {
        this.definition = definition;
    }

    /// Registers an action; called from subclass constructors only.
    protected final void action(
            String name, Function<AgentInvocation, Map<String, Object>> implementation) {
        actions.put(name, implementation);
    }

    @Override
    public AgentResponse execute(AgentInvocation invocation) {
        if (Boolean.parseBoolean(invocation.inputString(FAIL_KEY))) {
            return AgentResponse.Error.of(
                    "Agent " + definition.getId() + " failed task " + invocation.taskId());
        }

        String action = invocation.inputString(ACTION_KEY);
        if (action.isBlank()) {
            return AgentResponse.Success.of(acknowledge(invocation));
        }

        Function<AgentInvocation, Map<String, Object>> implementation = actions.get(action);
        if (implementation == null) {
            logger.fine("Agent " + definition.getId() + " has no action '" + action + "'");
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("status", "unknown_action");
            output.put(ACTION_KEY, action);
            return AgentResponse.Success.of(output);
        }
        return AgentResponse.Success.of(implementation.apply(invocation));
    }

    /// Builds the output for an invocation that carries no explicit action.
    protected Map<String, Object> acknowledge(AgentInvocation invocation) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status", "acknowledged");
        output.put("agent", definition.getName());
        output.put("capability", invocation.capability());
        Object goal = invocation.input().get("goal");
        if (goal != null) {
            output.put("goal", goal);
        }
        if (!invocation.dependencyOutputs().isEmpty()) {
            output.put("basedOn", invocation.dependencyOutputs().keySet());
        }
        return output;
    }

    public AgentDefinition getDefinition() {
        return definition;
    }
}
