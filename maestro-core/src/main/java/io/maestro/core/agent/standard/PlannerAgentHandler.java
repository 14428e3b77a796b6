package io.maestro.core.agent.standard;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentInvocation;
import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.AgentResponse;
import io.maestro.core.plan.Plan;
import io.maestro.core.plan.PlanRequest;
import io.maestro.core.plan.Planner;
import io.maestro.core.plan.RequestConstraints;
import io.maestro.core.plan.UnroutablePortion;
import io.maestro.core.task.TaskSpec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Planner agent: returns the plan the engine would build for the `goal` input, without
/// executing it.
public class PlannerAgentHandler extends StandardAgentHandler {

    private final Planner planner;
    private final AgentRegistry registry;

    public PlannerAgentHandler(
            AgentDefinition definition, Planner planner, AgentRegistry registry) {
        super(definition);
        this.planner = planner;
        this.registry = registry;
    }

    @Override
    public AgentResponse execute(AgentInvocation invocation) {
        if (Boolean.parseBoolean(invocation.inputString(FAIL_KEY))) {
            return super.execute(invocation);
        }
        String goal = invocation.inputString("goal");
        Plan plan =
                planner.decompose(
                        new PlanRequest(goal, invocation.context(), RequestConstraints.NONE),
                        registry.knownCapabilities());

        List<Map<String, Object>> steps = new ArrayList<>();
        for (int i = 0; i < plan.tasks().size(); i++) {
            TaskSpec spec = plan.tasks().get(i);
            Map<String, Object> step = new LinkedHashMap<>();
            step.put("index", i);
            step.put("capability", spec.capability());
            step.put("description", spec.description());
            step.put("dependsOn", spec.dependsOn());
            steps.add(step);
        }
        List<Map<String, Object>> unroutable = new ArrayList<>();
        for (UnroutablePortion portion : plan.unroutablePortions()) {
            unroutable.add(Map.of("text", portion.text(), "reason", portion.reason()));
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("status", "planned");
        output.put("goal", goal);
        output.put("request_type", plan.requestType());
        output.put("steps", steps);
        output.put("unroutable", unroutable);
        return AgentResponse.Success.of(output);
    }
}
