package io.maestro.core.plan;

import io.maestro.core.util.Payloads;
import java.util.Map;
import java.util.Objects;

/// A caller's goal together with its context and constraints.
///
/// @param goal free-text goal, not null
/// @param context caller and record context, never null
/// @param constraints planning and execution limits, never null
public record PlanRequest(
        String goal, Map<String, Object> context, RequestConstraints constraints) {

    public PlanRequest {
        Objects.requireNonNull(goal, "goal must not be null");
        context = Payloads.copy(context);
        constraints = constraints != null ? constraints : RequestConstraints.NONE;
    }

    public static PlanRequest of(String goal) {
        return new PlanRequest(goal, Map.of(), RequestConstraints.NONE);
    }
}
