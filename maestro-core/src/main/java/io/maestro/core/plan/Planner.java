package io.maestro.core.plan;

import java.util.Set;

/// Decomposes a goal into a dependency-ordered list of task specs.
///
/// Planning never throws for goals it cannot match; such portions are reported in
/// {@link Plan#unroutablePortions()} so the routable remainder still executes.
///
/// @see KeywordPlanner for the standard implementation
public interface Planner {

    /// Produces a plan for `request`.
    ///
    /// @param request goal, context and constraints, not null
    /// @param knownCapabilities capabilities declared by registered agents, not null
    /// @return the plan, never null
    Plan decompose(PlanRequest request, Set<String> knownCapabilities);
}
