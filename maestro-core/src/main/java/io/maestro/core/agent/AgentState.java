package io.maestro.core.agent;

import java.util.EnumSet;
import java.util.Set;

/// Operational state of a registered agent.
///
/// ### Transition graph
/// ```
/// INACTIVE <-> ACTIVE
/// ACTIVE    -> ERROR
/// ERROR     -> INACTIVE   (explicit reset)
/// ```
/// Only `ACTIVE` agents are visible to routing.
public enum AgentState {
    INACTIVE,
    ACTIVE,
    ERROR;

    /// Returns the states reachable from this one.
    ///
    /// @return successor states, never null
    public Set<AgentState> successors() {
        return switch (this) {
            case INACTIVE -> EnumSet.of(ACTIVE);
            case ACTIVE -> EnumSet.of(INACTIVE, ERROR);
            case ERROR -> EnumSet.of(INACTIVE);
        };
    }

    /// Checks whether a move to `target` is permitted.
    ///
    /// @param target requested state, not null
    /// @return `true` if the transition is in the graph
    public boolean canTransitionTo(AgentState target) {
        return successors().contains(target);
    }
}
