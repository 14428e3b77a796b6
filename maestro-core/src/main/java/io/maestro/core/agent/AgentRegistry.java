package io.maestro.core.agent;

import io.maestro.core.exception.AgentNotFoundException;
import io.maestro.core.exception.DuplicateIdentifierException;
import io.maestro.core.exception.InvalidTransitionException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Holds the known agents, their declared capabilities and their operational state, and
/// resolves which agents can currently handle a capability.
///
/// ### Contracts
/// - **Invariant**: every `ACTIVE` agent is returned by {@link #resolve} for each capability it
///   declares; `INACTIVE` and `ERROR` agents never are
/// - **Invariant**: a state change is visible to the very next `resolve` call (no caching)
/// - **Invariant**: agents are never removed by the engine
///
/// @implNote Implementations must be thread-safe. State transitions are serialized per agent;
/// unrelated agents may change state concurrently.
///
/// @see DefaultAgentRegistry for the standard implementation
public interface AgentRegistry {

    /// Adds an agent, or updates an existing one.
    ///
    /// New agents start `INACTIVE`. Re-registering an existing identifier keeps its state and
    /// counters and replaces definition and handler, provided the capability set is unchanged
    /// or `allowUpdate` is set.
    ///
    /// @param definition agent description, not null
    /// @param handler execution entry point, not null
    /// @param allowUpdate whether a changed capability set may replace an existing entry
    /// @return the registry entry, never null
    /// @throws DuplicateIdentifierException if the id exists with different capabilities and
    ///     `allowUpdate` is false
    RegisteredAgent register(AgentDefinition definition, AgentHandler handler, boolean allowUpdate);

    /// Registers without the explicit update flag.
    ///
    /// @see #register(AgentDefinition, AgentHandler, boolean)
    default RegisteredAgent register(AgentDefinition definition, AgentHandler handler) {
        return register(definition, handler, false);
    }

    /// Returns the active agents declaring `capability`.
    ///
    /// Ordered by priority (lower first), then registration order. An empty list is not an
    /// error; the caller decides whether it is fatal.
    ///
    /// @param capability capability name, case-insensitive, not null
    /// @return ordered active agents, never null
    List<RegisteredAgent> resolve(String capability);

    /// Moves an agent to a new operational state.
    ///
    /// @param agentId agent identifier, not null
    /// @param newState requested state, not null
    /// @return the previous state
    /// @throws AgentNotFoundException if no agent has this id
    /// @throws InvalidTransitionException if the state graph forbids the move
    AgentState setState(String agentId, AgentState newState);

    Optional<RegisteredAgent> find(String agentId);

    /// Looks up an agent or fails.
    ///
    /// @throws AgentNotFoundException if no agent has this id
    default RegisteredAgent getOrThrow(String agentId) {
        return find(agentId)
                .orElseThrow(() -> new AgentNotFoundException("Agent not found: " + agentId));
    }

    /// Returns the first active agent of a type, in routing order.
    ///
    /// @param type agent type tag, case-insensitive, not null
    /// @return matching agent, or empty
    Optional<RegisteredAgent> findActiveByType(String type);

    /// Returns all registered agents in routing order.
    ///
    /// @return agents, never null
    List<RegisteredAgent> all();

    /// Returns every capability declared by any registered agent, whatever its state.
    ///
    /// @return capability names, never null
    Set<String> knownCapabilities();

    void addStateListener(AgentStateListener listener);
}
