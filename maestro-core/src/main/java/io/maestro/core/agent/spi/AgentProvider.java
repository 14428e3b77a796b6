package io.maestro.core.agent.spi;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentHandler;

/// Provider interface for pluggable agent implementations.
///
/// Implement this interface to add new agent categories. Providers are passed explicitly to
/// {@link io.maestro.core.agent.AgentFactory} and additionally discovered through
/// `META-INF/services/io.maestro.core.agent.spi.AgentProvider`.
///
/// ### Priority System
/// When multiple providers support the same agent type, the one with the highest
/// {@link #getPriority()} value is selected. Use this to:
/// - Override the built-in business handlers with real integrations
/// - Provide testing stubs that intercept every type
///
/// @implNote Implementations should be stateless and thread-safe. The same provider may create
/// handlers for many agents.
///
/// @see io.maestro.core.agent.AgentFactory for provider selection
public interface AgentProvider {

    /// Returns the provider's display name for logging and diagnostics.
    ///
    /// @return provider name, never null
    String getName();

    /// Checks if this provider can create handlers for the given agent type.
    ///
    /// @param agentType lower-cased type tag, not null
    /// @return `true` if supported
    boolean supports(String agentType);

    /// Creates the execution handler for an agent.
    ///
    /// Called after {@link #supports(String)} returned `true` for the definition's type.
    ///
    /// @param definition agent definition, not null
    /// @return handler ready for execution, never null
    /// @throws IllegalArgumentException if the definition's configuration is invalid
    AgentHandler createHandler(AgentDefinition definition);

    /// Returns this provider's priority for type selection.
    ///
    /// @return priority value; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}
