package io.maestro.core.agent;

import io.maestro.core.agent.spi.AgentProvider;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Creates agent handlers from definitions using registered {@link AgentProvider}s.
///
/// Providers come from two sources: the list passed to the constructor, and implementations
/// discovered via {@link ServiceLoader}. When creating a handler, the highest-priority provider
/// that supports the definition's type wins.
///
/// @implNote Thread-safe after construction. The provider list is immutable once the factory
/// is created.
///
/// @see AgentProvider for implementing custom agent categories
public class AgentFactory {

    private static final Logger logger = Logger.getLogger(AgentFactory.class.getName());

    private final List<AgentProvider> providers;

    /// Creates a factory from explicit providers plus any discovered on the classpath.
    ///
    /// @param explicitProviders providers to use, not null (may be empty)
    public AgentFactory(List<AgentProvider> explicitProviders) {
        List<AgentProvider> all = new ArrayList<>(explicitProviders);
        all.addAll(loadProviders());
        this.providers = List.copyOf(all);

        logger.info(
                "Loaded "
                        + providers.size()
                        + " agent providers: "
                        + providers.stream().map(AgentProvider::getName).toList());
    }

    /// Creates the handler for an agent definition.
    ///
    /// @param definition agent definition, not null
    /// @return the created handler, never null
    /// @throws IllegalStateException if no provider supports the definition's type
    public AgentHandler createHandler(AgentDefinition definition) {
        String type = definition.getType();

        AgentProvider provider =
                providers.stream()
                        .filter(p -> p.supports(type))
                        .max(Comparator.comparingInt(AgentProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for agent type: "
                                                        + type
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(AgentProvider::getName)
                                                                .toList()));

        logger.fine("Creating handler for '" + definition.getId() + "' with " + provider.getName());
        return provider.createHandler(definition);
    }

    private List<AgentProvider> loadProviders() {
        List<AgentProvider> discovered = new ArrayList<>();
        for (AgentProvider provider : ServiceLoader.load(AgentProvider.class)) {
            discovered.add(provider);
            logger.fine("Discovered provider: " + provider.getName());
        }
        return discovered;
    }

    /// Checks if any loaded provider supports the given type.
    ///
    /// @param agentType type tag, not null
    /// @return `true` if a handler can be created
    public boolean isTypeSupported(String agentType) {
        return providers.stream().anyMatch(p -> p.supports(agentType));
    }
}
