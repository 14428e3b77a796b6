package io.maestro.core.agent;

import io.maestro.core.exception.DuplicateIdentifierException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Default implementation of {@link AgentRegistry} with thread-safe agent management.
///
/// Stores entries in a {@link ConcurrentHashMap}. Resolution scans the live entries on every
/// call, so a state change committed by {@link #setState} is observed by the next
/// {@link #resolve} without any cache invalidation.
///
/// @implNote Thread-safe. Registration of the same id is serialized through
/// {@link ConcurrentHashMap#compute}; state transitions lock only the affected entry.
///
/// @see AgentRegistry for the interface contract
public class DefaultAgentRegistry implements AgentRegistry {

    private static final Logger logger = Logger.getLogger(DefaultAgentRegistry.class.getName());

    /// Routing order: priority ascending, then registration order.
    public static final Comparator<RegisteredAgent> ROUTING_ORDER =
            Comparator.comparingInt((RegisteredAgent a) -> a.getDefinition().getPriority())
                    .thenComparingLong(RegisteredAgent::getRegistrationOrder);

    private final Map<String, RegisteredAgent> agents = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final List<AgentStateListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public RegisteredAgent register(
            AgentDefinition definition, AgentHandler handler, boolean allowUpdate) {
        Objects.requireNonNull(definition, "definition must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        RegisteredAgent entry =
                agents.compute(
                        definition.getId(),
                        (id, existing) -> {
                            if (existing == null) {
                                return new RegisteredAgent(
                                        definition, handler, sequence.incrementAndGet());
                            }
                            if (!allowUpdate
                                    && !existing.getDefinition().hasSameCapabilities(definition)) {
                                throw new DuplicateIdentifierException(
                                        "Agent '"
                                                + id
                                                + "' is already registered with capabilities "
                                                + existing.getDefinition().getCapabilities());
                            }
                            existing.update(definition, handler);
                            logger.info("Updated agent: " + id);
                            return existing;
                        });

        logger.info(
                "Registered agent: "
                        + definition.getId()
                        + " (type="
                        + definition.getType()
                        + ", capabilities="
                        + definition.getCapabilities()
                        + ")");
        return entry;
    }

    @Override
    public List<RegisteredAgent> resolve(String capability) {
        String normalised = capability.toLowerCase(Locale.ROOT);
        List<RegisteredAgent> result = new ArrayList<>();
        for (RegisteredAgent agent : agents.values()) {
            if (agent.isActive() && agent.getDefinition().declares(normalised)) {
                result.add(agent);
            }
        }
        result.sort(ROUTING_ORDER);
        return result;
    }

    @Override
    public AgentState setState(String agentId, AgentState newState) {
        Objects.requireNonNull(newState, "newState must not be null");
        RegisteredAgent agent = getOrThrow(agentId);
        AgentState previous = agent.transition(newState);

        logger.info("Agent " + agentId + " state: " + previous + " -> " + newState);
        for (AgentStateListener listener : listeners) {
            try {
                listener.onStateChange(agentId, previous, newState);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Agent state listener failed for " + agentId, e);
            }
        }
        return previous;
    }

    @Override
    public Optional<RegisteredAgent> find(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agents.get(agentId));
    }

    @Override
    public Optional<RegisteredAgent> findActiveByType(String type) {
        String normalised = type.toLowerCase(Locale.ROOT);
        return agents.values().stream()
                .filter(RegisteredAgent::isActive)
                .filter(a -> a.getDefinition().getType().equals(normalised))
                .min(ROUTING_ORDER);
    }

    @Override
    public List<RegisteredAgent> all() {
        List<RegisteredAgent> result = new ArrayList<>(agents.values());
        result.sort(ROUTING_ORDER);
        return result;
    }

    @Override
    public Set<String> knownCapabilities() {
        Set<String> result = new LinkedHashSet<>();
        for (RegisteredAgent agent : all()) {
            result.addAll(agent.getDefinition().getCapabilities());
        }
        return result;
    }

    @Override
    public void addStateListener(AgentStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /// Returns the number of registered agents.
    ///
    /// @return agent count, always non-negative
    public int size() {
        return agents.size();
    }
}
