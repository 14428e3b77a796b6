package io.maestro.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.maestro.core.MaestroEnvironment;
import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.orchestrator.Orchestrator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI configuration for server-specific beans.
///
/// The environment itself is produced by {@link MaestroEnvironmentProducer}. This class
/// produces:
/// - the shared Jackson `ObjectMapper`
/// - delegating producers that expose environment components for direct injection
@ApplicationScoped
public class ServerConfiguration {

    // ========== Utility Beans ==========

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return createMapper();
    }

    /// Creates the mapper used for REST bodies, JSON-RPC messages and the agent file.
    ///
    /// Instants are written as ISO-8601 strings; unknown properties are ignored on read.
    ///
    /// @return configured mapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ========== MaestroEnvironment Component Delegates ==========

    @Produces
    @Singleton
    public Orchestrator orchestrator(MaestroEnvironment env) {
        return env.getOrchestrator();
    }

    @Produces
    @Singleton
    public AgentRegistry agentRegistry(MaestroEnvironment env) {
        return env.getAgentRegistry();
    }
}
