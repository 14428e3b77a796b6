package io.maestro.core.store;

import io.maestro.core.MaestroConfig;
import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.orchestrator.RequestRecord;
import io.maestro.core.task.TaskSnapshot;
import java.util.List;
import java.util.Optional;

/// Durable side of the engine: agent definitions and configuration come in, task and request
/// state goes out.
///
/// The engine calls the persist methods at every task transition and request state change.
/// Failures thrown from them are logged and do not stop execution.
///
/// @implNote Implementations must be thread-safe; persist calls arrive from worker, scheduler
/// and caller threads concurrently.
///
/// @see InMemoryRecordStore for the default implementation
public interface RecordStore {

    /// Loads the agents to register at bootstrap.
    ///
    /// @return agent definitions, never null (empty means "use the defaults")
    List<AgentDefinition> loadAgents();

    /// Loads stored orchestrator settings that override the configured defaults.
    ///
    /// @return stored configuration, or empty
    Optional<MaestroConfig> loadOrchestratorConfig();

    void persistTask(TaskSnapshot task);

    void persistRequest(RequestRecord request);
}
