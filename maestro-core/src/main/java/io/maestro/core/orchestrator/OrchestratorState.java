package io.maestro.core.orchestrator;

/// Operational state of the orchestrator. Only `RUNNING` accepts requests.
public enum OrchestratorState {
    STOPPED,
    RUNNING,
    /// Stop in progress: no new requests, in-flight work is draining or being aborted.
    STOPPING
}
