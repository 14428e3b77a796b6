package io.maestro.core.orchestrator;

import io.maestro.core.agent.AgentSnapshot;
import io.maestro.core.agent.AgentState;
import io.maestro.core.task.QueueDepth;
import java.time.Instant;
import java.util.List;

/// Read-only snapshot of the engine.
///
/// @param state orchestrator state
/// @param queueDepth task counts per lifecycle position
/// @param inFlightRequests requests not yet aggregated
/// @param agents per-agent status with performance counters, in routing order
/// @param requestsProcessed finished requests since start-up
/// @param tasksProcessed tasks that reached a terminal state
/// @param successRate completed share of processed tasks, in percent
/// @param avgProcessingSeconds mean wall time of finished requests
/// @param recentOutcomes most recent finished requests, newest first
/// @param capturedAt snapshot time
public record OrchestratorStatus(
        OrchestratorState state,
        QueueDepth queueDepth,
        int inFlightRequests,
        List<AgentSnapshot> agents,
        long requestsProcessed,
        long tasksProcessed,
        double successRate,
        double avgProcessingSeconds,
        List<RequestOutcome> recentOutcomes,
        Instant capturedAt) {

    public long activeAgentCount() {
        return agents.stream().filter(a -> a.state() == AgentState.ACTIVE).count();
    }
}
