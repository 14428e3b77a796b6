package io.maestro.core.agent;

/// Callback for agent state changes, invoked after the change is visible to routing.
@FunctionalInterface
public interface AgentStateListener {

    void onStateChange(String agentId, AgentState from, AgentState to);
}
