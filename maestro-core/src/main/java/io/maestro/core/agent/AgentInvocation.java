package io.maestro.core.agent;

import io.maestro.core.util.Payloads;
import java.util.Map;
import java.util.Objects;

/// Input handed to an {@link AgentHandler} for one execution attempt.
///
/// @param taskId identifier of the task being executed, not null
/// @param requestId owning request identifier, not null
/// @param capability capability the task was routed for, not null
/// @param input the task's input payload, never null
/// @param context request context (caller, record context, constraints), never null
/// @param dependencyOutputs outputs of completed dependency tasks keyed by capability, never null
/// @param attempt execution attempt number, starting at 1
public record AgentInvocation(
        String taskId,
        String requestId,
        String capability,
        Map<String, Object> input,
        Map<String, Object> context,
        Map<String, Object> dependencyOutputs,
        int attempt) {

    public AgentInvocation {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(capability, "capability must not be null");
        input = Payloads.copy(input);
        context = Payloads.copy(context);
        dependencyOutputs = Payloads.copy(dependencyOutputs);
    }

    /// Returns a string input value.
    ///
    /// @param key input key, not null
    /// @return the value's string form, or empty string when absent
    public String inputString(String key) {
        Object value = input.get(key);
        return value != null ? value.toString() : "";
    }
}
