package io.maestro.core.orchestrator;

import io.maestro.core.exception.ErrorKind;

/// A task that ended in terminal failure.
///
/// @param taskId task identifier
/// @param index position in the plan
/// @param capability capability the task was routed for
/// @param agentId last assigned agent, may be null
/// @param kind failure classification of the last attempt
/// @param message failure description of the last attempt
/// @param attempts number of recorded failures
public record TaskFailure(
        String taskId,
        int index,
        String capability,
        String agentId,
        ErrorKind kind,
        String message,
        int attempts) {}
