package io.maestro.core.agent;

import io.maestro.core.util.Payloads;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Outcome of a single agent invocation.
///
/// - {@link Success}: structured output that becomes the task's output payload
/// - {@link Error}: the agent could not complete the task; the queue applies its retry policy
///
/// @see AgentHandler#execute
public sealed interface AgentResponse permits AgentResponse.Success, AgentResponse.Error {

    /// Returns when this response was created.
    Instant timestamp();

    /// Successful execution.
    ///
    /// @param output structured result, not null
    /// @param timestamp when the response was created, not null
    record Success(Map<String, Object> output, Instant timestamp) implements AgentResponse {

        public Success {
            output = Payloads.copy(output);
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Success of(Map<String, Object> output) {
            return new Success(output, Instant.now());
        }
    }

    /// Failed execution.
    ///
    /// @param message error description, not null
    /// @param cause underlying exception, may be null
    /// @param timestamp when the error occurred, not null
    record Error(String message, Throwable cause, Instant timestamp) implements AgentResponse {

        public Error {
            Objects.requireNonNull(message, "message must not be null");
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Error of(String message) {
            return new Error(message, null, Instant.now());
        }

        public static Error from(Throwable cause) {
            return new Error(
                    cause.getMessage() != null
                            ? cause.getMessage()
                            : cause.getClass().getSimpleName(),
                    cause,
                    Instant.now());
        }
    }
}
