package io.maestro.server.streaming;

import io.maestro.core.exception.ErrorKind;
import io.maestro.core.task.TaskError;
import io.maestro.core.task.TaskEvent;
import io.maestro.core.task.TaskSnapshot;
import java.time.Instant;
import java.util.Locale;

/// SSE-friendly view of a {@link TaskEvent}.
///
/// ### Event Types
/// - `task.enqueued`, `task.routed`, `task.running`, `task.completed`, `task.failed`,
///   `task.retry_scheduled`
/// - `request.completed` - last event of a request's stream
///
/// @param type event type identifier
/// @param requestId owning request
/// @param taskId task identifier, null for request-level events
/// @param capability task capability, null for request-level events
/// @param agentId assigned agent, may be null
/// @param attempt execution attempt, 0 for request-level events
/// @param terminal whether the task reached a terminal state
/// @param errorKind failure kind for failed tasks, may be null
/// @param message failure description for failed tasks, may be null
/// @param timestamp when the event was emitted
public record RequestEvent(
        String type,
        String requestId,
        String taskId,
        String capability,
        String agentId,
        int attempt,
        boolean terminal,
        ErrorKind errorKind,
        String message,
        Instant timestamp) {

    public static RequestEvent from(TaskEvent event) {
        String type = typeName(event.type());
        TaskSnapshot task = event.task();
        if (task == null) {
            return new RequestEvent(
                    type,
                    event.requestId(),
                    null,
                    null,
                    null,
                    0,
                    true,
                    null,
                    null,
                    event.timestamp());
        }
        TaskError error = event.type() == TaskEvent.Type.FAILED ? task.lastError() : null;
        return new RequestEvent(
                type,
                event.requestId(),
                task.id(),
                task.capability(),
                task.assignedAgentId(),
                task.attempt(),
                task.terminal(),
                error != null ? error.kind() : null,
                error != null ? error.message() : null,
                event.timestamp());
    }

    static String typeName(TaskEvent.Type type) {
        if (type == TaskEvent.Type.REQUEST_COMPLETED) {
            return "request.completed";
        }
        return "task." + type.name().toLowerCase(Locale.ROOT);
    }
}
