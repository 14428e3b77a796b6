package io.maestro.server.execution;

import io.maestro.core.task.TaskError;
import io.maestro.core.task.TaskEvent;
import io.maestro.core.task.TaskListener;
import io.maestro.core.task.TaskSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/// Logs task lifecycle events to the server log.
///
/// Completions, failures and retries are logged at INFO, the intermediate transitions at DEBUG.
///
/// ### Log Format
/// ```
/// [req-1f3c-1] crm -> crm-agent  COMPLETED (attempt 1)
/// [req-1f3c-2] inventory  FAILED NO_AGENT_AVAILABLE: No active agent for capability 'inventory'
/// [req-1f3c] REQUEST_COMPLETED
/// ```
///
/// @apiNote **Side effects**: writes to the JBoss log category
/// `io.maestro.server.execution.LoggingTaskListener`.
@ApplicationScoped
public class LoggingTaskListener implements TaskListener {

    private static final Logger LOG = Logger.getLogger(LoggingTaskListener.class);

    @Override
    public void onTaskEvent(TaskEvent event) {
        TaskSnapshot task = event.task();
        if (task == null) {
            LOG.infov("[{0}] {1}", event.requestId(), event.type());
            return;
        }
        switch (event.type()) {
            case COMPLETED ->
                    LOG.infov(
                            "[{0}] {1} -> {2}  COMPLETED (attempt {3})",
                            task.id(), task.capability(), task.assignedAgentId(), task.attempt());
            case FAILED -> {
                TaskError error = task.lastError();
                LOG.infov(
                        "[{0}] {1}  FAILED{2} {3}: {4}",
                        task.id(),
                        task.capability(),
                        task.terminal() ? "" : " (will retry)",
                        error != null ? error.kind() : "",
                        error != null ? error.message() : "");
            }
            case RETRY_SCHEDULED ->
                    LOG.infov(
                            "[{0}] {1}  retry {2}/{3} scheduled",
                            task.id(),
                            task.capability(),
                            task.retryCount() + 1,
                            task.maxAttempts());
            default ->
                    LOG.debugv(
                            "[{0}] {1} -> {2}  {3}",
                            task.id(), task.capability(), task.assignedAgentId(), event.type());
        }
    }
}
