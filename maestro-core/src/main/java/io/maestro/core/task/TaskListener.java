package io.maestro.core.task;

/// Receives task lifecycle events.
///
/// Events are delivered after the task's lock is released, on whichever thread caused the
/// transition (worker, scheduler or caller).
///
/// @implNote Implementations must be thread-safe and should return quickly.
@FunctionalInterface
public interface TaskListener {

    void onTaskEvent(TaskEvent event);
}
