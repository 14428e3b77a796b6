package io.maestro.server.execution;

import static org.assertj.core.api.Assertions.assertThatCode;

import io.maestro.core.task.Task;
import io.maestro.core.task.TaskEvent;
import io.maestro.core.task.TaskSnapshot;
import io.maestro.core.task.TaskSpec;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class LoggingTaskListenerTest {

    private final LoggingTaskListener listener = new LoggingTaskListener();

    @ParameterizedTest
    @EnumSource(
            value = TaskEvent.Type.class,
            names = "REQUEST_COMPLETED",
            mode = EnumSource.Mode.EXCLUDE)
    void shouldLogTaskEventsWithoutAssignedAgent(TaskEvent.Type type) {
        TaskSnapshot task =
                new Task("req-1-1", "req-1", 0, TaskSpec.of("crm", Map.of()), List.of(), 3)
                        .snapshot();

        assertThatCode(() -> listener.onTaskEvent(TaskEvent.of(type, task)))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldLogRequestLevelEvents() {
        assertThatCode(() -> listener.onTaskEvent(TaskEvent.requestCompleted("req-1")))
                .doesNotThrowAnyException();
    }
}
