package io.maestro.core.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentHandler;
import io.maestro.core.agent.AgentState;
import io.maestro.core.agent.DefaultAgentRegistry;
import io.maestro.core.agent.RegisteredAgent;
import io.maestro.core.exception.DependencyUnmetException;
import io.maestro.core.exception.ErrorKind;
import io.maestro.core.exception.InvalidTransitionException;
import io.maestro.core.exception.NoAgentAvailableException;
import io.maestro.core.routing.Router;
import io.maestro.core.store.InMemoryRecordStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskQueueTest {

    @Mock private ScheduledExecutorService scheduler;

    @Mock private AgentHandler handler;

    private InMemoryRecordStore store;
    private TaskQueue queue;
    private RegisteredAgent agent;
    private Router router;
    private final List<TaskEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        queue =
                new TaskQueue(
                        new RetryPolicy(2, Duration.ofMillis(100), Duration.ofSeconds(1)),
                        scheduler,
                        store);
        queue.addListener(events::add);

        DefaultAgentRegistry registry = new DefaultAgentRegistry();
        agent =
                registry.register(
                        AgentDefinition.builder().id("crm-agent").type("crm").build(), handler);
        registry.setState("crm-agent", AgentState.ACTIVE);
        router = (spec, excluded) -> agent;
    }

    @Nested
    class EnqueueTest {

        @Test
        void shouldRejectTaskWithIncompleteDependency() {
            // Given
            track("t-1", 0, List.of());
            track("t-2", 1, List.of("t-1"));

            // When / Then
            assertThatThrownBy(() -> queue.enqueue("t-2"))
                    .isInstanceOf(DependencyUnmetException.class)
                    .hasMessageContaining("t-1");
            assertThat(queue.get("t-2").orElseThrow().isWithheld()).isTrue();
        }

        @Test
        void shouldRejectDoubleEnqueue() {
            // Given
            track("t-1", 0, List.of());
            queue.enqueue("t-1");

            // When / Then
            assertThatThrownBy(() -> queue.enqueue("t-1"))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        void shouldRejectDuplicateTrackedId() {
            // Given
            track("t-1", 0, List.of());

            // When / Then
            assertThatThrownBy(() -> track("t-1", 0, List.of()))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        void shouldDispatchByPriorityThenEnqueueOrder() {
            // Given
            queue.track(task("low", TaskPriority.LOW));
            queue.track(task("first", TaskPriority.HIGH));
            queue.track(task("second", TaskPriority.HIGH));
            queue.track(task("urgent", TaskPriority.URGENT));
            queue.enqueue("low");
            queue.enqueue("first");
            queue.enqueue("second");
            queue.enqueue("urgent");

            // When
            List<String> order = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                order.add(queue.dequeueForExecution(router).orElseThrow().task().id());
            }

            // Then
            assertThat(order).containsExactly("urgent", "first", "second", "low");
            assertThat(queue.dequeueForExecution(router)).isEmpty();
        }
    }

    @Nested
    class LifecycleTest {

        @Test
        void shouldRunTaskToCompletionAndPersistEveryTransition() {
            // Given
            track("t-1", 0, List.of());
            queue.enqueue("t-1");

            // When
            TaskQueue.Dispatch dispatch = queue.dequeueForExecution(router).orElseThrow();
            TaskSnapshot running = queue.markRunning("t-1", Duration.ofSeconds(5));
            TaskSnapshot completed = queue.complete("t-1", running.attempt(), Map.of("ok", true));

            // Then
            assertThat(dispatch.agent()).isSameAs(agent);
            assertThat(running.deadline()).isNotNull();
            assertThat(completed.state()).isEqualTo(TaskState.COMPLETED);
            assertThat(completed.terminal()).isTrue();
            assertThat(completed.output()).containsEntry("ok", true);
            assertThat(events)
                    .extracting(TaskEvent::type)
                    .containsExactly(
                            TaskEvent.Type.ENQUEUED,
                            TaskEvent.Type.ROUTED,
                            TaskEvent.Type.RUNNING,
                            TaskEvent.Type.COMPLETED);
            assertThat(store.findTask("t-1").orElseThrow().state())
                    .isEqualTo(TaskState.COMPLETED);
        }

        @Test
        void shouldTreatCompletedAsFinal() {
            // Given
            runToRunning("t-1");
            queue.complete("t-1", Map.of());

            // When / Then
            assertThatThrownBy(
                            () -> queue.fail("t-1", TaskError.of(ErrorKind.AGENT_FAILURE, "late")))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(queue.abort("t-1", TaskError.of(ErrorKind.ORCHESTRATOR_STOPPED, "x")))
                    .isFalse();
        }

        @Test
        void shouldRejectStaleAttemptAfterReroute() {
            // Given
            TaskSnapshot running = runToRunning("t-1");

            // When
            queue.reroute("t-1", "crm-agent", (spec, excluded) -> agent);
            queue.markRunning("t-1", null);

            // Then
            assertThatThrownBy(() -> queue.complete("t-1", running.attempt(), Map.of()))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("Stale");
        }

        @Test
        void shouldCountTasksPerLifecyclePosition() {
            // Given
            track("a", 0, List.of());
            track("b", 1, List.of("a"));
            track("c", 2, List.of());
            queue.enqueue("a");
            queue.enqueue("c");
            queue.dequeueForExecution(router);

            // When
            QueueDepth depth = queue.depth();

            // Then
            assertThat(depth.routed()).isEqualTo(1);
            assertThat(depth.pending()).isEqualTo(1);
            assertThat(depth.withheld()).isEqualTo(1);
            assertThat(depth.active()).isEqualTo(3);
            assertThat(depth.total()).isEqualTo(3);
        }
    }

    @Nested
    class RetryTest {

        @Test
        void shouldScheduleRetryWithBackoffAndReenqueue() {
            // Given
            runToRunning("t-1");

            // When
            TaskSnapshot failed =
                    queue.fail("t-1", TaskError.of(ErrorKind.AGENT_FAILURE, "boom", "crm-agent"));

            // Then
            assertThat(failed.state()).isEqualTo(TaskState.FAILED);
            assertThat(failed.terminal()).isFalse();
            assertThat(queue.depth().retrying()).isEqualTo(1);
            ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler).schedule(retry.capture(), eq(100L), eq(TimeUnit.MILLISECONDS));

            // When the backoff elapses
            retry.getValue().run();

            // Then
            TaskSnapshot retried = queue.snapshot("t-1").orElseThrow();
            assertThat(retried.state()).isEqualTo(TaskState.PENDING);
            assertThat(retried.retryCount()).isEqualTo(1);
            assertThat(retried.failureHistory()).hasSize(1);
            assertThat(queue.dequeueForExecution(router)).isPresent();
        }

        @Test
        void shouldClearLastErrorWhenRetriedTaskCompletes() {
            // Given
            runToRunning("t-1");
            queue.fail("t-1", TaskError.of(ErrorKind.AGENT_FAILURE, "transient", "crm-agent"));
            ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler).schedule(retry.capture(), eq(100L), eq(TimeUnit.MILLISECONDS));
            retry.getValue().run();
            assertThat(queue.snapshot("t-1").orElseThrow().lastError()).isNull();

            // When
            queue.dequeueForExecution(router).orElseThrow();
            queue.markRunning("t-1", null);
            TaskSnapshot completed = queue.complete("t-1", Map.of("ok", true));

            // Then
            assertThat(completed.state()).isEqualTo(TaskState.COMPLETED);
            assertThat(completed.lastError()).isNull();
            assertThat(completed.failureHistory())
                    .extracting(TaskError::message)
                    .containsExactly("transient");
            assertThat(store.tasksForRequest("r-1"))
                    .filteredOn(TaskSnapshot::terminal)
                    .allSatisfy(snapshot -> assertThat(snapshot.lastError()).isNull());
        }

        @Test
        void shouldDoubleBackoffOnSecondFailure() {
            // Given
            runToRunning("t-1");
            queue.fail("t-1", TaskError.of(ErrorKind.AGENT_FAILURE, "first"));
            ArgumentCaptor<Runnable> retry = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler).schedule(retry.capture(), eq(100L), eq(TimeUnit.MILLISECONDS));
            retry.getValue().run();

            // When
            queue.dequeueForExecution(router);
            queue.markRunning("t-1", null);
            queue.fail("t-1", TaskError.of(ErrorKind.AGENT_FAILURE, "second"));

            // Then
            verify(scheduler).schedule(any(Runnable.class), eq(200L), eq(TimeUnit.MILLISECONDS));
        }

        @Test
        void shouldFailTerminallyWhenRetriesExhausted() {
            // Given
            TaskQueue strict = new TaskQueue(RetryPolicy.none(), scheduler, store);
            List<TaskEvent> strictEvents = new ArrayList<>();
            strict.addListener(strictEvents::add);
            strict.track(new Task("t-1", "r-1", 0, TaskSpec.of("crm", Map.of()), List.of(), 0));
            strict.enqueue("t-1");
            strict.dequeueForExecution(router);
            strict.markRunning("t-1", null);

            // When
            TaskSnapshot failed = strict.fail("t-1", TaskError.of(ErrorKind.AGENT_FAILURE, "x"));

            // Then
            assertThat(failed.terminal()).isTrue();
            assertThat(strictEvents)
                    .extracting(TaskEvent::type)
                    .doesNotContain(TaskEvent.Type.RETRY_SCHEDULED);
            verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any());
        }

        @Test
        void shouldNotRetryNonRetryableKind() {
            // Given
            runToRunning("t-1");

            // When
            TaskSnapshot failed =
                    queue.fail("t-1", TaskError.of(ErrorKind.AGENT_NOT_FOUND, "gone"));

            // Then
            assertThat(failed.terminal()).isTrue();
            assertThat(queue.depth().failed()).isEqualTo(1);
        }

        @Test
        void shouldRecordRoutingFailureAndScheduleRetry() {
            // Given
            track("t-1", 0, List.of());
            queue.enqueue("t-1");
            Router empty =
                    (spec, excluded) -> {
                        throw new NoAgentAvailableException("No active agent for 'crm'");
                    };

            // When
            boolean dispatched = queue.dequeueForExecution(empty).isPresent();

            // Then
            assertThat(dispatched).isFalse();
            TaskSnapshot snapshot = queue.snapshot("t-1").orElseThrow();
            assertThat(snapshot.state()).isEqualTo(TaskState.FAILED);
            assertThat(snapshot.lastError().kind()).isEqualTo(ErrorKind.NO_AGENT_AVAILABLE);
            verify(scheduler).schedule(any(Runnable.class), eq(100L), eq(TimeUnit.MILLISECONDS));
        }
    }

    @Nested
    class AbortAndPurgeTest {

        @Test
        void shouldAbortPendingTaskAndRemoveItFromDispatch() {
            // Given
            track("t-1", 0, List.of());
            queue.enqueue("t-1");

            // When
            boolean aborted =
                    queue.abort("t-1", TaskError.of(ErrorKind.ORCHESTRATOR_STOPPED, "stopped"));

            // Then
            assertThat(aborted).isTrue();
            assertThat(queue.dequeueForExecution(router)).isEmpty();
            TaskSnapshot snapshot = queue.snapshot("t-1").orElseThrow();
            assertThat(snapshot.terminal()).isTrue();
            assertThat(snapshot.lastError().kind()).isEqualTo(ErrorKind.ORCHESTRATOR_STOPPED);
        }

        @Test
        void shouldPurgeOnlyRequestsWhoseTasksAreAllTerminal() {
            // Given
            runToRunning("done");
            queue.complete("done", Map.of());
            track("open", 1, List.of());
            queue.track(new Task("other", "r-2", 0, TaskSpec.of("crm", Map.of()), List.of(), 2));
            queue.enqueue("other");
            queue.dequeueForExecution(router).orElseThrow();
            queue.markRunning("other", null);
            queue.complete("other", Map.of());

            // When
            int removed = queue.purgeTerminal(Duration.ofMillis(-1));

            // Then
            assertThat(removed).isEqualTo(1);
            assertThat(queue.get("other")).isEmpty();
            assertThat(queue.tasksForRequest("r-2")).isEmpty();
            assertThat(queue.tasksForRequest("r-1"))
                    .extracting(Task::getId)
                    .containsExactly("done", "open");
        }
    }

    @Nested
    class ConcurrencyTest {

        @Test
        void shouldLetExactlyOneOfRacingCompleteAndFailWin() throws Exception {
            ExecutorService racers = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < 50; round++) {
                    // Given
                    String id = "race-" + round;
                    TaskSnapshot running = runToRunning(id);
                    CountDownLatch go = new CountDownLatch(1);

                    // When
                    Future<Boolean> completer =
                            racers.submit(
                                    () -> {
                                        go.await();
                                        return accepted(
                                                () ->
                                                        queue.complete(
                                                                id,
                                                                running.attempt(),
                                                                Map.of("ok", true)));
                                    });
                    Future<Boolean> failer =
                            racers.submit(
                                    () -> {
                                        go.await();
                                        return accepted(
                                                () ->
                                                        queue.fail(
                                                                id,
                                                                running.attempt(),
                                                                TaskError.of(
                                                                        ErrorKind.AGENT_FAILURE,
                                                                        "late")));
                                    });
                    go.countDown();
                    boolean completed = completer.get(5, TimeUnit.SECONDS);
                    boolean failed = failer.get(5, TimeUnit.SECONDS);

                    // Then
                    assertThat(completed ^ failed).as("round %d", round).isTrue();
                    TaskSnapshot after = queue.snapshot(id).orElseThrow();
                    assertThat(after.state())
                            .isEqualTo(completed ? TaskState.COMPLETED : TaskState.FAILED);
                }
            } finally {
                racers.shutdownNow();
            }
        }

        private boolean accepted(Runnable signal) {
            try {
                signal.run();
                return true;
            } catch (InvalidTransitionException e) {
                return false;
            }
        }
    }

    private void track(String id, int index, List<String> dependencies) {
        queue.track(
                new Task(id, "r-1", index, TaskSpec.of("crm", Map.of()), dependencies, 2));
    }

    private Task task(String id, TaskPriority priority) {
        return new Task(
                id,
                "r-1",
                0,
                TaskSpec.of("crm", Map.of()).withPriority(priority),
                List.of(),
                2);
    }

    private TaskSnapshot runToRunning(String id) {
        track(id, 0, List.of());
        queue.enqueue(id);
        queue.dequeueForExecution(router).orElseThrow();
        return queue.markRunning(id, null);
    }
}
