package io.maestro.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.maestro.core.MaestroConfig;
import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.orchestrator.RequestRecord;
import io.maestro.core.orchestrator.RequestResult;
import io.maestro.core.orchestrator.RequestState;
import io.maestro.core.task.RetryPolicy;
import io.maestro.core.task.Task;
import io.maestro.core.task.TaskSnapshot;
import io.maestro.core.task.TaskSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryRecordStoreTest {

    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
    }

    @Test
    void shouldReturnEmptyDefaults() {
        assertThat(store.loadAgents()).isEmpty();
        assertThat(store.loadOrchestratorConfig()).isEmpty();
    }

    @Test
    void shouldReplaceAgentWithSameId() {
        // Given
        store.saveAgent(AgentDefinition.builder().id("crm-1").type("crm").priority(5).build());

        // When
        store.saveAgent(AgentDefinition.builder().id("crm-1").type("crm").priority(1).build());

        // Then
        assertThat(store.loadAgents()).hasSize(1);
        assertThat(store.loadAgents().get(0).getPriority()).isEqualTo(1);
    }

    @Test
    void shouldExposeSavedConfig() {
        MaestroConfig config = MaestroConfig.builder().threadPoolSize(2).build();

        store.saveOrchestratorConfig(config);

        assertThat(store.loadOrchestratorConfig()).containsSame(config);
    }

    @Test
    void shouldKeepLatestTaskRecordInPlanOrder() {
        // Given
        TaskSnapshot second = task("r-1-2", 1);
        TaskSnapshot first = task("r-1-1", 0);

        // When
        store.persistTask(second);
        store.persistTask(first);
        store.persistTask(first);
        store.persistTask(task("r-2-1", 0));

        // Then
        assertThat(store.taskCount()).isEqualTo(3);
        assertThat(store.tasksForRequest("r-1"))
                .extracting(TaskSnapshot::id)
                .containsExactly("r-1-1", "r-1-2");
        assertThat(store.findTask("r-1-2")).contains(second);
    }

    @Test
    void shouldEvictOldestFinishedRequestBeyondHistoryLimit() {
        // Given
        InMemoryRecordStore bounded = new InMemoryRecordStore(List.of(), null, 2);
        bounded.persistRequest(request("r-1", null));
        bounded.persistRequest(request("r-2", Instant.now()));
        bounded.persistTask(task("r-2-1", 0));

        // When
        bounded.persistRequest(request("r-3", null));

        // Then
        assertThat(bounded.requestCount()).isEqualTo(2);
        assertThat(bounded.findRequest("r-2")).isEmpty();
        assertThat(bounded.findTask("r-2-1")).isEmpty();
        assertThat(bounded.findRequest("r-1")).isPresent();
        assertThat(bounded.findRequest("r-3")).isPresent();
    }

    @Test
    void shouldPurgeOnlyFinishedRequestsOlderThanRetention() {
        // Given
        store.persistRequest(request("r-1", Instant.now().minus(Duration.ofHours(2))));
        store.persistTask(task("r-1-1", 0));
        store.persistRequest(request("r-2", Instant.now()));
        store.persistRequest(request("r-3", null));

        // When
        int removed = store.purgeFinished(Duration.ofHours(1));

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(store.findRequest("r-1")).isEmpty();
        assertThat(store.tasksForRequest("r-1")).isEmpty();
        assertThat(store.requestCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectNonPositiveHistoryLimit() {
        assertThatThrownBy(() -> new InMemoryRecordStore(List.of(), null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RequestRecord request(String id, Instant finishedAt) {
        return new RequestRecord(
                id,
                "create a lead",
                Map.of(),
                finishedAt != null ? RequestState.COMPLETED : RequestState.IN_PROGRESS,
                "crm",
                List.of(id + "-1"),
                List.of(),
                finishedAt != null ? RequestResult.Status.SUCCESS : null,
                Instant.now(),
                finishedAt);
    }

    private static TaskSnapshot task(String id, int index) {
        String requestId = id.substring(0, id.lastIndexOf('-'));
        return new Task(
                        id,
                        requestId,
                        index,
                        TaskSpec.of("crm", Map.of()),
                        List.of(),
                        RetryPolicy.none().maxAttempts())
                .snapshot();
    }
}
