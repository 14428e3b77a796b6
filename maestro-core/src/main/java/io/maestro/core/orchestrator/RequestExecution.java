package io.maestro.core.orchestrator;

import io.maestro.core.plan.Plan;
import io.maestro.core.plan.PlanRequest;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/// In-flight request: its plan, task ids and the future the caller waits on.
final class RequestExecution {

    private final String requestId;
    private final PlanRequest request;
    private final Plan plan;
    private final List<String> taskIds;
    private final Instant createdAt = Instant.now();
    private final long startNanos = System.nanoTime();
    private final CompletableFuture<RequestResult> result = new CompletableFuture<>();
    private final AtomicBoolean finished = new AtomicBoolean();

    RequestExecution(String requestId, PlanRequest request, Plan plan, List<String> taskIds) {
        this.requestId = requestId;
        this.request = request;
        this.plan = plan;
        this.taskIds = List.copyOf(taskIds);
    }

    String requestId() {
        return requestId;
    }

    PlanRequest request() {
        return request;
    }

    Plan plan() {
        return plan;
    }

    List<String> taskIds() {
        return taskIds;
    }

    Instant createdAt() {
        return createdAt;
    }

    long elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    CompletableFuture<RequestResult> result() {
        return result;
    }

    /// Claims the right to aggregate; only the first caller gets `true`.
    boolean markFinished() {
        return finished.compareAndSet(false, true);
    }

    RequestRecord record(
            RequestState state, RequestResult.Status status, Instant finishedAt) {
        return new RequestRecord(
                requestId,
                request.goal(),
                request.context(),
                state,
                plan.requestType(),
                taskIds,
                plan.unroutablePortions(),
                status,
                createdAt,
                finishedAt);
    }
}
