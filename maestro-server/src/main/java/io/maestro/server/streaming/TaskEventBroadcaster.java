package io.maestro.server.streaming;

import io.maestro.core.orchestrator.Orchestrator;
import io.maestro.core.task.TaskEvent;
import io.maestro.core.task.TaskListener;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.jboss.logging.Logger;

/// Broadcasts task lifecycle events of a request to SSE subscribers.
///
/// Manages per-request event streams using Mutiny's BroadcastProcessor. Registered on the task
/// queue as a {@link TaskListener}; events of requests nobody subscribed to are dropped.
///
/// ### Memory Management
/// A request's stream is completed and removed when:
/// - the request completes (`REQUEST_COMPLETED` event)
/// - the subscription targets a request that is not in flight (unknown or already finished)
/// - explicit unsubscribe via {@link #complete(String)}
///
/// @implNote Thread-safe. Uses ConcurrentHashMap for subscription management and
/// BroadcastProcessor for thread-safe event delivery.
///
/// @see io.maestro.server.api.RequestEventResource for the SSE endpoint
@ApplicationScoped
public class TaskEventBroadcaster implements TaskListener {

    private static final Logger LOG = Logger.getLogger(TaskEventBroadcaster.class);

    private final Map<String, BroadcastProcessor<RequestEvent>> processors =
            new ConcurrentHashMap<>();

    private final Predicate<String> inFlight;

    @Inject
    public TaskEventBroadcaster(Orchestrator orchestrator) {
        this(orchestrator::isInFlight);
    }

    TaskEventBroadcaster(Predicate<String> inFlight) {
        this.inFlight = Objects.requireNonNull(inFlight, "inFlight must not be null");
    }

    /// Subscribes to the events of a request.
    ///
    /// The stream of a request that is unknown or already finished completes at once.
    ///
    /// @param requestId the request to subscribe to, not null
    /// @return event stream that completes with the request
    public Multi<RequestEvent> subscribe(String requestId) {
        Objects.requireNonNull(requestId, "requestId must not be null");

        BroadcastProcessor<RequestEvent> processor =
                processors.computeIfAbsent(
                        requestId,
                        id -> {
                            LOG.debugv("Creating broadcast processor for request: {0}", id);
                            return BroadcastProcessor.create();
                        });
        // The processor exists before the check, so a request finishing now still reaches it.
        if (!inFlight.test(requestId)) {
            LOG.debugv("Request {0} is not in flight, completing its stream", requestId);
            complete(requestId);
        }

        return processor
                .onCancellation()
                .invoke(() -> LOG.debugv("Client disconnected from request: {0}", requestId));
    }

    @Override
    public void onTaskEvent(TaskEvent event) {
        BroadcastProcessor<RequestEvent> processor = processors.get(event.requestId());
        if (processor == null) {
            LOG.tracev(
                    "No subscribers for request {0}, event {1} dropped",
                    event.requestId(), event.type());
            return;
        }
        processor.onNext(RequestEvent.from(event));
        if (event.type() == TaskEvent.Type.REQUEST_COMPLETED) {
            complete(event.requestId());
        }
    }

    /// Completes the event stream of a request.
    ///
    /// @param requestId the request to complete, not null
    public void complete(String requestId) {
        Objects.requireNonNull(requestId, "requestId must not be null");

        BroadcastProcessor<RequestEvent> processor = processors.remove(requestId);
        if (processor != null) {
            LOG.debugv("Completing broadcast for request: {0}", requestId);
            processor.onComplete();
        }
    }

    public int activeSubscriptionCount() {
        return processors.size();
    }

    public boolean hasSubscribers(String requestId) {
        return processors.containsKey(requestId);
    }
}
