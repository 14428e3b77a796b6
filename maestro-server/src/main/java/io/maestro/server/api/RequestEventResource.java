package io.maestro.server.api;

import io.maestro.server.streaming.RequestEvent;
import io.maestro.server.streaming.TaskEventBroadcaster;
import io.maestro.server.validation.ValidId;
import io.smallrye.mutiny.Multi;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestStreamElementType;

/// SSE endpoint streaming the task lifecycle events of one request.
///
/// Subscribe right after `POST /api/v1/requests/async` returned the request id; events emitted
/// before the subscription are not replayed. The stream completes after the `request.completed`
/// event, or at once when the request is unknown or already finished.
///
/// @see TaskEventBroadcaster for event distribution
@Path("/api/v1/requests")
public class RequestEventResource {

    private static final Logger LOG = Logger.getLogger(RequestEventResource.class);

    private final TaskEventBroadcaster broadcaster;

    @Inject
    public RequestEventResource(TaskEventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    /// Subscribes to request events via SSE.
    ///
    /// ### Request
    /// ```
    /// GET /api/v1/requests/{requestId}/events
    /// Accept: text/event-stream
    /// ```
    ///
    /// ### Response (SSE stream)
    /// ```
    /// data: {"type":"task.running","requestId":"req-1","taskId":"req-1-1",...}
    ///
    /// data: {"type":"request.completed","requestId":"req-1","terminal":true,...}
    /// ```
    ///
    /// @param requestId the request to subscribe to
    /// @return SSE event stream
    @GET
    @Path("/{requestId}/events")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    public Multi<RequestEvent> streamEvents(@PathParam("requestId") @ValidId String requestId) {
        LOG.infov("SSE subscription: requestId={0}", requestId);

        return broadcaster
                .subscribe(requestId)
                .onSubscription()
                .invoke(() -> LOG.debugv("Client subscribed to request: {0}", requestId))
                .onTermination()
                .invoke(
                        (t, c) -> {
                            if (t != null) {
                                LOG.warnv(t, "SSE stream error for request: {0}", requestId);
                            } else if (c) {
                                LOG.debugv("SSE stream cancelled for request: {0}", requestId);
                            } else {
                                LOG.debugv("SSE stream completed for request: {0}", requestId);
                            }
                        });
    }
}
