package io.maestro.server.api;

import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.AgentSnapshot;
import io.maestro.core.agent.AgentState;
import io.maestro.core.orchestrator.AcceptedRequest;
import io.maestro.core.orchestrator.Orchestrator;
import io.maestro.core.orchestrator.OrchestratorStatus;
import io.maestro.core.orchestrator.RequestResult;
import io.maestro.core.orchestrator.StopPolicy;
import io.maestro.server.gateway.ProtocolGateway;
import io.maestro.server.security.CallerResolver;
import io.maestro.server.security.GlobalExceptionMapper;
import io.maestro.server.validation.LogSanitizer;
import io.maestro.server.validation.ValidId;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for requests, agents and the orchestrator lifecycle.
///
/// ### Endpoints
/// | Method | Path | Purpose |
/// |--------|------|---------|
/// | POST | `/api/v1/requests` | process a goal |
/// | POST | `/api/v1/requests/async` | start a goal, answer with its id |
/// | GET | `/api/v1/status` | orchestrator status snapshot |
/// | GET | `/api/v1/agents` | list agents |
/// | GET | `/api/v1/agents/{id}` | agent detail |
/// | PUT | `/api/v1/agents/{id}/state` | operator state transition |
/// | POST | `/api/v1/orchestrator/start` | start accepting requests |
/// | POST | `/api/v1/orchestrator/stop?policy=drain` | stop, draining or aborting |
///
/// Engine errors are turned into JSON error bodies by {@link GlobalExceptionMapper}.
///
/// @see RequestEventResource for the SSE task event stream
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OrchestratorResource {

    private static final Logger LOG = Logger.getLogger(OrchestratorResource.class);

    private final ProtocolGateway gateway;
    private final Orchestrator orchestrator;
    private final AgentRegistry registry;
    private final CallerResolver callerResolver;

    @Inject
    public OrchestratorResource(
            ProtocolGateway gateway,
            Orchestrator orchestrator,
            AgentRegistry registry,
            CallerResolver callerResolver) {
        this.gateway = gateway;
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.callerResolver = callerResolver;
    }

    /// Plans and executes a goal.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/requests
    /// X-Caller-Id: sales-desk
    ///
    /// {"goal": "Create a lead for ACME and then create a sales order",
    ///  "context": {"record_model": "res.partner", "record_id": 7},
    ///  "constraints": {"maxTasks": 5, "timeout": 60}}
    /// ```
    ///
    /// ### Response
    /// - 200 OK: aggregated result (`SUCCESS`, `PARTIAL_FAILURE` or `UNROUTABLE`)
    /// - 503 / 409 / 404: rejected result, status chosen by its error kind
    @POST
    @Path("/requests")
    public Uni<Response> processRequest(
            @Valid @NotNull ProcessRequestBody request,
            @HeaderParam(CallerResolver.HEADER) String callerHeader) {
        String caller = callerResolver.resolve(callerHeader);
        return gateway.processRequestAsync(
                        request.goal(), request.context(), request.constraints(), caller)
                .map(OrchestratorResource::toResponse);
    }

    /// Plans a goal and starts it without waiting for the result.
    ///
    /// The returned id is known before any task runs, so the caller can subscribe to the event
    /// stream in time.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/requests/async
    ///
    /// {"goal": "Create a lead for ACME"}
    /// ```
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"requestId": "req-abc", "events": "/api/v1/requests/req-abc/events"}
    /// ```
    /// A refused request gets the same error status and body as `POST /api/v1/requests`.
    @POST
    @Path("/requests/async")
    public Response startRequest(
            @Valid @NotNull ProcessRequestBody request,
            @HeaderParam(CallerResolver.HEADER) String callerHeader) {
        String caller = callerResolver.resolve(callerHeader);
        AcceptedRequest accepted =
                gateway.acceptRequest(
                        request.goal(), request.context(), request.constraints(), caller);
        if (accepted.requestId() == null) {
            return toResponse(accepted.result().join());
        }
        String requestId = accepted.requestId();
        return Response.accepted()
                .entity(
                        Map.of(
                                "requestId", requestId,
                                "events", "/api/v1/requests/" + requestId + "/events"))
                .build();
    }

    static Response toResponse(RequestResult result) {
        int status =
                result.status() == RequestResult.Status.REJECTED
                        ? GlobalExceptionMapper.statusFor(result.errorKind())
                        : 200;
        return Response.status(status).entity(result).build();
    }

    @GET
    @Path("/status")
    public OrchestratorStatus status() {
        return gateway.agentStatus();
    }

    @GET
    @Path("/agents")
    public List<AgentSnapshot> agents() {
        return gateway.listAgents();
    }

    /// Returns one agent's detail.
    ///
    /// @param agentId agent identifier
    /// @return 200 with the agent, or 404 if unknown
    @GET
    @Path("/agents/{id}")
    public AgentSnapshot agent(@PathParam("id") @ValidId String agentId) {
        return gateway.agent(agentId);
    }

    /// Moves an agent to another operational state.
    ///
    /// ### Request
    /// ```
    /// PUT /api/v1/agents/crm-agent/state
    ///
    /// {"state": "inactive"}
    /// ```
    ///
    /// ### Response
    /// - 200 OK: `{"agentId": ..., "previous": "ACTIVE", "state": "INACTIVE"}`
    /// - 400: unknown state name
    /// - 404: unknown agent
    /// - 409: transition not allowed by the state graph
    @PUT
    @Path("/agents/{id}/state")
    public Response changeState(
            @PathParam("id") @ValidId String agentId, @Valid @NotNull StateChangeBody request) {
        AgentState target = parseState(request.state());
        AgentState previous = registry.setState(agentId, target);
        LOG.infov("Agent {0} moved from {1} to {2} by operator", agentId, previous, target);
        return Response.ok(
                        Map.of(
                                "agentId", agentId,
                                "previous", previous.name(),
                                "state", target.name()))
                .build();
    }

    @POST
    @Path("/orchestrator/start")
    public Response start() {
        orchestrator.start();
        return Response.ok(Map.of("state", orchestrator.getState().name())).build();
    }

    /// Stops the orchestrator.
    ///
    /// With `drain` the call returns once in-flight tasks have finished or the drain timeout
    /// elapsed; with `abort` remaining tasks fail with `ORCHESTRATOR_STOPPED`.
    ///
    /// @param policy `drain` or `abort`, the configured policy when absent
    /// @return 200 with the resulting state
    @POST
    @Path("/orchestrator/stop")
    public Response stop(@QueryParam("policy") String policy) {
        if (policy == null || policy.isBlank()) {
            orchestrator.stop();
        } else {
            StopPolicy parsed;
            try {
                parsed = StopPolicy.parse(policy);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Unknown stop policy: " + LogSanitizer.sanitize(policy), e);
            }
            orchestrator.stop(parsed);
        }
        return Response.ok(Map.of("state", orchestrator.getState().name())).build();
    }

    private static AgentState parseState(String state) {
        try {
            return AgentState.valueOf(state.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown agent state: " + LogSanitizer.sanitize(state), e);
        }
    }

    /// Body of `POST /api/v1/requests`.
    ///
    /// @param goal free-text goal, not blank
    /// @param context record context, may be null
    /// @param constraints planning and execution limits, may be null
    public record ProcessRequestBody(
            @NotBlank(message = "goal is required") String goal,
            Map<String, Object> context,
            Map<String, Object> constraints) {}

    /// Body of `PUT /api/v1/agents/{id}/state`.
    ///
    /// @param state target state name, case-insensitive
    public record StateChangeBody(@NotBlank(message = "state is required") String state) {}
}
