package io.maestro.server.gateway;

import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.AgentSnapshot;
import io.maestro.core.agent.RegisteredAgent;
import io.maestro.core.exception.AgentNotActiveException;
import io.maestro.core.exception.AgentNotFoundException;
import io.maestro.core.exception.OrchestratorException;
import io.maestro.core.orchestrator.AcceptedRequest;
import io.maestro.core.orchestrator.Orchestrator;
import io.maestro.core.orchestrator.OrchestratorStatus;
import io.maestro.core.orchestrator.RequestResult;
import io.maestro.core.plan.PlanRequest;
import io.maestro.core.plan.RequestConstraints;
import io.maestro.server.security.CallerResolver;
import io.maestro.server.validation.LogSanitizer;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/// Transport-neutral adapter between external callers and the orchestrator.
///
/// Exposes the three gateway operations (`process_request`, `execute_agent`,
/// `get_agent_status`) and the read-only resource projections. The JSON-RPC handler, the REST
/// resources and the conversational front end all go through this class.
///
/// ### Error Contract
/// Engine refusals (not running, unknown or inactive agent) come back as a
/// {@link RequestResult.Status#REJECTED} result carrying the error kind; only malformed input
/// is thrown, as {@link IllegalArgumentException}.
///
/// @implNote Thread-safe. Holds no per-request state besides two counters.
@ApplicationScoped
public class ProtocolGateway {

    private static final Logger LOG = Logger.getLogger(ProtocolGateway.class);

    private final Orchestrator orchestrator;
    private final AgentRegistry registry;

    private final AtomicLong requestsServed = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();

    @Inject
    public ProtocolGateway(Orchestrator orchestrator, AgentRegistry registry) {
        this.orchestrator = orchestrator;
        this.registry = registry;
    }

    /// Plans a goal and starts executing it, returning as soon as the request id is assigned.
    ///
    /// A refused request comes back with a null id and an already completed rejected result.
    ///
    /// @param goal free-text goal, not blank
    /// @param context record context, may be null
    /// @param constraints loosely typed constraints as received over the wire, may be null
    /// @param caller resolved caller identity, may be null
    /// @return the request id with its pending result, never null
    /// @throws IllegalArgumentException if the goal is blank or the constraints are malformed
    public AcceptedRequest acceptRequest(
            String goal, Map<String, Object> context, Map<String, ?> constraints, String caller) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("goal is required");
        }
        RequestConstraints parsed = RequestConstraints.fromMap(constraints);
        LOG.infov(
                "process_request from {0}: {1}",
                LogSanitizer.sanitize(caller), LogSanitizer.sanitize(goal));

        try {
            PlanRequest request = new PlanRequest(goal, withCaller(context, caller), parsed);
            AcceptedRequest accepted = orchestrator.accept(request);
            return new AcceptedRequest(
                    accepted.requestId(), accepted.result().thenApply(this::record));
        } catch (OrchestratorException e) {
            return new AcceptedRequest(
                    null, CompletableFuture.completedFuture(record(rejected(goal, e))));
        }
    }

    /// Submits a goal for planning and execution.
    ///
    /// @return future completed with the aggregated or rejected result, never null
    /// @throws IllegalArgumentException if the goal is blank or the constraints are malformed
    /// @see #acceptRequest
    public CompletableFuture<RequestResult> submitRequest(
            String goal, Map<String, Object> context, Map<String, ?> constraints, String caller) {
        return acceptRequest(goal, context, constraints, caller).result();
    }

    /// Blocking form of {@link #submitRequest}.
    public RequestResult processRequest(
            String goal, Map<String, Object> context, Map<String, ?> constraints, String caller) {
        return submitRequest(goal, context, constraints, caller).join();
    }

    /// Reactive form of {@link #submitRequest} for non-blocking endpoints.
    public Uni<RequestResult> processRequestAsync(
            String goal, Map<String, Object> context, Map<String, ?> constraints, String caller) {
        return Uni.createFrom()
                .completionStage(() -> submitRequest(goal, context, constraints, caller));
    }

    /// Runs a task directly on one agent, bypassing planner and router.
    ///
    /// `agent` is looked up as an agent identifier first, then as a type tag; a type resolves
    /// to its first active agent in routing order.
    ///
    /// @param agent agent identifier or type, not blank
    /// @param taskData agent input, may be null
    /// @param caller resolved caller identity, may be null
    /// @return single-task result, or a rejected result for an unknown or inactive agent
    /// @throws IllegalArgumentException if `agent` is blank
    public RequestResult executeAgent(String agent, Map<String, Object> taskData, String caller) {
        if (agent == null || agent.isBlank()) {
            throw new IllegalArgumentException("agent_type is required");
        }
        LOG.infov(
                "execute_agent from {0} on {1}",
                LogSanitizer.sanitize(caller), LogSanitizer.sanitize(agent));

        RequestResult result;
        try {
            String agentId = resolveAgentId(agent.strip());
            result =
                    orchestrator
                            .submitToAgent(agentId, taskData, withCaller(Map.of(), caller))
                            .join();
        } catch (OrchestratorException e) {
            result = rejected("execute " + agent, e);
        }
        return record(result);
    }

    private String resolveAgentId(String agent) {
        if (registry.find(agent).isPresent()) {
            return agent;
        }
        String type = agent.toLowerCase(Locale.ROOT);
        return registry.findActiveByType(type)
                .map(RegisteredAgent::getId)
                .orElseThrow(
                        () -> {
                            boolean typeKnown =
                                    registry.all().stream()
                                            .anyMatch(
                                                    a ->
                                                            a.getDefinition()
                                                                    .getType()
                                                                    .equals(type));
                            return typeKnown
                                    ? new AgentNotActiveException(
                                            "No active agent of type " + type)
                                    : new AgentNotFoundException(
                                            "No agent with id or type " + agent);
                        });
    }

    /// Returns the orchestrator status snapshot (`get_agent_status`).
    public OrchestratorStatus agentStatus() {
        return orchestrator.getStatus();
    }

    /// Lists every registered agent in routing order.
    public List<AgentSnapshot> listAgents() {
        return registry.all().stream().map(RegisteredAgent::snapshot).toList();
    }

    /// Returns one agent's detail.
    ///
    /// @param agentId agent identifier, not null
    /// @return agent projection, never null
    /// @throws AgentNotFoundException if no agent has this id
    public AgentSnapshot agent(String agentId) {
        return registry.getOrThrow(agentId).snapshot();
    }

    public long requestsServed() {
        return requestsServed.get();
    }

    public long successCount() {
        return successes.get();
    }

    private RequestResult record(RequestResult result) {
        requestsServed.incrementAndGet();
        if (result.isSuccess()) {
            successes.incrementAndGet();
        }
        LOG.debugv(
                "Request {0} finished with status {1}", result.requestId(), result.status());
        return result;
    }

    private static RequestResult rejected(String goal, OrchestratorException e) {
        LOG.warnv("Request rejected ({0}): {1}", e.getKind(), e.getMessage());
        return RequestResult.rejected(goal, e.getKind(), e.getMessage());
    }

    private static Map<String, Object> withCaller(Map<String, Object> context, String caller) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (context != null) {
            result.putAll(context);
        }
        if (caller != null) {
            result.put(CallerResolver.CONTEXT_KEY, caller);
        }
        return result;
    }
}
