package io.maestro.server.api;

import io.maestro.core.orchestrator.OrchestratorStatus;
import io.maestro.server.gateway.ProtocolGateway;
import io.maestro.server.mcp.McpException;
import io.maestro.server.mcp.McpRequestHandler;
import io.maestro.server.security.CallerResolver;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.jboss.logging.Logger;

/// MCP gateway REST resource.
///
/// Provides the HTTP endpoints of the protocol gateway:
/// - **POST /mcp**: one JSON-RPC 2.0 message in, its response out
/// - **GET /mcp/status**: gateway health summary
///
/// ### Example Exchange
/// ```
/// POST /mcp
/// X-Caller-Id: sales-desk
///
/// {"jsonrpc":"2.0","id":1,"method":"tools/call",
///  "params":{"name":"process_request","arguments":{"goal":"Create a lead for ACME"}}}
/// ```
/// ```json
/// {"jsonrpc":"2.0","id":1,"result":{"content":[{"type":"text","text":"{...}"}],
///  "structuredContent":{"status":"SUCCESS", ...},"isError":false}}
/// ```
///
/// @see McpRequestHandler for the supported methods
@Path("/mcp")
public class McpGatewayResource {

    private static final Logger LOG = Logger.getLogger(McpGatewayResource.class);

    private final McpRequestHandler handler;
    private final ProtocolGateway gateway;
    private final CallerResolver callerResolver;

    @Inject
    public McpGatewayResource(
            McpRequestHandler handler, ProtocolGateway gateway, CallerResolver callerResolver) {
        this.handler = handler;
        this.gateway = gateway;
        this.callerResolver = callerResolver;
    }

    /// Handles one JSON-RPC message.
    ///
    /// ### Response
    /// - 200 OK: JSON-RPC response (errors included, as JSON-RPC error objects)
    /// - 202 Accepted: the message was a notification
    /// - 400 Bad Request: empty body
    ///
    /// @param jsonMessage the JSON-RPC message
    /// @param callerHeader optional caller identity
    /// @return JSON-RPC response
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response message(
            String jsonMessage, @HeaderParam(CallerResolver.HEADER) String callerHeader) {
        if (jsonMessage == null || jsonMessage.isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(
                            Map.of(
                                    "error", "Empty message body",
                                    "code", McpException.INVALID_REQUEST))
                    .build();
        }

        LOG.debugv(
                "Received MCP message: {0}",
                jsonMessage.substring(0, Math.min(200, jsonMessage.length())));

        String response = handler.handle(jsonMessage, callerResolver.resolve(callerHeader));
        if (response == null) {
            return Response.accepted().build();
        }
        return Response.ok(response, MediaType.APPLICATION_JSON).build();
    }

    /// Health check endpoint for MCP gateway status.
    ///
    /// ### Response
    /// ```json
    /// {
    ///   "orchestrator": "RUNNING",
    ///   "activeAgents": 7,
    ///   "requestsServed": 12,
    ///   "successCount": 11
    /// }
    /// ```
    @GET
    @Path("/status")
    @Produces(MediaType.APPLICATION_JSON)
    public Response status() {
        OrchestratorStatus status = gateway.agentStatus();
        return Response.ok(
                        Map.of(
                                "orchestrator", status.state().name(),
                                "activeAgents", status.activeAgentCount(),
                                "requestsServed", gateway.requestsServed(),
                                "successCount", gateway.successCount()))
                .build();
    }
}
