package io.maestro.server.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.maestro.core.agent.AgentSnapshot;
import io.maestro.core.exception.AgentNotFoundException;
import io.maestro.core.exception.OrchestratorException;
import io.maestro.core.orchestrator.RequestResult;
import io.maestro.core.util.Payloads;
import io.maestro.server.gateway.ProtocolGateway;
import io.maestro.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Handles MCP JSON-RPC messages on behalf of the protocol gateway.
///
/// ### Supported Methods
/// | Method | Result |
/// |--------|--------|
/// | `initialize` | server info and capabilities |
/// | `ping` | empty object |
/// | `tools/list` | `process_request`, `execute_agent`, `get_agent_status` |
/// | `tools/call` | `{content, structuredContent, isError}` |
/// | `resources/list` | `ai://agents`, `ai://orchestrator/status`, `ai://agent/{id}` |
/// | `resources/templates/list` | `ai://agent/{agent_id}` |
/// | `resources/read` | `{contents: [{uri, mimeType, text}]}` |
///
/// Notifications (no `id`) are accepted and produce no response. A tool call the engine
/// refuses is answered with a normal result flagged `isError: true`; malformed messages and
/// unknown methods, tools or resources are answered with a JSON-RPC error object.
///
/// @implNote Thread-safe. Stateless apart from the injected collaborators.
@ApplicationScoped
public class McpRequestHandler {

    private static final Logger LOG = Logger.getLogger(McpRequestHandler.class);

    static final String PROTOCOL_VERSION = "2024-11-05";
    static final String AGENTS_URI = "ai://agents";
    static final String AGENT_URI_PREFIX = "ai://agent/";
    static final String STATUS_URI = "ai://orchestrator/status";

    private static final String MIME_JSON = "application/json";

    private static final List<Map<String, Object>> TOOLS =
            List.of(
                    tool(
                            "process_request",
                            "Plan a free-text goal into tasks, route them to agents and return"
                                    + " the aggregated result",
                            Map.of(
                                    "goal",
                                    Map.of("type", "string", "description", "What to achieve"),
                                    "context",
                                    Map.of("type", "object", "description", "Record context"),
                                    "constraints",
                                    Map.of(
                                            "type",
                                            "object",
                                            "description",
                                            "maxTasks, timeout (seconds), priority,"
                                                    + " dependencies, tasks")),
                            List.of("goal")),
                    tool(
                            "execute_agent",
                            "Run one task directly on an agent, bypassing planning and routing",
                            Map.of(
                                    "agent_type",
                                    Map.of(
                                            "type",
                                            "string",
                                            "description",
                                            "Agent identifier or type"),
                                    "task_data",
                                    Map.of("type", "object", "description", "Agent input")),
                            List.of("agent_type")),
                    tool(
                            "get_agent_status",
                            "Report orchestrator state, queue depth and per-agent status",
                            Map.of(),
                            List.of()));

    private final JsonRpc jsonRpc;
    private final ProtocolGateway gateway;
    private final ObjectMapper mapper;
    private final String serverName;
    private final String serverVersion;

    @Inject
    public McpRequestHandler(
            JsonRpc jsonRpc,
            ProtocolGateway gateway,
            ObjectMapper mapper,
            @ConfigProperty(name = "maestro.mcp.server-name", defaultValue = "maestro")
                    String serverName,
            @ConfigProperty(name = "maestro.mcp.server-version", defaultValue = "0.1.0")
                    String serverVersion) {
        this.jsonRpc = jsonRpc;
        this.gateway = gateway;
        this.mapper = mapper;
        this.serverName = serverName;
        this.serverVersion = serverVersion;
    }

    /// Handles one JSON-RPC message.
    ///
    /// @param json the raw message
    /// @param caller resolved caller identity, may be null
    /// @return JSON-RPC response text, or null for a notification
    public String handle(String json, String caller) {
        JsonRpc.Request request;
        try {
            request = jsonRpc.parse(json);
        } catch (McpException e) {
            LOG.debugv("Rejected malformed JSON-RPC message: {0}", e.getMessage());
            return jsonRpc.createErrorResponse(
                    jsonRpc.extractId(json), e.getCode(), e.getMessage(), e.getData());
        }

        if (request.isNotification()) {
            LOG.debugv("Received notification: {0}", LogSanitizer.sanitize(request.method()));
            return null;
        }

        LOG.debugv(
                "MCP request: method={0}, caller={1}",
                LogSanitizer.sanitize(request.method()), LogSanitizer.sanitize(caller));
        try {
            Object result = dispatch(request.method(), request.params(), caller);
            return jsonRpc.createResponse(request.id(), result);
        } catch (McpException e) {
            return jsonRpc.createErrorResponse(
                    request.id(), e.getCode(), e.getMessage(), e.getData());
        } catch (OrchestratorException e) {
            McpException error = McpException.engineError(e.getKind(), e.getMessage());
            return jsonRpc.createErrorResponse(
                    request.id(), error.getCode(), error.getMessage(), error.getData());
        } catch (IllegalArgumentException e) {
            return jsonRpc.createErrorResponse(
                    request.id(), McpException.INVALID_PARAMS, e.getMessage(), null);
        } catch (RuntimeException e) {
            LOG.errorv(e, "Failed to handle MCP method {0}", request.method());
            return jsonRpc.createErrorResponse(
                    request.id(), McpException.INTERNAL_ERROR, "Internal error", null);
        }
    }

    private Object dispatch(String method, Map<String, Object> params, String caller) {
        return switch (method) {
            case "initialize" -> initialize(params);
            case "ping" -> Map.of();
            case "tools/list" -> Map.of("tools", TOOLS);
            case "tools/call" -> callTool(params, caller);
            case "resources/list" -> Map.of("resources", listResources());
            case "resources/templates/list" -> Map.of("resourceTemplates", resourceTemplates());
            case "resources/read" -> readResource(requiredString(params, "uri"));
            default -> throw McpException.methodNotFound(method);
        };
    }

    private Map<String, Object> initialize(Map<String, Object> params) {
        Object requested = params.get("protocolVersion");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(
                "protocolVersion", requested != null ? requested.toString() : PROTOCOL_VERSION);
        result.put(
                "capabilities",
                Map.of(
                        "tools", Map.of("listChanged", false),
                        "resources", Map.of("subscribe", false, "listChanged", false)));
        result.put("serverInfo", Map.of("name", serverName, "version", serverVersion));
        return result;
    }

    // -- Tools ----------------------------------------------------------------------------

    private Map<String, Object> callTool(Map<String, Object> params, String caller) {
        String name = requiredString(params, "name");
        Map<String, Object> arguments = Payloads.nested(params, "arguments");

        Object structured =
                switch (name) {
                    case "process_request" ->
                            gateway.processRequest(
                                    requiredString(arguments, "goal"),
                                    Payloads.nested(arguments, "context"),
                                    Payloads.nested(arguments, "constraints"),
                                    caller);
                    case "execute_agent" ->
                            gateway.executeAgent(
                                    requiredString(arguments, "agent_type"),
                                    Payloads.nested(arguments, "task_data"),
                                    caller);
                    case "get_agent_status" -> gateway.agentStatus();
                    default -> throw McpException.invalidParams("Unknown tool: " + name);
                };

        boolean isError =
                structured instanceof RequestResult result
                        && result.status() == RequestResult.Status.REJECTED;

        Map<String, Object> toolResult = new LinkedHashMap<>();
        toolResult.put("content", List.of(Map.of("type", "text", "text", toJson(structured))));
        toolResult.put("structuredContent", structured);
        toolResult.put("isError", isError);
        return toolResult;
    }

    private static Map<String, Object> tool(
            String name,
            String description,
            Map<String, Object> properties,
            List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);

        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("inputSchema", schema);
        return tool;
    }

    // -- Resources ------------------------------------------------------------------------

    private List<Map<String, Object>> listResources() {
        List<Map<String, Object>> resources = new ArrayList<>();
        resources.add(resource(AGENTS_URI, "agents", "All registered agents"));
        resources.add(resource(STATUS_URI, "orchestrator/status", "Orchestrator status"));
        for (AgentSnapshot agent : gateway.listAgents()) {
            resources.add(
                    resource(
                            AGENT_URI_PREFIX + agent.id(),
                            "agent/" + agent.id(),
                            agent.name() + " (" + agent.type() + ")"));
        }
        return resources;
    }

    private static List<Map<String, Object>> resourceTemplates() {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("uriTemplate", AGENT_URI_PREFIX + "{agent_id}");
        template.put("name", "agent");
        template.put("description", "Detail of one agent");
        template.put("mimeType", MIME_JSON);
        return List.of(template);
    }

    private Map<String, Object> readResource(String uri) {
        Object content;
        if (AGENTS_URI.equals(uri)) {
            content = gateway.listAgents();
        } else if (STATUS_URI.equals(uri)) {
            content = gateway.agentStatus();
        } else if (uri.startsWith(AGENT_URI_PREFIX)
                && uri.length() > AGENT_URI_PREFIX.length()) {
            try {
                content = gateway.agent(uri.substring(AGENT_URI_PREFIX.length()));
            } catch (AgentNotFoundException e) {
                throw McpException.resourceNotFound(uri);
            }
        } else {
            throw McpException.resourceNotFound(uri);
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("uri", uri);
        entry.put("mimeType", MIME_JSON);
        entry.put("text", toJson(content));
        return Map.of("contents", List.of(entry));
    }

    private static Map<String, Object> resource(String uri, String name, String description) {
        Map<String, Object> resource = new LinkedHashMap<>();
        resource.put("uri", uri);
        resource.put("name", name);
        resource.put("description", description);
        resource.put("mimeType", MIME_JSON);
        return resource;
    }

    // -- Helpers --------------------------------------------------------------------------

    private static String requiredString(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (!(value instanceof String str) || str.isBlank()) {
            throw McpException.invalidParams(key + " is required");
        }
        return str;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new McpException(
                    McpException.INTERNAL_ERROR, "Failed to serialize result: " + e.getMessage());
        }
    }
}
