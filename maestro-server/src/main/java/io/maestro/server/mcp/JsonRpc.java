package io.maestro.server.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Map;

/// JSON-RPC 2.0 helper for the gateway's MCP messages.
///
/// Parses incoming requests and builds the responses. All MCP communication uses JSON-RPC 2.0
/// format over `POST /mcp`.
///
/// ### Message Types
/// - **Request**: Has `id`, `method`, `params` - expects a response
/// - **Notification**: Has `method`, `params` - no response expected
/// - **Response**: Has `id`, `result` or `error`
///
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
@ApplicationScoped
public class JsonRpc {

    private final ObjectMapper mapper;

    @Inject
    public JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /// Parses an incoming JSON-RPC request or notification.
    ///
    /// @param json the raw message
    /// @return parsed request, never null
    /// @throws McpException with `-32700` if the text is not JSON, or `-32600` if it is not a
    ///     JSON-RPC 2.0 request object
    @SuppressWarnings("unchecked")
    public Request parse(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw McpException.parseError("Parse error: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw McpException.invalidRequest("Request must be a JSON object");
        }
        if (!"2.0".equals(node.path("jsonrpc").asText())) {
            throw McpException.invalidRequest("jsonrpc must be \"2.0\"");
        }
        JsonNode methodNode = node.get("method");
        if (methodNode == null || !methodNode.isTextual()) {
            throw McpException.invalidRequest("method is required");
        }

        JsonNode paramsNode = node.get("params");
        Map<String, Object> params;
        if (paramsNode == null || paramsNode.isNull()) {
            params = Map.of();
        } else if (paramsNode.isObject()) {
            params = mapper.convertValue(paramsNode, Map.class);
        } else {
            throw McpException.invalidParams("params must be an object");
        }
        return new Request(node.get("id"), methodNode.asText(), params);
    }

    /// Extracts the ID from a JSON-RPC message without validating it.
    ///
    /// @param json the JSON-RPC message
    /// @return the ID node, or null if not present or unparseable
    public JsonNode extractId(String json) {
        try {
            JsonNode node = mapper.readTree(json);
            return node != null ? node.get("id") : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /// Creates a JSON-RPC success response.
    ///
    /// @param id the request ID being responded to, echoed verbatim
    /// @param result the result data
    /// @return JSON-RPC response string
    public String createResponse(JsonNode id, Object result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id);
        root.set("result", mapper.valueToTree(result));
        return root.toString();
    }

    /// Creates a JSON-RPC error response.
    ///
    /// @param id the request ID being responded to, null when it could not be read
    /// @param code error code
    /// @param message error message
    /// @param data extra error detail, omitted when null
    /// @return JSON-RPC error response string
    public String createErrorResponse(JsonNode id, int code, String message, Object data) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        if (id == null) {
            root.putNull("id");
        } else {
            root.set("id", id);
        }
        ObjectNode error = root.putObject("error");
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.set("data", mapper.valueToTree(data));
        }
        return root.toString();
    }

    /// A parsed JSON-RPC request.
    ///
    /// @param id request ID, null for notifications
    /// @param method method name, not null
    /// @param params named parameters, never null
    public record Request(JsonNode id, String method, Map<String, Object> params) {

        public boolean isNotification() {
            return id == null || id.isNull();
        }
    }
}
