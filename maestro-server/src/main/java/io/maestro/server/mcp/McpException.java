package io.maestro.server.mcp;

import io.maestro.core.exception.ErrorKind;
import java.io.Serial;
import java.util.Map;

/// Exception raised while handling a JSON-RPC message, carrying the error code to answer with.
///
/// Codes follow JSON-RPC 2.0 and the MCP conventions:
/// - `-32700` parse error, `-32600` invalid request
/// - `-32601` unknown method, `-32602` invalid params
/// - `-32002` resource not found
/// - `-32000` engine error, with the error kind in `data.kind`
/// - `-32603` internal error
public class McpException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5486229795475543465L;

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int ENGINE_ERROR = -32000;
    public static final int RESOURCE_NOT_FOUND = -32002;

    private final int code;
    private final Map<String, Object> data;

    /// Creates an exception with a code and message.
    ///
    /// @param code JSON-RPC error code
    /// @param message the error message
    public McpException(int code, String message) {
        this(code, message, null);
    }

    /// Creates an exception with structured error data.
    ///
    /// @param code JSON-RPC error code
    /// @param message the error message
    /// @param data extra error detail, may be null
    public McpException(int code, String message, Map<String, Object> data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    /// Returns the error detail.
    ///
    /// @return data object, or null if not available
    public Map<String, Object> getData() {
        return data;
    }

    public static McpException parseError(String message) {
        return new McpException(PARSE_ERROR, message);
    }

    public static McpException invalidRequest(String message) {
        return new McpException(INVALID_REQUEST, message);
    }

    public static McpException methodNotFound(String method) {
        return new McpException(METHOD_NOT_FOUND, "Method not found: " + method);
    }

    public static McpException invalidParams(String message) {
        return new McpException(INVALID_PARAMS, message);
    }

    /// Creates an exception for an unknown resource URI.
    ///
    /// @param uri the requested URI
    /// @return new exception
    public static McpException resourceNotFound(String uri) {
        return new McpException(RESOURCE_NOT_FOUND, "Resource not found", Map.of("uri", uri));
    }

    /// Creates an exception for an engine refusal.
    ///
    /// @param kind engine error classification
    /// @param message the error message
    /// @return new exception
    public static McpException engineError(ErrorKind kind, String message) {
        return new McpException(ENGINE_ERROR, message, Map.of("kind", kind.name()));
    }
}
