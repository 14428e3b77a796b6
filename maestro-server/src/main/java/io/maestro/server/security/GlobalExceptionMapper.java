package io.maestro.server.security;

import io.maestro.core.exception.ErrorKind;
import io.maestro.core.exception.OrchestratorException;
import io.maestro.server.validation.LogSanitizer;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Global exception mapper that prevents stack trace leakage to clients.
///
/// Engine exceptions are mapped by their {@link ErrorKind}; everything else is treated as a
/// generic web or server error. Full stack traces are logged server-side for debugging.
///
/// ### Response Format
/// ```json
/// {"error": "Agent not found: crm-9", "kind": "AGENT_NOT_FOUND", "status": 404}
/// ```
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof OrchestratorException engine) {
            int status = statusFor(engine.getKind());
            String message = LogSanitizer.sanitize(engine.getMessage());
            LOG.debugv("Engine error {0} ({1}): {2}", status, engine.getKind(), message);
            return json(
                    status,
                    Map.of("error", message, "kind", engine.getKind().name(), "status", status));
        }

        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());

            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return json(status, Map.of("error", message, "status", status));
        }

        if (exception instanceof IllegalArgumentException) {
            String message = LogSanitizer.sanitize(exception.getMessage());
            LOG.debugv("Invalid request: {0}", message);
            return json(400, Map.of("error", message, "status", 400));
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return json(500, Map.of("error", "Internal server error", "status", 500));
    }

    /// Returns the HTTP status for an engine error kind.
    ///
    /// @param kind error classification, not null
    /// @return HTTP status code
    public static int statusFor(ErrorKind kind) {
        return switch (kind) {
            case AGENT_NOT_FOUND -> 404;
            case INVALID_TRANSITION, DUPLICATE_IDENTIFIER, AGENT_NOT_ACTIVE -> 409;
            case ORCHESTRATOR_NOT_RUNNING, ORCHESTRATOR_STOPPED, NO_AGENT_AVAILABLE -> 503;
            case DEPENDENCY_UNMET, UNROUTABLE -> 400;
            default -> 500;
        };
    }

    private static Response json(int status, Map<String, Object> body) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? LogSanitizer.sanitize(raw) : "Bad request";
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 409 -> "Conflict";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield raw != null ? LogSanitizer.sanitize(raw) : "Request failed";
            }
        };
    }
}
