package io.maestro.server.security;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// Resolves the identity of the caller of a gateway, REST or chat request.
///
/// The identity is taken from the `X-Caller-Id` header; requests without it are attributed to
/// `maestro.caller.default`. The identity is informational: it is attached to the request
/// context as `caller` and shows up in logs and conversation records, but grants nothing.
@ApplicationScoped
public class CallerResolver {

    /// Header carrying the caller identity.
    public static final String HEADER = "X-Caller-Id";

    /// Context key under which the caller is attached to a request.
    public static final String CONTEXT_KEY = "caller";

    private static final int MAX_LENGTH = 64;

    private final String defaultCaller;

    public CallerResolver(
            @ConfigProperty(name = "maestro.caller.default", defaultValue = "anonymous")
                    String defaultCaller) {
        this.defaultCaller = defaultCaller;
    }

    /// Returns the caller identity for a header value.
    ///
    /// @param header raw `X-Caller-Id` value, may be null
    /// @return trimmed identity, or the configured default; never null or blank
    public String resolve(String header) {
        if (header == null || header.isBlank()) {
            return defaultCaller;
        }
        String trimmed = header.strip();
        return trimmed.length() > MAX_LENGTH ? trimmed.substring(0, MAX_LENGTH) : trimmed;
    }
}
