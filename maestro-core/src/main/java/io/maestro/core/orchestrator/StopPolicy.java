package io.maestro.core.orchestrator;

import java.util.Locale;

/// How {@link Orchestrator#stop} treats in-flight work.
public enum StopPolicy {
    /// Wait for every non-terminal task to finish, up to the drain timeout.
    DRAIN,
    /// Fail every non-terminal task immediately with `ORCHESTRATOR_STOPPED`.
    ABORT;

    /// Parses a policy name, case-insensitive.
    ///
    /// @param value policy name, not null
    /// @return the policy
    /// @throws IllegalArgumentException if the name is unknown
    public static StopPolicy parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
