package io.maestro.core.plan;

import java.util.List;
import java.util.Set;

/// Maps free text to the capabilities it refers to.
@FunctionalInterface
public interface CapabilityMatcher {

    /// Finds the capabilities mentioned in `text`.
    ///
    /// @param text goal portion, not null
    /// @param knownCapabilities capabilities declared by registered agents, not null
    /// @return matched capability names in order of first mention; may include capabilities
    ///     outside `knownCapabilities` when the matcher's own vocabulary recognises them
    List<String> match(String text, Set<String> knownCapabilities);
}
