package io.maestro.core.agent;

import io.maestro.core.util.Payloads;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable description of an agent: identity, type tag, declared capabilities and the opaque
/// configuration blob handed to its handler.
///
/// Capability names are normalised to lower case and de-duplicated, preserving declaration order.
/// The `type` tag is free text; the standard categories are listed in {@link StandardTypes}, and
/// new categories are introduced by configuration together with an
/// {@link io.maestro.core.agent.spi.AgentProvider} that understands them.
///
/// ### Required Fields
/// - `id` - unique registry key
/// - `type` - category tag (e.g. `crm`, `sales`, `custom`)
///
/// ### Optional Fields
/// - `name` - display name (defaults to the id)
/// - `capabilities` - declared capability names (defaults to the type tag)
/// - `priority` - routing preference, lower wins (default: 10)
/// - `enabled` - whether bootstrap activates the agent (default: true)
/// - `configuration` - opaque key-value settings
///
/// @implNote Thread-safe. All fields are immutable after construction.
public final class AgentDefinition {

    /// Default routing priority; lower values are preferred.
    public static final int DEFAULT_PRIORITY = 10;

    private final String id;
    private final String name;
    private final String type;
    private final String description;
    private final List<String> capabilities;
    private final int priority;
    private final boolean enabled;
    private final Map<String, Object> configuration;

    private AgentDefinition(Builder builder) {
        this.id = requireText(builder.id, "Agent ID required");
        this.type = requireText(builder.type, "Agent type required").toLowerCase(Locale.ROOT);
        this.name = builder.name != null && !builder.name.isBlank() ? builder.name : id;
        this.description = builder.description != null ? builder.description : "";
        this.capabilities = normalise(builder.capabilities, type);
        this.priority = builder.priority;
        this.enabled = builder.enabled;
        this.configuration = Payloads.copy(builder.configuration);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the declared capabilities in declaration order.
    ///
    /// @return unmodifiable, lower-cased capability names, never empty
    public List<String> getCapabilities() {
        return capabilities;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    /// Checks whether this agent declares the given capability.
    ///
    /// @param capability capability name, case-insensitive, not null
    /// @return `true` if declared
    public boolean declares(String capability) {
        return capabilities.contains(capability.toLowerCase(Locale.ROOT));
    }

    /// Compares declared capabilities ignoring order.
    ///
    /// @param other definition to compare with, not null
    /// @return `true` if both declare exactly the same capability set
    public boolean hasSameCapabilities(AgentDefinition other) {
        return Set.copyOf(capabilities).equals(Set.copyOf(other.capabilities));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this definition's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .description(description)
                .capabilities(capabilities)
                .priority(priority)
                .enabled(enabled)
                .configuration(configuration);
    }

    private static String requireText(String value, String message) {
        Objects.requireNonNull(value, message);
        if (value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }

    private static List<String> normalise(List<String> declared, String type) {
        Set<String> result = new LinkedHashSet<>();
        if (declared != null) {
            for (String capability : declared) {
                if (capability != null && !capability.isBlank()) {
                    result.add(capability.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        if (result.isEmpty()) {
            result.add(type);
        }
        return List.copyOf(result);
    }

    /// Builder for {@link AgentDefinition}.
    ///
    /// @implNote Not thread-safe.
    public static final class Builder {
        private String id;
        private String name;
        private String type;
        private String description;
        private List<String> capabilities = List.of();
        private int priority = DEFAULT_PRIORITY;
        private boolean enabled = true;
        private Map<String, Object> configuration = Map.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder capabilities(List<String> capabilities) {
            this.capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
            return this;
        }

        public Builder capabilities(String... capabilities) {
            return capabilities(List.of(capabilities));
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder configuration(Map<String, Object> configuration) {
            this.configuration = configuration;
            return this;
        }

        /// Builds the definition.
        ///
        /// @return immutable definition, never null
        /// @throws NullPointerException if id or type is null
        /// @throws IllegalArgumentException if id or type is blank
        public AgentDefinition build() {
            return new AgentDefinition(this);
        }
    }

    /// Type tags of the built-in agent categories.
    public static final class StandardTypes {
        public static final String PLANNER = "planner";
        public static final String ROUTER = "router";
        public static final String CRM = "crm";
        public static final String SALES = "sales";
        public static final String INVENTORY = "inventory";
        public static final String ACCOUNTING = "accounting";
        public static final String HR = "hr";
        public static final String CUSTOM = "custom";

        /// Business categories that the keyword planner can route goals to.
        public static final List<String> BUSINESS = List.of(CRM, SALES, INVENTORY, ACCOUNTING, HR);

        private StandardTypes() {}
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentDefinition that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "AgentDefinition{id='" + id + "', type='" + type + "', capabilities=" + capabilities
                + "}";
    }
}
