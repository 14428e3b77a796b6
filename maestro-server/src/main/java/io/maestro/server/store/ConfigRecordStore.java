package io.maestro.server.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.maestro.core.MaestroConfig;
import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.orchestrator.RequestRecord;
import io.maestro.core.store.InMemoryRecordStore;
import io.maestro.core.task.TaskSnapshot;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// Record store whose agents come from a JSON bootstrap file and whose history stays in memory.
///
/// ### File Format
/// ```json
/// {"agents": [
///   {"id": "crm-agent", "type": "crm", "capabilities": ["crm", "lead_management"],
///    "priority": 10, "enabled": true, "configuration": {"leads": []}}
/// ]}
/// ```
/// A missing file yields no agents, which makes bootstrap fall back to the default set.
///
/// @implNote Thread-safe. Agent definitions are read once at construction.
public class ConfigRecordStore extends InMemoryRecordStore {

    private static final Logger LOG = Logger.getLogger(ConfigRecordStore.class);

    public ConfigRecordStore(List<AgentDefinition> agents, MaestroConfig config) {
        super(agents, config);
    }

    public ConfigRecordStore(
            List<AgentDefinition> agents, MaestroConfig config, int historyLimit) {
        super(agents, config, historyLimit);
    }

    /// Loads the agent file from the classpath.
    ///
    /// @param mapper JSON mapper, not null
    /// @param location classpath resource name, not null
    /// @param config orchestrator settings to report from {@link #loadOrchestratorConfig()}, may
    ///     be null
    /// @return store holding the file's agents, never null
    /// @throws UncheckedIOException if the file exists but cannot be parsed
    public static ConfigRecordStore fromClasspath(
            ObjectMapper mapper, String location, MaestroConfig config) {
        return fromClasspath(mapper, location, config, DEFAULT_HISTORY_LIMIT);
    }

    /// Loads the agent file from the classpath into a store keeping at most `historyLimit`
    /// request records.
    ///
    /// @see #fromClasspath(ObjectMapper, String, MaestroConfig)
    public static ConfigRecordStore fromClasspath(
            ObjectMapper mapper, String location, MaestroConfig config, int historyLimit) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigRecordStore.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(location)) {
            if (in == null) {
                LOG.infov("Agent file {0} not found, using default agents", location);
                return new ConfigRecordStore(List.of(), config, historyLimit);
            }
            List<AgentDefinition> agents = parse(mapper, in);
            LOG.infov("Loaded {0} agent definitions from {1}", agents.size(), location);
            return new ConfigRecordStore(agents, config, historyLimit);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read agent file " + location, e);
        }
    }

    static List<AgentDefinition> parse(ObjectMapper mapper, InputStream in) throws IOException {
        AgentFile file = mapper.readValue(in, AgentFile.class);
        List<AgentDefinition> result = new ArrayList<>();
        if (file.agents() == null) {
            return result;
        }
        for (AgentEntry entry : file.agents()) {
            result.add(
                    AgentDefinition.builder()
                            .id(entry.id())
                            .name(entry.name())
                            .type(entry.type())
                            .description(entry.description())
                            .capabilities(entry.capabilities())
                            .priority(
                                    entry.priority() != null
                                            ? entry.priority()
                                            : AgentDefinition.DEFAULT_PRIORITY)
                            .enabled(entry.enabled() == null || entry.enabled())
                            .configuration(
                                    entry.configuration() != null
                                            ? entry.configuration()
                                            : Map.of())
                            .build());
        }
        return result;
    }

    @Override
    public void persistTask(TaskSnapshot task) {
        super.persistTask(task);
        LOG.tracev("Task {0} recorded in state {1}", task.id(), task.state());
    }

    @Override
    public void persistRequest(RequestRecord request) {
        super.persistRequest(request);
        LOG.debugv("Request {0} recorded in state {1}", request.requestId(), request.state());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AgentFile(List<AgentEntry> agents) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AgentEntry(
            String id,
            String name,
            String type,
            String description,
            List<String> capabilities,
            Integer priority,
            Boolean enabled,
            Map<String, Object> configuration) {}
}
