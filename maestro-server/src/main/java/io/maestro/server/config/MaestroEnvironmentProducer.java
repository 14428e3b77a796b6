package io.maestro.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.maestro.core.MaestroConfig;
import io.maestro.core.MaestroEnvironment;
import io.maestro.core.MaestroFactory;
import io.maestro.core.orchestrator.StopPolicy;
import io.maestro.core.task.RetryPolicy;
import io.maestro.server.store.ConfigRecordStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the orchestration environment.
///
/// Wires the engine via {@link MaestroFactory} with settings read from MicroProfile Config and
/// a {@link ConfigRecordStore} loaded from the agent file.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `maestro.orchestrator.thread-pool-size` | int | `10` | Max concurrently executing tasks |
/// | `maestro.orchestrator.max-attempts` | int | `3` | Retries after the first execution |
/// | `maestro.orchestrator.backoff-base` | Duration | `500ms` | First retry delay |
/// | `maestro.orchestrator.backoff-max` | Duration | `30s` | Retry delay cap |
/// | `maestro.orchestrator.task-timeout` | Duration | `300s` | Default task deadline |
/// | `maestro.orchestrator.drain-timeout` | Duration | `60s` | Drain wait before abort |
/// | `maestro.orchestrator.stop-policy` | String | `drain` | `drain` or `abort` |
/// | `maestro.agents.location` | String | `agents.json` | Classpath agent file |
/// | `maestro.store.history-limit` | int | `10000` | Request records kept in memory |
///
/// @implNote The environment is produced as a `@Singleton`; {@link MaestroEnvironment} is final
/// and cannot be proxied.
@ApplicationScoped
public class MaestroEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(MaestroEnvironmentProducer.class);

    private static final String PREFIX = "maestro.orchestrator.";

    private MaestroEnvironment environment;

    @Inject Config config;

    @Inject ObjectMapper objectMapper;

    /// Produces the orchestration environment for CDI injection.
    ///
    /// Agents are not registered here; {@link ServerBootstrap} does that on startup.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @Singleton
    public MaestroEnvironment maestroEnvironment() {
        MaestroConfig maestroConfig = readConfig();
        String location =
                config.getOptionalValue("maestro.agents.location", String.class)
                        .orElse("agents.json");
        int historyLimit =
                config.getOptionalValue("maestro.store.history-limit", Integer.class)
                        .orElse(ConfigRecordStore.DEFAULT_HISTORY_LIMIT);

        environment =
                MaestroFactory.builder()
                        .config(maestroConfig)
                        .recordStore(
                                ConfigRecordStore.fromClasspath(
                                        objectMapper, location, null, historyLimit))
                        .build();

        LOG.infov(
                "Configured MaestroEnvironment: threadPoolSize={0}, retry={1}, stopPolicy={2}",
                maestroConfig.getThreadPoolSize(),
                maestroConfig.getRetryPolicy(),
                maestroConfig.getStopPolicy());
        return environment;
    }

    MaestroConfig readConfig() {
        RetryPolicy defaults = RetryPolicy.DEFAULT;
        RetryPolicy retryPolicy =
                new RetryPolicy(
                        intValue("max-attempts", defaults.maxAttempts()),
                        durationValue("backoff-base", defaults.baseDelay()),
                        durationValue("backoff-max", defaults.maxDelay()));

        MaestroConfig defaultConfig = new MaestroConfig();
        return MaestroConfig.builder()
                .threadPoolSize(intValue("thread-pool-size", defaultConfig.getThreadPoolSize()))
                .retryPolicy(retryPolicy)
                .defaultTaskTimeout(
                        durationValue("task-timeout", defaultConfig.getDefaultTaskTimeout()))
                .drainTimeout(durationValue("drain-timeout", defaultConfig.getDrainTimeout()))
                .stopPolicy(
                        config.getOptionalValue(PREFIX + "stop-policy", String.class)
                                .map(StopPolicy::parse)
                                .orElse(defaultConfig.getStopPolicy()))
                .build();
    }

    private int intValue(String key, int fallback) {
        return config.getOptionalValue(PREFIX + key, Integer.class).orElse(fallback);
    }

    private Duration durationValue(String key, Duration fallback) {
        return config.getOptionalValue(PREFIX + key, Duration.class).orElse(fallback);
    }

    /// Stops the orchestrator and releases its thread pools on shutdown.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
            LOG.info("MaestroEnvironment closed");
        }
    }
}
