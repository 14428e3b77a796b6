package io.maestro.server.config;

import io.maestro.core.MaestroEnvironment;
import io.maestro.server.execution.LoggingTaskListener;
import io.maestro.server.streaming.TaskEventBroadcaster;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Server bootstrap that registers server-specific components and agents on startup.
///
/// Performs the following steps:
/// - Registers {@link TaskEventBroadcaster} on the task queue for SSE streaming
/// - Registers {@link LoggingTaskListener} on the task queue
/// - Registers the record store's agents (or the default set) and activates them
/// - Starts the orchestrator unless `maestro.orchestrator.auto-start` is `false`
///
/// ### Execution Order
/// Runs during Quarkus startup event, after CDI beans are initialized.
@ApplicationScoped
public class ServerBootstrap {

    private static final Logger LOG = Logger.getLogger(ServerBootstrap.class);

    private final MaestroEnvironment environment;
    private final TaskEventBroadcaster eventBroadcaster;
    private final LoggingTaskListener loggingListener;
    private final boolean autoStart;

    @Inject
    public ServerBootstrap(
            MaestroEnvironment environment,
            TaskEventBroadcaster eventBroadcaster,
            LoggingTaskListener loggingListener,
            @ConfigProperty(name = "maestro.orchestrator.auto-start", defaultValue = "true")
                    boolean autoStart) {
        this.environment = environment;
        this.eventBroadcaster = eventBroadcaster;
        this.loggingListener = loggingListener;
        this.autoStart = autoStart;
    }

    /// Registers server components on application startup.
    ///
    /// @param ev the startup event
    void onStart(@Observes StartupEvent ev) {
        LOG.info("Initializing Maestro server components...");

        environment.getTaskQueue().addListener(eventBroadcaster);
        environment.getTaskQueue().addListener(loggingListener);
        LOG.info("Registered task listeners for SSE streaming and logging");

        int registered = environment.bootstrap(autoStart);
        LOG.infov(
                "Maestro server initialization complete: {0} agents, orchestrator {1}",
                registered, environment.getOrchestrator().getState());
    }
}
