package io.maestro.core;

import io.maestro.core.agent.AgentDefinition;
import io.maestro.core.agent.AgentFactory;
import io.maestro.core.agent.AgentHandler;
import io.maestro.core.agent.AgentRegistry;
import io.maestro.core.agent.AgentState;
import io.maestro.core.agent.RegisteredAgent;
import io.maestro.core.agent.standard.StandardAgents;
import io.maestro.core.orchestrator.Orchestrator;
import io.maestro.core.plan.Planner;
import io.maestro.core.routing.Router;
import io.maestro.core.store.RecordStore;
import io.maestro.core.task.TaskQueue;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Container holding the wired engine components.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @implNote Safe for concurrent reads. {@link #close()} stops the orchestrator with its
/// configured policy before shutting down the executors.
///
/// @apiNote Create instances via {@link MaestroFactory#builder()} rather than direct
/// construction.
public final class MaestroEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(MaestroEnvironment.class.getName());

    private final MaestroConfig config;
    private final AgentRegistry agentRegistry;
    private final AgentFactory agentFactory;
    private final TaskQueue taskQueue;
    private final Planner planner;
    private final Router router;
    private final RecordStore recordStore;
    private final Orchestrator orchestrator;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;

    public MaestroEnvironment(
            MaestroConfig config,
            AgentRegistry agentRegistry,
            AgentFactory agentFactory,
            TaskQueue taskQueue,
            Planner planner,
            Router router,
            RecordStore recordStore,
            Orchestrator orchestrator,
            ExecutorService workers,
            ScheduledExecutorService scheduler) {
        this.config = config;
        this.agentRegistry = agentRegistry;
        this.agentFactory = agentFactory;
        this.taskQueue = taskQueue;
        this.planner = planner;
        this.router = router;
        this.recordStore = recordStore;
        this.orchestrator = orchestrator;
        this.workers = workers;
        this.scheduler = scheduler;
    }

    /// Registers the record store's agents and activates the enabled ones.
    ///
    /// When the store provides no agents, {@link StandardAgents#defaults()} is registered
    /// instead. An agent whose type no provider supports is skipped with a warning.
    ///
    /// @param start whether to start the orchestrator afterwards
    /// @return number of agents registered
    public int bootstrap(boolean start) {
        List<AgentDefinition> definitions = recordStore.loadAgents();
        if (definitions.isEmpty()) {
            logger.info("Record store has no agents, registering the default set");
            definitions = StandardAgents.defaults();
        }

        int registered = 0;
        for (AgentDefinition definition : definitions) {
            if (!agentFactory.isTypeSupported(definition.getType())) {
                logger.warning(
                        "Skipping agent "
                                + definition.getId()
                                + ": no provider for type "
                                + definition.getType());
                continue;
            }
            AgentHandler handler = agentFactory.createHandler(definition);
            RegisteredAgent agent = agentRegistry.register(definition, handler, true);
            if (definition.isEnabled() && !agent.isActive()) {
                agentRegistry.setState(definition.getId(), AgentState.ACTIVE);
            }
            registered++;
        }
        logger.info("Bootstrapped " + registered + " agents");

        if (start) {
            orchestrator.start();
        }
        return registered;
    }

    public MaestroConfig getConfig() {
        return config;
    }

    public AgentRegistry getAgentRegistry() {
        return agentRegistry;
    }

    public AgentFactory getAgentFactory() {
        return agentFactory;
    }

    public TaskQueue getTaskQueue() {
        return taskQueue;
    }

    public Planner getPlanner() {
        return planner;
    }

    public Router getRouter() {
        return router;
    }

    public RecordStore getRecordStore() {
        return recordStore;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    /// Stops the orchestrator and shuts down the worker pool and the scheduler.
    ///
    /// @apiNote **Side effects**: blocks for at most the drain timeout plus a short grace period
    /// for worker threads to exit.
    @Override
    public void close() {
        orchestrator.stop();
        workers.shutdown();
        scheduler.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            logger.log(Level.FINE, "Interrupted while awaiting worker shutdown", e);
        }
    }
}
