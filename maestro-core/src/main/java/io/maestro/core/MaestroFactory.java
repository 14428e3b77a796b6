package io.maestro.core;

import io.maestro.core.agent.AgentFactory;
import io.maestro.core.agent.DefaultAgentRegistry;
import io.maestro.core.agent.spi.AgentProvider;
import io.maestro.core.agent.standard.CoordinationAgentProvider;
import io.maestro.core.agent.standard.StandardAgentProvider;
import io.maestro.core.orchestrator.Orchestrator;
import io.maestro.core.plan.CapabilityMatcher;
import io.maestro.core.plan.KeywordCapabilityMatcher;
import io.maestro.core.plan.KeywordPlanner;
import io.maestro.core.plan.Planner;
import io.maestro.core.routing.LoadAwareRouter;
import io.maestro.core.routing.Router;
import io.maestro.core.store.InMemoryRecordStore;
import io.maestro.core.store.RecordStore;
import io.maestro.core.task.TaskListener;
import io.maestro.core.task.TaskQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring orchestration environments.
///
/// ### Usage
/// {@snippet :
/// try (var env = MaestroFactory.builder()
///         .config(MaestroConfig.builder().threadPoolSize(4).build())
///         .recordStore(store)
///         .build()) {
///     env.bootstrap(true);
///     RequestResult result = env.getOrchestrator().processRequest("create a lead", null, null);
/// }
/// }
///
/// @see MaestroEnvironment
/// @see MaestroConfig
public final class MaestroFactory {

    private static final Logger logger = Logger.getLogger(MaestroFactory.class.getName());

    private MaestroFactory() {}

    /// Creates an environment with default configuration and an in-memory record store.
    ///
    /// @return a fully-wired environment, never null
    public static MaestroEnvironment createEnvironment() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link MaestroEnvironment}.
    ///
    /// The built-in {@link CoordinationAgentProvider} and {@link StandardAgentProvider} are always
    /// included; explicit providers with a higher priority take precedence over them.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private MaestroConfig config = new MaestroConfig();
        private RecordStore recordStore;
        private final List<AgentProvider> agentProviders = new ArrayList<>();
        private final List<TaskListener> taskListeners = new ArrayList<>();
        private CapabilityMatcher capabilityMatcher;
        private Planner planner;

        private Builder() {}

        public Builder config(MaestroConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the record store. Defaults to a fresh {@link InMemoryRecordStore}.
        ///
        /// @param recordStore the store, not null
        /// @return this builder for chaining, never null
        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        public Builder agentProviders(List<AgentProvider> providers) {
            this.agentProviders.clear();
            this.agentProviders.addAll(providers);
            return this;
        }

        public Builder agentProvider(AgentProvider provider) {
            this.agentProviders.add(provider);
            return this;
        }

        /// Adds a listener receiving every task lifecycle event.
        ///
        /// @param listener the listener, not null
        /// @return this builder for chaining, never null
        public Builder taskListener(TaskListener listener) {
            this.taskListeners.add(listener);
            return this;
        }

        /// Replaces the keyword vocabulary used by the default planner.
        ///
        /// Ignored when a custom {@link #planner(Planner)} is set.
        ///
        /// @param matcher the matcher, not null
        /// @return this builder for chaining, never null
        public Builder capabilityMatcher(CapabilityMatcher matcher) {
            this.capabilityMatcher = matcher;
            return this;
        }

        public Builder planner(Planner planner) {
            this.planner = planner;
            return this;
        }

        /// Wires all components.
        ///
        /// Stored orchestrator settings from the record store, when present, replace the
        /// configured ones. The orchestrator is returned `STOPPED` and no agent is registered
        /// yet; see {@link MaestroEnvironment#bootstrap(boolean)}.
        ///
        /// @return a fully-wired environment, never null
        public MaestroEnvironment build() {
            RecordStore store = recordStore != null ? recordStore : new InMemoryRecordStore();
            Optional<MaestroConfig> stored = store.loadOrchestratorConfig();
            MaestroConfig effective = stored.orElse(config);
            if (stored.isPresent()) {
                logger.info("Using orchestrator settings from the record store");
            }

            DefaultAgentRegistry registry = new DefaultAgentRegistry();
            ScheduledExecutorService scheduler =
                    Executors.newScheduledThreadPool(2, threadFactory("maestro-scheduler"));
            ExecutorService workers =
                    Executors.newFixedThreadPool(
                            effective.getThreadPoolSize(), threadFactory("maestro-worker"));

            TaskQueue queue = new TaskQueue(effective.getRetryPolicy(), scheduler, store);
            Planner effectivePlanner =
                    planner != null
                            ? planner
                            : new KeywordPlanner(
                                    capabilityMatcher != null
                                            ? capabilityMatcher
                                            : KeywordCapabilityMatcher.standard());
            Router router = new LoadAwareRouter(registry);

            List<AgentProvider> providers = new ArrayList<>(agentProviders);
            providers.add(new CoordinationAgentProvider(effectivePlanner, registry));
            providers.add(new StandardAgentProvider());
            AgentFactory agentFactory = new AgentFactory(providers);

            Orchestrator orchestrator =
                    new Orchestrator(
                            registry,
                            queue,
                            effectivePlanner,
                            router,
                            store,
                            effective,
                            workers,
                            scheduler);
            taskListeners.forEach(queue::addListener);

            return new MaestroEnvironment(
                    effective,
                    registry,
                    agentFactory,
                    queue,
                    effectivePlanner,
                    router,
                    store,
                    orchestrator,
                    workers,
                    scheduler);
        }

        private static ThreadFactory threadFactory(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
