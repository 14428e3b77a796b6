package io.maestro.core;

import io.maestro.core.orchestrator.StopPolicy;
import io.maestro.core.task.RetryPolicy;
import java.time.Duration;

/// Configuration options for the orchestration engine.
///
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `threadPoolSize`: `10` (maximum concurrently executing tasks)
/// - `retryPolicy`: 3 retries, 500 ms base delay, 30 s cap
/// - `defaultTaskTimeout`: 300 s
/// - `stopPolicy`: `DRAIN`
/// - `drainTimeout`: 60 s (a drain that takes longer degrades into an abort)
/// - `recentOutcomeLimit`: 20
///
/// @implNote **Not thread-safe**. Configure before passing to {@link MaestroFactory}; do not
/// modify after the environment is created.
///
/// @see MaestroFactory.Builder#config(MaestroConfig)
public class MaestroConfig {
    private int threadPoolSize = 10;
    private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;
    private Duration defaultTaskTimeout = Duration.ofSeconds(300);
    private StopPolicy stopPolicy = StopPolicy.DRAIN;
    private Duration drainTimeout = Duration.ofSeconds(60);
    private int recentOutcomeLimit = 20;

    /// Creates a configuration with default values.
    public MaestroConfig() {}

    /// Returns the maximum number of tasks executing at once.
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the worker pool size.
    ///
    /// @param threadPoolSize number of worker threads, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    /// Returns the deadline applied to tasks whose request sets no timeout.
    public Duration getDefaultTaskTimeout() {
        return defaultTaskTimeout;
    }

    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) {
        this.defaultTaskTimeout = defaultTaskTimeout;
    }

    public StopPolicy getStopPolicy() {
        return stopPolicy;
    }

    public void setStopPolicy(StopPolicy stopPolicy) {
        this.stopPolicy = stopPolicy;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    /// Returns how many finished requests the status snapshot keeps.
    public int getRecentOutcomeLimit() {
        return recentOutcomeLimit;
    }

    public void setRecentOutcomeLimit(int recentOutcomeLimit) {
        this.recentOutcomeLimit = recentOutcomeLimit;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link MaestroConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final MaestroConfig config = new MaestroConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            config.retryPolicy = retryPolicy;
            return this;
        }

        public Builder defaultTaskTimeout(Duration defaultTaskTimeout) {
            config.defaultTaskTimeout = defaultTaskTimeout;
            return this;
        }

        public Builder stopPolicy(StopPolicy stopPolicy) {
            config.stopPolicy = stopPolicy;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            config.drainTimeout = drainTimeout;
            return this;
        }

        public Builder recentOutcomeLimit(int recentOutcomeLimit) {
            config.recentOutcomeLimit = recentOutcomeLimit;
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        /// @throws IllegalArgumentException if the pool size or outcome limit is not positive
        public MaestroConfig build() {
            if (config.threadPoolSize < 1) {
                throw new IllegalArgumentException(
                        "threadPoolSize must be positive: " + config.threadPoolSize);
            }
            if (config.recentOutcomeLimit < 1) {
                throw new IllegalArgumentException(
                        "recentOutcomeLimit must be positive: " + config.recentOutcomeLimit);
            }
            return config;
        }
    }
}
