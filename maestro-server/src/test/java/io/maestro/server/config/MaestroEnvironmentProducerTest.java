package io.maestro.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.maestro.core.MaestroConfig;
import io.maestro.core.MaestroEnvironment;
import io.maestro.core.orchestrator.StopPolicy;
import io.maestro.core.task.RetryPolicy;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MaestroEnvironmentProducerTest {

    private Config config;
    private MaestroEnvironmentProducer producer;

    @BeforeEach
    void setUp() {
        config = mock(Config.class);
        when(config.getOptionalValue(anyString(), any())).thenReturn(Optional.empty());

        producer = new MaestroEnvironmentProducer();
        producer.config = config;
        producer.objectMapper = ServerConfiguration.createMapper();
    }

    @Test
    void shouldUseDefaultsWhenNothingConfigured() {
        MaestroConfig result = producer.readConfig();
        MaestroConfig defaults = new MaestroConfig();

        assertThat(result.getThreadPoolSize()).isEqualTo(defaults.getThreadPoolSize());
        assertThat(result.getRetryPolicy()).isEqualTo(RetryPolicy.DEFAULT);
        assertThat(result.getStopPolicy()).isEqualTo(defaults.getStopPolicy());
    }

    @Test
    void shouldReadConfiguredSettings() {
        // Given
        when(config.getOptionalValue("maestro.orchestrator.thread-pool-size", Integer.class))
                .thenReturn(Optional.of(4));
        when(config.getOptionalValue("maestro.orchestrator.max-attempts", Integer.class))
                .thenReturn(Optional.of(1));
        when(config.getOptionalValue("maestro.orchestrator.backoff-base", Duration.class))
                .thenReturn(Optional.of(Duration.ofMillis(100)));
        when(config.getOptionalValue("maestro.orchestrator.drain-timeout", Duration.class))
                .thenReturn(Optional.of(Duration.ofSeconds(5)));
        when(config.getOptionalValue("maestro.orchestrator.stop-policy", String.class))
                .thenReturn(Optional.of("abort"));

        // When
        MaestroConfig result = producer.readConfig();

        // Then
        assertThat(result.getThreadPoolSize()).isEqualTo(4);
        assertThat(result.getRetryPolicy().maxAttempts()).isEqualTo(1);
        assertThat(result.getRetryPolicy().baseDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(result.getDrainTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(result.getStopPolicy()).isEqualTo(StopPolicy.ABORT);
    }

    @Test
    void shouldLoadAgentsFromConfiguredFile() {
        when(config.getOptionalValue("maestro.agents.location", String.class))
                .thenReturn(Optional.of("agents-test.json"));

        MaestroEnvironment environment = producer.maestroEnvironment();
        try {
            environment.bootstrap(false);

            assertThat(environment.getAgentRegistry().find("crm-eu")).isPresent();
        } finally {
            producer.cleanup();
        }
    }
}
