package io.maestro.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.maestro.core.agent.spi.AgentProvider;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AgentFactoryTest {

    @Mock private AgentProvider standardProvider;

    @Mock private AgentProvider integrationProvider;

    @Mock private AgentHandler standardHandler;

    @Mock private AgentHandler integrationHandler;

    private final AgentDefinition crmAgent =
            AgentDefinition.builder().id("crm-agent").type("crm").build();

    @Test
    void shouldPickHighestPriorityProviderSupportingType() {
        // Given
        lenient().when(standardProvider.getName()).thenReturn("standard");
        lenient().when(integrationProvider.getName()).thenReturn("integration");
        when(standardProvider.supports("crm")).thenReturn(true);
        when(integrationProvider.supports("crm")).thenReturn(true);
        when(standardProvider.getPriority()).thenReturn(0);
        when(integrationProvider.getPriority()).thenReturn(100);
        when(integrationProvider.createHandler(crmAgent)).thenReturn(integrationHandler);
        AgentFactory factory = new AgentFactory(List.of(standardProvider, integrationProvider));

        // When
        AgentHandler handler = factory.createHandler(crmAgent);

        // Then
        assertThat(handler).isSameAs(integrationHandler);
        verify(standardProvider, never()).createHandler(crmAgent);
    }

    @Test
    void shouldSkipProvidersNotSupportingType() {
        // Given
        lenient().when(standardProvider.getName()).thenReturn("standard");
        lenient().when(integrationProvider.getName()).thenReturn("integration");
        when(standardProvider.supports("crm")).thenReturn(true);
        when(integrationProvider.supports("crm")).thenReturn(false);
        when(standardProvider.createHandler(crmAgent)).thenReturn(standardHandler);
        AgentFactory factory = new AgentFactory(List.of(standardProvider, integrationProvider));

        // When / Then
        assertThat(factory.createHandler(crmAgent)).isSameAs(standardHandler);
        assertThat(factory.isTypeSupported("crm")).isTrue();
    }

    @Test
    void shouldFailForUnsupportedType() {
        // Given
        lenient().when(standardProvider.getName()).thenReturn("standard");
        when(standardProvider.supports("crm")).thenReturn(false);
        AgentFactory factory = new AgentFactory(List.of(standardProvider));

        // When / Then
        assertThatThrownBy(() -> factory.createHandler(crmAgent))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("crm");
    }
}
