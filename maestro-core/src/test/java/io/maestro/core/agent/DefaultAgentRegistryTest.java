package io.maestro.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.maestro.core.exception.AgentNotFoundException;
import io.maestro.core.exception.DuplicateIdentifierException;
import io.maestro.core.exception.InvalidTransitionException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultAgentRegistryTest {

    @Mock private AgentHandler handler;

    @Mock private AgentHandler otherHandler;

    private DefaultAgentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultAgentRegistry();
    }

    @Nested
    class RegisterTest {

        @Test
        void shouldRegisterNewAgentAsInactive() {
            // When
            RegisteredAgent agent = registry.register(crm("crm-1", 10), handler);

            // Then
            assertThat(agent.getState()).isEqualTo(AgentState.INACTIVE);
            assertThat(registry.find("crm-1")).containsSame(agent);
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        void shouldUpdateHandlerWhenCapabilitiesUnchanged() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            registry.setState("crm-1", AgentState.ACTIVE);

            // When
            RegisteredAgent updated =
                    registry.register(
                            crm("crm-1", 10).toBuilder().description("new").build(),
                            otherHandler);

            // Then
            assertThat(updated.getHandler()).isSameAs(otherHandler);
            assertThat(updated.getDefinition().getDescription()).isEqualTo("new");
            assertThat(updated.getState()).isEqualTo(AgentState.ACTIVE);
            assertThat(registry.size()).isEqualTo(1);
        }

        @Test
        void shouldRejectChangedCapabilitiesWithoutUpdateFlag() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            AgentDefinition changed =
                    crm("crm-1", 10).toBuilder().capabilities("crm", "billing").build();

            // When / Then
            assertThatThrownBy(() -> registry.register(changed, otherHandler, false))
                    .isInstanceOf(DuplicateIdentifierException.class)
                    .hasMessageContaining("crm-1");
            assertThat(registry.getOrThrow("crm-1").getHandler()).isSameAs(handler);
        }

        @Test
        void shouldReplaceChangedCapabilitiesWithUpdateFlag() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            AgentDefinition changed =
                    crm("crm-1", 10).toBuilder().capabilities("crm", "billing").build();

            // When
            registry.register(changed, otherHandler, true);

            // Then
            assertThat(registry.getOrThrow("crm-1").getDefinition().declares("billing")).isTrue();
        }
    }

    @Nested
    class ResolveTest {

        @Test
        void shouldReturnOnlyActiveAgentsOrderedByPriorityThenRegistration() {
            // Given
            registry.register(crm("crm-late", 5), handler);
            registry.register(crm("crm-slow", 20), handler);
            registry.register(crm("crm-fast", 5), handler);
            registry.register(crm("crm-off", 1), handler);
            registry.setState("crm-late", AgentState.ACTIVE);
            registry.setState("crm-slow", AgentState.ACTIVE);
            registry.setState("crm-fast", AgentState.ACTIVE);

            // When
            List<RegisteredAgent> resolved = registry.resolve("CRM");

            // Then
            assertThat(resolved)
                    .extracting(RegisteredAgent::getId)
                    .containsExactly("crm-late", "crm-fast", "crm-slow");
        }

        @Test
        void shouldReturnEmptyListForUnknownCapability() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            registry.setState("crm-1", AgentState.ACTIVE);

            // When / Then
            assertThat(registry.resolve("payroll")).isEmpty();
        }

        @Test
        void shouldSeeStateChangeOnNextResolve() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            registry.setState("crm-1", AgentState.ACTIVE);
            assertThat(registry.resolve("crm")).hasSize(1);

            // When
            registry.setState("crm-1", AgentState.ERROR);

            // Then
            assertThat(registry.resolve("crm")).isEmpty();
        }

        @Test
        void shouldListCapabilitiesOfAllAgents() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            registry.register(
                    AgentDefinition.builder()
                            .id("hr-1")
                            .type("hr")
                            .capabilities("hr", "payroll")
                            .build(),
                    handler);

            // When / Then
            assertThat(registry.knownCapabilities())
                    .containsExactlyInAnyOrder("crm", "lead_management", "hr", "payroll");
        }

        @Test
        void shouldFindActiveAgentByType() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            registry.register(crm("crm-2", 1), handler);
            registry.setState("crm-1", AgentState.ACTIVE);

            // When / Then
            assertThat(registry.findActiveByType("crm"))
                    .map(RegisteredAgent::getId)
                    .contains("crm-1");
            assertThat(registry.findActiveByType("sales")).isEmpty();
        }
    }

    @Nested
    class SetStateTest {

        @Test
        void shouldReturnPreviousStateAndNotifyListeners() {
            // Given
            AgentStateListener listener = mock(AgentStateListener.class);
            registry.addStateListener(listener);
            registry.register(crm("crm-1", 10), handler);

            // When
            AgentState previous = registry.setState("crm-1", AgentState.ACTIVE);

            // Then
            assertThat(previous).isEqualTo(AgentState.INACTIVE);
            verify(listener).onStateChange("crm-1", AgentState.INACTIVE, AgentState.ACTIVE);
        }

        @Test
        void shouldRejectTransitionOutsideGraph() {
            // Given
            registry.register(crm("crm-1", 10), handler);

            // When / Then
            assertThatThrownBy(() -> registry.setState("crm-1", AgentState.ERROR))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(registry.getOrThrow("crm-1").getState()).isEqualTo(AgentState.INACTIVE);
        }

        @Test
        void shouldRequireResetThroughInactiveAfterError() {
            // Given
            registry.register(crm("crm-1", 10), handler);
            registry.setState("crm-1", AgentState.ACTIVE);
            registry.setState("crm-1", AgentState.ERROR);

            // When / Then
            assertThatThrownBy(() -> registry.setState("crm-1", AgentState.ACTIVE))
                    .isInstanceOf(InvalidTransitionException.class);
            registry.setState("crm-1", AgentState.INACTIVE);
            registry.setState("crm-1", AgentState.ACTIVE);
            assertThat(registry.getOrThrow("crm-1").isActive()).isTrue();
        }

        @Test
        void shouldThrowForUnknownAgent() {
            assertThatThrownBy(() -> registry.setState("ghost", AgentState.ACTIVE))
                    .isInstanceOf(AgentNotFoundException.class);
        }

        @Test
        void shouldIsolateFailingListener() {
            // Given
            AgentStateListener failing = mock(AgentStateListener.class);
            doThrow(new IllegalStateException("boom"))
                    .when(failing)
                    .onStateChange("crm-1", AgentState.INACTIVE, AgentState.ACTIVE);
            registry.addStateListener(failing);
            registry.register(crm("crm-1", 10), handler);

            // When
            registry.setState("crm-1", AgentState.ACTIVE);

            // Then
            assertThat(registry.getOrThrow("crm-1").isActive()).isTrue();
        }
    }

    private static AgentDefinition crm(String id, int priority) {
        return AgentDefinition.builder()
                .id(id)
                .name(id)
                .type("crm")
                .capabilities("crm", "lead_management")
                .priority(priority)
                .build();
    }
}
