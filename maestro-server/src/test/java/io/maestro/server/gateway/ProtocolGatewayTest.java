package io.maestro.server.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.maestro.core.MaestroConfig;
import io.maestro.core.MaestroEnvironment;
import io.maestro.core.MaestroFactory;
import io.maestro.core.agent.AgentSnapshot;
import io.maestro.core.agent.AgentState;
import io.maestro.core.exception.AgentNotFoundException;
import io.maestro.core.exception.ErrorKind;
import io.maestro.core.orchestrator.AcceptedRequest;
import io.maestro.core.orchestrator.OrchestratorState;
import io.maestro.core.orchestrator.OrchestratorStatus;
import io.maestro.core.orchestrator.RequestResult;
import io.maestro.core.task.RetryPolicy;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProtocolGatewayTest {

    private MaestroEnvironment env;
    private ProtocolGateway gateway;

    @BeforeEach
    void setUp() {
        env =
                MaestroFactory.builder()
                        .config(
                                MaestroConfig.builder()
                                        .retryPolicy(RetryPolicy.none())
                                        .build())
                        .build();
        env.bootstrap(true);
        gateway = new ProtocolGateway(env.getOrchestrator(), env.getAgentRegistry());
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    @Nested
    class ProcessRequest {

        @Test
        void shouldPlanAndRouteGoal() {
            // When
            RequestResult result =
                    gateway.processRequest(
                            "Create a lead for ACME Corp",
                            Map.of("record_model", "res.partner"),
                            Map.of("maxTasks", 5, "timeout", 60),
                            "sales-desk");

            // Then
            assertThat(result.status()).isEqualTo(RequestResult.Status.SUCCESS);
            assertThat(result.requestId()).startsWith("req-");
            assertThat(result.outputs()).extracting("agentId").containsExactly("crm-agent");
            assertThat(gateway.requestsServed()).isEqualTo(1);
            assertThat(gateway.successCount()).isEqualTo(1);
        }

        @Test
        void shouldReportUnroutableGoal() {
            RequestResult result =
                    gateway.processRequest("book a flight to Paris", null, null, null);

            assertThat(result.status()).isEqualTo(RequestResult.Status.UNROUTABLE);
            assertThat(result.unroutablePortions()).isNotEmpty();
            assertThat(gateway.requestsServed()).isEqualTo(1);
            assertThat(gateway.successCount()).isZero();
        }

        @Test
        void shouldRejectWhenOrchestratorStopped() {
            // Given
            env.getOrchestrator().stop();

            // When
            RequestResult result =
                    gateway.processRequest("Create a lead for ACME Corp", null, null, "ops");

            // Then
            assertThat(result.status()).isEqualTo(RequestResult.Status.REJECTED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.ORCHESTRATOR_NOT_RUNNING);
            assertThat(result.goal()).isEqualTo("Create a lead for ACME Corp");
            assertThat(gateway.requestsServed()).isEqualTo(1);
        }

        @Test
        void shouldRequireGoal() {
            assertThatThrownBy(() -> gateway.processRequest("  ", null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("goal is required");
            assertThat(gateway.requestsServed()).isZero();
        }

        @Test
        void shouldReturnRequestIdBeforeResult() {
            // When
            AcceptedRequest accepted =
                    gateway.acceptRequest("Create a lead for ACME Corp", null, null, "ops");

            // Then
            assertThat(accepted.requestId()).startsWith("req-");
            RequestResult result = accepted.result().join();
            assertThat(result.requestId()).isEqualTo(accepted.requestId());
            assertThat(result.isSuccess()).isTrue();
            assertThat(gateway.requestsServed()).isEqualTo(1);
        }

        @Test
        void shouldAcceptRefusedRequestWithoutId() {
            env.getOrchestrator().stop();

            AcceptedRequest accepted =
                    gateway.acceptRequest("Create a lead for ACME Corp", null, null, null);

            assertThat(accepted.requestId()).isNull();
            assertThat(accepted.result()).isDone();
            assertThat(accepted.result().join().errorKind())
                    .isEqualTo(ErrorKind.ORCHESTRATOR_NOT_RUNNING);
        }

        @Test
        void shouldCompleteAsyncForm() {
            RequestResult result =
                    gateway.processRequestAsync("Create a lead for ACME Corp", null, null, null)
                            .await()
                            .atMost(Duration.ofSeconds(10));

            assertThat(result.isSuccess()).isTrue();
        }
    }

    @Nested
    class ExecuteAgent {

        @Test
        void shouldRunOnAgentById() {
            RequestResult result =
                    gateway.executeAgent(
                            "crm-agent",
                            Map.of("action", "create_lead", "lead_data", Map.of("name", "Acme")),
                            "ops");

            assertThat(result.status()).isEqualTo(RequestResult.Status.SUCCESS);
            assertThat(result.outputs().get(0).output()).containsEntry("status", "created");
        }

        @Test
        void shouldResolveAgentByType() {
            RequestResult result = gateway.executeAgent("CRM", Map.of(), null);

            assertThat(result.status()).isEqualTo(RequestResult.Status.SUCCESS);
            assertThat(result.outputs().get(0).agentId()).isEqualTo("crm-agent");
        }

        @Test
        void shouldRejectUnknownAgent() {
            RequestResult result = gateway.executeAgent("shipping", Map.of(), null);

            assertThat(result.status()).isEqualTo(RequestResult.Status.REJECTED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.AGENT_NOT_FOUND);
            assertThat(result.goal()).isEqualTo("execute shipping");
        }

        @Test
        void shouldRejectTypeWithoutActiveAgent() {
            // Given
            env.getAgentRegistry().setState("hr-agent", AgentState.INACTIVE);

            // When
            RequestResult result = gateway.executeAgent("hr", Map.of(), null);

            // Then
            assertThat(result.status()).isEqualTo(RequestResult.Status.REJECTED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.AGENT_NOT_ACTIVE);
        }

        @Test
        void shouldReportAgentFailureAsPartialFailure() {
            RequestResult result = gateway.executeAgent("crm-agent", Map.of("fail", true), null);

            assertThat(result.status()).isEqualTo(RequestResult.Status.PARTIAL_FAILURE);
            assertThat(result.failures()).hasSize(1);
            assertThat(gateway.successCount()).isZero();
        }

        @Test
        void shouldRequireAgent() {
            assertThatThrownBy(() -> gateway.executeAgent("", Map.of(), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("agent_type is required");
        }
    }

    @Nested
    class Projections {

        @Test
        void shouldReportStatus() {
            OrchestratorStatus status = gateway.agentStatus();

            assertThat(status.state()).isEqualTo(OrchestratorState.RUNNING);
            assertThat(status.agents()).hasSize(7);
            assertThat(status.activeAgentCount()).isEqualTo(7);
        }

        @Test
        void shouldListAgentsAndDescribeOne() {
            assertThat(gateway.listAgents()).extracting(AgentSnapshot::id).contains("crm-agent");

            AgentSnapshot crm = gateway.agent("crm-agent");
            assertThat(crm.type()).isEqualTo("crm");
            assertThat(crm.state()).isEqualTo(AgentState.ACTIVE);
        }

        @Test
        void shouldThrowForUnknownAgentDetail() {
            assertThatThrownBy(() -> gateway.agent("nobody"))
                    .isInstanceOf(AgentNotFoundException.class);
        }
    }
}
