package io.maestro.server.integration;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import org.junit.jupiter.api.Test;

/// End-to-end checks through the full Quarkus pipeline: bootstrap from `agents.json`, JSON-RPC
/// dispatch, REST validation and the chat front end.
///
/// The orchestrator is shared by all tests of the class; none of them stops it.
@QuarkusTest
class GatewayIntegrationTest {

    // --- MCP gateway ---

    @Test
    void mcpShouldAnswerPing() {
        Response response =
                given().contentType(ContentType.JSON)
                        .body("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}")
                        .when()
                        .post("/mcp");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getString("jsonrpc")).isEqualTo("2.0");
        assertThat(response.jsonPath().getInt("id")).isEqualTo(1);
    }

    @Test
    void mcpShouldAcceptNotification() {
        Response response =
                given().contentType(ContentType.JSON)
                        .body("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}")
                        .when()
                        .post("/mcp");

        assertThat(response.statusCode()).isEqualTo(202);
    }

    @Test
    void mcpShouldProcessRequestThroughBootstrappedAgents() {
        Response response =
                given().contentType(ContentType.JSON)
                        .header("X-Caller-Id", "integration")
                        .body(
                                "{\"jsonrpc\":\"2.0\",\"id\":\"t1\",\"method\":\"tools/call\","
                                        + "\"params\":{\"name\":\"process_request\","
                                        + "\"arguments\":{\"goal\":\"Create a lead for ACME\"}}}")
                        .when()
                        .post("/mcp");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getBoolean("result.isError")).isFalse();
        assertThat(response.jsonPath().getString("result.structuredContent.status"))
                .isEqualTo("SUCCESS");
        assertThat(response.jsonPath().getString("result.structuredContent.outputs[0].agentId"))
                .isEqualTo("crm-agent");
    }

    @Test
    void mcpStatusShouldReportRunningOrchestrator() {
        Response response = given().when().get("/mcp/status");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getString("orchestrator")).isEqualTo("RUNNING");
        assertThat(response.jsonPath().getInt("activeAgents")).isEqualTo(7);
    }

    // --- REST API ---

    @Test
    void asyncRequestShouldAnswerAcceptedWithEventsLink() {
        Response response =
                given().contentType(ContentType.JSON)
                        .body("{\"goal\":\"Create a lead for ACME\"}")
                        .when()
                        .post("/api/v1/requests/async");

        assertThat(response.statusCode()).isEqualTo(202);
        String requestId = response.jsonPath().getString("requestId");
        assertThat(requestId).startsWith("req-");
        assertThat(response.jsonPath().getString("events"))
                .isEqualTo("/api/v1/requests/" + requestId + "/events");
    }

    @Test
    void eventStreamOfUnknownRequestShouldEndAtOnce() {
        Response response =
                given().accept("text/event-stream")
                        .when()
                        .get("/api/v1/requests/req-unknown/events");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.asString()).doesNotContain("task.");
    }

    @Test
    void agentsShouldListConfiguredAgents() {
        Response response = given().when().get("/api/v1/agents");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getList("id")).contains("crm-agent", "custom-agent");
    }

    @Test
    void agentDetailShouldReturn404ForUnknownAgent() {
        Response response = given().when().get("/api/v1/agents/nobody");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.jsonPath().getString("kind")).isEqualTo("AGENT_NOT_FOUND");
    }

    @Test
    void agentDetailShouldRejectInvalidIdentifier() {
        Response response = given().when().get("/api/v1/agents/<script>");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.jsonPath().getString("error")).contains("valid identifier");
    }

    @Test
    void requestShouldRejectBlankGoal() {
        Response response =
                given().contentType(ContentType.JSON)
                        .body("{\"goal\":\" \"}")
                        .when()
                        .post("/api/v1/requests");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(response.jsonPath().getString("error")).contains("goal is required");
    }

    @Test
    void requestShouldReturnAggregatedResult() {
        Response response =
                given().contentType(ContentType.JSON)
                        .body("{\"goal\":\"Check stock levels for DESK-001\"}")
                        .when()
                        .post("/api/v1/requests");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getString("status")).isEqualTo("SUCCESS");
        assertThat(response.jsonPath().getString("requestType")).isEqualTo("inventory");
    }

    // --- Chat ---

    @Test
    void chatShouldAnswerHelp() {
        Response response =
                given().contentType(ContentType.JSON)
                        .body("{\"message\":\"what can you do\"}")
                        .when()
                        .post("/api/v1/chat");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.jsonPath().getString("intent")).isEqualTo("HELP");
        assertThat(response.jsonPath().getString("reply")).startsWith("I'm your AI assistant!");
    }
}
