package io.maestro.server.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.maestro.server.config.ServerConfiguration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonRpcTest {

    private JsonRpc jsonRpc;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = ServerConfiguration.createMapper();
        jsonRpc = new JsonRpc(mapper);
    }

    @Nested
    class Parse {

        @Test
        void shouldParseRequestWithParams() {
            JsonRpc.Request request =
                    jsonRpc.parse(
                            "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"tools/call\","
                                    + "\"params\":{\"name\":\"get_agent_status\"}}");

            assertThat(request.id().asInt()).isEqualTo(7);
            assertThat(request.method()).isEqualTo("tools/call");
            assertThat(request.params()).containsEntry("name", "get_agent_status");
            assertThat(request.isNotification()).isFalse();
        }

        @Test
        void shouldTreatMissingIdAsNotification() {
            JsonRpc.Request request =
                    jsonRpc.parse("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");

            assertThat(request.isNotification()).isTrue();
            assertThat(request.params()).isEmpty();
        }

        @Test
        void shouldTreatNullIdAsNotification() {
            JsonRpc.Request request =
                    jsonRpc.parse("{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"ping\"}");

            assertThat(request.isNotification()).isTrue();
        }

        @Test
        void shouldRejectInvalidJson() {
            assertThatThrownBy(() -> jsonRpc.parse("{not json"))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getCode())
                    .isEqualTo(McpException.PARSE_ERROR);
        }

        @Test
        void shouldRejectNonObjectMessage() {
            assertThatThrownBy(() -> jsonRpc.parse("[1, 2]"))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getCode())
                    .isEqualTo(McpException.INVALID_REQUEST);
        }

        @Test
        void shouldRejectWrongProtocolVersion() {
            String json = "{\"jsonrpc\":\"1.0\",\"id\":1,\"method\":\"ping\"}";

            assertThatThrownBy(() -> jsonRpc.parse(json))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getCode())
                    .isEqualTo(McpException.INVALID_REQUEST);
        }

        @Test
        void shouldRejectMissingMethod() {
            assertThatThrownBy(() -> jsonRpc.parse("{\"jsonrpc\":\"2.0\",\"id\":1}"))
                    .isInstanceOf(McpException.class)
                    .hasMessage("method is required");
        }

        @Test
        void shouldRejectPositionalParams() {
            assertThatThrownBy(
                            () ->
                                    jsonRpc.parse(
                                            "{\"jsonrpc\":\"2.0\",\"id\":1,"
                                                    + "\"method\":\"ping\",\"params\":[1]}"))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getCode())
                    .isEqualTo(McpException.INVALID_PARAMS);
        }
    }

    @Nested
    class ExtractId {

        @Test
        void shouldExtractIdFromInvalidRequest() {
            JsonNode id = jsonRpc.extractId("{\"jsonrpc\":\"1.0\",\"id\":\"abc\"}");

            assertThat(id.asText()).isEqualTo("abc");
        }

        @Test
        void shouldReturnNullForUnparseableMessage() {
            assertThat(jsonRpc.extractId("{oops")).isNull();
        }
    }

    @Nested
    class CreateResponse {

        @Test
        void shouldEchoIdVerbatim() throws Exception {
            String json = jsonRpc.createResponse(new IntNode(3), Map.of("tools", List.of()));

            JsonNode node = mapper.readTree(json);
            assertThat(node.get("jsonrpc").asText()).isEqualTo("2.0");
            assertThat(node.get("id").isInt()).isTrue();
            assertThat(node.get("id").asInt()).isEqualTo(3);
            assertThat(node.get("result").get("tools").isArray()).isTrue();
        }
    }

    @Nested
    class CreateErrorResponse {

        @Test
        void shouldCreateErrorResponse() throws Exception {
            String json =
                    jsonRpc.createErrorResponse(
                            new TextNode("req-1"), -32601, "Method not found: foo", null);

            JsonNode node = mapper.readTree(json);
            assertThat(node.get("id").asText()).isEqualTo("req-1");
            assertThat(node.get("error").get("code").asInt()).isEqualTo(-32601);
            assertThat(node.get("error").get("message").asText())
                    .isEqualTo("Method not found: foo");
            assertThat(node.get("error").has("data")).isFalse();
        }

        @Test
        void shouldWriteNullIdWhenUnknown() throws Exception {
            String json =
                    jsonRpc.createErrorResponse(
                            null, -32700, "Parse error", Map.of("kind", "PARSE"));

            JsonNode node = mapper.readTree(json);
            assertThat(node.has("id")).isTrue();
            assertThat(node.get("id").isNull()).isTrue();
            assertThat(node.get("error").get("data").get("kind").asText()).isEqualTo("PARSE");
        }
    }
}
