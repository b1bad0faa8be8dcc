package io.shipme.mcp.server.transport;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class McpProtocolTest {
    private final McpProtocol protocol = EchoTools.protocol();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldListToolsInRegistrationOrder() {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tools = (List<Map<String, Object>>) protocol.listTools().get("tools");

        assertThat(tools).extracting(tool -> tool.get("name")).containsExactly("echo", "count", "boom", "opaque");
        assertThat(tools.get(0).get("inputSchema")).isEqualTo(Map.of(
            "type", "object",
            "properties", Map.of("message", Map.of("type", "string", "description", "Text to echo")),
            "required", List.of("message")
        ));
    }

    @Test
    void shouldWrapSuccessEnvelopeAsTextContent() throws Exception {
        JsonNode envelope = envelope(protocol.callTool("echo", Map.of("message", "hi")));

        assertThat(envelope.path("success").asBoolean()).isTrue();
        assertThat(envelope.path("echo").asText()).isEqualTo("hi");
    }

    @Test
    void shouldPlaceNonMapResultsUnderResult() throws Exception {
        JsonNode envelope = envelope(protocol.callTool("count", null));

        assertThat(envelope.path("success").asBoolean()).isTrue();
        assertThat(envelope.path("result").asInt()).isEqualTo(42);
    }

    @Test
    void shouldReportFailuresInBand() throws Exception {
        assertThat(envelope(protocol.callTool("boom", Map.of())).path("error").asText()).isEqualTo("kaboom");
        assertThat(envelope(protocol.callTool("nope", Map.of())).path("error").asText()).isEqualTo("Unknown tool: nope");
        assertThat(envelope(protocol.callTool("echo", Map.of())).path("error").asText())
            .isEqualTo("Invalid arguments: Missing required field 'message'");
    }

    @Test
    void shouldStillAnswerWhenResultCannotBeSerialized() throws Exception {
        JsonNode envelope = envelope(protocol.callTool("opaque", Map.of()));

        assertThat(envelope.path("success").asBoolean()).isFalse();
        assertThat(envelope.path("error").asText()).startsWith("Result could not be serialized");
    }

    private JsonNode envelope(Map<String, Object> response) throws Exception {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> content = (List<Map<String, Object>>) response.get("content");
        assertThat(content).hasSize(1);
        assertThat(content.get(0)).containsEntry("type", "text");
        return mapper.readTree((String) content.get(0).get("text"));
    }
}
