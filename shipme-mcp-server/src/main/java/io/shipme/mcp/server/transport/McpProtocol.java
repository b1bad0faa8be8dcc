package io.shipme.mcp.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shipme.core.tool.ToolCallResult;
import io.shipme.core.tool.ToolDefinition;
import io.shipme.core.tool.ToolDispatcher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shapes shared by every transport: the discovery listing and the text-content wrapper around a result
 * envelope.
 */
public final class McpProtocol {
    private static final Logger LOG = LoggerFactory.getLogger(McpProtocol.class);
    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "shipme-mcp";
    public static final String SERVER_VERSION = "1.0.0";

    private final ToolDispatcher dispatcher;
    private final ObjectMapper mapper;

    public McpProtocol(ToolDispatcher dispatcher, ObjectMapper mapper) {
        this.dispatcher = dispatcher;
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public Map<String, Object> listTools() {
        List<Map<String, Object>> tools = dispatcher.list().stream().map(ToolDefinition::toDescriptor).toList();
        return Map.of("tools", tools);
    }

    public Map<String, Object> callTool(String name, Map<String, Object> arguments) {
        ToolCallResult result = dispatcher.invoke(name, arguments == null ? Map.of() : arguments);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("type", "text");
        content.put("text", envelopeJson(result));
        return Map.of("content", List.of(content));
    }

    public Map<String, Object> initializeResult() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("capabilities", Map.of("tools", Map.of()));
        result.put("serverInfo", Map.of("name", SERVER_NAME, "version", SERVER_VERSION));
        return result;
    }

    String envelopeJson(ToolCallResult result) {
        try {
            return mapper.writeValueAsString(result.toEnvelope());
        } catch (JsonProcessingException e) {
            LOG.warn("Result envelope could not be serialized: {}", e.getOriginalMessage());
            try {
                return mapper.writeValueAsString(
                    ToolCallResult.failure("Result could not be serialized: " + e.getOriginalMessage()).toEnvelope()
                );
            } catch (JsonProcessingException unexpected) {
                return "{\"success\":false,\"error\":\"Result could not be serialized\"}";
            }
        }
    }
}
