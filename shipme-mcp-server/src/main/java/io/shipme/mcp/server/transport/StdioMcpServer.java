package io.shipme.mcp.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-delimited JSON-RPC 2.0 over a pair of streams. Every line written to the output is a protocol message.
 */
public final class StdioMcpServer {
    private static final Logger LOG = LoggerFactory.getLogger(StdioMcpServer.class);
    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    private final McpProtocol protocol;
    private final InputStream input;
    private final PrintStream output;

    public StdioMcpServer(McpProtocol protocol, InputStream input, OutputStream output) {
        this.protocol = protocol;
        this.input = input;
        this.output = new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    /**
     * Serves requests until the input is exhausted.
     */
    public void run() throws IOException {
        LOG.info("MCP stdio transport ready");
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            Map<String, Object> response = handle(line);
            if (response != null) {
                output.println(protocol.mapper().writeValueAsString(response));
            }
        }
        LOG.info("MCP stdio input closed");
    }

    Map<String, Object> handle(String line) {
        ObjectMapper mapper = protocol.mapper();
        JsonNode request;
        try {
            request = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return error(null, PARSE_ERROR, "Parse error: " + e.getOriginalMessage());
        }
        if (request == null || !request.isObject() || !request.path("method").isTextual()) {
            return error(null, INVALID_REQUEST, "Invalid request");
        }

        JsonNode idNode = request.get("id");
        Object id = idNode == null || idNode.isNull() ? null : mapper.convertValue(idNode, Object.class);
        String method = request.path("method").asText();
        boolean notification = idNode == null;

        switch (method) {
            case "initialize":
                return notification ? null : result(id, protocol.initializeResult());
            case "ping":
                return notification ? null : result(id, Map.of());
            case "tools/list":
                return notification ? null : result(id, protocol.listTools());
            case "tools/call":
                JsonNode params = request.path("params");
                if (!params.path("name").isTextual()) {
                    return notification ? null : error(id, INVALID_PARAMS, "Missing tool name");
                }
                Map<String, Object> arguments = params.path("arguments").isObject()
                    ? mapper.convertValue(params.path("arguments"), ARGUMENTS)
                    : Map.of();
                Map<String, Object> callResult = protocol.callTool(params.path("name").asText(), arguments);
                return notification ? null : result(id, callResult);
            default:
                if (notification) {
                    LOG.debug("Ignoring notification {}", method);
                    return null;
                }
                return error(id, METHOD_NOT_FOUND, "Method not found: " + method);
        }
    }

    private static Map<String, Object> result(Object id, Object result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("result", result);
        return response;
    }

    private static Map<String, Object> error(Object id, int code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("error", error);
        return response;
    }
}
