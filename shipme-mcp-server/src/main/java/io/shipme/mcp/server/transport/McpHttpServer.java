package io.shipme.mcp.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(McpHttpServer.class);

    private final McpProtocol protocol;
    private final Undertow undertow;
    private final int requestedPort;
    private volatile boolean started;

    public McpHttpServer(int port, McpProtocol protocol) {
        this(port, "0.0.0.0", protocol);
    }

    public McpHttpServer(int port, String host, McpProtocol protocol) {
        this.protocol = protocol;
        this.requestedPort = port;
        HttpHandler handler = new BlockingHandler(this::route);
        this.undertow = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(handler)
            .build();
    }

    public void start() {
        undertow.start();
        started = true;
        LOG.info("MCP HTTP transport listening on port {}", port());
    }

    /**
     * Bound port, which differs from the requested one when the server was asked for port 0.
     */
    public int port() {
        if (!started) {
            return requestedPort;
        }
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return requestedPort;
    }

    @Override
    public void close() {
        if (started) {
            undertow.stop();
            started = false;
        }
    }

    private void route(HttpServerExchange exchange) throws IOException {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        ObjectMapper mapper = protocol.mapper();
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();

        if ("GET".equals(method) && "/healthz".equals(path)) {
            writeJson(exchange, Map.of("status", "ok"));
            return;
        }

        if ("GET".equals(method) && "/mcp/tools".equals(path)) {
            writeJson(exchange, protocol.listTools());
            return;
        }

        if ("POST".equals(method) && "/mcp/call".equals(path)) {
            Map<String, Object> request;
            try {
                request = mapper.readValue(exchange.getInputStream(), new TypeReference<>() {});
            } catch (JsonProcessingException e) {
                exchange.setStatusCode(400);
                writeJson(exchange, Map.of("error", "Malformed JSON request: " + e.getOriginalMessage()));
                return;
            }
            if (request == null) {
                exchange.setStatusCode(400);
                writeJson(exchange, Map.of("error", "Request body is required"));
                return;
            }
            String name = String.valueOf(request.getOrDefault("name", ""));
            @SuppressWarnings("unchecked")
            Map<String, Object> args = request.get("arguments") instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
            writeJson(exchange, protocol.callTool(name, args));
            return;
        }

        exchange.setStatusCode(404);
        writeJson(exchange, Map.of("error", "Not found"));
    }

    private void writeJson(HttpServerExchange exchange, Object payload) throws IOException {
        exchange.getResponseSender().send(protocol.mapper().writeValueAsString(payload));
    }
}
