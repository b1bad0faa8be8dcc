package io.shipme.mcp.server;

import io.shipme.mcp.server.config.McpServerConfig;
import io.shipme.mcp.server.config.MissingCredentialException;
import io.shipme.mcp.server.transport.McpHttpServer;
import io.shipme.mcp.server.transport.StdioMcpServer;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpServerApplication {
    private static final Logger log = LoggerFactory.getLogger(McpServerApplication.class);

    private McpServerApplication() {
    }

    public static void main(String[] args) {
        McpServerConfig config;
        try {
            config = McpServerConfig.fromEnv();
        } catch (MissingCredentialException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }

        try {
            System.exit(serve(config));
        } catch (Exception e) {
            log.error("MCP server failed", e);
            System.exit(1);
        }
    }

    /**
     * Serves the configured transport until stdin closes (stdio) or the JVM shuts down (http).
     */
    public static int serve(McpServerConfig config) throws Exception {
        try (McpServerRuntime runtime = McpServerRuntime.create(config)) {
            switch (config.transport()) {
                case HTTP -> {
                    CountDownLatch shutdown = new CountDownLatch(1);
                    try (McpHttpServer server = new McpHttpServer(config.port(), runtime.protocol())) {
                        Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
                        server.start();
                        log.info("ShipMe MCP server listening on port {} with {} tool(s)", server.port(), runtime.dispatcher().list().size());
                        shutdown.await();
                    }
                }
                case STDIO -> {
                    log.info("ShipMe MCP server running on stdio with {} tool(s)", runtime.dispatcher().list().size());
                    new StdioMcpServer(runtime.protocol(), System.in, System.out).run();
                }
            }
            return 0;
        }
    }
}
