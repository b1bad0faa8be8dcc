package io.shipme.cli;

import io.shipme.mcp.server.config.McpServerConfig;

@FunctionalInterface
public interface ServerRunner {
    int run(McpServerConfig config) throws Exception;
}
