package io.shipme.cli;

import io.shipme.mcp.server.McpServerRuntime;
import io.shipme.mcp.server.config.McpServerConfig;

@FunctionalInterface
public interface RuntimeFactory {
    McpServerRuntime create(McpServerConfig config);
}
