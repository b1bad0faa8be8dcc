package io.shipme.cli;

import io.shipme.mcp.server.McpServerApplication;
import io.shipme.mcp.server.McpServerRuntime;
import java.util.Map;

public record CliContext(
    Map<String, String> environment,
    RuntimeFactory runtimeFactory,
    ServerRunner serverRunner
) {
    public CliContext(Map<String, String> environment) {
        this(environment, McpServerRuntime::create, McpServerApplication::serve);
    }
}
