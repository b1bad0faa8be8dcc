package io.shipme.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.shipme.mcp.server.McpServerRuntime;
import io.shipme.mcp.server.config.McpServerConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "tools", description = "Print the tool discovery listing as JSON")
public final class ToolsCommand implements Callable<Integer> {
    private final CliContext context;

    public ToolsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        McpServerConfig config;
        try {
            config = McpServerConfig.inspectEnv(context.environment());
        } catch (IllegalArgumentException e) {
            System.err.println("Tools command failed: " + e.getMessage());
            return 1;
        }
        try (McpServerRuntime runtime = context.runtimeFactory().create(config)) {
            ObjectMapper mapper = runtime.protocol().mapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(runtime.protocol().listTools()));
            return 0;
        } catch (Exception e) {
            System.err.println("Tools command failed: " + e.getMessage());
            return 1;
        }
    }
}
