package io.shipme.cli;

import io.shipme.mcp.server.config.McpServerConfig;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Serve the provisioning tools over stdio or HTTP")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--transport"}, description = "stdio or http (default: SHIPME_TRANSPORT or stdio)")
    String transport;

    @Option(names = {"--port"}, description = "HTTP port (default: SHIPME_MCP_PORT or 8791)")
    Integer port;

    @Option(names = {"--providers"}, description = "Comma separated providers to host (default: SHIPME_PROVIDERS)")
    String providers;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            Map<String, String> env = new HashMap<>(context.environment());
            if (transport != null) {
                env.put("SHIPME_TRANSPORT", transport);
            }
            if (port != null) {
                env.put("SHIPME_MCP_PORT", String.valueOf(port));
            }
            if (providers != null) {
                env.put("SHIPME_PROVIDERS", providers);
            }
            return context.serverRunner().run(McpServerConfig.fromEnv(env));
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
