package io.shipme.cli;

import io.shipme.mcp.server.config.McpServerConfig;
import io.shipme.mcp.server.config.ProviderConfig;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show which providers are enabled and configured")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            McpServerConfig config = McpServerConfig.inspectEnv(context.environment());
            System.out.println("Transport: " + config.transport().name().toLowerCase(Locale.ROOT));
            System.out.println("HTTP port: " + config.port());
            System.out.println("Retry: " + config.retryPolicy().maxRetries() + " retries, initial delay "
                + config.retryPolicy().initialDelay().toMillis() + "ms");
            System.out.println("Readiness: poll every " + config.readinessPolicy().pollInterval().toSeconds()
                + "s, give up after " + config.readinessPolicy().maxWaitTime().toSeconds() + "s");
            for (ProviderConfig provider : config.providers().values()) {
                System.out.println(provider.name() + " configured: " + provider.configured() + " (" + provider.baseUrl() + ")");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
