package io.shipme.mcp.server.provider;

import io.shipme.core.readiness.ReadinessPoller;
import io.shipme.core.readiness.ReadinessPolicy;
import io.shipme.core.retry.RetryEngine;
import io.shipme.core.retry.RetryPolicy;
import io.shipme.core.vault.SecretVault;
import io.shipme.mcp.server.config.McpServerConfig;

/**
 * Everything the handlers of one provisioning run share. The vault lives exactly as long as the run;
 * closing the context destroys it.
 */
public record ProvisioningContext(
    SecretVault vault,
    RetryEngine retryEngine,
    RetryPolicy retryPolicy,
    ReadinessPoller poller,
    ReadinessPolicy readinessPolicy
) implements AutoCloseable {

    public static ProvisioningContext fromConfig(McpServerConfig config) {
        return new ProvisioningContext(
            new SecretVault(),
            new RetryEngine(),
            config.retryPolicy(),
            new ReadinessPoller(),
            config.readinessPolicy()
        );
    }

    public RetryPolicy retryPolicy(String label) {
        return retryPolicy.withLabel(label);
    }

    public ReadinessPolicy readinessPolicy(String label) {
        return readinessPolicy.withLabel(label);
    }

    @Override
    public void close() {
        vault.destroy();
    }
}
