package io.shipme.mcp.server.provider;

import io.shipme.core.tool.FieldSpec;
import io.shipme.core.tool.InputSchema;
import io.shipme.core.tool.Tool;
import io.shipme.core.tool.ToolProvider;
import io.shipme.core.vault.SecretVault;
import io.shipme.core.vault.VaultStatus;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exposes the run's vault to the orchestrator. Values go in, only names and references come out.
 */
public final class VaultProvider implements ToolProvider {
    private final SecretVault vault;

    public VaultProvider(SecretVault vault) {
        this.vault = vault;
    }

    @Override
    public String name() {
        return "vault";
    }

    @Override
    public List<Tool> tools() {
        return List.of(
            Tool.of(
                "store_secret",
                "Store a secret in the run vault and get back a {{secrets.<name>}} reference",
                InputSchema.builder()
                    .field(FieldSpec.string("name").description("Secret name (letters, digits, underscores)").required())
                    .field(FieldSpec.string("value").description("Secret value").required())
                    .build(),
                this::storeSecret
            ),
            Tool.of("list_secrets", "List the names of the secrets held by the run vault", InputSchema.empty(), this::listSecrets),
            Tool.of("vault_status", "Report how many secrets the run vault holds and whether it was destroyed", InputSchema.empty(), this::vaultStatus),
            Tool.of("destroy_vault", "Destroy the run vault and its key; stored secrets become unrecoverable", InputSchema.empty(), this::destroyVault)
        );
    }

    private Map<String, Object> storeSecret(Map<String, Object> args) {
        String name = Args.string(args, "name");
        vault.store(name, Args.string(args, "value"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("reference", SecretVault.reference(name));
        return result;
    }

    private Map<String, Object> listSecrets(Map<String, Object> args) {
        return Map.of("secrets", vault.listKeys());
    }

    private Map<String, Object> vaultStatus(Map<String, Object> args) {
        VaultStatus status = vault.status();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("secret_count", status.secretCount());
        result.put("destroyed", status.destroyed());
        return result;
    }

    private Map<String, Object> destroyVault(Map<String, Object> args) {
        vault.destroy();
        return Map.of("message", "Vault destroyed");
    }
}
