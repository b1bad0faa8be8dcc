package io.shipme.core.vault;

public final class VaultDestroyedException extends IllegalStateException {
    public VaultDestroyedException() {
        super("Vault has been destroyed");
    }
}
