package io.shipme.core.vault;

public record VaultStatus(int secretCount, boolean destroyed) {
}
