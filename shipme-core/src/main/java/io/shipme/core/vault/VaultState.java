package io.shipme.core.vault;

public enum VaultState {
    ACTIVE,
    DESTROYED
}
