package io.shipme.core.vault;

public final class SecretNotFoundException extends IllegalArgumentException {
    private final String secretName;

    public SecretNotFoundException(String secretName) {
        super("Secret '" + secretName + "' not found in vault");
        this.secretName = secretName;
    }

    public String secretName() {
        return secretName;
    }
}
