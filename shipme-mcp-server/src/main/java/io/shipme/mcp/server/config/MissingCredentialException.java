package io.shipme.mcp.server.config;

public final class MissingCredentialException extends IllegalStateException {
    private final String variable;

    public MissingCredentialException(String provider, String variable, String hint) {
        super(
            variable + " environment variable is required for provider " + provider
                + (hint == null || hint.isBlank() ? "" : ". " + hint)
        );
        this.variable = variable;
    }

    public String variable() {
        return variable;
    }
}
