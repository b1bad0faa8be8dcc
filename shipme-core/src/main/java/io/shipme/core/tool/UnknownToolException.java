package io.shipme.core.tool;

public final class UnknownToolException extends IllegalArgumentException {
    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
    }
}
