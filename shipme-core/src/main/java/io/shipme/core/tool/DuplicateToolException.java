package io.shipme.core.tool;

public final class DuplicateToolException extends IllegalStateException {
    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
    }
}
