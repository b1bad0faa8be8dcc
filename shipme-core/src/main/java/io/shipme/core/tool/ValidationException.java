package io.shipme.core.tool;

import java.util.List;

public final class ValidationException extends IllegalArgumentException {
    public static final int STATUS = 400;

    private final List<String> violations;

    public ValidationException(String violation) {
        this(List.of(violation));
    }

    public ValidationException(List<String> violations) {
        super("Invalid arguments: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    public int status() {
        return STATUS;
    }
}
