package io.shipme.core.tool;

import java.util.Map;

@FunctionalInterface
public interface ToolHandler {
    /**
     * Runs the operation with already validated arguments. A {@link Map} result is spread into the
     * success envelope; any other value is reported under {@code result}.
     */
    Object handle(Map<String, Object> arguments) throws Exception;
}
