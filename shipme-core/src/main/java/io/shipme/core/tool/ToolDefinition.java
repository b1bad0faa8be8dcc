package io.shipme.core.tool;

import java.util.LinkedHashMap;
import java.util.Map;

public record ToolDefinition(
    String name,
    String description,
    InputSchema inputSchema
) {
    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? InputSchema.empty() : inputSchema;
    }

    public Map<String, Object> toDescriptor() {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("name", name);
        descriptor.put("description", description);
        descriptor.put("inputSchema", inputSchema.toJsonSchema());
        return descriptor;
    }
}
