package io.shipme.core.tool;

public record Tool(ToolDefinition definition, ToolHandler handler) {
    public Tool {
        if (definition == null || handler == null) {
            throw new IllegalArgumentException("Tool needs both a definition and a handler");
        }
    }

    public static Tool of(String name, String description, InputSchema schema, ToolHandler handler) {
        return new Tool(new ToolDefinition(name, description, schema), handler);
    }

    public String name() {
        return definition.name();
    }
}
