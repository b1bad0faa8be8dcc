package io.shipme.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative argument shape of a tool. Checked once by the {@link ToolDispatcher} before the handler runs.
 */
public final class InputSchema {
    private static final InputSchema EMPTY = new InputSchema(List.of());

    private final Map<String, FieldSpec> fields;

    private InputSchema(List<FieldSpec> fields) {
        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Duplicate field in schema: " + field.name());
            }
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public static InputSchema empty() {
        return EMPTY;
    }

    public static InputSchema of(FieldSpec... fields) {
        return new InputSchema(List.of(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<FieldSpec> fields() {
        return List.copyOf(fields.values());
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (FieldSpec field : fields.values()) {
            properties.put(field.name(), field.toJsonSchema());
            if (field.required()) {
                required.add(field.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }

    /**
     * Validates {@code arguments} and returns a copy with declared defaults filled in.
     *
     * @throws ValidationException listing every violation found
     */
    public Map<String, Object> validate(Map<String, Object> arguments) {
        Map<String, Object> input = arguments == null ? Map.of() : arguments;
        List<String> violations = new ArrayList<>();
        collectViolations("", input, violations);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        Map<String, Object> normalized = new LinkedHashMap<>(input);
        for (FieldSpec field : fields.values()) {
            if (field.defaultValue() != null && normalized.get(field.name()) == null) {
                normalized.put(field.name(), field.defaultValue());
            }
        }
        return normalized;
    }

    void collectViolations(String prefix, Map<?, ?> input, List<String> violations) {
        for (FieldSpec field : fields.values()) {
            Object value = input.get(field.name());
            String path = prefix + field.name();
            if (value == null) {
                if (field.required()) {
                    violations.add("Missing required field '" + path + "'");
                }
                continue;
            }
            field.validate(path, value, violations);
        }
    }

    public static final class Builder {
        private final List<FieldSpec> fields = new ArrayList<>();

        public Builder field(FieldSpec field) {
            fields.add(field);
            return this;
        }

        public Builder field(FieldSpec.Builder field) {
            return field(field.build());
        }

        public InputSchema build() {
            return fields.isEmpty() ? EMPTY : new InputSchema(fields);
        }
    }
}
