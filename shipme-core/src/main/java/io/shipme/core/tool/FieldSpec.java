package io.shipme.core.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One named field of an {@link InputSchema}.
 *
 * <p>{@code items} describes array elements, {@code properties} the known keys of an object and
 * {@code valueType} the type every value of a free-form object must have.
 */
public record FieldSpec(
    String name,
    FieldType type,
    String description,
    boolean required,
    Object defaultValue,
    List<String> allowedValues,
    FieldSpec items,
    InputSchema properties,
    FieldType valueType
) {
    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Field " + name + " has no type");
        }
        description = description == null ? "" : description;
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("Required field " + name + " cannot declare a default");
        }
    }

    public static Builder string(String name) {
        return new Builder(name, FieldType.STRING);
    }

    public static Builder bool(String name) {
        return new Builder(name, FieldType.BOOLEAN);
    }

    public static Builder number(String name) {
        return new Builder(name, FieldType.NUMBER);
    }

    public static Builder integer(String name) {
        return new Builder(name, FieldType.INTEGER);
    }

    public static Builder array(String name, FieldSpec items) {
        return new Builder(name, FieldType.ARRAY).items(items);
    }

    public static Builder object(String name) {
        return new Builder(name, FieldType.OBJECT);
    }

    public Map<String, Object> toJsonSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type.jsonType());
        if (!description.isBlank()) {
            schema.put("description", description);
        }
        if (!allowedValues.isEmpty()) {
            schema.put("enum", allowedValues);
        }
        if (defaultValue != null) {
            schema.put("default", defaultValue);
        }
        if (items != null) {
            schema.put("items", items.toJsonSchema());
        }
        if (properties != null) {
            Map<String, Object> nested = properties.toJsonSchema();
            schema.put("properties", nested.get("properties"));
            if (nested.containsKey("required")) {
                schema.put("required", nested.get("required"));
            }
        }
        if (valueType != null) {
            schema.put("additionalProperties", Map.of("type", valueType.jsonType()));
        }
        return schema;
    }

    void validate(String path, Object value, List<String> violations) {
        if (!type.accepts(value)) {
            violations.add("Field '" + path + "' must be of type " + type.jsonType());
            return;
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(String.valueOf(value))) {
            violations.add("Field '" + path + "' must be one of " + allowedValues);
            return;
        }
        if (type == FieldType.ARRAY && items != null) {
            List<?> elements = (List<?>) value;
            for (int i = 0; i < elements.size(); i++) {
                Object element = elements.get(i);
                String elementPath = path + "[" + i + "]";
                if (element == null) {
                    violations.add("Field '" + elementPath + "' must not be null");
                } else {
                    items.validate(elementPath, element, violations);
                }
            }
        }
        if (type == FieldType.OBJECT) {
            Map<?, ?> map = (Map<?, ?>) value;
            if (properties != null) {
                properties.collectViolations(path + ".", map, violations);
            }
            if (valueType != null) {
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    if (!valueType.accepts(entry.getValue())) {
                        violations.add("Field '" + path + "." + entry.getKey() + "' must be of type " + valueType.jsonType());
                    }
                }
            }
        }
    }

    public static final class Builder {
        private final String name;
        private final FieldType type;
        private String description = "";
        private boolean required;
        private Object defaultValue;
        private final List<String> allowedValues = new ArrayList<>();
        private FieldSpec items;
        private InputSchema properties;
        private FieldType valueType;

        private Builder(String name, FieldType type) {
            this.name = name;
            this.type = type;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder oneOf(String... values) {
            this.allowedValues.addAll(List.of(values));
            return this;
        }

        public Builder items(FieldSpec items) {
            this.items = items;
            return this;
        }

        public Builder properties(InputSchema properties) {
            this.properties = properties;
            return this;
        }

        public Builder valuesOfType(FieldType valueType) {
            this.valueType = valueType;
            return this;
        }

        public FieldSpec build() {
            return new FieldSpec(name, type, description, required, defaultValue, allowedValues, items, properties, valueType);
        }
    }
}
