package io.shipme.core.tool;

import java.util.LinkedHashMap;
import java.util.Map;

public record ToolCallResult(
    boolean success,
    Object data,
    String error
) {
    public static ToolCallResult success(Object data) {
        return new ToolCallResult(true, data, null);
    }

    public static ToolCallResult failure(String message) {
        return new ToolCallResult(false, null, message == null || message.isBlank() ? "Unknown error" : message);
    }

    public Map<String, Object> toEnvelope() {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("success", success);
        if (!success) {
            envelope.put("error", error);
            return envelope;
        }
        if (data instanceof Map<?, ?> fields) {
            for (Map.Entry<?, ?> entry : fields.entrySet()) {
                String key = String.valueOf(entry.getKey());
                if (!"success".equals(key)) {
                    envelope.put(key, entry.getValue());
                }
            }
        } else if (data != null) {
            envelope.put("result", data);
        }
        return envelope;
    }
}
