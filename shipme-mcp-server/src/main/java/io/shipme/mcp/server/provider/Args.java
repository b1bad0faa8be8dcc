package io.shipme.mcp.server.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Args {
    private Args() {
    }

    static String string(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value == null ? "" : String.valueOf(value);
    }

    static String optionalString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return null;
        }
        return String.valueOf(value);
    }

    static boolean bool(Map<String, Object> args, String key) {
        return Boolean.TRUE.equals(args.get(key));
    }

    static List<Map<String, Object>> objects(Map<String, Object> args, String key) {
        if (!(args.get(key) instanceof List<?> raw)) {
            return List.of();
        }
        return raw.stream().map(Args::toObjectMap).toList();
    }

    static Map<String, String> strings(Map<String, Object> args, String key) {
        if (!(args.get(key) instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), String.valueOf(v)));
        return out;
    }

    private static Map<String, Object> toObjectMap(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
