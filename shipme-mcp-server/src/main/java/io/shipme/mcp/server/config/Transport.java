package io.shipme.mcp.server.config;

import java.util.Locale;

public enum Transport {
    STDIO,
    HTTP;

    public static Transport parse(String raw, Transport fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Transport.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
