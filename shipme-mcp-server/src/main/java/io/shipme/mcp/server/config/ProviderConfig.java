package io.shipme.mcp.server.config;

import io.shipme.core.vault.SecretValues;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderConfig(
    String name,
    String baseUrl,
    String token,
    String organizationId
) {
    public ProviderConfig {
        baseUrl = trimTrailingSlash(baseUrl);
        organizationId = organizationId == null || organizationId.isBlank() ? null : organizationId.trim();
    }

    public ProviderConfig(String name, String baseUrl, String token) {
        this(name, baseUrl, token, null);
    }

    public boolean configured() {
        return token != null && !token.isBlank();
    }

    public Map<String, String> authorizationHeaders() {
        if (!configured()) {
            return Map.of();
        }
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + token);
        return headers;
    }

    @Override
    public String toString() {
        return "ProviderConfig[name=" + name
            + ", baseUrl=" + baseUrl
            + ", token=" + SecretValues.mask(token == null ? "" : token, 0)
            + ", organizationId=" + organizationId + "]";
    }

    private static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
