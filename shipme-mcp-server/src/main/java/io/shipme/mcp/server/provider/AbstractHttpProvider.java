package io.shipme.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipme.core.retry.RetryPolicy;
import io.shipme.core.tool.Tool;
import io.shipme.core.tool.ToolProvider;
import io.shipme.mcp.server.config.ProviderConfig;
import io.shipme.mcp.server.http.ProviderHttpClient;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for providers that talk to one vendor control plane with a bearer token.
 */
public abstract class AbstractHttpProvider implements ToolProvider {
    private final ProviderConfig config;
    private final ProviderHttpClient httpClient;
    private final ProvisioningContext context;

    protected AbstractHttpProvider(ProviderConfig config, ProviderHttpClient httpClient, ProvisioningContext context) {
        this.config = config;
        this.httpClient = httpClient;
        this.context = context;
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public abstract List<Tool> tools();

    protected ProviderConfig config() {
        return config;
    }

    protected ProvisioningContext context() {
        return context;
    }

    protected Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>(config.authorizationHeaders());
        headers.put("Content-Type", "application/json");
        return headers;
    }

    protected JsonNode call(String method, String path, Object body) throws IOException {
        return httpClient.send(method, config.baseUrl(), path, headers(), body);
    }

    protected JsonNode callWithRetry(String label, String method, String path, Object body) throws Exception {
        RetryPolicy policy = context.retryPolicy(label);
        return context.retryEngine().withRetry(() -> call(method, path, body), policy);
    }

    protected Object toPlain(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return httpClient.mapper().convertValue(node, Object.class);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
