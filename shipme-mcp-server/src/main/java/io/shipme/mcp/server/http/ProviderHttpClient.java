package io.shipme.mcp.server.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.shipme.core.retry.ApiException;
import java.io.IOException;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * JSON over HTTP for vendor control-plane APIs. A non-2xx answer raises {@link ApiException} carrying the
 * status, so callers can hand the decision to retry to the retry engine. Transport faults surface as
 * {@link IOException} without a status.
 */
public final class ProviderHttpClient {
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public ProviderHttpClient(OkHttpClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonNode send(
        String method,
        String baseUrl,
        String path,
        Map<String, String> headers,
        Object body
    ) throws IOException {
        HttpUrl url = HttpUrl.parse(baseUrl + path);
        if (url == null) {
            throw new IllegalArgumentException("Invalid URL: " + baseUrl + path);
        }

        RequestBody requestBody = requiresBody(method)
            ? RequestBody.create(mapper.writeValueAsString(body == null ? Map.of() : body), JSON)
            : null;

        Request.Builder requestBuilder = new Request.Builder().url(url);
        for (Map.Entry<String, String> header : headers.entrySet()) {
            requestBuilder.addHeader(header.getKey(), header.getValue());
        }
        if (!headers.containsKey("Accept")) {
            requestBuilder.header("Accept", "application/json");
        }

        Request request = requestBuilder.method(method, requestBody).build();

        try (Response response = client.newCall(request).execute()) {
            String raw = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new ApiException(response.code(), errorMessage(raw, response));
            }
            return parseJsonBody(raw);
        }
    }

    private boolean requiresBody(String method) {
        return "POST".equalsIgnoreCase(method)
            || "PUT".equalsIgnoreCase(method)
            || "PATCH".equalsIgnoreCase(method);
    }

    private JsonNode parseJsonBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(raw);
        } catch (IOException e) {
            return mapper.getNodeFactory().objectNode().put("raw", raw);
        }
    }

    private String errorMessage(String raw, Response response) {
        String fallback = "HTTP " + response.code() + " from " + response.request().url().encodedPath();
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            JsonNode json = mapper.readTree(raw);
            for (String field : new String[] {"message", "error", "msg"}) {
                JsonNode value = json.path(field);
                if (value.isTextual() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
            return raw;
        } catch (IOException e) {
            return raw;
        }
    }
}
