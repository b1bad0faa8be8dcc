package io.shipme.mcp.server.config;

import io.shipme.core.readiness.ReadinessPolicy;
import io.shipme.core.retry.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record McpServerConfig(
    Transport transport,
    int port,
    Duration timeout,
    RetryPolicy retryPolicy,
    ReadinessPolicy readinessPolicy,
    Map<String, ProviderConfig> providers
) {
    public static final List<String> KNOWN_PROVIDERS = List.of("supabase", "github", "netlify");

    public McpServerConfig {
        providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    public static McpServerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads the configuration of the providers listed in {@code SHIPME_PROVIDERS}.
     *
     * @throws MissingCredentialException when an enabled provider has no token
     */
    public static McpServerConfig fromEnv(Map<String, String> env) {
        return build(env, true);
    }

    /**
     * Same as {@link #fromEnv(Map)} but keeps providers without a token instead of failing. Used for status
     * reporting only.
     */
    public static McpServerConfig inspectEnv(Map<String, String> env) {
        return build(env, false);
    }

    public ProviderConfig provider(String name) {
        ProviderConfig config = providers.get(name);
        if (config == null) {
            throw new IllegalArgumentException("Provider not enabled: " + name);
        }
        return config;
    }

    public boolean enabled(String name) {
        return providers.containsKey(name);
    }

    static List<String> enabledProviders(Map<String, String> env) {
        String raw = env.get("SHIPME_PROVIDERS");
        if (raw == null || raw.isBlank()) {
            return KNOWN_PROVIDERS;
        }
        List<String> names = new ArrayList<>();
        for (String part : raw.split(",")) {
            String name = part.trim().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            if (!KNOWN_PROVIDERS.contains(name)) {
                throw new IllegalArgumentException("Unknown provider '" + name + "', expected one of " + KNOWN_PROVIDERS);
            }
            if (!names.contains(name)) {
                names.add(name);
            }
        }
        return names;
    }

    private static McpServerConfig build(Map<String, String> env, boolean requireTokens) {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        for (String name : enabledProviders(env)) {
            ProviderConfig config = provider(name, env);
            if (requireTokens && !config.configured()) {
                throw missingCredential(name);
            }
            providers.put(name, config);
        }
        return new McpServerConfig(
            Transport.parse(env.get("SHIPME_TRANSPORT"), Transport.STDIO),
            intEnv(env, "SHIPME_MCP_PORT", 8791),
            Duration.ofSeconds(intEnv(env, "SHIPME_HTTP_TIMEOUT_SECONDS", 25)),
            new RetryPolicy(
                Math.min(intEnv(env, "SHIPME_RETRY_MAX", RetryPolicy.DEFAULT_MAX_RETRIES), RetryPolicy.MAX_RETRIES_LIMIT),
                Duration.ofMillis(intEnv(env, "SHIPME_RETRY_INITIAL_DELAY_MS", 1000)),
                RetryPolicy.DEFAULT_RETRYABLE_STATUSES,
                "API call"
            ),
            new ReadinessPolicy(
                Duration.ofSeconds(Math.max(1, intEnv(env, "SHIPME_POLL_INTERVAL_SECONDS", 5))),
                Duration.ofSeconds(intEnv(env, "SHIPME_POLL_MAX_WAIT_SECONDS", 120)),
                "resource"
            ),
            providers
        );
    }

    private static MissingCredentialException missingCredential(String name) {
        return switch (name) {
            case "supabase" -> new MissingCredentialException(
                name,
                "SUPABASE_ACCESS_TOKEN",
                "Get your access token from: https://supabase.com/dashboard/account/tokens"
            );
            case "github" -> new MissingCredentialException(name, "GITHUB_TOKEN", "");
            default -> new MissingCredentialException(
                name,
                "NETLIFY_AUTH_TOKEN",
                "Get your access token from: https://app.netlify.com/user/applications"
            );
        };
    }

    private static ProviderConfig provider(String name, Map<String, String> env) {
        return switch (name) {
            case "supabase" -> new ProviderConfig(
                name,
                env(env, "SUPABASE_API_URL", "https://api.supabase.com/v1"),
                env(env, "SUPABASE_ACCESS_TOKEN", ""),
                env(env, "SUPABASE_ORG_ID", "")
            );
            case "github" -> new ProviderConfig(
                name,
                env(env, "GITHUB_API_URL", "https://api.github.com"),
                env(env, "GITHUB_TOKEN", "")
            );
            case "netlify" -> new ProviderConfig(
                name,
                env(env, "NETLIFY_API_URL", "https://api.netlify.com/api/v1"),
                env(env, "NETLIFY_AUTH_TOKEN", env(env, "NETLIFY_ACCESS_TOKEN", ""))
            );
            default -> throw new IllegalArgumentException("Unknown provider: " + name);
        };
    }

    private static String env(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private static int intEnv(Map<String, String> env, String key, int fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed < 0 ? fallback : parsed;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
