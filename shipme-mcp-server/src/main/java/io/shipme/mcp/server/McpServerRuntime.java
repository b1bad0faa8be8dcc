package io.shipme.mcp.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.shipme.core.tool.ToolDispatcher;
import io.shipme.core.tool.ToolProvider;
import io.shipme.mcp.server.config.McpServerConfig;
import io.shipme.mcp.server.config.ProviderConfig;
import io.shipme.mcp.server.http.ProviderHttpClient;
import io.shipme.mcp.server.provider.GitHubProvider;
import io.shipme.mcp.server.provider.NetlifyProvider;
import io.shipme.mcp.server.provider.ProvisioningContext;
import io.shipme.mcp.server.provider.SupabaseProvider;
import io.shipme.mcp.server.provider.VaultProvider;
import io.shipme.mcp.server.transport.McpProtocol;
import java.util.ArrayList;
import java.util.List;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One provisioning run: the enabled providers, the dispatcher over them and the run's vault. Closing the
 * runtime destroys the vault.
 */
public final class McpServerRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(McpServerRuntime.class);

    private final McpServerConfig config;
    private final ProvisioningContext context;
    private final List<ToolProvider> providers;
    private final ToolDispatcher dispatcher;
    private final McpProtocol protocol;

    public McpServerRuntime(McpServerConfig config, ProviderHttpClient httpClient, ProvisioningContext context) {
        this.config = config;
        this.context = context;
        this.providers = createProviders(config, httpClient, context);
        this.dispatcher = new ToolDispatcher(providers);
        this.protocol = new McpProtocol(dispatcher, httpClient.mapper());
    }

    public static McpServerRuntime create(McpServerConfig config) {
        OkHttpClient client = new OkHttpClient.Builder().callTimeout(config.timeout()).build();
        ProviderHttpClient httpClient = new ProviderHttpClient(client, objectMapper());
        return new McpServerRuntime(config, httpClient, ProvisioningContext.fromConfig(config));
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    public McpServerConfig config() {
        return config;
    }

    public ProvisioningContext context() {
        return context;
    }

    public List<ToolProvider> providers() {
        return providers;
    }

    public ToolDispatcher dispatcher() {
        return dispatcher;
    }

    public McpProtocol protocol() {
        return protocol;
    }

    @Override
    public void close() {
        context.close();
        log.info("Provisioning run closed, vault destroyed");
    }

    private static List<ToolProvider> createProviders(
        McpServerConfig config,
        ProviderHttpClient httpClient,
        ProvisioningContext context
    ) {
        List<ToolProvider> providers = new ArrayList<>();
        for (ProviderConfig providerConfig : config.providers().values()) {
            switch (providerConfig.name()) {
                case "supabase" -> providers.add(new SupabaseProvider(providerConfig, httpClient, context));
                case "github" -> providers.add(new GitHubProvider(providerConfig, httpClient, context));
                case "netlify" -> providers.add(new NetlifyProvider(providerConfig, httpClient, context));
                default -> throw new IllegalArgumentException("Unknown provider: " + providerConfig.name());
            }
            log.info("Provider {} configured={} baseUrl={}", providerConfig.name(), providerConfig.configured(), providerConfig.baseUrl());
        }
        providers.add(new VaultProvider(context.vault()));
        return List.copyOf(providers);
    }
}
