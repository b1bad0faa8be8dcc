package io.shipme.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipme.core.readiness.ReadinessResult;
import io.shipme.core.tool.FieldSpec;
import io.shipme.core.tool.InputSchema;
import io.shipme.core.tool.Tool;
import io.shipme.core.tool.ValidationException;
import io.shipme.core.vault.SecretValues;
import io.shipme.core.vault.SecretVault;
import io.shipme.mcp.server.config.ProviderConfig;
import io.shipme.mcp.server.http.ProviderHttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SupabaseProvider extends AbstractHttpProvider {
    private static final Logger LOG = LoggerFactory.getLogger(SupabaseProvider.class);
    private static final String READY_STATUS = "ACTIVE_HEALTHY";
    private static final Set<String> FAILED_STATUSES = Set.of("INIT_FAILED", "REMOVED", "INACTIVE");
    private static final int MIN_PASSWORD_LENGTH = 12;

    public SupabaseProvider(ProviderConfig config, ProviderHttpClient httpClient, ProvisioningContext context) {
        super(config, httpClient, context);
    }

    @Override
    public List<Tool> tools() {
        return List.of(
            Tool.of(
                "create_project",
                "Create a new Supabase project with database and API keys",
                InputSchema.builder()
                    .field(FieldSpec.string("name").description("Project name (will be slugified for the project reference)").required())
                    .field(FieldSpec.string("db_password").description(
                        "Database password (min 12 characters). May be a {{secrets.<name>}} reference; generated when omitted"
                    ))
                    .field(FieldSpec.string("region").description("AWS region (e.g., us-east-1, eu-west-1, ap-southeast-1)").defaultValue("us-east-1"))
                    .field(FieldSpec.string("plan").description("Pricing plan").oneOf("free", "pro").defaultValue("free"))
                    .build(),
                this::createProject
            ),
            Tool.of(
                "execute_sql",
                "Execute SQL statements on a Supabase project (migrations, schema changes)",
                InputSchema.builder()
                    .field(FieldSpec.string("project_ref").description("Supabase project reference ID").required())
                    .field(FieldSpec.string("sql").description("SQL statement(s) to execute, separated by semicolons").required())
                    .build(),
                this::executeSql
            ),
            Tool.of(
                "configure_auth_provider",
                "Configure an OAuth authentication provider (Google, GitHub, etc.)",
                InputSchema.builder()
                    .field(FieldSpec.string("project_ref").description("Supabase project reference ID").required())
                    .field(FieldSpec.string("provider").description("OAuth provider to configure")
                        .oneOf("google", "github", "gitlab", "bitbucket", "azure").required())
                    .field(FieldSpec.string("client_id").description("OAuth application client ID").required())
                    .field(FieldSpec.string("client_secret").description("OAuth application client secret or a {{secrets.<name>}} reference").required())
                    .field(FieldSpec.string("redirect_uri").description("Optional redirect URI (defaults to Supabase auth callback)"))
                    .build(),
                this::configureAuthProvider
            ),
            Tool.of(
                "get_project_info",
                "Get information about a Supabase project (status, URL, region)",
                InputSchema.of(FieldSpec.string("project_ref").description("Supabase project reference ID").required().build()),
                this::getProjectInfo
            )
        );
    }

    private Map<String, Object> createProject(Map<String, Object> args) throws Exception {
        SecretVault vault = context().vault();
        String name = Args.string(args, "name");
        String region = Args.string(args, "region");
        String plan = Args.string(args, "plan");
        String requested = Args.optionalString(args, "db_password");
        String dbPassword = requested == null ? SecretValues.generatePassword(32) : vault.resolve(requested);

        if (dbPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("Database password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }

        String organizationId = resolveOrganization();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("organization_id", organizationId);
        body.put("region", region);
        body.put("db_pass", dbPassword);
        body.put("plan", plan);
        JsonNode project = callWithRetry("Supabase project creation", "POST", "/projects", body);
        String projectId = text(project, "id");
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalStateException("Supabase did not return a project id for " + name);
        }

        LOG.info("Waiting for project {} to initialize...", projectId);
        ReadinessResult<String> ready = context().poller().waitUntilReady(
            () -> projectStatus(projectId),
            READY_STATUS::equals,
            FAILED_STATUSES::contains,
            context().readinessPolicy("Supabase project " + projectId)
        );

        String anonKey = "";
        String serviceRoleKey = "";
        try {
            JsonNode keys = callWithRetry("Supabase API keys fetch", "GET", "/projects/" + projectId + "/api-keys", null);
            for (JsonNode key : keys) {
                if ("anon".equals(text(key, "name"))) {
                    anonKey = text(key, "api_key");
                } else if ("service_role".equals(text(key, "name"))) {
                    serviceRoleKey = text(key, "api_key");
                }
            }
        } catch (Exception e) {
            LOG.warn("Failed to fetch API keys for project {}: {}", projectId, e.getMessage());
        }

        String prefix = secretPrefix(projectId);
        vault.store(prefix + "_db_password", dbPassword);
        vault.store(
            prefix + "_db_connection_string",
            "postgresql://postgres:" + dbPassword + "@db." + projectId + ".supabase.co:5432/postgres"
        );
        String serviceRoleReference = "";
        if (serviceRoleKey != null && !serviceRoleKey.isBlank()) {
            vault.store(prefix + "_service_role_key", serviceRoleKey);
            serviceRoleReference = SecretVault.reference(prefix + "_service_role_key");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("project_id", projectId);
        result.put("project_ref", projectId);
        result.put("status", ready.status());
        result.put("url", "https://" + projectId + ".supabase.co");
        result.put("api_url", "https://" + projectId + ".supabase.co");
        result.put("anon_key", anonKey == null ? "" : anonKey);
        result.put("service_role_key", serviceRoleReference);
        result.put("db_password", SecretVault.reference(prefix + "_db_password"));
        result.put("db_connection_string", SecretVault.reference(prefix + "_db_connection_string"));
        result.put("dashboard_url", "https://supabase.com/dashboard/project/" + projectId);
        return result;
    }

    private Map<String, Object> executeSql(Map<String, Object> args) throws Exception {
        String projectRef = Args.string(args, "project_ref");
        String sql = context().vault().resolve(Args.string(args, "sql"));

        JsonNode data = call("POST", "/projects/" + projectRef + "/database/query", Map.of("query", sql));

        Map<String, Object> result = new LinkedHashMap<>();
        if (data.isArray()) {
            result.put("rows_affected", data.size());
            result.put("rows", toPlain(data));
        } else {
            result.put("rows_affected", data.path("rows_affected").asInt(0));
        }
        return result;
    }

    private Map<String, Object> configureAuthProvider(Map<String, Object> args) throws Exception {
        String projectRef = Args.string(args, "project_ref");
        String provider = Args.string(args, "provider");
        String redirectUri = Args.optionalString(args, "redirect_uri");

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("enabled", true);
        settings.put("client_id", Args.string(args, "client_id"));
        settings.put("secret", context().vault().resolve(Args.string(args, "client_secret")));
        if (redirectUri != null) {
            settings.put("redirect_uri", redirectUri);
        }

        call("PATCH", "/projects/" + projectRef + "/config/auth", Map.of(provider, settings));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("provider", provider);
        result.put("message", provider + " OAuth provider configured successfully");
        return result;
    }

    private Map<String, Object> getProjectInfo(Map<String, Object> args) throws Exception {
        String projectRef = Args.string(args, "project_ref");
        JsonNode project = callWithRetry("Supabase project info", "GET", "/projects/" + projectRef, null);
        String id = text(project, "id");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("project_id", id);
        result.put("project_ref", id);
        result.put("name", text(project, "name"));
        result.put("url", "https://" + id + ".supabase.co");
        result.put("api_url", "https://" + id + ".supabase.co");
        result.put("region", text(project, "region"));
        result.put("status", text(project, "status"));
        result.put("created_at", text(project, "created_at"));
        return result;
    }

    private String resolveOrganization() throws Exception {
        if (config().organizationId() != null) {
            return config().organizationId();
        }
        JsonNode organizations = callWithRetry("Supabase org fetch", "GET", "/organizations", null);
        if (!organizations.isArray() || organizations.isEmpty()) {
            throw new IllegalStateException("No organizations found. Create one at https://supabase.com/dashboard");
        }
        JsonNode first = organizations.get(0);
        LOG.info("Using organization: {} ({})", text(first, "name"), text(first, "id"));
        return text(first, "id");
    }

    private String projectStatus(String projectId) throws Exception {
        JsonNode project = callWithRetry("Supabase project status", "GET", "/projects/" + projectId, null);
        return text(project, "status");
    }

    private static String secretPrefix(String projectId) {
        return projectId.replaceAll("\\W", "_");
    }
}
