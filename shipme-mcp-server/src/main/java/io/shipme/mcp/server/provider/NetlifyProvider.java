package io.shipme.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipme.core.readiness.ReadinessResult;
import io.shipme.core.retry.StatusCodes;
import io.shipme.core.tool.FieldSpec;
import io.shipme.core.tool.FieldType;
import io.shipme.core.tool.InputSchema;
import io.shipme.core.tool.Tool;
import io.shipme.core.tool.ValidationException;
import io.shipme.mcp.server.config.ProviderConfig;
import io.shipme.mcp.server.http.ProviderHttpClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NetlifyProvider extends AbstractHttpProvider {
    private static final Logger LOG = LoggerFactory.getLogger(NetlifyProvider.class);

    public NetlifyProvider(ProviderConfig config, ProviderHttpClient httpClient, ProvisioningContext context) {
        super(config, httpClient, context);
    }

    @Override
    public List<Tool> tools() {
        return List.of(
            Tool.of(
                "create_site",
                "Create a new Netlify site",
                InputSchema.builder()
                    .field(FieldSpec.string("name").description("Site name (will be used in URL: name.netlify.app)").required())
                    .field(FieldSpec.string("repo").description("GitHub repository (format: owner/repo)"))
                    .build(),
                this::createSite
            ),
            Tool.of(
                "configure_env_vars",
                "Configure environment variables for a Netlify site",
                InputSchema.builder()
                    .field(FieldSpec.string("site_id").description("Netlify site ID").required())
                    .field(FieldSpec.object("env_vars")
                        .description("Environment variables as key-value pairs; values may be {{secrets.<name>}} references")
                        .valuesOfType(FieldType.STRING)
                        .required())
                    .build(),
                this::configureEnvVars
            ),
            Tool.of(
                "deploy_site",
                "Trigger a deployment for a Netlify site",
                InputSchema.builder()
                    .field(FieldSpec.string("site_id").description("Netlify site ID").required())
                    .field(FieldSpec.string("branch").description("Git branch to deploy").defaultValue("main"))
                    .field(FieldSpec.bool("wait_for_ready").description("Wait until the deploy is live").defaultValue(false))
                    .build(),
                this::deploySite
            ),
            Tool.of(
                "get_site_info",
                "Get information about a Netlify site",
                InputSchema.of(FieldSpec.string("site_id").description("Netlify site ID").required().build()),
                this::getSiteInfo
            )
        );
    }

    static String siteSlug(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
    }

    private Map<String, Object> createSite(Map<String, Object> args) throws Exception {
        String name = Args.string(args, "name");
        String repo = Args.optionalString(args, "repo");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", siteSlug(name));
        if (repo != null) {
            String[] parts = repo.split("/", -1);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new ValidationException("Repository must be in format \"owner/repo\"");
            }
            Map<String, Object> repoSettings = new LinkedHashMap<>();
            repoSettings.put("provider", "github");
            repoSettings.put("repo", repo);
            repoSettings.put("private", false);
            repoSettings.put("branch", "main");
            repoSettings.put("cmd", "npm run build");
            repoSettings.put("dir", ".next");
            body.put("repo", repoSettings);
        }

        JsonNode site = callWithRetry("Netlify site creation", "POST", "/sites", body);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("site_id", text(site, "id"));
        result.put("site_name", text(site, "name"));
        result.put("url", siteUrl(site));
        result.put("admin_url", text(site, "admin_url"));
        result.put("deploy_url", text(site, "deploy_url"));
        return result;
    }

    private Map<String, Object> configureEnvVars(Map<String, Object> args) {
        String siteId = Args.string(args, "site_id");
        Map<String, String> envVars = Args.strings(args, "env_vars");

        int setCount = 0;
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, String> variable : envVars.entrySet()) {
            String key = variable.getKey();
            try {
                String value = context().vault().resolve(variable.getValue());
                if (setVariable(siteId, key, value)) {
                    setCount++;
                } else {
                    errors.add("Failed to set " + key);
                }
            } catch (Exception e) {
                LOG.warn("Error setting environment variable {} on site {}: {}", key, siteId, e.getClass().getSimpleName());
                errors.add("Error setting " + key + ": " + e.getClass().getSimpleName());
            }
        }

        if (!errors.isEmpty() && setCount == 0) {
            throw new IllegalStateException("Failed to set environment variables: " + String.join(", ", errors));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("vars_set", setCount);
        result.put(
            "message",
            "Set " + setCount + " environment variable(s)" + (errors.isEmpty() ? "" : " (" + errors.size() + " failed)")
        );
        return result;
    }

    private Map<String, Object> deploySite(Map<String, Object> args) throws Exception {
        String siteId = Args.string(args, "site_id");
        String branch = Args.string(args, "branch");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("clear_cache", false);
        body.put("branch", branch);
        JsonNode build = callWithRetry("Netlify deploy trigger", "POST", "/sites/" + siteId + "/builds", body);
        String deployId = text(build, "deploy_id");
        String state = text(build, "state");
        String deployUrl = text(build, "deploy_url");

        if (Args.bool(args, "wait_for_ready")) {
            if (deployId == null) {
                throw new IllegalStateException(
                    "Build " + text(build, "id") + " was triggered but Netlify returned no deploy_id; cannot wait for readiness"
                );
            }
            ReadinessResult<JsonNode> ready = context().poller().waitUntilReady(
                () -> callWithRetry("Netlify deploy status", "GET", "/deploys/" + deployId, null),
                deploy -> "ready".equals(text(deploy, "state")),
                deploy -> "error".equals(text(deploy, "state")),
                context().readinessPolicy("Netlify deploy " + deployId)
            );
            state = text(ready.status(), "state");
            String liveUrl = text(ready.status(), "deploy_ssl_url");
            if (liveUrl != null) {
                deployUrl = liveUrl;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("deploy_id", deployId);
        result.put("build_id", text(build, "id"));
        result.put("deploy_url", deployUrl);
        result.put("state", state);
        result.put("message", "Deployment triggered successfully. State: " + state);
        return result;
    }

    private Map<String, Object> getSiteInfo(Map<String, Object> args) throws Exception {
        String siteId = Args.string(args, "site_id");
        JsonNode site = call("GET", "/sites/" + siteId, null);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("site_id", text(site, "id"));
        result.put("site_name", text(site, "name"));
        result.put("url", siteUrl(site));
        result.put("admin_url", text(site, "admin_url"));
        result.put("state", text(site, "state"));
        result.put("created_at", text(site, "created_at"));
        result.put("updated_at", text(site, "updated_at"));
        result.put("build_settings", toPlain(site.path("build_settings")));
        return result;
    }

    private boolean setVariable(String siteId, String key, String value) throws Exception {
        Map<String, Object> accountBody = new LinkedHashMap<>();
        accountBody.put("context", "production");
        accountBody.put("scope", "builds");
        accountBody.put("values", List.of(Map.of("value", value, "context", "all")));
        try {
            call("POST", "/accounts/-/env/" + key, accountBody);
            return true;
        } catch (Exception e) {
            OptionalInt status = StatusCodes.of(e);
            if (status.isEmpty()) {
                throw e;
            }
            LOG.debug("Account env endpoint rejected {} with status {}, trying site endpoint", key, status.getAsInt());
        }

        try {
            call("PATCH", "/sites/" + siteId + "/env", Map.of(key, value));
            return true;
        } catch (Exception e) {
            if (StatusCodes.of(e).isEmpty()) {
                throw e;
            }
            LOG.warn("Site env endpoint rejected {} on site {} with status {}", key, siteId, StatusCodes.of(e).getAsInt());
            return false;
        }
    }

    private static String siteUrl(JsonNode site) {
        String url = text(site, "url");
        return url == null || url.isBlank() ? "https://" + text(site, "name") + ".netlify.app" : url;
    }
}
