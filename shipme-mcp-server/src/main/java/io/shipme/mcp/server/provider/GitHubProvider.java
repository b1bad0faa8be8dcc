package io.shipme.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipme.core.tool.FieldSpec;
import io.shipme.core.tool.InputSchema;
import io.shipme.core.tool.Tool;
import io.shipme.core.vault.SecretVault;
import io.shipme.mcp.server.config.ProviderConfig;
import io.shipme.mcp.server.http.ProviderHttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GitHubProvider extends AbstractHttpProvider {
    private static final Logger LOG = LoggerFactory.getLogger(GitHubProvider.class);
    private static final String DEFAULT_COMMIT_MESSAGE = "Update from ShipMe";

    public GitHubProvider(ProviderConfig config, ProviderHttpClient httpClient, ProvisioningContext context) {
        super(config, httpClient, context);
    }

    @Override
    public List<Tool> tools() {
        FieldSpec file = FieldSpec.object("file")
            .properties(InputSchema.of(
                FieldSpec.string("path").description("File path in repository").required().build(),
                FieldSpec.string("content").description("File content").required().build()
            ))
            .build();
        return List.of(
            Tool.of(
                "create_repository",
                "Create a new GitHub repository",
                InputSchema.builder()
                    .field(FieldSpec.string("name").description("Repository name").required())
                    .field(FieldSpec.string("description").description("Repository description").required())
                    .field(FieldSpec.bool("private").description("Make repository private").defaultValue(false))
                    .field(FieldSpec.string("template_owner").description("Template repository owner (optional)"))
                    .field(FieldSpec.string("template_repo").description("Template repository name (optional)"))
                    .build(),
                this::createRepository
            ),
            Tool.of(
                "push_files",
                "Push files to a GitHub repository",
                InputSchema.builder()
                    .field(FieldSpec.string("owner").description("Repository owner").required())
                    .field(FieldSpec.string("repo").description("Repository name").required())
                    .field(FieldSpec.array("files", file).description("Files to push").required())
                    .field(FieldSpec.string("message").description("Commit message").defaultValue(DEFAULT_COMMIT_MESSAGE))
                    .field(FieldSpec.string("branch").description("Branch to commit to").defaultValue("main"))
                    .build(),
                this::pushFiles
            )
        );
    }

    @Override
    protected Map<String, String> headers() {
        Map<String, String> headers = super.headers();
        headers.put("Accept", "application/vnd.github+json");
        headers.put("X-GitHub-Api-Version", "2022-11-28");
        return headers;
    }

    private Map<String, Object> createRepository(Map<String, Object> args) throws Exception {
        String name = Args.string(args, "name");
        String description = Args.string(args, "description");
        boolean isPrivate = Args.bool(args, "private");
        String templateOwner = Args.optionalString(args, "template_owner");
        String templateRepo = Args.optionalString(args, "template_repo");

        JsonNode user = callWithRetry("GitHub user fetch", "GET", "/user", null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("description", description);
        body.put("private", isPrivate);
        JsonNode repo;
        if (templateOwner != null && templateRepo != null) {
            body.put("include_all_branches", false);
            LOG.info("Creating repository {} from template {}/{}", name, templateOwner, templateRepo);
            repo = call("POST", "/repos/" + templateOwner + "/" + templateRepo + "/generate", body);
        } else {
            body.put("auto_init", true);
            body.put("gitignore_template", "Node");
            LOG.info("Creating repository {}", name);
            repo = call("POST", "/user/repos", body);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("repo_url", text(repo, "html_url"));
        result.put("clone_url", text(repo, "clone_url"));
        result.put("ssh_url", text(repo, "ssh_url"));
        result.put("owner", text(user, "login"));
        result.put("repo_name", name);
        return result;
    }

    private Map<String, Object> pushFiles(Map<String, Object> args) throws Exception {
        SecretVault vault = context().vault();
        String owner = Args.string(args, "owner");
        String repo = Args.string(args, "repo");
        String message = Args.string(args, "message");
        String branch = Args.string(args, "branch");
        List<Map<String, Object>> files = Args.objects(args, "files");
        String base = "/repos/" + owner + "/" + repo + "/git";

        JsonNode ref = callWithRetry("GitHub ref fetch", "GET", base + "/ref/heads/" + branch, null);
        String parentSha = ref.path("object").path("sha").asText();
        JsonNode parent = callWithRetry("GitHub commit fetch", "GET", base + "/commits/" + parentSha, null);
        String baseTreeSha = parent.path("tree").path("sha").asText();

        List<Map<String, Object>> entries = new ArrayList<>();
        for (Map<String, Object> file : files) {
            String content = vault.resolve(Args.string(file, "content"));
            Map<String, Object> blobRequest = new LinkedHashMap<>();
            blobRequest.put("content", Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8)));
            blobRequest.put("encoding", "base64");
            JsonNode blob = callWithRetry("GitHub blob creation", "POST", base + "/blobs", blobRequest);

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", Args.string(file, "path"));
            entry.put("mode", "100644");
            entry.put("type", "blob");
            entry.put("sha", text(blob, "sha"));
            entries.add(entry);
        }

        Map<String, Object> treeRequest = new LinkedHashMap<>();
        treeRequest.put("tree", entries);
        treeRequest.put("base_tree", baseTreeSha);
        JsonNode tree = callWithRetry("GitHub tree creation", "POST", base + "/trees", treeRequest);

        Map<String, Object> commitRequest = new LinkedHashMap<>();
        commitRequest.put("message", message);
        commitRequest.put("tree", text(tree, "sha"));
        commitRequest.put("parents", List.of(parentSha));
        JsonNode commit = callWithRetry("GitHub commit creation", "POST", base + "/commits", commitRequest);
        String commitSha = text(commit, "sha");

        call("PATCH", base + "/refs/heads/" + branch, Map.of("sha", commitSha));
        LOG.info("Pushed {} file(s) to {}/{}@{}", files.size(), owner, repo, branch);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("commit_sha", commitSha);
        result.put("files_pushed", files.size());
        result.put("message", "Pushed " + files.size() + " file(s) to " + owner + "/" + repo);
        return result;
    }
}
