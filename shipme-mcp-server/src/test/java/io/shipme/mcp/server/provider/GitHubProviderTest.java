package io.shipme.mcp.server.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.shipme.core.tool.ToolCallResult;
import io.shipme.core.tool.ToolDispatcher;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GitHubProviderTest {
    private MockWebServer server;
    private ProviderFixture fixture;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        fixture = new ProviderFixture();
        dispatcher = ProviderFixture.dispatcher(new GitHubProvider(
            ProviderFixture.config("github", server, "ghp_test"),
            fixture.httpClient,
            fixture.context
        ));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldCreateInitializedRepository() throws Exception {
        server.enqueue(json("{\"login\":\"octo\"}"));
        server.enqueue(json("""
            {"html_url":"https://github.com/octo/shop","clone_url":"https://github.com/octo/shop.git","ssh_url":"git@github.com:octo/shop.git"}
            """));

        ToolCallResult result = dispatcher.invoke("create_repository", Map.of("name", "shop", "description", "My shop"));

        assertThat(result.success()).isTrue();
        assertThat(ProviderFixture.data(result))
            .containsEntry("repo_url", "https://github.com/octo/shop")
            .containsEntry("clone_url", "https://github.com/octo/shop.git")
            .containsEntry("ssh_url", "git@github.com:octo/shop.git")
            .containsEntry("owner", "octo")
            .containsEntry("repo_name", "shop");

        RecordedRequest user = server.takeRequest();
        assertThat(user.getPath()).isEqualTo("/user");
        assertThat(user.getHeader("Authorization")).isEqualTo("Bearer ghp_test");
        assertThat(user.getHeader("Accept")).isEqualTo("application/vnd.github+json");

        RecordedRequest create = server.takeRequest();
        assertThat(create.getPath()).isEqualTo("/user/repos");
        JsonNode body = ProviderFixture.body(create);
        assertThat(body.path("auto_init").asBoolean()).isTrue();
        assertThat(body.path("gitignore_template").asText()).isEqualTo("Node");
        assertThat(body.path("private").asBoolean()).isFalse();
    }

    @Test
    void shouldGenerateRepositoryFromTemplate() throws Exception {
        server.enqueue(json("{\"login\":\"octo\"}"));
        server.enqueue(json("{\"html_url\":\"https://github.com/octo/shop\"}"));

        ToolCallResult result = dispatcher.invoke("create_repository", Map.of(
            "name", "shop",
            "description", "My shop",
            "private", true,
            "template_owner", "acme",
            "template_repo", "starter"
        ));

        assertThat(result.success()).isTrue();
        server.takeRequest();
        RecordedRequest generate = server.takeRequest();
        assertThat(generate.getPath()).isEqualTo("/repos/acme/starter/generate");
        JsonNode body = ProviderFixture.body(generate);
        assertThat(body.path("private").asBoolean()).isTrue();
        assertThat(body.path("include_all_branches").asBoolean()).isFalse();
        assertThat(body.has("auto_init")).isFalse();
    }

    @Test
    void shouldPushFilesThroughGitDataApi() throws Exception {
        fixture.vault.store("anon_key", "anon-123");
        server.enqueue(json("{\"object\":{\"sha\":\"parent-sha\"}}"));
        server.enqueue(json("{\"sha\":\"parent-sha\",\"tree\":{\"sha\":\"base-tree\"}}"));
        server.enqueue(json("{\"sha\":\"blob-1\"}"));
        server.enqueue(json("{\"sha\":\"blob-2\"}"));
        server.enqueue(json("{\"sha\":\"tree-sha\"}"));
        server.enqueue(json("{\"sha\":\"commit-sha\"}"));
        server.enqueue(json("{\"ref\":\"refs/heads/main\"}"));

        ToolCallResult result = dispatcher.invoke("push_files", Map.of(
            "owner", "octo",
            "repo", "shop",
            "files", List.of(
                Map.of("path", "README.md", "content", "# Shop"),
                Map.of("path", ".env", "content", "ANON_KEY={{secrets.anon_key}}")
            )
        ));

        assertThat(result.success()).isTrue();
        assertThat(ProviderFixture.data(result))
            .containsEntry("commit_sha", "commit-sha")
            .containsEntry("files_pushed", 2)
            .containsEntry("message", "Pushed 2 file(s) to octo/shop");

        assertThat(server.takeRequest().getPath()).isEqualTo("/repos/octo/shop/git/ref/heads/main");
        assertThat(server.takeRequest().getPath()).isEqualTo("/repos/octo/shop/git/commits/parent-sha");
        server.takeRequest();
        RecordedRequest secondBlob = server.takeRequest();
        String content = ProviderFixture.body(secondBlob).path("content").asText();
        assertThat(new String(Base64.getDecoder().decode(content), StandardCharsets.UTF_8)).isEqualTo("ANON_KEY=anon-123");

        JsonNode tree = ProviderFixture.body(server.takeRequest());
        assertThat(tree.path("base_tree").asText()).isEqualTo("base-tree");
        assertThat(tree.path("tree").get(1).path("path").asText()).isEqualTo(".env");
        assertThat(tree.path("tree").get(1).path("sha").asText()).isEqualTo("blob-2");
        assertThat(tree.path("tree").get(1).path("mode").asText()).isEqualTo("100644");

        JsonNode commit = ProviderFixture.body(server.takeRequest());
        assertThat(commit.path("message").asText()).isEqualTo("Update from ShipMe");
        assertThat(commit.path("tree").asText()).isEqualTo("tree-sha");
        assertThat(commit.path("parents").get(0).asText()).isEqualTo("parent-sha");

        RecordedRequest update = server.takeRequest();
        assertThat(update.getMethod()).isEqualTo("PATCH");
        assertThat(update.getPath()).isEqualTo("/repos/octo/shop/git/refs/heads/main");
        assertThat(ProviderFixture.body(update).path("sha").asText()).isEqualTo("commit-sha");
    }

    @Test
    void shouldReportMissingBranchWithoutRetrying() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"Not Found\"}"));

        ToolCallResult result = dispatcher.invoke("push_files", Map.of(
            "owner", "octo",
            "repo", "shop",
            "branch", "release",
            "files", List.of(Map.of("path", "a.txt", "content", "a"))
        ));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Not Found");
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(fixture.clock.sleeps()).isEmpty();
    }

    @Test
    void shouldValidateNestedFileEntries() {
        ToolCallResult result = dispatcher.invoke("push_files", Map.of(
            "owner", "octo",
            "repo", "shop",
            "files", List.of(Map.of("path", "a.txt"))
        ));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("files[0].content");
        assertThat(server.getRequestCount()).isZero();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
