package com.contractbridge;

import com.contractbridge.cli.ExitCodes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for the {@code contract-bridge} command line.
 */
class ContractBridgeCLITest {

    private static final String CONTRACT = """
        version: "1.0"
        repo_id: user-service
        role: provider
        last_updated: "2024-05-01T10:00:00Z"
        endpoints:
          - path: /api/users
            method: GET
            consumers: [web-app]
          - path: /api/users
            method: POST
        """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void noArguments_printsBanner() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("Contract Bridge - API contract sync and drift detection");
    }

    @Test
    void init_createsConfigurationOnce() {
        assertThat(run("init", "-r", repo(), "--repo-id", "web-app")).isEqualTo(ExitCodes.OK);
        assertThat(tempDir.resolve(".bridge/settings/bridge.json")).exists();
        assertThat(out.toString()).contains("Role: consumer");

        assertThat(run("init", "-r", repo())).isEqualTo(ExitCodes.CONFIG_ERROR);
        assertThat(err.toString()).contains("Configuration already exists");

        assertThat(run("init", "-r", repo(), "--role", "provider", "--force")).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("Provides: .bridge/contracts/provided-api.yaml");
    }

    @Test
    void init_invalidRole_isConfigurationError() {
        assertThat(run("init", "-r", repo(), "--role", "observer")).isEqualTo(ExitCodes.CONFIG_ERROR);
        assertThat(err.toString()).contains("Invalid role: observer");
        assertThat(tempDir.resolve(".bridge/settings/bridge.json")).doesNotExist();
    }

    @Test
    void addDependency_thenValidate_reportsMissingContract() {
        run("init", "-r", repo());

        assertThat(run("add-dependency", "user-service", "-r", repo())).isEqualTo(ExitCodes.CONFIG_ERROR);
        assertThat(run("add-dependency", "user-service", "-r", repo(),
            "--git-url", "https://git.example.com/acme/user-service.git")).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("Cache: .bridge/contracts/user-service-api.yaml");

        int exitCode = run("validate", "-r", repo());

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
        assertThat(out.toString())
            .contains("Found 1 drift issue(s) with user-service contract")
            .contains("[ERROR] missing_contract")
            .contains("Run 'contract-bridge sync' to fetch the contract");
    }

    @Test
    void validate_syncedContractWithMatchingCalls_succeeds() throws IOException {
        run("init", "-r", repo());
        run("add-dependency", "user-service", "-r", repo(), "--git-url", "https://git.example.com/acme/user-service.git");
        write(".bridge/contracts/user-service-api.yaml", CONTRACT);
        write("src/main/java/com/example/UserClient.java", """
            package com.example;

            class UserClient {
                void list() {
                    restTemplate.getForObject("/api/users", List.class);
                }
            }
            """);

        assertThat(run("validate", "-r", repo(), "user-service")).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("All API calls align with user-service contract");
    }

    @Test
    void validate_invalidConfiguration_isConfigurationError() throws IOException {
        write(".bridge/settings/bridge.json", "{\"bridge\": {\"role\": \"observer\"}}");

        assertThat(run("validate", "-r", repo())).isEqualTo(ExitCodes.CONFIG_ERROR);
        assertThat(out.toString()).contains("Invalid role: observer");
    }

    @Test
    void removeDependency_unknownName_isConfigurationError() {
        run("init", "-r", repo());

        assertThat(run("remove-dependency", "missing", "-r", repo())).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    @Test
    void status_listsDependenciesWithCacheState() throws IOException {
        run("init", "-r", repo(), "--repo-id", "web-app");
        run("add-dependency", "user-service", "-r", repo(), "--git-url", "https://git.example.com/acme/user-service.git");
        run("add-dependency", "order-service", "-r", repo(), "--git-url", "https://git.example.com/acme/order-service.git");
        write(".bridge/contracts/user-service-api.yaml", CONTRACT);

        assertThat(run("status", "-r", repo())).isEqualTo(ExitCodes.OK);
        assertThat(out.toString())
            .contains("Repository: web-app")
            .contains("user-service: 2 endpoints, updated 2024-05-01T10:00:00Z")
            .contains("order-service: not synced");
    }

    @Test
    void sync_noDependencies_succeeds() {
        run("init", "-r", repo());

        assertThat(run("sync", "-r", repo())).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("No dependencies configured");
    }

    @Test
    void sync_unknownDependency_fails() {
        run("init", "-r", repo());

        assertThat(run("sync", "-r", repo(), "missing")).isEqualTo(ExitCodes.FAILURE);
        assertThat(out.toString()).contains("Error: Dependency 'missing' not found in configuration");
    }

    @Test
    void extract_providerRepository_writesContract() throws IOException {
        run("init", "-r", repo(), "--role", "provider", "--repo-id", "user-service");
        write("src/main/java/com/example/UserController.java", """
            package com.example;

            @RestController
            @RequestMapping("/api/users")
            class UserController {
                @GetMapping("/{id}")
                User get(@PathVariable Long id) { return null; }
            }
            """);

        assertThat(run("extract", "-r", repo())).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("Extracted 1 endpoints and 0 models");
        assertThat(Files.readString(tempDir.resolve(".bridge/contracts/provided-api.yaml")))
            .contains("/api/users/{id}")
            .contains("repo_id: user-service");
    }

    @Test
    void breaking_removedConsumedEndpoint_fails() throws IOException {
        write("old.yaml", CONTRACT);
        write("new.yaml", CONTRACT.replace("""
              - path: /api/users
                method: GET
                consumers: [web-app]
            """, ""));

        int exitCode = run("breaking", "-r", repo(), "old.yaml", "new.yaml");

        assertThat(exitCode).isEqualTo(ExitCodes.FAILURE);
        assertThat(out.toString())
            .contains("[ERROR] GET /api/users")
            .contains("Affected Consumers: web-app")
            .doesNotContain("unused_endpoint");
    }

    @Test
    void breaking_unchangedContract_succeeds() throws IOException {
        write("old.yaml", CONTRACT);

        assertThat(run("breaking", "-r", repo(), "--show-unused", "old.yaml", "old.yaml")).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("[INFO] POST /api/users");
    }

    @Test
    void recordConsumers_marksExpectedEndpoints() throws IOException {
        write("provider-api.yaml", CONTRACT);
        write(".bridge/contracts/user-service-expectations.yaml", """
            dependency: user-service
            last_updated: "2024-05-02T08:00:00Z"
            expectations:
              - endpoint: POST /api/users
                status: using
                usage_locations:
                  - src/main/java/com/example/UserClient.java:9
            """);

        int exitCode = run("record-consumers", "-r", repo(), "provider-api.yaml",
            "--consumer", "mobile-app", "--dependency", "user-service");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("Recorded mobile-app on 1 endpoint(s)");
        assertThat(Files.readString(tempDir.resolve("provider-api.yaml"))).contains("mobile-app");
    }

    private int run(String... args) {
        CommandLine commandLine = ContractBridgeCLI.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private String repo() {
        return tempDir.toString();
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
