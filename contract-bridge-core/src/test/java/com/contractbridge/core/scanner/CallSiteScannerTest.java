package com.contractbridge.core.scanner;

import com.contractbridge.core.RepositoryTestBase;
import com.contractbridge.core.model.ApiCall;
import com.contractbridge.core.model.HttpMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Functional tests for {@link CallSiteScanner}.
 *
 * <p>These tests validate the scanner's ability to:
 * <ul>
 *   <li>Detect outbound calls on known HTTP client receivers</li>
 *   <li>Resolve literal, concatenated and formatted URLs to paths</li>
 *   <li>Ignore unknown receivers, dynamic URLs and test sources</li>
 * </ul>
 */
class CallSiteScannerTest extends RepositoryTestBase {

    private CallSiteScanner scanner;

    @BeforeEach
    void setUpScanner() {
        scanner = new CallSiteScanner(tempDir);
    }

    @Test
    void scan_restTemplateClient_extractsCallsWithLocations() throws IOException {
        // Given: A client using RestTemplate verbs with literal and formatted URLs
        createFile("src/main/java/com/example/UserClient.java", """
            package com.example;

            public class UserClient {

                private final RestTemplate restTemplate;

                public UserClient(RestTemplate restTemplate) {
                    this.restTemplate = restTemplate;
                }

                public User getUser(long id) {
                    return restTemplate.getForObject(String.format("http://user-service/api/users/%d", id), User.class);
                }

                public List<User> listUsers() {
                    return this.restTemplate.getForObject("/api/users", List.class);
                }

                public void createUser(User user) {
                    restTemplate.postForEntity("/api/" + "users", user, User.class);
                }

                public void deleteUser(long id) {
                    restTemplate.delete("/api/users/%s".formatted(id));
                }
            }
            """);

        // When: The repository is scanned
        List<ApiCall> calls = scanner.scan();

        // Then: Every call is reported with its path and line
        assertThat(calls)
            .extracting(ApiCall::method, ApiCall::path, ApiCall::location)
            .containsExactly(
                tuple(HttpMethod.GET, "/api/users/{}", "src/main/java/com/example/UserClient.java:12"),
                tuple(HttpMethod.GET, "/api/users", "src/main/java/com/example/UserClient.java:16"),
                tuple(HttpMethod.POST, "/api/users", "src/main/java/com/example/UserClient.java:20"),
                tuple(HttpMethod.DELETE, "/api/users/{}", "src/main/java/com/example/UserClient.java:24"));
    }

    @Test
    void scan_genericClientVerbs_extractsCalls() throws IOException {
        createFile("src/main/java/com/example/OrderGateway.java", """
            package com.example;

            public class OrderGateway {
                void sync() {
                    client.put("/api/orders/{id}", order);
                    http.patch("/api/orders/1/status");
                    Unirest.head("https://orders.internal/api/orders");
                }
            }
            """);

        List<ApiCall> calls = scanner.scan();

        assertThat(calls).extracting(call -> call.method() + " " + call.path())
            .containsExactly("PUT /api/orders/{id}", "PATCH /api/orders/1/status", "HEAD /api/orders");
    }

    @Test
    void scan_unknownReceiverOrDynamicUrl_isIgnored() throws IOException {
        createFile("src/main/java/com/example/Cache.java", """
            package com.example;

            public class Cache {
                void load(String key, String baseUrl) {
                    map.get("/api/users");
                    restTemplate.getForObject(baseUrl + "/api/users", String.class);
                    restTemplate.getForObject(url);
                    get("/api/users");
                    restTemplate.exchange("/api/users", HttpMethod.GET, null, String.class);
                }
            }
            """);

        assertThat(scanner.scan()).isEmpty();
    }

    @Test
    void scan_testSourcesAndBuildOutput_areSkipped() throws IOException {
        String client = """
            package com.example;

            public class Client {
                void call() {
                    restTemplate.getForObject("/api/users", String.class);
                }
            }
            """;
        createFile("src/test/java/com/example/Client.java", client);
        createFile("target/generated-sources/Client.java", client);
        createFile("src/main/java/com/example/ClientTest.java", client);
        createFile("src/main/java/com/example/ClientIT.java", client);
        createFile("src/main/java/com/example/Client.java", client);

        List<ApiCall> calls = scanner.scan();

        assertThat(calls).singleElement()
            .satisfies(call -> assertThat(call.sourceFile()).isEqualTo("src/main/java/com/example/Client.java"));
    }

    @Test
    void scan_unparsableFile_isSkipped() throws IOException {
        createFile("src/main/java/com/example/Broken.java", "class Broken { void x() { restTemplate.delete(\"/a\" }");

        assertThat(scanner.scan()).isEmpty();
    }
}
