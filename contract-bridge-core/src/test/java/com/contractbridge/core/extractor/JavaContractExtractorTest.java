package com.contractbridge.core.extractor;

import com.contractbridge.core.RepositoryTestBase;
import com.contractbridge.core.config.BridgeConfig;
import com.contractbridge.core.io.ContractStore;
import com.contractbridge.core.model.Contract;
import com.contractbridge.core.model.Endpoint;
import com.contractbridge.core.model.EndpointParameter;
import com.contractbridge.core.model.EndpointResponse;
import com.contractbridge.core.model.HttpMethod;
import com.contractbridge.core.model.ModelField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JavaContractExtractor}.
 *
 * <p>These tests validate the extractor's ability to:
 * <ul>
 *   <li>Detect Spring mapping annotations, including class-level prefixes</li>
 *   <li>Extract parameters with their required flag</li>
 *   <li>Describe responses, unwrapping ResponseEntity</li>
 *   <li>Collect record and marked model classes</li>
 *   <li>Keep the first of duplicate endpoints and skip unparsable files</li>
 * </ul>
 */
class JavaContractExtractorTest extends RepositoryTestBase {

    private static final List<String> SOURCES = List.of("src/main/java/**/*.java");

    private JavaContractExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new JavaContractExtractor(tempDir, "user-service");
    }

    @Test
    void extract_springController_findsEveryMappedMethod() throws IOException {
        // Given: A controller with a class-level prefix and one method per mapping style
        createFile("src/main/java/com/example/UserController.java", """
            package com.example;

            import org.springframework.web.bind.annotation.*;

            @RestController
            @RequestMapping("/api/users")
            public class UserController {

                @GetMapping
                public List<User> listUsers(@RequestParam(required = false) String email) {
                    return List.of();
                }

                @GetMapping("/{id}")
                public User getUser(@PathVariable Long id) {
                    return null;
                }

                @PostMapping
                @ResponseStatus(HttpStatus.CREATED)
                public ResponseEntity<User> createUser(@RequestBody CreateUserRequest request) {
                    return null;
                }

                @PutMapping(path = "/{id}")
                public User updateUser(@PathVariable Long id, @RequestBody User user) {
                    return null;
                }

                @DeleteMapping("/{id}")
                public void deleteUser(@PathVariable Long id) {
                }

                @PatchMapping(value = "/{id}/email")
                public ResponseEntity<?> changeEmail(@PathVariable Long id, @RequestParam(defaultValue = "") String email) {
                    return null;
                }

                @RequestMapping(value = "/search", method = RequestMethod.POST)
                public User[] search(@RequestBody Optional<String> query) {
                    return new User[0];
                }

                public void helper() {
                }
            }
            """);

        // When: The contract is extracted
        Contract contract = extractor.extract(SOURCES);

        // Then: Every mapped method becomes an endpoint, in source order
        assertThat(contract.repoId()).isEqualTo("user-service");
        assertThat(contract.role()).isEqualTo("provider");
        assertThat(contract.version()).isEqualTo(Contract.CURRENT_VERSION);
        assertThat(contract.endpoints()).extracting(endpoint -> endpoint.key().toString())
            .containsExactly(
                "GET /api/users",
                "GET /api/users/{id}",
                "POST /api/users",
                "PUT /api/users/{id}",
                "DELETE /api/users/{id}",
                "PATCH /api/users/{id}/email",
                "POST /api/users/search");
        assertThat(contract.endpoints()).allSatisfy(endpoint -> {
            assertThat(endpoint.sourceFile()).isEqualTo("src/main/java/com/example/UserController.java");
            assertThat(endpoint.implementedAt()).isEqualTo(contract.lastUpdated());
            assertThat(endpoint.consumers()).isEmpty();
        });
    }

    @Test
    void extract_parametersAndResponses_describeSignature() throws IOException {
        // Given: The same controller as above, reduced to the interesting signatures
        createFile("src/main/java/com/example/UserController.java", """
            package com.example;

            @RestController
            @RequestMapping("api/users/")
            public class UserController {

                @GetMapping
                public List<User> listUsers(@RequestParam(required = false) String email, @RequestParam int page) {
                    return List.of();
                }

                @GetMapping("{id}")
                public User getUser(@PathVariable Long id) {
                    return null;
                }

                @PostMapping
                @ResponseStatus(HttpStatus.CREATED)
                public ResponseEntity<User> createUser(@RequestBody CreateUserRequest request) {
                    return null;
                }

                @DeleteMapping("/{id}")
                @ResponseStatus(code = HttpStatus.NO_CONTENT)
                public void deleteUser(@PathVariable Long id) {
                }

                @GetMapping("/stream")
                public ResponseEntity<?> stream(Optional<String> cursor) {
                    return null;
                }
            }
            """);

        // When: The contract is extracted
        Contract contract = extractor.extract(SOURCES);

        // Then: Parameter requirements and response shapes follow the signatures
        Endpoint list = contract.findEndpoint(HttpMethod.GET, "/api/users").orElseThrow();
        assertThat(list.functionName()).isEqualTo("listUsers");
        assertThat(list.parameters()).containsExactly(
            new EndpointParameter("email", "String", false),
            new EndpointParameter("page", "int", true));
        assertThat(list.response()).isEqualTo(EndpointResponse.array(200, "User"));

        Endpoint get = contract.findEndpoint(HttpMethod.GET, "/api/users/{id}").orElseThrow();
        assertThat(get.id()).isEqualTo("get-api-users-id");
        assertThat(get.response()).isEqualTo(EndpointResponse.object(200, "User"));

        Endpoint create = contract.findEndpoint(HttpMethod.POST, "/api/users").orElseThrow();
        assertThat(create.response()).isEqualTo(EndpointResponse.object(201, "User"));

        Endpoint delete = contract.findEndpoint(HttpMethod.DELETE, "/api/users/{id}").orElseThrow();
        assertThat(delete.response()).isEqualTo(EndpointResponse.unknown(204));

        Endpoint stream = contract.findEndpoint(HttpMethod.GET, "/api/users/stream").orElseThrow();
        assertThat(stream.parameters()).containsExactly(new EndpointParameter("cursor", "Optional<String>", false));
        assertThat(stream.response()).isEqualTo(EndpointResponse.unknown(200));
    }

    @Test
    void extract_controllerWithoutPrefix_usesRootForEmptyPath() throws IOException {
        createFile("src/main/java/com/example/HealthController.java", """
            package com.example;

            @RestController
            public class HealthController {

                @GetMapping
                public String root() {
                    return "ok";
                }

                @RequestMapping("/ping")
                public String ping() {
                    return "pong";
                }
            }
            """);

        Contract contract = extractor.extract(SOURCES);

        assertThat(contract.endpoints()).extracting(endpoint -> endpoint.key().toString())
            .containsExactly("GET /", "GET /ping");
    }

    @Test
    void extract_models_collectsRecordsAndMarkedClasses() throws IOException {
        // Given: A record, a class extending a model marker and an unrelated class
        createFile("src/main/java/com/example/model/User.java", """
            package com.example.model;

            public record User(Long id, String email, List<String> roles) {}
            """);
        createFile("src/main/java/com/example/model/Address.java", """
            package com.example.model;

            public class Address extends BaseModel {
                private static final long serialVersionUID = 1L;
                private String street;
                private String city, zip;
            }
            """);
        createFile("src/main/java/com/example/service/UserService.java", """
            package com.example.service;

            public class UserService {
                private String name;
            }
            """);

        // When: The contract is extracted
        Contract contract = extractor.extract(SOURCES);

        // Then: Only records and marked classes become models
        assertThat(contract.models()).containsOnlyKeys("Address", "User");
        assertThat(contract.models().get("User").fields()).containsExactly(
            new ModelField("id", "Long"),
            new ModelField("email", "String"),
            new ModelField("roles", "List<String>"));
        assertThat(contract.models().get("Address").fields()).extracting(ModelField::name)
            .containsExactly("street", "city", "zip");
    }

    @Test
    void extract_duplicateEndpointAcrossFiles_keepsFirstInPathOrder() throws IOException {
        createFile("src/main/java/com/example/a/UserController.java", """
            package com.example.a;

            @RestController
            public class UserController {
                @GetMapping("/api/users")
                public List<User> listUsers() { return List.of(); }
            }
            """);
        createFile("src/main/java/com/example/b/LegacyUserController.java", """
            package com.example.b;

            @RestController
            public class LegacyUserController {
                @GetMapping("/api/users")
                public List<User> legacyUsers() { return List.of(); }
            }
            """);

        Contract contract = extractor.extract(SOURCES);

        assertThat(contract.endpoints()).singleElement()
            .satisfies(endpoint -> assertThat(endpoint.functionName()).isEqualTo("listUsers"));
    }

    @Test
    void extract_unparsableFile_isSkipped() throws IOException {
        createFile("src/main/java/com/example/Broken.java", "public class Broken { @GetMapping(\"/x\") void ( }");
        createFile("src/main/java/com/example/OrderController.java", """
            package com.example;

            @RestController
            public class OrderController {
                @GetMapping("/api/orders")
                public List<Order> orders() { return List.of(); }
            }
            """);

        Contract contract = extractor.extract(SOURCES);

        assertThat(contract.endpoints()).extracting(endpoint -> endpoint.key().toString())
            .containsExactly("GET /api/orders");
    }

    @Test
    void extract_noMatchingFiles_returnsEmptyContract() {
        Contract contract = extractor.extract(SOURCES);

        assertThat(contract.endpoints()).isEmpty();
        assertThat(contract.models()).isEmpty();
        assertThat(contract.lastUpdated()).isNotBlank();
    }

    @Test
    void extractAndSave_writesProvidedContract() throws Exception {
        createFile("src/main/java/com/example/OrderController.java", """
            package com.example;

            @RestController
            @RequestMapping("/api/orders")
            public class OrderController {
                @GetMapping("/{id}")
                public Order get(@PathVariable String id) { return null; }
            }
            """);
        BridgeConfig config = BridgeConfig.createDefault(tempDir, BridgeConfig.ROLE_PROVIDER);
        config.setRepoId("order-service");

        Contract contract = JavaContractExtractor.extractAndSave(config);

        Contract saved = ContractStore.load(tempDir.resolve(".bridge/contracts/provided-api.yaml"));
        assertThat(saved).isEqualTo(contract);
        assertThat(saved.repoId()).isEqualTo("order-service");
        assertThat(saved.lastUpdated()).matches("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?Z$");
        assertThat(saved.endpoints()).extracting(endpoint -> endpoint.key().toString())
            .containsExactly("GET /api/orders/{id}");
    }
}
