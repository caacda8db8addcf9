package com.contractbridge.core.config;

import com.contractbridge.core.model.Dependency;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The dependency registry of one repository, backed by {@code .bridge/settings/bridge.json}.
 *
 * <p>A configuration knows the repository root it belongs to; every relative path it
 * holds (contract files, caches) is resolved against that root, never against the
 * process working directory.
 *
 * <p>Only {@link #addDependency} and {@link #removeDependency} persist implicitly.
 * Other changes are written by an explicit {@link #save()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BridgeConfig config = BridgeConfig.load(repoRoot);
 * config.addDependency(Dependency.git("user-service",
 *     "https://github.com/acme/user-service.git",
 *     ".bridge/contracts/provided-api.yaml",
 *     ".bridge/contracts/user-service-api.yaml"));
 *
 * List<String> problems = config.validate();
 * }</pre>
 */
public class BridgeConfig {

    public static final String DEFAULT_CONFIG_PATH = ".bridge/settings/bridge.json";
    public static final String CONTRACTS_DIR = ".bridge/contracts";

    public static final String ROLE_CONSUMER = "consumer";
    public static final String ROLE_PROVIDER = "provider";
    public static final String ROLE_BOTH = "both";
    private static final Set<String> ROLES = Set.of(ROLE_CONSUMER, ROLE_PROVIDER, ROLE_BOTH);

    private static final Logger log = LoggerFactory.getLogger(BridgeConfig.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path repoRoot;
    private final Path configPath;
    private boolean enabled = true;
    private String role = ROLE_CONSUMER;
    private String repoId = "";
    private ProvidesConfig provides;
    private final Map<String, Dependency> dependencies = new LinkedHashMap<>();
    private Long fetchTimeoutSeconds;

    private BridgeConfig(Path repoRoot, Path configPath) {
        this.repoRoot = Objects.requireNonNull(repoRoot, "repoRoot must not be null");
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
    }

    /**
     * Loads the registry at the default location below {@code repoRoot}.
     *
     * @param repoRoot repository root
     * @return loaded configuration, or an empty consumer configuration if no registry exists
     * @throws BridgeConfigException if the registry exists but cannot be read
     */
    public static BridgeConfig load(Path repoRoot) {
        return load(repoRoot, repoRoot.resolve(DEFAULT_CONFIG_PATH));
    }

    /**
     * Loads a registry file.
     *
     * @param repoRoot repository root
     * @param configPath registry file; relative paths are resolved against {@code repoRoot}
     * @return loaded configuration, or an empty consumer configuration if the file does not exist
     * @throws BridgeConfigException if the file exists but cannot be read or parsed
     */
    public static BridgeConfig load(Path repoRoot, Path configPath) {
        BridgeConfig config = new BridgeConfig(repoRoot, repoRoot.resolve(configPath));
        if (!Files.exists(config.configPath)) {
            log.debug("No bridge configuration at {}, using empty consumer configuration", config.configPath);
            return config;
        }

        RegistryDocument document;
        try {
            document = JSON_MAPPER.readValue(config.configPath.toFile(), RegistryDocument.class);
        } catch (IOException e) {
            throw new BridgeConfigException("Failed to read bridge configuration " + config.configPath
                + ": " + e.getMessage(), e);
        }

        RegistryDocument.Settings settings = document == null ? null : document.bridge();
        if (settings != null) {
            config.enabled = settings.enabled() == null || settings.enabled();
            config.role = settings.role() == null ? ROLE_CONSUMER : settings.role();
            config.repoId = settings.repoId() == null ? "" : settings.repoId();
            config.provides = settings.provides();
            config.fetchTimeoutSeconds = settings.fetchTimeoutSeconds();
            if (settings.dependencies() != null) {
                config.dependencies.putAll(settings.dependencies());
            }
        }
        log.debug("Loaded bridge configuration from {} ({} dependencies)", config.configPath, config.dependencies.size());
        return config;
    }

    /**
     * Creates an unsaved configuration with defaults for the given role. Provider and
     * {@code both} roles get a default {@code provides} section.
     *
     * @param repoRoot repository root
     * @param role consumer, provider or both
     * @return new configuration
     */
    public static BridgeConfig createDefault(Path repoRoot, String role) {
        BridgeConfig config = new BridgeConfig(repoRoot, repoRoot.resolve(DEFAULT_CONFIG_PATH));
        config.role = role;
        if (ROLE_PROVIDER.equals(role) || ROLE_BOTH.equals(role)) {
            config.provides = ProvidesConfig.defaults();
        }
        return config;
    }

    /**
     * Writes the registry, creating parent directories.
     *
     * @throws BridgeConfigException if the file cannot be written
     */
    public void save() {
        RegistryDocument document = new RegistryDocument(new RegistryDocument.Settings(
            enabled, role, repoId, provides, new LinkedHashMap<>(dependencies), fetchTimeoutSeconds));
        try {
            Files.createDirectories(configPath.toAbsolutePath().getParent());
            JSON_MAPPER.writeValue(configPath.toFile(), document);
        } catch (IOException e) {
            throw new BridgeConfigException("Failed to write bridge configuration " + configPath
                + ": " + e.getMessage(), e);
        }
        log.debug("Saved bridge configuration to {}", configPath);
    }

    /**
     * Registers (or replaces) a dependency and saves the registry.
     *
     * @param dependency dependency to register, keyed by its name
     */
    public void addDependency(Dependency dependency) {
        Objects.requireNonNull(dependency, "dependency must not be null");
        dependencies.put(dependency.name(), dependency);
        save();
    }

    /**
     * Removes a dependency, saves the registry and deletes the dependency's cached
     * contract when it exists. Unknown names are ignored.
     *
     * @param name dependency name
     */
    public void removeDependency(String name) {
        Dependency removed = dependencies.remove(name);
        if (removed == null) {
            return;
        }
        save();

        if (removed.localCache() != null && !removed.localCache().isBlank()) {
            Path cache = resolve(removed.localCache());
            try {
                if (Files.deleteIfExists(cache)) {
                    log.debug("Deleted cached contract {}", cache);
                }
            } catch (IOException e) {
                log.warn("Failed to delete cached contract {}: {}", cache, e.getMessage());
            }
        }
    }

    public Optional<Dependency> getDependency(String name) {
        return Optional.ofNullable(dependencies.get(name));
    }

    /**
     * Returns the registered dependency names in registration order.
     *
     * @return dependency names
     */
    public List<String> listDependencies() {
        return new ArrayList<>(dependencies.keySet());
    }

    public Map<String, Dependency> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    /**
     * Checks the registry for problems.
     *
     * @return validation messages, empty when the configuration is valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (role == null || role.isBlank()) {
            errors.add("Role is required");
        } else if (!ROLES.contains(role)) {
            errors.add("Invalid role: " + role);
        }

        dependencies.forEach((name, dep) -> {
            if (isBlank(dep.name())) {
                errors.add("Dependency " + name + ": name is required");
            }
            if (isBlank(dep.type())) {
                errors.add("Dependency " + name + ": type is required");
            }
            if (isBlank(dep.syncMethod())) {
                errors.add("Dependency " + name + ": sync_method is required");
            }
            if (Dependency.SYNC_GIT.equals(dep.syncMethod()) && isBlank(dep.gitUrl())) {
                errors.add("Dependency " + name + ": git_url is required for git sync method");
            }
            if (isBlank(dep.contractPath())) {
                errors.add("Dependency " + name + ": contract_path is required");
            }
            if (isBlank(dep.localCache())) {
                errors.add("Dependency " + name + ": local_cache is required");
            }
        });

        if (fetchTimeoutSeconds != null && fetchTimeoutSeconds <= 0) {
            errors.add("fetch_timeout_seconds must be positive");
        }
        return errors;
    }

    /**
     * Resolves a registry-relative path against the repository root.
     *
     * @param relativePath path as stored in the registry
     * @return absolute path below the repository root (absolute inputs are returned unchanged)
     */
    public Path resolve(String relativePath) {
        return repoRoot.resolve(relativePath);
    }

    /**
     * Default cache location for a dependency: {@code .bridge/contracts/<name>-api.yaml}.
     *
     * @param dependencyName dependency name
     * @return repository-relative path
     */
    public static String defaultCachePath(String dependencyName) {
        return CONTRACTS_DIR + "/" + dependencyName + "-api.yaml";
    }

    /**
     * Location of the consumer expectations recorded for a dependency:
     * {@code .bridge/contracts/<name>-expectations.yaml}.
     *
     * @param dependencyName dependency name
     * @return repository-relative path
     */
    public static String expectationsPath(String dependencyName) {
        return CONTRACTS_DIR + "/" + dependencyName + "-expectations.yaml";
    }

    public Path expectationsFile(String dependencyName) {
        return repoRoot.resolve(expectationsPath(dependencyName));
    }

    public Path getRepoRoot() {
        return repoRoot;
    }

    public Path getConfigPath() {
        return configPath;
    }

    public boolean exists() {
        return Files.exists(configPath);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public String getRepoId() {
        return repoId;
    }

    public void setRepoId(String repoId) {
        this.repoId = repoId == null ? "" : repoId;
    }

    public Optional<ProvidesConfig> getProvides() {
        return Optional.ofNullable(provides);
    }

    public void setProvides(ProvidesConfig provides) {
        this.provides = provides;
    }

    /**
     * Timeout for a single contract fetch.
     *
     * @return configured timeout, or empty for no timeout
     */
    public Optional<Duration> getFetchTimeout() {
        return fetchTimeoutSeconds == null ? Optional.empty() : Optional.of(Duration.ofSeconds(fetchTimeoutSeconds));
    }

    public void setFetchTimeoutSeconds(Long fetchTimeoutSeconds) {
        this.fetchTimeoutSeconds = fetchTimeoutSeconds;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
