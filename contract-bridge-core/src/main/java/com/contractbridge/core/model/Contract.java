package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A provider's published API contract.
 *
 * <p>Owned by whichever side produced it; consumers treat fetched contracts as
 * read-only snapshots. {@code lastUpdated} is kept as the exact ISO-8601 text that was
 * written so it round-trips unchanged.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * version: "1.0"
 * repo_id: "user-service"
 * role: "provider"
 * last_updated: "2024-11-27T10:00:00Z"
 * endpoints:
 *   - id: "get-users-id"
 *     path: "/users/{id}"
 *     method: "GET"
 *     status: "implemented"
 *     consumers: ["frontend"]
 * models:
 *   User:
 *     fields:
 *       - name: "id"
 *         type: "Long"
 * }</pre>
 *
 * @param version contract format version
 * @param repoId identifier of the repository that owns the contract
 * @param role role of the producing repository (provider, consumer or both)
 * @param lastUpdated ISO-8601 timestamp
 * @param endpoints endpoints in publication order
 * @param models model name to model definition, in publication order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Contract(
    @JsonProperty("version") String version,
    @JsonProperty("repo_id") String repoId,
    @JsonProperty("role") String role,
    @JsonProperty("last_updated") String lastUpdated,
    @JsonProperty("endpoints") List<Endpoint> endpoints,
    @JsonProperty("models") Map<String, ModelDefinition> models
) {
    public static final String CURRENT_VERSION = "1.0";

    /**
     * Compact constructor with validation.
     */
    public Contract {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(repoId, "repoId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
        endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
        models = models == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    /**
     * Indexes endpoints by (method, path), keeping the first endpoint for a key.
     *
     * @return insertion-ordered map of endpoints
     */
    public Map<EndpointKey, Endpoint> endpointsByKey() {
        Map<EndpointKey, Endpoint> byKey = new LinkedHashMap<>();
        for (Endpoint endpoint : endpoints) {
            byKey.putIfAbsent(endpoint.key(), endpoint);
        }
        return byKey;
    }

    public Optional<Endpoint> findEndpoint(HttpMethod method, String path) {
        return Optional.ofNullable(endpointsByKey().get(new EndpointKey(method, path)));
    }

    /**
     * Returns a copy of this contract with a different endpoint list.
     *
     * @param updatedEndpoints replacement endpoints
     * @return new contract
     */
    public Contract withEndpoints(List<Endpoint> updatedEndpoints) {
        return new Contract(version, repoId, role, lastUpdated, updatedEndpoints, models);
    }
}
