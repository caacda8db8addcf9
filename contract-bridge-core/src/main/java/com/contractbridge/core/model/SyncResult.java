package com.contractbridge.core.model;

import com.contractbridge.core.util.Timestamps;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of syncing one dependency.
 *
 * <p>A result is one of:
 * <ul>
 *   <li>a clean success ({@link #synced}),</li>
 *   <li>a success with warning when a cached contract is used after a failed fetch
 *       ({@link #offline}); {@code errors} then carries the fetch failure,</li>
 *   <li>a failure with at least one error ({@link #failed}).</li>
 * </ul>
 *
 * @param dependencyName name of the synced dependency
 * @param success whether a usable contract is available
 * @param changes human-readable change lines (or the offline warning)
 * @param errors error messages
 * @param endpointCount number of endpoints in the usable contract
 * @param cachedFile path of the cached contract
 * @param timestamp ISO-8601 time the result was produced
 */
public record SyncResult(
    @JsonProperty("dependency_name") String dependencyName,
    @JsonProperty("success") boolean success,
    @JsonProperty("changes") List<String> changes,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("endpoint_count") int endpointCount,
    @JsonProperty("cached_file") String cachedFile,
    @JsonProperty("timestamp") String timestamp
) {
    public SyncResult {
        Objects.requireNonNull(dependencyName, "dependencyName must not be null");
        changes = changes == null ? List.of() : List.copyOf(changes);
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (!success && errors.isEmpty()) {
            throw new IllegalArgumentException("A failed sync result needs at least one error");
        }
        if (timestamp == null) {
            timestamp = Timestamps.now();
        }
    }

    public static SyncResult synced(String dependencyName, List<String> changes, int endpointCount, String cachedFile) {
        return new SyncResult(dependencyName, true, changes, List.of(), endpointCount, cachedFile, null);
    }

    public static SyncResult offline(String dependencyName, String warning, String error, int endpointCount, String cachedFile) {
        return new SyncResult(dependencyName, true, List.of(warning), List.of(error), endpointCount, cachedFile, null);
    }

    public static SyncResult failed(String dependencyName, String... errors) {
        return new SyncResult(dependencyName, false, List.of(), List.of(errors), 0, null, null);
    }

    /**
     * Whether this is a success that relies on a stale cached contract.
     *
     * @return true for success-with-warning results
     */
    @JsonIgnore
    public boolean isStale() {
        return success && !errors.isEmpty();
    }
}
