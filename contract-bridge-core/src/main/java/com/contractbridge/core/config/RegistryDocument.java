package com.contractbridge.core.config;

import com.contractbridge.core.model.Dependency;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * On-disk shape of {@code bridge.json}: a single {@code bridge} object.
 *
 * @param bridge registry content
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RegistryDocument(@JsonProperty("bridge") Settings bridge) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Settings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("role") String role,
        @JsonProperty("repo_id") String repoId,
        @JsonProperty("provides") ProvidesConfig provides,
        @JsonProperty("dependencies") Map<String, Dependency> dependencies,
        @JsonProperty("fetch_timeout_seconds") Long fetchTimeoutSeconds
    ) {
    }
}
