package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A consumer-side registration of one provider relationship: how and where to fetch
 * its contract.
 *
 * <p>Fields are not validated here. A git dependency without {@code gitUrl} is a valid
 * value; it is rejected by {@code BridgeConfig.validate()}.
 *
 * @param name unique key within a configuration
 * @param type API type (e.g. {@code http-api})
 * @param syncMethod how the contract is fetched: {@code git}, {@code http} or {@code s3}
 * @param gitUrl remote URL for git sync
 * @param contractPath location of the contract inside the provider repository
 * @param localCache location of the cached contract inside the consumer repository
 * @param syncOnCommit whether the contract should be synced on every commit (default true)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Dependency(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("sync_method") String syncMethod,
    @JsonProperty("git_url") String gitUrl,
    @JsonProperty("contract_path") String contractPath,
    @JsonProperty("local_cache") String localCache,
    @JsonProperty("sync_on_commit") Boolean syncOnCommit
) {
    public static final String SYNC_GIT = "git";
    public static final String SYNC_HTTP = "http";
    public static final String SYNC_S3 = "s3";
    public static final String DEFAULT_TYPE = "http-api";

    public Dependency {
        if (syncOnCommit == null) {
            syncOnCommit = Boolean.TRUE;
        }
    }

    /**
     * Creates a git dependency of type {@code http-api}.
     *
     * @param name dependency name
     * @param gitUrl remote URL
     * @param contractPath contract location inside the provider repository
     * @param localCache cache location inside this repository
     * @return dependency
     */
    public static Dependency git(String name, String gitUrl, String contractPath, String localCache) {
        return new Dependency(name, DEFAULT_TYPE, SYNC_GIT, gitUrl, contractPath, localCache, Boolean.TRUE);
    }
}
