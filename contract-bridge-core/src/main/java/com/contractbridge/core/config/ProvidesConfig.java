package com.contractbridge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What a provider publishes: where its contract lives and which sources it is extracted from.
 *
 * @param contractFile contract location relative to the repository root
 * @param extractFrom glob patterns of the source files routes are extracted from
 * @param autoUpdate whether the contract should be re-extracted automatically
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidesConfig(
    @JsonProperty("contract_file") String contractFile,
    @JsonProperty("extract_from") List<String> extractFrom,
    @JsonProperty("auto_update") Boolean autoUpdate
) {
    public static final String DEFAULT_CONTRACT_FILE = ".bridge/contracts/provided-api.yaml";
    public static final String DEFAULT_SOURCE_GLOB = "src/main/java/**/*.java";

    public ProvidesConfig {
        if (contractFile == null || contractFile.isBlank()) {
            contractFile = DEFAULT_CONTRACT_FILE;
        }
        extractFrom = extractFrom == null ? List.of() : List.copyOf(extractFrom);
        if (autoUpdate == null) {
            autoUpdate = Boolean.TRUE;
        }
    }

    public static ProvidesConfig defaults() {
        return new ProvidesConfig(DEFAULT_CONTRACT_FILE, List.of(DEFAULT_SOURCE_GLOB), Boolean.TRUE);
    }
}
