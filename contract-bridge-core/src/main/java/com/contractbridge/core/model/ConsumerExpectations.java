package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The endpoints of one dependency that this consumer currently calls.
 *
 * <p>Written by the sync engine next to the cached contract; one entry per endpoint key
 * with all call-site locations accumulated.
 *
 * @param dependency dependency name
 * @param lastUpdated ISO-8601 timestamp
 * @param expectations expectations, one per endpoint key
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsumerExpectations(
    @JsonProperty("dependency") String dependency,
    @JsonProperty("last_updated") String lastUpdated,
    @JsonProperty("expectations") List<Expectation> expectations
) {
    public ConsumerExpectations {
        expectations = expectations == null ? List.of() : List.copyOf(expectations);
    }
}
