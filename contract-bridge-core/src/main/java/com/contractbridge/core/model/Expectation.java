package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One provider endpoint the consumer depends on, with the call sites using it.
 *
 * @param endpoint endpoint key in {@code "METHOD /path"} form
 * @param status usage status, {@code using} for endpoints found in source
 * @param usageLocations {@code file:line} locations of matching call sites
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Expectation(
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("status") String status,
    @JsonProperty("usage_locations") List<String> usageLocations
) {
    public static final String STATUS_USING = "using";

    public Expectation {
        usageLocations = usageLocations == null ? List.of() : List.copyOf(usageLocations);
    }
}
