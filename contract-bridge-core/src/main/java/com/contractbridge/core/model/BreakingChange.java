package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A provider contract change that affects, or could affect, consumers.
 *
 * @param type kind of change
 * @param severity error for removals, warning for modifications, info for unused endpoints
 * @param endpoint endpoint path
 * @param method endpoint HTTP method
 * @param message description
 * @param affectedConsumers consumers recorded on the endpoint
 * @param suggestion how to proceed
 */
public record BreakingChange(
    @JsonProperty("type") BreakingChangeType type,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("method") String method,
    @JsonProperty("message") String message,
    @JsonProperty("affected_consumers") List<String> affectedConsumers,
    @JsonProperty("suggestion") String suggestion
) {
    public BreakingChange {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        affectedConsumers = affectedConsumers == null ? List.of() : List.copyOf(affectedConsumers);
    }
}
