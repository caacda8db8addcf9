package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A mismatch between a consumer's outbound calls and a provider contract.
 *
 * @param type kind of drift
 * @param severity error or warning
 * @param endpoint path of the call site (empty for configuration issues)
 * @param method HTTP method of the call site (empty for configuration issues)
 * @param location {@code file:line} of the call site (empty for configuration issues)
 * @param message description of the problem
 * @param suggestion how to resolve it
 */
public record DriftIssue(
    @JsonProperty("type") DriftIssueType type,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("method") String method,
    @JsonProperty("location") String location,
    @JsonProperty("message") String message,
    @JsonProperty("suggestion") String suggestion
) {
    public DriftIssue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        endpoint = endpoint == null ? "" : endpoint;
        method = method == null ? "" : method;
        location = location == null ? "" : location;
        suggestion = suggestion == null ? "" : suggestion;
    }

    /**
     * Creates an error issue that is not tied to a call site.
     *
     * @param type kind of drift
     * @param message description
     * @param suggestion resolution hint
     * @return issue
     */
    public static DriftIssue precondition(DriftIssueType type, String message, String suggestion) {
        return new DriftIssue(type, Severity.ERROR, "", "", "", message, suggestion);
    }
}
