package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of drift between a consumer and a provider contract.
 */
public enum DriftIssueType {
    /** The dependency is not registered. */
    CONFIGURATION_ERROR,

    /** No cached contract exists for the dependency. */
    MISSING_CONTRACT,

    /** The cached contract cannot be read. */
    INVALID_CONTRACT,

    /** A call site targets an endpoint the contract does not publish. */
    MISSING_ENDPOINT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
