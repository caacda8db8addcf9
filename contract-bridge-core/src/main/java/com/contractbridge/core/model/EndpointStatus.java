package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a contract endpoint.
 */
public enum EndpointStatus {
    /** Endpoint is served by the provider. */
    IMPLEMENTED,

    /** Endpoint is still served but scheduled for removal. */
    DEPRECATED,

    /** Endpoint is announced but not served yet. */
    PLANNED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EndpointStatus parse(String value) {
        if (value == null || value.isBlank()) {
            return IMPLEMENTED;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
