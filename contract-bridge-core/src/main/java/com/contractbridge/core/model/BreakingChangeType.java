package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of provider-side contract changes reported to providers.
 */
public enum BreakingChangeType {
    ENDPOINT_REMOVED,
    ENDPOINT_MODIFIED,
    UNUSED_ENDPOINT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
