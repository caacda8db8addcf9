package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a drift issue or breaking change.
 *
 * @since 1.0.0
 */
public enum Severity {
    /**
     * Must be fixed before the change ships.
     */
    ERROR,

    /**
     * Potential issue that should be reviewed.
     */
    WARNING,

    /**
     * Informational - no action required.
     */
    INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
