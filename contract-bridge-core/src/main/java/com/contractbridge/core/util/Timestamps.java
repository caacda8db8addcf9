package com.contractbridge.core.util;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * ISO-8601 UTC timestamps as written to contract and expectation files,
 * e.g. {@code 2024-11-27T10:00:00Z}.
 */
public final class Timestamps {

    private Timestamps() {
        // Utility class
    }

    public static String now() {
        return format(Instant.now());
    }

    public static String format(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
