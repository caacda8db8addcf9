package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;
import java.util.Optional;

/**
 * HTTP methods a contract endpoint may declare.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    PATCH,
    HEAD,
    OPTIONS;

    /**
     * Looks up a method by name, ignoring case.
     *
     * @param value method name such as {@code "get"} or {@code "POST"}
     * @return the matching method, or empty if the name is not an HTTP method
     */
    public static Optional<HttpMethod> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @JsonCreator
    public static HttpMethod parse(String value) {
        return fromString(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown HTTP method: " + value));
    }
}
