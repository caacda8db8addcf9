package com.contractbridge.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity of an endpoint inside a contract: the (method, path) pair.
 *
 * <p>The string form {@code "GET /users/{id}"} is what expectation files and diff
 * descriptions use.
 *
 * @param method HTTP method
 * @param path URL path template
 */
public record EndpointKey(HttpMethod method, String path) {

    public EndpointKey {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }

    /**
     * Parses the {@code "METHOD /path"} form.
     *
     * @param value key text
     * @return parsed key, or empty when the text is not a valid key
     */
    public static Optional<EndpointKey> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        int space = trimmed.indexOf(' ');
        if (space <= 0) {
            return Optional.empty();
        }
        String path = trimmed.substring(space + 1).trim();
        if (path.isEmpty()) {
            return Optional.empty();
        }
        return HttpMethod.fromString(trimmed.substring(0, space))
            .map(method -> new EndpointKey(method, path));
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
