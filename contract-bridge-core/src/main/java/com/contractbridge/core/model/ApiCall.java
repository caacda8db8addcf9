package com.contractbridge.core.model;

import java.util.Objects;

/**
 * An outbound HTTP call found in consumer source code.
 *
 * @param method HTTP method of the call
 * @param path request path (scheme, host, query and fragment removed)
 * @param sourceFile source file relative to the repository root, with {@code /} separators
 * @param lineNumber 1-based line of the call expression
 */
public record ApiCall(
    HttpMethod method,
    String path,
    String sourceFile,
    int lineNumber
) {
    public ApiCall {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(sourceFile, "sourceFile must not be null");
    }

    /**
     * Returns the {@code file:line} location of the call.
     *
     * @return location string
     */
    public String location() {
        return sourceFile + ":" + lineNumber;
    }

    @Override
    public String toString() {
        return method + " " + path + " at " + location();
    }
}
