package com.contractbridge.core.scanner;

import com.contractbridge.core.model.EndpointKey;
import com.contractbridge.core.model.HttpMethod;

import java.util.regex.Pattern;

/**
 * Canonical form of path templates used to match call sites against contract endpoints.
 *
 * <p>Every brace-delimited segment, including the empty interpolation placeholder
 * {@code {}}, becomes {@code {param}}: {@code /users/{id}}, {@code /users/{userId}} and
 * {@code /users/{}} all normalize to {@code /users/{param}}.
 */
public final class PathNormalizer {

    public static final String PARAM = "{param}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{[^}]*\\}");

    private PathNormalizer() {
        // Utility class
    }

    public static String normalize(String path) {
        return PLACEHOLDER.matcher(path).replaceAll("{param}");
    }

    /**
     * Normalized key of an endpoint or call.
     *
     * @param method HTTP method
     * @param path path template
     * @return key with normalized path
     */
    public static EndpointKey key(HttpMethod method, String path) {
        return new EndpointKey(method, normalize(path));
    }
}
