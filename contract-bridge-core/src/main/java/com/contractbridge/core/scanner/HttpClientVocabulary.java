package com.contractbridge.core.scanner;

import com.contractbridge.core.model.HttpMethod;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Names that identify outbound HTTP calls in consumer code.
 *
 * <p>A call {@code receiver.verb(url, ...)} is an API call when {@code receiver} is one of
 * {@link #RECEIVERS} and {@code verb} is a key of {@link #VERBS}. Recognition is purely
 * syntactic: variable names are matched, not their declared types.
 */
public final class HttpClientVocabulary {

    /**
     * Variable or field names conventionally holding an HTTP client
     * (Spring RestTemplate/RestClient, JDK or Apache clients, Unirest, REST Assured).
     */
    public static final Set<String> RECEIVERS = Set.of(
        "restTemplate",
        "restClient",
        "client",
        "httpClient",
        "http",
        "session",
        "Unirest",
        "RestAssured"
    );

    /**
     * Method names mapped to the HTTP method they issue.
     */
    public static final Map<String, HttpMethod> VERBS = Map.ofEntries(
        Map.entry("get", HttpMethod.GET),
        Map.entry("post", HttpMethod.POST),
        Map.entry("put", HttpMethod.PUT),
        Map.entry("delete", HttpMethod.DELETE),
        Map.entry("patch", HttpMethod.PATCH),
        Map.entry("head", HttpMethod.HEAD),
        Map.entry("options", HttpMethod.OPTIONS),
        // RestTemplate
        Map.entry("getForObject", HttpMethod.GET),
        Map.entry("getForEntity", HttpMethod.GET),
        Map.entry("postForObject", HttpMethod.POST),
        Map.entry("postForEntity", HttpMethod.POST),
        Map.entry("postForLocation", HttpMethod.POST),
        Map.entry("patchForObject", HttpMethod.PATCH),
        Map.entry("headForHeaders", HttpMethod.HEAD),
        Map.entry("optionsForAllow", HttpMethod.OPTIONS)
    );

    private HttpClientVocabulary() {
        // Utility class
    }

    public static boolean isReceiver(String name) {
        return RECEIVERS.contains(name);
    }

    public static Optional<HttpMethod> httpMethodFor(String methodName) {
        return Optional.ofNullable(VERBS.get(methodName));
    }
}
