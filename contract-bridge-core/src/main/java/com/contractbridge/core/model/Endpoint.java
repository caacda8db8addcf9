package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * An HTTP endpoint published in a contract.
 *
 * <p>Within one {@link Contract} the {@link #key() (method, path)} pair is unique.
 * Consumers are an order-insensitive set; they are stored de-duplicated in the order
 * they were first recorded.
 *
 * @param id endpoint identifier
 * @param path URL template, may contain {@code {param}} segments
 * @param method HTTP method
 * @param status lifecycle status
 * @param implementedAt ISO-8601 timestamp of extraction (provenance)
 * @param sourceFile source file the endpoint was extracted from (provenance)
 * @param functionName handler method name (provenance)
 * @param parameters handler parameters in declaration order
 * @param response response descriptor
 * @param consumers identifiers of consumers known to call this endpoint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Endpoint(
    @JsonProperty("id") String id,
    @JsonProperty("path") String path,
    @JsonProperty("method") HttpMethod method,
    @JsonProperty("status") EndpointStatus status,
    @JsonProperty("implemented_at") String implementedAt,
    @JsonProperty("source_file") String sourceFile,
    @JsonProperty("function_name") String functionName,
    @JsonProperty("parameters") List<EndpointParameter> parameters,
    @JsonProperty("response") EndpointResponse response,
    @JsonProperty("consumers") List<String> consumers
) {
    /**
     * Compact constructor with validation.
     */
    public Endpoint {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(method, "method must not be null");
        if (id == null || id.isBlank()) {
            id = defaultId(method, path);
        }
        if (status == null) {
            status = EndpointStatus.IMPLEMENTED;
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        consumers = consumers == null ? List.of() : List.copyOf(new LinkedHashSet<>(consumers));
    }

    /**
     * Creates an implemented endpoint without provenance, parameters or consumers.
     *
     * @param method HTTP method
     * @param path URL template
     * @return endpoint
     */
    public static Endpoint of(HttpMethod method, String path) {
        return new Endpoint(null, path, method, EndpointStatus.IMPLEMENTED,
            null, null, null, List.of(), null, List.of());
    }

    /**
     * Derives the identifier used when a contract does not carry one,
     * e.g. {@code get-users-id} for {@code GET /users/{id}}.
     *
     * @param method HTTP method
     * @param path URL template
     * @return identifier
     */
    public static String defaultId(HttpMethod method, String path) {
        String slug = path.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        String prefix = method.name().toLowerCase(Locale.ROOT);
        return slug.isEmpty() ? prefix + "-root" : prefix + "-" + slug;
    }

    public EndpointKey key() {
        return new EndpointKey(method, path);
    }

    /**
     * Compares every field except the extraction timestamp and the consumer list.
     *
     * @param other endpoint to compare with
     * @return true when both endpoints describe the same extracted endpoint
     */
    public boolean sameExtractedShape(Endpoint other) {
        return sameContractShape(other)
            && Objects.equals(sourceFile, other.sourceFile)
            && Objects.equals(functionName, other.functionName);
    }

    /**
     * Compares the fields that make up the published contract, ignoring the
     * timestamp, the consumer list and provenance.
     *
     * @param other endpoint to compare with
     * @return true when callers observe no difference between both endpoints
     */
    public boolean sameContractShape(Endpoint other) {
        return Objects.equals(id, other.id)
            && Objects.equals(path, other.path)
            && method == other.method
            && status == other.status
            && Objects.equals(parameters, other.parameters)
            && Objects.equals(response, other.response);
    }

    /**
     * Returns a copy with {@code consumer} added to the consumer set.
     *
     * @param consumer consumer identifier
     * @return updated endpoint, or this endpoint when the consumer is already recorded
     */
    public Endpoint withConsumer(String consumer) {
        if (consumers.contains(consumer)) {
            return this;
        }
        List<String> updated = new ArrayList<>(consumers);
        updated.add(consumer);
        return new Endpoint(id, path, method, status, implementedAt, sourceFile,
            functionName, parameters, response, updated);
    }
}
