package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response descriptor of an endpoint: status code plus a type descriptor.
 *
 * <p>{@code type} is one of {@code object} (with {@code schema}), {@code array}
 * (with {@code items}) or {@code unknown}.
 *
 * @param status HTTP status code of a successful call
 * @param type type descriptor
 * @param schema model name for object responses
 * @param items element type for array responses
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EndpointResponse(
    @JsonProperty("status") Integer status,
    @JsonProperty("type") String type,
    @JsonProperty("schema") String schema,
    @JsonProperty("items") String items
) {
    public static final String OBJECT = "object";
    public static final String ARRAY = "array";
    public static final String UNKNOWN = "unknown";

    public static EndpointResponse object(int status, String schema) {
        return new EndpointResponse(status, OBJECT, schema, null);
    }

    public static EndpointResponse array(int status, String items) {
        return new EndpointResponse(status, ARRAY, null, items);
    }

    public static EndpointResponse unknown(int status) {
        return new EndpointResponse(status, UNKNOWN, null, null);
    }
}
