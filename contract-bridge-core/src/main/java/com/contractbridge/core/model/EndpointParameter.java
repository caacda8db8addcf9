package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A declared parameter of an endpoint handler.
 *
 * @param name parameter name
 * @param type declared type, or null when the source did not declare one
 * @param required whether callers must supply the parameter
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EndpointParameter(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("required") boolean required
) {
    public EndpointParameter {
        Objects.requireNonNull(name, "name must not be null");
    }
}
