package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A field of a data model published in a contract.
 *
 * @param name field name
 * @param type declared type as written in source
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelField(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type
) {}
