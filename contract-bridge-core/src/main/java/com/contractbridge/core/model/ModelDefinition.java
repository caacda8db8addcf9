package com.contractbridge.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A data model published in a contract.
 *
 * @param fields model fields in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelDefinition(
    @JsonProperty("fields") List<ModelField> fields
) {
    public ModelDefinition {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
