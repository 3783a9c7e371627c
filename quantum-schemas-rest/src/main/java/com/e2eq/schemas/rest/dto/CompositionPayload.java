package com.e2eq.schemas.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompositionPayload(
        List<String> categories,
        List<FieldPayload> properties,
        List<FieldPayload> subobjects,
        List<String> warnings
) {
    public CompositionPayload {
        categories = categories == null ? List.of() : List.copyOf(categories);
        properties = properties == null ? List.of() : List.copyOf(properties);
        subobjects = subobjects == null ? List.of() : List.copyOf(subobjects);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
