package com.e2eq.schemas.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A property or subobject of a composition. Flags are 1/0 integers on the wire.
 *
 * @param title   {@code Property:<name>} or {@code Subobject:<name>}
 * @param sources every selected category declaring the field, in selection order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldPayload(
        String name,
        String title,
        int required,
        int shared,
        List<String> sources
) {
    public FieldPayload {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
