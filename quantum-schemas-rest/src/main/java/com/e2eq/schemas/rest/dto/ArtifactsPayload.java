package com.e2eq.schemas.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.*;

/**
 * Generated templates and form for a category selection.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactsPayload(
        String name,
        List<Unit> units,
        Map<String, String> templates,
        String form,
        List<String> warnings
) {
    public ArtifactsPayload {
        units = units == null ? List.of() : List.copyOf(units);
        templates = templates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Unit(
            String category,
            String identityKey,
            int first,
            List<Field> properties,
            List<String> subobjects
    ) {
        public Unit {
            properties = properties == null ? List.of() : List.copyOf(properties);
            subobjects = subobjects == null ? List.of() : List.copyOf(subobjects);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Field(
            String name,
            String parameter,
            String label,
            String input,
            int required,
            int multiValue,
            int shared
    ) {}
}
