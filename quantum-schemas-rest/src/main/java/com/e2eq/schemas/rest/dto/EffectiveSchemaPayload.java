package com.e2eq.schemas.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A single category's schema after inheritance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EffectiveSchemaPayload(
        String category,
        List<String> lineage,
        List<Property> properties,
        List<Subobject> subobjects,
        List<String> warnings
) {
    public EffectiveSchemaPayload {
        lineage = lineage == null ? List.of() : List.copyOf(lineage);
        properties = properties == null ? List.of() : List.copyOf(properties);
        subobjects = subobjects == null ? List.of() : List.copyOf(subobjects);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * @param origin root-most category declaring the property; absent for nested subobject fields
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Property(
            String name,
            String title,
            String datatype,
            int required,
            int multiValue,
            String origin
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Subobject(
            String name,
            String title,
            int required,
            String origin,
            List<Property> properties
    ) {
        public Subobject {
            properties = properties == null ? List.of() : List.copyOf(properties);
        }
    }
}
