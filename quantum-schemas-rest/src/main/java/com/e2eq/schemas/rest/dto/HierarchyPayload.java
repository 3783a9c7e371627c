package com.e2eq.schemas.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.*;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HierarchyPayload(
        String rootCategory,
        Map<String, List<String>> nodes,
        List<InheritedProperty> inheritedProperties
) {
    public HierarchyPayload {
        nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        inheritedProperties = inheritedProperties == null ? List.of() : List.copyOf(inheritedProperties);
    }

    public record InheritedProperty(String propertyTitle, String sourceCategory, int required) {}
}
