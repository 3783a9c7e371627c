package com.e2eq.schemas.generator;

import java.util.List;
import java.util.Objects;

/**
 * The per-category slice of a composition, ready for a renderer.
 *
 * @param identityKey {@code category#<12 hex>}, stable for the same category and field set
 * @param first       whether this unit leads the composition and so carries the shared fields
 */
public record GenerationUnit(String category,
                             String identityKey,
                             List<FieldSpec> properties,
                             List<SubobjectSpec> subobjects,
                             boolean first) {
    public GenerationUnit {
        Objects.requireNonNull(category, "category");
        properties = properties == null ? List.of() : List.copyOf(properties);
        subobjects = subobjects == null ? List.of() : List.copyOf(subobjects);
    }

    public boolean isEmpty() {
        return properties.isEmpty() && subobjects.isEmpty();
    }

    public List<String> propertyNames() {
        return properties.stream().map(FieldSpec::property).toList();
    }

    public List<String> subobjectNames() {
        return subobjects.stream().map(SubobjectSpec::subobject).toList();
    }
}
