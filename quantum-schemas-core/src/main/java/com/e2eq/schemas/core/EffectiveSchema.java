package com.e2eq.schemas.core;

import java.util.*;

/**
 * A category's schema merged with every ancestor. Ancestor fields come first; warnings list
 * every required/optional conflict that was settled by promotion.
 *
 * @param lineage          the resolved chain, root ancestor first and the category last
 * @param propertyOrigins  property name to the root-most category of the chain declaring it
 * @param subobjectOrigins subobject name to the root-most category of the chain declaring it
 */
public record EffectiveSchema(String category,
                              List<String> lineage,
                              List<PropertyDefinition> properties,
                              List<SubobjectDefinition> subobjects,
                              Map<String, String> propertyOrigins,
                              Map<String, String> subobjectOrigins,
                              List<PromotionWarning> warnings) {

    public EffectiveSchema {
        Objects.requireNonNull(category, "category");
        lineage = lineage == null ? List.of(category) : List.copyOf(lineage);
        properties = properties == null ? List.of() : List.copyOf(properties);
        subobjects = subobjects == null ? List.of() : List.copyOf(subobjects);
        propertyOrigins = propertyOrigins == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(propertyOrigins));
        subobjectOrigins = subobjectOrigins == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subobjectOrigins));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Optional<PropertyDefinition> property(String name) {
        return properties.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public Optional<SubobjectDefinition> subobject(String name) {
        return subobjects.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public boolean isRequired(String propertyName) {
        return property(propertyName).map(PropertyDefinition::required).orElse(false);
    }

    public List<String> propertyNames() {
        return properties.stream().map(PropertyDefinition::name).toList();
    }

    public List<String> subobjectNames() {
        return subobjects.stream().map(SubobjectDefinition::name).toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
