package com.e2eq.schemas.core;

import java.util.*;

/**
 * Several effective schemas composed into one, each field listed under exactly one category.
 *
 * @param slices             one slice per selected category, in selection order
 * @param propertySources    property name to owning category
 * @param subobjectSources   subobject name to owning category
 * @param propertyDeclarers  property name to every selected category declaring it, in selection order
 * @param subobjectDeclarers subobject name to every selected category declaring it, in selection order
 * @param warnings           inheritance warnings of each category followed by cross-category promotions
 */
public record ComposedSchema(List<CategorySlice> slices,
                             Map<String, String> propertySources,
                             Map<String, String> subobjectSources,
                             Map<String, List<String>> propertyDeclarers,
                             Map<String, List<String>> subobjectDeclarers,
                             List<PromotionWarning> warnings) {

    public record CategorySlice(String category,
                                List<PropertyDefinition> properties,
                                List<SubobjectDefinition> subobjects) {
        public CategorySlice {
            Objects.requireNonNull(category, "category");
            properties = properties == null ? List.of() : List.copyOf(properties);
            subobjects = subobjects == null ? List.of() : List.copyOf(subobjects);
        }
    }

    public ComposedSchema {
        slices = slices == null ? List.of() : List.copyOf(slices);
        propertySources = propertySources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(propertySources));
        subobjectSources = subobjectSources == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subobjectSources));
        propertyDeclarers = propertyDeclarers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(propertyDeclarers));
        subobjectDeclarers = subobjectDeclarers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subobjectDeclarers));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<String> categoryNames() {
        return slices.stream().map(CategorySlice::category).toList();
    }

    public Optional<CategorySlice> slice(String category) {
        return slices.stream().filter(s -> s.category().equals(category)).findFirst();
    }

    /** All properties in slice order. */
    public List<PropertyDefinition> properties() {
        return slices.stream().flatMap(s -> s.properties().stream()).toList();
    }

    /** All subobjects in slice order. */
    public List<SubobjectDefinition> subobjects() {
        return slices.stream().flatMap(s -> s.subobjects().stream()).toList();
    }

    public List<String> propertySources(String property) {
        return propertyDeclarers.getOrDefault(property, List.of());
    }

    public List<String> subobjectSources(String subobject) {
        return subobjectDeclarers.getOrDefault(subobject, List.of());
    }

    public boolean isSharedProperty(String property) {
        return propertySources(property).size() > 1;
    }

    public boolean isSharedSubobject(String subobject) {
        return subobjectSources(subobject).size() > 1;
    }

    public boolean isEmpty() {
        return slices.isEmpty();
    }

    public static ComposedSchema empty() {
        return new ComposedSchema(List.of(), Map.of(), Map.of(), Map.of(), Map.of(), List.of());
    }
}
