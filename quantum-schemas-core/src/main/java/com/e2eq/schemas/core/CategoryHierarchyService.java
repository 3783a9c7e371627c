package com.e2eq.schemas.core;

import com.e2eq.schemas.core.SchemaStore.CategorySchema;
import com.e2eq.schemas.core.SchemaStore.Declaration;

import java.util.*;

/**
 * Builds a view of a category's ancestor chain for tree widgets: one node per category with its
 * parent link, and every inherited property tagged with the nearest category that declares it.
 */
public class CategoryHierarchyService {

    public static final String CATEGORY_PREFIX = "Category:";
    public static final String PROPERTY_PREFIX = "Property:";

    private final InheritanceResolver resolver;

    public CategoryHierarchyService(InheritanceResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public record InheritedProperty(String propertyTitle, String sourceCategory, boolean required) {}

    public record HierarchyView(String rootCategory,
                                Map<String, List<String>> nodes,
                                List<InheritedProperty> inheritedProperties) {
        public HierarchyView {
            nodes = nodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
            inheritedProperties = inheritedProperties == null ? List.of() : List.copyOf(inheritedProperties);
        }

        public boolean isEmpty() {
            return nodes.isEmpty();
        }
    }

    /**
     * Hierarchy of a category. An unknown category yields an empty view; a broken chain
     * propagates the resolver's exception.
     */
    public HierarchyView hierarchyOf(String categoryName) {
        String rootTitle = CATEGORY_PREFIX + categoryName;
        if (resolver.store().schemaOf(categoryName).isEmpty()) {
            return new HierarchyView(rootTitle, Map.of(), List.of());
        }

        EffectiveSchema effective = resolver.resolve(categoryName);
        List<String> nearestFirst = new ArrayList<>(effective.lineage());
        Collections.reverse(nearestFirst);

        Map<String, List<String>> nodes = new LinkedHashMap<>();
        for (String name : nearestFirst) {
            CategorySchema schema = resolver.store().schemaOf(name).orElseThrow();
            nodes.put(CATEGORY_PREFIX + name, schema.parent().map(p -> List.of(CATEGORY_PREFIX + p)).orElse(List.of()));
        }

        // nearest declaration supplies the source; the requirement is the merged one
        Map<String, String> nearestSource = new LinkedHashMap<>();
        for (String name : nearestFirst) {
            for (Declaration d : resolver.store().schemaOf(name).orElseThrow().properties()) {
                nearestSource.putIfAbsent(d.name(), name);
            }
        }

        List<InheritedProperty> inherited = new ArrayList<>();
        for (PropertyDefinition p : effective.properties()) {
            inherited.add(new InheritedProperty(PROPERTY_PREFIX + p.name(),
                    CATEGORY_PREFIX + nearestSource.get(p.name()), p.required()));
        }
        return new HierarchyView(rootTitle, nodes, inherited);
    }
}
