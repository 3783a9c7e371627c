package com.e2eq.schemas.core;

import java.util.*;

/**
 * Read-only lookup over raw category schemas and the global property and subobject registries.
 * The resolvers never write through this interface.
 */
public interface SchemaStore {
    Optional<CategorySchema> schemaOf(String category);
    Optional<PropertyType> propertyOf(String property);
    Optional<SubobjectType> subobjectOf(String subobject);
    Map<String, CategorySchema> categories();
    Map<String, PropertyType> properties();
    Map<String, SubobjectType> subobjects();

    /**
     * Datatype of a property as registered globally. A property referenced by a category but
     * absent from the registry is treated as {@link Datatype#PAGE}.
     */
    default Datatype datatypeOf(String property) {
        return propertyOf(property).map(PropertyType::datatype).orElse(Datatype.PAGE);
    }

    default boolean isMultiValue(String property) {
        return propertyOf(property).map(PropertyType::multiValue).orElse(false);
    }

    default SchemaSet getCurrentSchemaSet() { return new SchemaSet(categories(), properties(), subobjects()); }
    default String getHash() { return SchemaHasher.computeHash(getCurrentSchemaSet()); }

    static SchemaStore inMemory(SchemaSet set) { return new InMemorySchemaStore(set); }

    /** A property or subobject reference as written in a category or subobject schema. */
    record Declaration(String name, Requirement requirement) {
        public Declaration {
            Objects.requireNonNull(name, "name");
            requirement = requirement == null ? Requirement.OPTIONAL : requirement;
        }

        public static Declaration required(String name) { return new Declaration(name, Requirement.REQUIRED); }
        public static Declaration optional(String name) { return new Declaration(name, Requirement.OPTIONAL); }
    }

    record CategorySchema(String name,
                          Optional<String> parent,
                          String label,
                          String description,
                          List<Declaration> properties,
                          List<Declaration> subobjects) {
        public CategorySchema {
            Objects.requireNonNull(name, "name");
            parent = parent == null ? Optional.empty() : parent.filter(p -> !p.isBlank());
            label = label == null || label.isBlank() ? name : label;
            description = description == null ? "" : description;
            properties = properties == null ? List.of() : List.copyOf(properties);
            subobjects = subobjects == null ? List.of() : List.copyOf(subobjects);
        }

        public CategorySchema(String name, String parent, List<Declaration> properties, List<Declaration> subobjects) {
            this(name, Optional.ofNullable(parent), null, null, properties, subobjects);
        }
    }

    record PropertyType(String name,
                        Datatype datatype,
                        boolean multiValue,
                        String label,
                        List<String> allowedValues,
                        Optional<String> rangeCategory) {
        public PropertyType {
            Objects.requireNonNull(name, "name");
            datatype = datatype == null ? Datatype.PAGE : datatype;
            label = label == null || label.isBlank() ? name : label;
            allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
            rangeCategory = rangeCategory == null ? Optional.empty() : rangeCategory;
        }

        public PropertyType(String name, Datatype datatype, boolean multiValue) {
            this(name, datatype, multiValue, null, List.of(), Optional.empty());
        }
    }

    record SubobjectType(String name, String label, List<Declaration> properties) {
        public SubobjectType {
            Objects.requireNonNull(name, "name");
            label = label == null || label.isBlank() ? name : label;
            properties = properties == null ? List.of() : List.copyOf(properties);
        }
    }

    record SchemaSet(Map<String, CategorySchema> categories,
                     Map<String, PropertyType> properties,
                     Map<String, SubobjectType> subobjects) {
        public SchemaSet {
            categories = categories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
            properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
            subobjects = subobjects == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subobjects));
        }
    }
}
