package com.e2eq.schemas.core;

import java.util.*;
import com.e2eq.schemas.core.SchemaStore.*;

public final class InMemorySchemaStore implements SchemaStore {
    private final Map<String, CategorySchema> categories;
    private final Map<String, PropertyType> properties;
    private final Map<String, SubobjectType> subobjects;

    public InMemorySchemaStore(SchemaSet set) {
        this.categories = set.categories();
        this.properties = set.properties();
        this.subobjects = set.subobjects();
    }
    public Optional<CategorySchema> schemaOf(String name){ return name == null ? Optional.empty() : Optional.ofNullable(categories.get(name)); }
    public Optional<PropertyType> propertyOf(String name){ return name == null ? Optional.empty() : Optional.ofNullable(properties.get(name)); }
    public Optional<SubobjectType> subobjectOf(String name){ return name == null ? Optional.empty() : Optional.ofNullable(subobjects.get(name)); }
    public Map<String, CategorySchema> categories(){ return categories; }
    public Map<String, PropertyType> properties(){ return properties; }
    public Map<String, SubobjectType> subobjects(){ return subobjects; }
}
