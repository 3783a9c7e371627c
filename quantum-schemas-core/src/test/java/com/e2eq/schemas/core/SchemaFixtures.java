package com.e2eq.schemas.core;

import com.e2eq.schemas.core.SchemaStore.*;

import java.util.*;

import static com.e2eq.schemas.core.SchemaStore.Declaration.optional;
import static com.e2eq.schemas.core.SchemaStore.Declaration.required;

/**
 * Small in-memory stores shared by the resolver and generator tests.
 */
public final class SchemaFixtures {
    private SchemaFixtures() {}

    public static Builder builder() {
        return new Builder();
    }

    /** Book(title req, author opt) and Novel extends Book(author req, genre opt). */
    public static SchemaStore books() {
        return builder()
                .property("title", Datatype.TEXT)
                .property("author", Datatype.PAGE)
                .property("genre", Datatype.TEXT)
                .category("Book", null, List.of(required("title"), optional("author")))
                .category("Novel", "Book", List.of(required("author"), optional("genre")))
                .build();
    }

    /** Person and Employee both declaring name as required, plus an Address subobject. */
    public static SchemaStore people() {
        return builder()
                .property("name", Datatype.TEXT)
                .property("email", Datatype.EMAIL)
                .property("phone", Datatype.TELEPHONE_NUMBER)
                .property("employee id", Datatype.TEXT)
                .property("street", Datatype.TEXT)
                .property("city", Datatype.TEXT)
                .subobject("Address", List.of(required("street"), optional("city")))
                .category("Person", null, List.of(required("name"), optional("email"), optional("phone")),
                        List.of(optional("Address")))
                .category("Employee", null, List.of(required("name"), required("employee id"), required("email")),
                        List.of(required("Address")))
                .build();
    }

    public static final class Builder {
        private final Map<String, CategorySchema> categories = new LinkedHashMap<>();
        private final Map<String, PropertyType> properties = new LinkedHashMap<>();
        private final Map<String, SubobjectType> subobjects = new LinkedHashMap<>();

        public Builder property(String name, Datatype datatype) {
            properties.put(name, new PropertyType(name, datatype, false));
            return this;
        }

        public Builder multiValueProperty(String name, Datatype datatype) {
            properties.put(name, new PropertyType(name, datatype, true));
            return this;
        }

        public Builder property(PropertyType type) {
            properties.put(type.name(), type);
            return this;
        }

        public Builder subobject(String name, List<Declaration> props) {
            subobjects.put(name, new SubobjectType(name, null, props));
            return this;
        }

        public Builder category(String name, String parent, List<Declaration> props) {
            return category(name, parent, props, List.of());
        }

        public Builder category(String name, String parent, List<Declaration> props, List<Declaration> subs) {
            categories.put(name, new CategorySchema(name, parent, props, subs));
            return this;
        }

        public SchemaStore build() {
            return SchemaStore.inMemory(new SchemaSet(categories, properties, subobjects));
        }
    }
}
