package com.e2eq.schemas.core;

import java.util.List;
import java.util.Objects;

/**
 * A named group of properties nested under a category. The nested list comes from the global
 * subobject registry, so every category referencing the subobject sees the same fields.
 */
public record SubobjectDefinition(String name, Requirement requirement, List<PropertyDefinition> properties)
        implements ResolvedField {

    public SubobjectDefinition {
        Objects.requireNonNull(name, "name");
        requirement = requirement == null ? Requirement.OPTIONAL : requirement;
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public boolean required() {
        return requirement.isRequired();
    }

    @Override
    public SubobjectDefinition withRequirement(Requirement requirement) {
        return requirement == this.requirement ? this : new SubobjectDefinition(name, requirement, properties);
    }
}
