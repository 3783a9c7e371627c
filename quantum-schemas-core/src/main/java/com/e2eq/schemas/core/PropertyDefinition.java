package com.e2eq.schemas.core;

import java.util.Objects;

/**
 * A property as it appears in a resolved schema: the declaration's requirement combined with
 * the globally registered datatype.
 */
public record PropertyDefinition(String name, Datatype datatype, Requirement requirement, boolean multiValue)
        implements ResolvedField {

    public PropertyDefinition {
        Objects.requireNonNull(name, "name");
        datatype = datatype == null ? Datatype.PAGE : datatype;
        requirement = requirement == null ? Requirement.OPTIONAL : requirement;
    }

    public boolean required() {
        return requirement.isRequired();
    }

    @Override
    public PropertyDefinition withRequirement(Requirement requirement) {
        return requirement == this.requirement ? this : new PropertyDefinition(name, datatype, requirement, multiValue);
    }
}
