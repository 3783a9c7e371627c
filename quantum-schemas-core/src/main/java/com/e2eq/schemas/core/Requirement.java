package com.e2eq.schemas.core;

/**
 * Two-point lattice {@code OPTIONAL < REQUIRED}. Declaration order matters for nothing but
 * warnings; the merged value is always the join.
 */
public enum Requirement {
    OPTIONAL,
    REQUIRED;

    public Requirement join(Requirement other) {
        if (other == null) {
            return this;
        }
        return this == REQUIRED || other == REQUIRED ? REQUIRED : OPTIONAL;
    }

    public boolean isRequired() {
        return this == REQUIRED;
    }

    public static Requirement of(boolean required) {
        return required ? REQUIRED : OPTIONAL;
    }
}
