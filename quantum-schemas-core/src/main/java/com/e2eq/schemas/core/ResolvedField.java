package com.e2eq.schemas.core;

/**
 * Common shape of resolved properties and subobjects. Both resolvers fold fields through this
 * interface so the two kinds are merged by the same code.
 */
public interface ResolvedField {
    String name();
    Requirement requirement();
    ResolvedField withRequirement(Requirement requirement);
}
