package com.e2eq.schemas.core;

import java.util.List;
import java.util.Objects;

/**
 * Non-fatal record of a required/optional conflict. The merged field is always required; the
 * warning tells callers which declarations disagreed.
 *
 * @param kind       whether a property or a subobject was promoted
 * @param name       the promoted field
 * @param category   the category whose resolved schema carries the promoted field
 * @param requiredIn categories declaring the field required, in fold order
 * @param optionalIn categories declaring the field optional, in fold order
 */
public record PromotionWarning(FieldKind kind,
                               String name,
                               String category,
                               List<String> requiredIn,
                               List<String> optionalIn) {

    public enum FieldKind {
        PROPERTY("Property"),
        SUBOBJECT("Subobject");

        private final String label;

        FieldKind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public PromotionWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
        requiredIn = requiredIn == null ? List.of() : List.copyOf(requiredIn);
        optionalIn = optionalIn == null ? List.of() : List.copyOf(optionalIn);
    }

    public String message() {
        return String.format("%s '%s' promoted to required in '%s' (required in %s, optional in %s)",
                kind.label(), name, category, String.join(", ", requiredIn), String.join(", ", optionalIn));
    }
}
