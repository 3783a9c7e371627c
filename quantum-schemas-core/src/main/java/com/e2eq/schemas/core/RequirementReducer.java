package com.e2eq.schemas.core;

import com.e2eq.schemas.core.PromotionWarning.FieldKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds every declaration of one field name into a single requirement. The result is the join
 * over {@code OPTIONAL < REQUIRED}; a warning is produced whenever the declarations disagree.
 */
public final class RequirementReducer {
    private RequirementReducer() {}

    public record Contribution(String category, Requirement requirement) {}

    public record Outcome(Requirement requirement, Optional<PromotionWarning> warning) {
        public boolean promoted() {
            return warning.isPresent();
        }
    }

    public static Outcome reduce(FieldKind kind, String name, String category, List<Contribution> contributions) {
        Requirement merged = Requirement.OPTIONAL;
        List<String> requiredIn = new ArrayList<>();
        List<String> optionalIn = new ArrayList<>();
        for (Contribution c : contributions) {
            merged = merged.join(c.requirement());
            if (c.requirement().isRequired()) {
                requiredIn.add(c.category());
            } else {
                optionalIn.add(c.category());
            }
        }
        if (requiredIn.isEmpty() || optionalIn.isEmpty()) {
            return new Outcome(merged, Optional.empty());
        }
        return new Outcome(merged, Optional.of(new PromotionWarning(kind, name, category, requiredIn, optionalIn)));
    }
}
