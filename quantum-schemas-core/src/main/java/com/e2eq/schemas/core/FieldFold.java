package com.e2eq.schemas.core;

import com.e2eq.schemas.core.PromotionWarning.FieldKind;
import com.e2eq.schemas.core.RequirementReducer.Contribution;
import com.e2eq.schemas.core.RequirementReducer.Outcome;

import java.util.*;
import java.util.function.Function;

/**
 * Accumulates field declarations from several categories. The first category offering a name
 * owns it and fixes its position; every later offer only contributes its requirement.
 */
final class FieldFold<F extends ResolvedField> {

    private final FieldKind kind;
    private final Map<String, F> firstCopies = new LinkedHashMap<>();
    private final Map<String, String> owners = new LinkedHashMap<>();
    private final Map<String, List<Contribution>> contributions = new LinkedHashMap<>();
    private final Map<String, List<String>> declarers = new LinkedHashMap<>();

    FieldFold(FieldKind kind) {
        this.kind = kind;
    }

    /**
     * @return true when the category became the owner of the field
     */
    boolean offer(String category, F field) {
        String name = field.name();
        contributions.computeIfAbsent(name, k -> new ArrayList<>()).add(new Contribution(category, field.requirement()));
        List<String> names = declarers.computeIfAbsent(name, k -> new ArrayList<>());
        if (!names.contains(category)) {
            names.add(category);
        }
        if (firstCopies.containsKey(name)) {
            return false;
        }
        firstCopies.put(name, field);
        owners.put(name, category);
        return true;
    }

    Map<String, String> owners() {
        return Collections.unmodifiableMap(owners);
    }

    Map<String, List<String>> declarers() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        declarers.forEach((name, cats) -> copy.put(name, List.copyOf(cats)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Folds requirements and returns the owned copies in first-seen order.
     *
     * @param warningCategory maps a field name to the category reported on its warning
     * @param warnings        receives one warning per promoted field
     */
    @SuppressWarnings("unchecked")
    List<F> fold(Function<String, String> warningCategory, List<PromotionWarning> warnings) {
        List<F> result = new ArrayList<>(firstCopies.size());
        for (Map.Entry<String, F> e : firstCopies.entrySet()) {
            String name = e.getKey();
            Outcome outcome = RequirementReducer.reduce(kind, name, warningCategory.apply(name), contributions.get(name));
            outcome.warning().ifPresent(warnings::add);
            result.add((F) e.getValue().withRequirement(outcome.requirement()));
        }
        return result;
    }
}
