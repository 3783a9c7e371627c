package com.e2eq.schemas.core;

import com.e2eq.schemas.core.SchemaStore.*;

import java.util.*;

/**
 * Consistency checks over a schema store: reference integrity, parent cycles and duplicate
 * declarations. Problems are reported, not thrown; resolution still fails per request on the
 * categories that are actually broken.
 */
public final class SchemaStoreValidator {
    private SchemaStoreValidator() {}

    public static List<String> validate(SchemaStore store) {
        if (store == null) return List.of();
        List<String> errors = new ArrayList<>();
        Map<String, CategorySchema> categories = store.categories();

        for (Map.Entry<String, CategorySchema> e : categories.entrySet()) {
            String name = e.getKey();
            CategorySchema c = e.getValue();
            check(name.equals(c.name()), errors, "Category key '" + name + "' does not match schema name '" + c.name() + "'");
            c.parent().ifPresent(p -> check(categories.containsKey(p), errors,
                    "Category '" + name + "': parent category '" + p + "' does not exist"));
            for (Declaration d : c.properties()) {
                check(store.propertyOf(d.name()).isPresent(), errors,
                        "Category '" + name + "': property '" + d.name() + "' is not registered (treated as Page)");
            }
            for (Declaration d : c.subobjects()) {
                check(store.subobjectOf(d.name()).isPresent(), errors,
                        "Category '" + name + "': subobject '" + d.name() + "' is not registered");
            }
            duplicates(c.properties()).forEach(d -> errors.add("Category '" + name + "': property '" + d + "' declared more than once"));
            duplicates(c.subobjects()).forEach(d -> errors.add("Category '" + name + "': subobject '" + d + "' declared more than once"));
        }

        for (SubobjectType s : store.subobjects().values()) {
            for (Declaration d : s.properties()) {
                check(store.propertyOf(d.name()).isPresent(), errors,
                        "Subobject '" + s.name() + "': property '" + d.name() + "' is not registered (treated as Page)");
            }
        }

        detectParentCycles(categories, errors);
        return errors;
    }

    private static void detectParentCycles(Map<String, CategorySchema> categories, List<String> errors) {
        Set<String> reported = new HashSet<>();
        for (String start : categories.keySet()) {
            Set<String> visited = new LinkedHashSet<>();
            String current = start;
            while (current != null && visited.add(current)) {
                CategorySchema def = categories.get(current);
                current = def == null ? null : def.parent().orElse(null);
            }
            if (current != null && current.equals(start) && reported.add(start)) {
                errors.add("Cycle detected in category hierarchy involving '" + start + "'");
            }
        }
    }

    private static Set<String> duplicates(List<Declaration> decls) {
        Set<String> seen = new HashSet<>();
        Set<String> dups = new LinkedHashSet<>();
        for (Declaration d : decls) {
            if (!seen.add(d.name())) dups.add(d.name());
        }
        return dups;
    }

    private static void check(boolean cond, List<String> errors, String msg) {
        if (!cond) errors.add(msg);
    }
}
