package com.e2eq.schemas.generator;

import com.e2eq.schemas.core.PromotionWarning;

import java.util.*;

/**
 * Everything generated for one composition.
 *
 * @param templates category name to rendered template, in unit order
 */
public record CompositeArtifacts(String name,
                                 List<GenerationUnit> units,
                                 Map<String, String> templates,
                                 String form,
                                 List<PromotionWarning> warnings) {
    public CompositeArtifacts {
        Objects.requireNonNull(name, "name");
        units = units == null ? List.of() : List.copyOf(units);
        templates = templates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(templates));
        form = form == null ? "" : form;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
