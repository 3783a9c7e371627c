package com.e2eq.schemas.generator;

import java.util.List;
import java.util.Objects;

/**
 * A subobject as a generation unit emits it: a repeatable group of fields.
 */
public record SubobjectSpec(String subobject,
                            String parameter,
                            String label,
                            boolean mandatory,
                            boolean shared,
                            List<String> sources,
                            List<FieldSpec> fields) {
    public SubobjectSpec {
        Objects.requireNonNull(subobject, "subobject");
        sources = sources == null ? List.of() : List.copyOf(sources);
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
