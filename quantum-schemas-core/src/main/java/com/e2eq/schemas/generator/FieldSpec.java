package com.e2eq.schemas.generator;

import com.e2eq.schemas.core.Datatype;

import java.util.List;
import java.util.Objects;

/**
 * One property as a generation unit emits it.
 *
 * @param property   property name as registered
 * @param parameter  template parameter the value binds to
 * @param label      display label
 * @param inputType  form input type
 * @param input      full form input definition, e.g. {@code input type=text|size=60|mandatory=true}
 * @param shared     declared by more than one selected category
 * @param sources    every selected category declaring the property, in selection order
 */
public record FieldSpec(String property,
                        String parameter,
                        String label,
                        Datatype datatype,
                        String inputType,
                        String input,
                        boolean mandatory,
                        boolean multiValue,
                        boolean shared,
                        List<String> sources) {
    public FieldSpec {
        Objects.requireNonNull(property, "property");
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
