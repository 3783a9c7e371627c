package com.e2eq.schemas.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.e2eq.schemas.core.SchemaStore.Declaration.optional;
import static com.e2eq.schemas.core.SchemaStore.Declaration.required;
import static org.junit.jupiter.api.Assertions.*;

class SchemaStoreValidatorTest {

    @Test
    void testValidStore() {
        assertTrue(SchemaStoreValidator.validate(SchemaFixtures.people()).isEmpty());
    }

    @Test
    void testReportsEveryProblem() {
        SchemaStore store = SchemaFixtures.builder()
                .property("name", Datatype.TEXT)
                .subobject("Address", List.of(required("street")))
                .category("Orphan", "Missing", List.of(required("name"), optional("name"), optional("unregistered")),
                        List.of(optional("Address"), optional("Nowhere")))
                .category("A", "B", List.of())
                .category("B", "A", List.of())
                .build();

        List<String> errors = SchemaStoreValidator.validate(store);

        assertTrue(errors.stream().anyMatch(e -> e.contains("parent category 'Missing' does not exist")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("property 'unregistered' is not registered")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("subobject 'Nowhere' is not registered")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("property 'name' declared more than once")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("Subobject 'Address': property 'street'")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("Cycle detected in category hierarchy involving 'A'")));
        assertTrue(errors.stream().anyMatch(e -> e.contains("Cycle detected in category hierarchy involving 'B'")));
    }

    @Test
    void testNullStore() {
        assertTrue(SchemaStoreValidator.validate(null).isEmpty());
    }
}
