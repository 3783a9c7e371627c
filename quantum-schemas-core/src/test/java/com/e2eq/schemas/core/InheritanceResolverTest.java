package com.e2eq.schemas.core;

import com.e2eq.schemas.exceptions.CyclicInheritanceException;
import com.e2eq.schemas.exceptions.UnknownCategoryException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.e2eq.schemas.core.SchemaStore.Declaration.optional;
import static com.e2eq.schemas.core.SchemaStore.Declaration.required;
import static org.junit.jupiter.api.Assertions.*;

class InheritanceResolverTest {

    @Test
    void testNovelInheritsAndPromotesAuthor() {
        InheritanceResolver resolver = new InheritanceResolver(SchemaFixtures.books());

        EffectiveSchema novel = resolver.resolve("Novel");

        assertEquals(List.of("Book", "Novel"), novel.lineage());
        assertEquals(List.of("title", "author", "genre"), novel.propertyNames());
        assertEquals(new PropertyDefinition("title", Datatype.TEXT, Requirement.REQUIRED, false), novel.property("title").get());
        assertEquals(new PropertyDefinition("author", Datatype.PAGE, Requirement.REQUIRED, false), novel.property("author").get());
        assertEquals(new PropertyDefinition("genre", Datatype.TEXT, Requirement.OPTIONAL, false), novel.property("genre").get());

        assertEquals(1, novel.warnings().size());
        PromotionWarning w = novel.warnings().get(0);
        assertEquals("author", w.name());
        assertEquals("Novel", w.category());
        assertTrue(w.message().contains("promoted to required"));
        assertEquals("Book", novel.propertyOrigins().get("author"));
        assertEquals("Novel", novel.propertyOrigins().get("genre"));
    }

    @Test
    void testParentlessCategoryReturnsOwnDeclarationsUnchanged() {
        InheritanceResolver resolver = new InheritanceResolver(SchemaFixtures.books());

        EffectiveSchema book = resolver.resolve("Book");

        assertEquals(List.of("Book"), book.lineage());
        assertEquals(List.of("title", "author"), book.propertyNames());
        assertTrue(book.isRequired("title"));
        assertFalse(book.isRequired("author"));
        assertFalse(book.hasWarnings());
    }

    @Test
    void testRequiredAncestorCannotBeRelaxed() {
        SchemaStore store = SchemaFixtures.builder()
                .property("isbn", Datatype.TEXT)
                .category("Book", null, List.of(required("isbn")))
                .category("Draft", "Book", List.of(optional("isbn")))
                .build();

        EffectiveSchema draft = new InheritanceResolver(store).resolve("Draft");

        assertTrue(draft.isRequired("isbn"));
        assertEquals(1, draft.warnings().size());
        assertEquals(List.of("Book"), draft.warnings().get(0).requiredIn());
        assertEquals(List.of("Draft"), draft.warnings().get(0).optionalIn());
    }

    @Test
    void testThreeLevelOrderingKeepsAncestorPositions() {
        SchemaStore store = SchemaFixtures.builder()
                .category("A", null, List.of(optional("a1"), optional("shared")))
                .category("B", "A", List.of(optional("b1"), optional("a1")))
                .category("C", "B", List.of(required("shared"), optional("c1")))
                .build();

        EffectiveSchema c = new InheritanceResolver(store).resolve("C");

        assertEquals(List.of("A", "B", "C"), c.lineage());
        assertEquals(List.of("a1", "shared", "b1", "c1"), c.propertyNames());
        assertTrue(c.isRequired("shared"));
        assertFalse(c.isRequired("a1"));
    }

    @Test
    void testUnregisteredPropertyFallsBackToPage() {
        SchemaStore store = SchemaFixtures.builder()
                .category("Thing", null, List.of(optional("Has mystery")))
                .build();

        EffectiveSchema thing = new InheritanceResolver(store).resolve("Thing");

        assertEquals(Datatype.PAGE, thing.property("Has mystery").get().datatype());
    }

    @Test
    void testSubobjectsFollowPropertyRules() {
        SchemaStore store = SchemaFixtures.builder()
                .property("street", Datatype.TEXT)
                .subobject("Address", List.of(required("street")))
                .category("Agent", null, List.of(), List.of(optional("Address")))
                .category("Company", "Agent", List.of(), List.of(required("Address"), optional("Ghost group")))
                .build();

        EffectiveSchema company = new InheritanceResolver(store).resolve("Company");

        assertEquals(List.of("Address", "Ghost group"), company.subobjectNames());
        SubobjectDefinition address = company.subobject("Address").get();
        assertTrue(address.required());
        assertEquals(List.of("street"), address.properties().stream().map(PropertyDefinition::name).toList());
        assertTrue(company.subobject("Ghost group").get().properties().isEmpty());
        assertEquals(1, company.warnings().size());
        assertEquals(PromotionWarning.FieldKind.SUBOBJECT, company.warnings().get(0).kind());
    }

    @Test
    void testUnknownCategory() {
        InheritanceResolver resolver = new InheritanceResolver(SchemaFixtures.books());

        UnknownCategoryException ex = assertThrows(UnknownCategoryException.class, () -> resolver.resolve("Ghost"));
        assertEquals("Ghost", ex.getCategory());
        assertTrue(ex.getMessage().contains("Unknown category 'Ghost'"));
    }

    @Test
    void testDanglingParentFailsNamingTheChild() {
        SchemaStore store = SchemaFixtures.builder()
                .category("Orphan", "Missing", List.of(optional("x")))
                .build();

        UnknownCategoryException ex = assertThrows(UnknownCategoryException.class,
                () -> new InheritanceResolver(store).resolve("Orphan"));
        assertEquals("Missing", ex.getCategory());
        assertEquals("Orphan", ex.getReferencedBy());
    }

    @Test
    void testCycleDetected() {
        SchemaStore store = SchemaFixtures.builder()
                .category("A", "B", List.of())
                .category("B", "C", List.of())
                .category("C", "A", List.of())
                .build();

        CyclicInheritanceException ex = assertThrows(CyclicInheritanceException.class,
                () -> new InheritanceResolver(store).resolve("A"));
        assertEquals(List.of("A", "B", "C", "A"), ex.getChain());
        assertTrue(ex.getMessage().contains("Cycle detected"));
    }

    @Test
    void testSelfParentIsACycle() {
        SchemaStore store = SchemaFixtures.builder()
                .category("Loop", "Loop", List.of())
                .build();

        assertThrows(CyclicInheritanceException.class, () -> new InheritanceResolver(store).resolve("Loop"));
    }

    @Test
    void testResolutionIsIdempotent() {
        InheritanceResolver resolver = new InheritanceResolver(SchemaFixtures.books());

        assertEquals(resolver.resolve("Novel"), resolver.resolve("Novel"));
    }

    @Test
    void testAncestryQueries() {
        SchemaStore store = SchemaFixtures.builder()
                .category("A", null, List.of())
                .category("B", "A", List.of())
                .category("C", "B", List.of())
                .category("X", "Y", List.of())
                .build();
        InheritanceResolver resolver = new InheritanceResolver(store);

        assertEquals(List.of("A", "B", "C"), resolver.lineageOf("C"));
        assertTrue(resolver.isAncestorOf("A", "C"));
        assertFalse(resolver.isAncestorOf("C", "C"));
        assertFalse(resolver.isAncestorOf("C", "A"));

        List<String> errors = resolver.validateInheritance();
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).contains("'Y'"));
    }
}
