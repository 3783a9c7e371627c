package com.e2eq.schemas.core;

import com.e2eq.schemas.core.SchemaStore.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class YamlSchemaLoaderTest {

    private final YamlSchemaLoader loader = new YamlSchemaLoader();

    @Test
    void testLoadFromClasspath() throws IOException {
        SchemaSet set = loader.loadFromClasspath("schemas/test-categories.yaml");

        assertEquals(List.of("Book", "Novel", "Publisher"), List.copyOf(set.categories().keySet()));

        CategorySchema book = set.categories().get("Book");
        assertEquals("Any published book.", book.description());
        assertEquals(List.of(Declaration.required("Has title"), Declaration.optional("Has author"), Declaration.optional("Has keyword")),
                book.properties());
        assertEquals(Optional.of("Book"), set.categories().get("Novel").parent());
        assertEquals(List.of(Declaration.required("Address")), set.categories().get("Publisher").subobjects());
    }

    @Test
    void testPropertyRegistry() throws IOException {
        SchemaSet set = loader.loadFromClasspath("/schemas/test-categories.yaml");

        assertEquals(Datatype.TEXT, set.properties().get("Has genre").datatype());
        assertEquals(List.of("Fantasy", "Mystery"), set.properties().get("Has genre").allowedValues());
        assertEquals(Optional.of("Person"), set.properties().get("Has author").rangeCategory());
        assertTrue(set.properties().get("Has keyword").multiValue());
        assertEquals(Datatype.PAGE, set.properties().get("Has rating").datatype());
        assertEquals("Postal address", set.subobjects().get("Address").label());
    }

    @Test
    void testLoadedSchemasResolve() throws IOException {
        SchemaStore store = SchemaStore.inMemory(loader.loadFromClasspath("schemas/test-categories.yaml"));

        EffectiveSchema novel = new InheritanceResolver(store).resolve("Novel");

        assertEquals(List.of("Has title", "Has author", "Has keyword", "Has genre", "Has rating"), novel.propertyNames());
        assertTrue(novel.isRequired("Has author"));
        assertTrue(SchemaStoreValidator.validate(store).isEmpty());
    }

    @Test
    void testMissingSectionsAreTolerated() throws IOException {
        String yaml = "categories:\n  - id: Lonely\n";
        SchemaSet set = loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertTrue(set.properties().isEmpty());
        assertTrue(set.categories().get("Lonely").properties().isEmpty());
        assertEquals("Lonely", set.categories().get("Lonely").label());
    }

    @Test
    void testLoadFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("categories.json");
        Files.writeString(file, "{\"categories\": [{\"id\": \"Song\", \"parent\": \"Work\"}, {\"id\": \"Work\"}]}");

        SchemaSet set = loader.loadFromPath(file);

        assertEquals(Optional.of("Work"), set.categories().get("Song").parent());
        assertEquals(List.of("Work", "Song"), new InheritanceResolver(SchemaStore.inMemory(set)).lineageOf("Song"));
    }

    @Test
    void testMissingResource() {
        assertThrows(IOException.class, () -> loader.loadFromClasspath("schemas/nope.yaml"));
    }

    @Test
    void testMissingIdRejected() {
        String yaml = "properties:\n  - datatype: Text\n";
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }
}
