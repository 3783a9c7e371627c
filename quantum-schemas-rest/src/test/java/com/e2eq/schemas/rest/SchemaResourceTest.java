package com.e2eq.schemas.rest;

import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.security.TestSecurity;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
@TestSecurity(user = "editor@test-quantum-com", roles = {"editor"})
public class SchemaResourceTest {

    @Test
    void effective_schema_merges_ancestors() {
        given()
            .when()
                .get("/schemas/categories/{category}/effective", "Novel")
            .then()
                .statusCode(200)
                .contentType(ContentType.JSON)
                .body("category", is("Novel"))
                .body("lineage", contains("Book", "Novel"))
                .body("properties.name", contains("Has title", "Has author", "Has keyword", "Has genre", "Has page count"))
                .body("properties.find { it.name == 'Has author' }.required", is(1))
                .body("properties.find { it.name == 'Has author' }.origin", is("Book"))
                .body("properties.find { it.name == 'Has genre' }.required", is(0))
                .body("properties.find { it.name == 'Has keyword' }.multiValue", is(1))
                .body("warnings", hasSize(1))
                .body("warnings[0]", containsString("promoted to required"));
    }

    @Test
    void category_prefix_is_stripped() {
        given()
            .when()
                .get("/schemas/categories/{category}/effective", "category:Person")
            .then()
                .statusCode(200)
                .body("category", is("Person"))
                .body("subobjects[0].title", is("Subobject:Address"))
                .body("subobjects[0].properties.name", contains("Has street", "Has city"));
    }

    @Test
    void hierarchy_lists_ancestors_and_sources() {
        given()
            .when()
                .get("/schemas/categories/{category}/hierarchy", "Employee")
            .then()
                .statusCode(200)
                .body("rootCategory", is("Category:Employee"))
                .body("nodes.'Category:Employee'", contains("Category:Person"))
                .body("nodes.'Category:Agent'", empty())
                .body("inheritedProperties.find { it.propertyTitle == 'Property:Has name' }.sourceCategory", is("Category:Agent"))
                .body("inheritedProperties.find { it.propertyTitle == 'Property:Has email' }.sourceCategory", is("Category:Employee"))
                .body("inheritedProperties.find { it.propertyTitle == 'Property:Has email' }.required", is(1));
    }

    @Test
    void composition_places_shared_fields_once() {
        given()
            .queryParam("categories", "Person,Employee")
            .when()
                .get("/schemas/composition")
            .then()
                .statusCode(200)
                .body("categories", contains("Person", "Employee"))
                .body("properties.findAll { it.name == 'Has name' }", hasSize(1))
                .body("properties.find { it.name == 'Has name' }.title", is("Property:Has name"))
                .body("properties.find { it.name == 'Has name' }.shared", is(1))
                .body("properties.find { it.name == 'Has name' }.sources", contains("Person", "Employee"))
                .body("properties.find { it.name == 'Has employee ID' }.shared", is(0))
                .body("properties.find { it.name == 'Has email' }.required", is(1))
                .body("subobjects.find { it.name == 'Address' }.shared", is(1));
    }

    @Test
    void composition_accepts_repeated_parameters() {
        given()
            .queryParam("categories", "Category:Book")
            .queryParam("categories", " Company ")
            .when()
                .get("/schemas/composition")
            .then()
                .statusCode(200)
                .body("categories", contains("Book", "Company"));
    }

    @Test
    void artifacts_use_alphabetical_name() {
        given()
            .queryParam("categories", "Person,Employee")
            .when()
                .get("/schemas/artifacts")
            .then()
                .statusCode(200)
                .body("name", is("Employee+Person"))
                .body("units.category", contains("Person", "Employee"))
                .body("units[0].first", is(1))
                .body("units[1].properties.name", contains("Has employee ID", "Has employer"))
                .body("units[0].identityKey", startsWith("Person#"))
                .body("templates.Person", containsString("{{#if:{{{name|}}}|"))
                .body("form", containsString("{{{for template|Employee}}}"));
    }

    @Test
    void unknown_category_fails_whole_request() {
        given()
            .queryParam("categories", "Person,Ghost")
            .when()
                .get("/schemas/composition")
            .then()
                .statusCode(404)
                .body("status", is(404))
                .body("category", is("Ghost"))
                .body("statusMessage", containsString("Unknown category 'Ghost'"));
    }

    @Test
    void empty_selection_is_bad_request() {
        given()
            .when()
                .get("/schemas/artifacts")
            .then()
                .statusCode(400)
                .body("reasonMessage", is("Empty category selection"));
    }
}
