package com.e2eq.schemas.rest;

import com.e2eq.schemas.rest.dto.ArtifactsPayload;
import com.e2eq.schemas.rest.dto.CompositionPayload;
import com.e2eq.schemas.rest.dto.EffectiveSchemaPayload;
import com.e2eq.schemas.rest.dto.HierarchyPayload;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

/**
 * Read-only access to resolved category schemas. A selection that names any unknown category
 * fails as a whole.
 */
@Path("/schemas")
@RolesAllowed({"admin", "editor"})
@Tag(name = "schemas", description = "Category schema resolution, composition and artifact generation")
public class SchemaResource {

    private final SchemaPayloadService payloadService;

    @Inject
    public SchemaResource(SchemaPayloadService payloadService) {
        this.payloadService = payloadService;
    }

    @GET
    @Path("/categories/{category}/effective")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Effective schema of a category, including inherited fields")
    public EffectiveSchemaPayload effective(@PathParam("category") String category) {
        return payloadService.effective(category);
    }

    @GET
    @Path("/categories/{category}/hierarchy")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Ancestor chain and inherited properties of a category")
    public HierarchyPayload hierarchy(@PathParam("category") String category) {
        return payloadService.hierarchy(category);
    }

    @GET
    @Path("/composition")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Compose several categories into one duplicate-free field set")
    public CompositionPayload composition(@QueryParam("categories") List<String> categories) {
        return payloadService.composition(categories);
    }

    @GET
    @Path("/artifacts")
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Templates and form generated for a category selection")
    public ArtifactsPayload artifacts(@QueryParam("categories") List<String> categories) {
        return payloadService.artifacts(categories);
    }
}
