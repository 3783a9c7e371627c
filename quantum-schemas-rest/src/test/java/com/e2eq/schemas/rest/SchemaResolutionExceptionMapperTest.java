package com.e2eq.schemas.rest;

import com.e2eq.schemas.exceptions.CyclicInheritanceException;
import com.e2eq.schemas.exceptions.EmptySelectionException;
import com.e2eq.schemas.exceptions.UnknownCategoryException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaResolutionExceptionMapperTest {

    private final SchemaResolutionExceptionMapper mapper = new SchemaResolutionExceptionMapper();

    @Test
    void testUnknownCategoryIsNotFound() {
        Response response = mapper.toResponse(new UnknownCategoryException("Ghost"));

        assertEquals(404, response.getStatus());
        RestError error = (RestError) response.getEntity();
        assertEquals("Ghost", error.getCategory());
        assertEquals(404, error.getStatus());
    }

    @Test
    void testEmptySelectionIsBadRequest() {
        assertEquals(400, mapper.toResponse(new EmptySelectionException()).getStatus());
    }

    @Test
    void testCycleIsConflictWithChain() {
        Response response = mapper.toResponse(new CyclicInheritanceException("A", List.of("A", "B", "A")));

        assertEquals(409, response.getStatus());
        assertEquals(List.of("A", "B", "A"), ((RestError) response.getEntity()).getChain());
    }
}
