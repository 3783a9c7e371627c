package com.e2eq.schemas.rest;

import com.e2eq.schemas.exceptions.CyclicInheritanceException;
import com.e2eq.schemas.exceptions.EmptySelectionException;
import com.e2eq.schemas.exceptions.SchemaResolutionException;
import com.e2eq.schemas.exceptions.UnknownCategoryException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class SchemaResolutionExceptionMapper implements ExceptionMapper<SchemaResolutionException> {

    private static final Logger LOG = Logger.getLogger(SchemaResolutionExceptionMapper.class);

    @Override
    public Response toResponse(SchemaResolutionException e) {
        Response.Status status;
        String reason;
        RestError error = RestError.builder()
                .statusMessage(e.getMessage())
                .category(e.getCategory())
                .build();

        if (e instanceof UnknownCategoryException) {
            status = Response.Status.NOT_FOUND;
            reason = "Unknown category";
        } else if (e instanceof EmptySelectionException) {
            status = Response.Status.BAD_REQUEST;
            reason = "Empty category selection";
        } else if (e instanceof CyclicInheritanceException cyclic) {
            status = Response.Status.CONFLICT;
            reason = "Cyclic category inheritance";
            error.setChain(cyclic.getChain());
        } else {
            status = Response.Status.BAD_REQUEST;
            reason = "Schema resolution failed";
        }
        error.setStatus(status.getStatusCode());
        error.setReasonMessage(reason);

        LOG.debugf("%s: %s", reason, e.getMessage());
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(error).build();
    }
}
