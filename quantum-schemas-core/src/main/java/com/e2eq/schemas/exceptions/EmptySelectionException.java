package com.e2eq.schemas.exceptions;

public class EmptySelectionException extends SchemaResolutionException {
    private static final long serialVersionUID = 1L;

    public EmptySelectionException() {
        super("At least one category must be selected");
    }
}
