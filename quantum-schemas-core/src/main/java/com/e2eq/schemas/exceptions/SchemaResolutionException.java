package com.e2eq.schemas.exceptions;

/**
 * Base class for fatal resolution failures. A resolution that throws one of these produces
 * no partial result; callers must not render templates or forms from it.
 */
public class SchemaResolutionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String category;

    public SchemaResolutionException(String message) {
        this(message, null, null);
    }

    public SchemaResolutionException(String message, String category) {
        this(message, category, null);
    }

    public SchemaResolutionException(String message, String category, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    /**
     * The category being resolved when the failure occurred, if known.
     */
    public String getCategory() {
        return category;
    }
}
