package com.e2eq.schemas.exceptions;

/**
 * Thrown when a category name has no schema in the store. Also raised when a category
 * references a parent the store does not know.
 */
public class UnknownCategoryException extends SchemaResolutionException {
    private static final long serialVersionUID = 1L;

    private final String referencedBy;

    public UnknownCategoryException(String category) {
        super("Unknown category '" + category + "'", category);
        this.referencedBy = null;
    }

    public UnknownCategoryException(String category, String referencedBy) {
        super(String.format("Unknown category '%s' referenced as parent of '%s'", category, referencedBy), category);
        this.referencedBy = referencedBy;
    }

    /**
     * The child category whose parent link is dangling, or null when the requested category
     * itself is unknown.
     */
    public String getReferencedBy() {
        return referencedBy;
    }
}
