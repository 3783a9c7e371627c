package com.e2eq.schemas.exceptions;

import java.util.List;

/**
 * Thrown when a category reappears in its own ancestor chain.
 */
public class CyclicInheritanceException extends SchemaResolutionException {
    private static final long serialVersionUID = 1L;

    private final List<String> chain;

    public CyclicInheritanceException(String category, List<String> chain) {
        super("Cycle detected in category hierarchy involving '" + category + "': " + String.join(" -> ", chain), category);
        this.chain = List.copyOf(chain);
    }

    /**
     * The chain walked from the requested category up to and including the repeated name.
     */
    public List<String> getChain() {
        return chain;
    }
}
