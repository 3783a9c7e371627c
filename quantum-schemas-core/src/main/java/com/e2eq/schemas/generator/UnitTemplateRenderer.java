package com.e2eq.schemas.generator;

/**
 * Renders the display/storage template of one generation unit.
 */
public interface UnitTemplateRenderer {
    String render(GenerationUnit unit);
}
