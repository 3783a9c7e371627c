package com.e2eq.schemas.generator;

import java.util.List;

/**
 * Renders one input form covering every unit of a composition, in unit order.
 */
public interface CompositeFormRenderer {
    String render(String compositeName, List<GenerationUnit> units);
}
