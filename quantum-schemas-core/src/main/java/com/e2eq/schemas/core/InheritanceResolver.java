package com.e2eq.schemas.core;

import com.e2eq.schemas.core.PromotionWarning.FieldKind;
import com.e2eq.schemas.core.SchemaStore.*;
import com.e2eq.schemas.exceptions.CyclicInheritanceException;
import com.e2eq.schemas.exceptions.SchemaResolutionException;
import com.e2eq.schemas.exceptions.UnknownCategoryException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Merges a category's schema with its single-parent ancestor chain.
 * <p>
 * Schemas are folded from the root ancestor down to the requested category. A name declared at
 * several levels keeps the position of its first (root-most) declaration and is required if any
 * level requires it. Conflicts are reported as {@link PromotionWarning}s on the result, never
 * thrown.
 * </p>
 * Nothing is cached: each call reads the store afresh.
 */
public class InheritanceResolver {

    private static final Logger LOG = Logger.getLogger(InheritanceResolver.class);

    private final SchemaStore store;

    public InheritanceResolver(SchemaStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public SchemaStore store() {
        return store;
    }

    /**
     * Resolve the effective schema of a category.
     *
     * @throws UnknownCategoryException    if the category or one of its ancestors has no schema
     * @throws CyclicInheritanceException  if the category reappears in its own ancestor chain
     */
    public EffectiveSchema resolve(String categoryName) {
        List<String> lineage = lineageOf(categoryName);

        FieldFold<PropertyDefinition> properties = new FieldFold<>(FieldKind.PROPERTY);
        FieldFold<SubobjectDefinition> subobjects = new FieldFold<>(FieldKind.SUBOBJECT);

        for (String level : lineage) {
            CategorySchema schema = store.schemaOf(level).orElseThrow(() -> new UnknownCategoryException(level));
            for (Declaration d : schema.properties()) {
                properties.offer(level, toProperty(d));
            }
            for (Declaration d : schema.subobjects()) {
                subobjects.offer(level, toSubobject(d));
            }
        }

        List<PromotionWarning> warnings = new ArrayList<>();
        List<PropertyDefinition> mergedProperties = properties.fold(name -> categoryName, warnings);
        List<SubobjectDefinition> mergedSubobjects = subobjects.fold(name -> categoryName, warnings);

        for (PromotionWarning w : warnings) {
            LOG.debugf("Inheritance: %s", w.message());
        }
        LOG.tracef("Resolved '%s' through %s: %d properties, %d subobjects",
                categoryName, lineage, mergedProperties.size(), mergedSubobjects.size());

        return new EffectiveSchema(categoryName, lineage, mergedProperties, mergedSubobjects,
                properties.owners(), subobjects.owners(), warnings);
    }

    /**
     * The ancestor chain of a category, root first and the category itself last.
     *
     * @throws UnknownCategoryException    if the category or one of its ancestors has no schema
     * @throws CyclicInheritanceException  if the chain loops
     */
    public List<String> lineageOf(String categoryName) {
        CategorySchema current = store.schemaOf(categoryName)
                .orElseThrow(() -> new UnknownCategoryException(categoryName));

        // bounded by the store size: every step adds a distinct name or throws
        LinkedHashSet<String> chain = new LinkedHashSet<>();
        chain.add(categoryName);
        String child = categoryName;
        while (current.parent().isPresent()) {
            String parent = current.parent().get();
            if (chain.contains(parent)) {
                List<String> walked = new ArrayList<>(chain);
                walked.add(parent);
                throw new CyclicInheritanceException(categoryName, walked);
            }
            String referencedBy = child;
            current = store.schemaOf(parent).orElseThrow(() -> new UnknownCategoryException(parent, referencedBy));
            chain.add(parent);
            child = parent;
        }

        List<String> lineage = new ArrayList<>(chain);
        Collections.reverse(lineage);
        return lineage;
    }

    /**
     * Whether {@code ancestor} appears in the chain above {@code category}. A category is not its
     * own ancestor.
     */
    public boolean isAncestorOf(String ancestor, String category) {
        List<String> lineage = lineageOf(category);
        return lineage.subList(0, lineage.size() - 1).contains(ancestor);
    }

    /**
     * Checks every category in the store and returns one message per broken chain.
     */
    public List<String> validateInheritance() {
        List<String> errors = new ArrayList<>();
        for (String name : store.categories().keySet()) {
            try {
                lineageOf(name);
            } catch (SchemaResolutionException e) {
                errors.add(e.getMessage());
            }
        }
        return errors;
    }

    private PropertyDefinition toProperty(Declaration d) {
        return new PropertyDefinition(d.name(), store.datatypeOf(d.name()), d.requirement(), store.isMultiValue(d.name()));
    }

    private SubobjectDefinition toSubobject(Declaration d) {
        List<PropertyDefinition> nested = store.subobjectOf(d.name())
                .map(SubobjectType::properties)
                .orElse(List.of())
                .stream()
                .map(this::toProperty)
                .toList();
        return new SubobjectDefinition(d.name(), d.requirement(), nested);
    }
}
