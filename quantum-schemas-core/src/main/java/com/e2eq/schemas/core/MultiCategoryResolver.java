package com.e2eq.schemas.core;

import com.e2eq.schemas.core.ComposedSchema.CategorySlice;
import com.e2eq.schemas.core.PromotionWarning.FieldKind;
import com.e2eq.schemas.exceptions.EmptySelectionException;
import com.e2eq.schemas.exceptions.UnknownCategoryException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Composes the effective schemas of several categories into one {@link ComposedSchema}.
 * <p>
 * Categories are processed in the given order. The first category declaring a property or
 * subobject owns it; later declarations are removed from their own slice but still fold into the
 * owner's requirement, so a later "required" promotes the owner's copy. Properties and subobjects
 * go through the same fold.
 * </p>
 * The resolver never reorders its input. Callers building a selection without a meaningful order
 * should pass it through {@link #sortedSelection(Collection)} first.
 */
public class MultiCategoryResolver {

    private static final Logger LOG = Logger.getLogger(MultiCategoryResolver.class);

    private final InheritanceResolver inheritance;

    public MultiCategoryResolver(InheritanceResolver inheritance) {
        this.inheritance = Objects.requireNonNull(inheritance, "inheritance");
    }

    /**
     * @throws EmptySelectionException  if no category is given
     * @throws UnknownCategoryException if any category cannot be resolved; no partial result is returned
     */
    public ComposedSchema resolve(List<String> categoryNames) {
        if (categoryNames == null || categoryNames.isEmpty()) {
            throw new EmptySelectionException();
        }

        List<String> selection = new ArrayList<>(new LinkedHashSet<>(categoryNames));
        if (selection.size() != categoryNames.size()) {
            LOG.debugf("Collapsed duplicate categories in selection %s", categoryNames);
        }

        // resolve everything up front so a bad name aborts before any composition work
        List<EffectiveSchema> effective = new ArrayList<>(selection.size());
        for (String name : selection) {
            effective.add(inheritance.resolve(name));
        }

        FieldFold<PropertyDefinition> properties = new FieldFold<>(FieldKind.PROPERTY);
        FieldFold<SubobjectDefinition> subobjects = new FieldFold<>(FieldKind.SUBOBJECT);
        Map<String, List<String>> ownedProperties = new LinkedHashMap<>();
        Map<String, List<String>> ownedSubobjects = new LinkedHashMap<>();

        List<PromotionWarning> warnings = new ArrayList<>();
        for (EffectiveSchema schema : effective) {
            String category = schema.category();
            warnings.addAll(schema.warnings());
            List<String> ownProps = ownedProperties.computeIfAbsent(category, k -> new ArrayList<>());
            for (PropertyDefinition p : schema.properties()) {
                if (properties.offer(category, p)) {
                    ownProps.add(p.name());
                }
            }
            List<String> ownSubs = ownedSubobjects.computeIfAbsent(category, k -> new ArrayList<>());
            for (SubobjectDefinition s : schema.subobjects()) {
                if (subobjects.offer(category, s)) {
                    ownSubs.add(s.name());
                }
            }
        }

        Map<String, String> propertySources = properties.owners();
        Map<String, String> subobjectSources = subobjects.owners();

        List<PromotionWarning> crossCategory = new ArrayList<>();
        Map<String, PropertyDefinition> foldedProperties = index(properties.fold(propertySources::get, crossCategory));
        Map<String, SubobjectDefinition> foldedSubobjects = index(subobjects.fold(subobjectSources::get, crossCategory));
        for (PromotionWarning w : crossCategory) {
            LOG.debugf("Composition: %s", w.message());
        }
        warnings.addAll(crossCategory);

        List<CategorySlice> slices = new ArrayList<>(selection.size());
        for (String category : selection) {
            slices.add(new CategorySlice(category,
                    ownedProperties.get(category).stream().map(foldedProperties::get).toList(),
                    ownedSubobjects.get(category).stream().map(foldedSubobjects::get).toList()));
        }

        LOG.tracef("Composed %s: %d properties, %d subobjects, %d warnings",
                selection, foldedProperties.size(), foldedSubobjects.size(), warnings.size());

        return new ComposedSchema(slices, propertySources, subobjectSources,
                properties.declarers(), subobjects.declarers(), warnings);
    }

    /**
     * Alphabetical order for selections made without an explicit order, such as a multi-select.
     */
    public static List<String> sortedSelection(Collection<String> categoryNames) {
        if (categoryNames == null) {
            return List.of();
        }
        return categoryNames.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    private static <F extends ResolvedField> Map<String, F> index(List<F> fields) {
        Map<String, F> byName = new LinkedHashMap<>();
        for (F f : fields) {
            byName.put(f.name(), f);
        }
        return byName;
    }
}
