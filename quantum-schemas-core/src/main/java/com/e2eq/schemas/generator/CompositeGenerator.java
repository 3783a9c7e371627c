package com.e2eq.schemas.generator;

import com.e2eq.schemas.core.ComposedSchema;
import com.e2eq.schemas.core.ComposedSchema.CategorySlice;
import com.e2eq.schemas.core.PropertyDefinition;
import com.e2eq.schemas.core.SchemaHasher;
import com.e2eq.schemas.core.SchemaStore;
import com.e2eq.schemas.core.SchemaStore.PropertyType;
import com.e2eq.schemas.core.SchemaStore.SubobjectType;
import com.e2eq.schemas.core.SubobjectDefinition;
import org.jboss.logging.Logger;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Turns a {@link ComposedSchema} into generation units and rendered artifacts.
 * <p>
 * One unit per slice, in slice order. Fields declared by two or more selected categories are
 * placed in the first unit only; later units keep just the fields they alone declare. Every
 * field therefore appears in exactly one unit.
 * </p>
 */
public class CompositeGenerator {

    private static final Logger LOG = Logger.getLogger(CompositeGenerator.class);

    public static final String NAME_SEPARATOR = "+";
    static final int IDENTITY_HASH_LENGTH = 12;

    private final SchemaStore store;
    private final PropertyInputMapper inputMapper;
    private final UnitTemplateRenderer templateRenderer;
    private final CompositeFormRenderer formRenderer;

    public CompositeGenerator(SchemaStore store) {
        this(store, new WikitextTemplateRenderer(), new WikitextFormRenderer());
    }

    public CompositeGenerator(SchemaStore store, UnitTemplateRenderer templateRenderer, CompositeFormRenderer formRenderer) {
        this.store = Objects.requireNonNull(store, "store");
        this.inputMapper = new PropertyInputMapper(store);
        this.templateRenderer = Objects.requireNonNull(templateRenderer, "templateRenderer");
        this.formRenderer = Objects.requireNonNull(formRenderer, "formRenderer");
    }

    public List<GenerationUnit> generate(ComposedSchema composed) {
        Objects.requireNonNull(composed, "composed");
        List<CategorySlice> slices = composed.slices();
        List<GenerationUnit> units = new ArrayList<>(slices.size());

        for (int i = 0; i < slices.size(); i++) {
            CategorySlice slice = slices.get(i);
            List<PropertyDefinition> props = new ArrayList<>();
            List<SubobjectDefinition> subs = new ArrayList<>();

            if (i == 0) {
                props.addAll(slice.properties());
                subs.addAll(slice.subobjects());
                // shared fields owned further down move up to the first unit
                for (CategorySlice later : slices.subList(1, slices.size())) {
                    later.properties().stream().filter(p -> composed.isSharedProperty(p.name())).forEach(props::add);
                    later.subobjects().stream().filter(s -> composed.isSharedSubobject(s.name())).forEach(subs::add);
                }
            } else {
                slice.properties().stream().filter(p -> !composed.isSharedProperty(p.name())).forEach(props::add);
                slice.subobjects().stream().filter(s -> !composed.isSharedSubobject(s.name())).forEach(subs::add);
            }

            String key = identityKey(slice.category(), props, subs);
            units.add(new GenerationUnit(slice.category(), key,
                    props.stream().map(p -> fieldSpec(p, composed.propertySources(p.name()))).toList(),
                    subs.stream().map(s -> subobjectSpec(s, composed.subobjectSources(s.name()))).toList(),
                    i == 0));
        }

        LOG.debugf("Generated %d units for %s", units.size(), composed.categoryNames());
        return units;
    }

    /**
     * Category names in alphabetical order joined with {@value #NAME_SEPARATOR}, so every
     * ordering of the same selection names the same artifact.
     */
    public static String compositeName(ComposedSchema composed) {
        return compositeName(composed.categoryNames());
    }

    public static String compositeName(Collection<String> categoryNames) {
        return categoryNames.stream()
                .distinct()
                .sorted(String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.joining(NAME_SEPARATOR));
    }

    public CompositeArtifacts render(ComposedSchema composed) {
        List<GenerationUnit> units = generate(composed);
        String name = compositeName(composed);

        Map<String, String> templates = new LinkedHashMap<>();
        for (GenerationUnit unit : units) {
            templates.put(unit.category(), templateRenderer.render(unit));
        }
        String form = formRenderer.render(name, units);

        LOG.debugf("Rendered composite '%s': %d templates, %d warnings", name, templates.size(), composed.warnings().size());
        return new CompositeArtifacts(name, units, templates, form, composed.warnings());
    }

    static String identityKey(String category, List<PropertyDefinition> properties, List<SubobjectDefinition> subobjects) {
        String hash = SchemaHasher.fieldSetHash(category, properties, subobjects);
        return category + "#" + hash.substring(0, IDENTITY_HASH_LENGTH);
    }

    private FieldSpec fieldSpec(PropertyDefinition p, List<String> sources) {
        String label = store.propertyOf(p.name())
                .map(PropertyType::label)
                .filter(l -> !l.equals(p.name()))
                .orElse(ParameterNames.labelOf(p.name()));
        return new FieldSpec(p.name(),
                ParameterNames.parameterOf(p.name()),
                label,
                p.datatype(),
                inputMapper.inputType(p),
                inputMapper.inputDefinition(p),
                p.required(),
                p.multiValue(),
                sources.size() > 1,
                sources);
    }

    private SubobjectSpec subobjectSpec(SubobjectDefinition s, List<String> sources) {
        String label = store.subobjectOf(s.name())
                .map(SubobjectType::label)
                .orElse(s.name());
        return new SubobjectSpec(s.name(),
                ParameterNames.parameterOf(s.name()),
                label,
                s.required(),
                sources.size() > 1,
                sources,
                s.properties().stream().map(p -> fieldSpec(p, List.of())).toList());
    }
}
