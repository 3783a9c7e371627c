package com.e2eq.schemas.rest;

import com.e2eq.schemas.core.*;
import com.e2eq.schemas.core.CategoryHierarchyService.HierarchyView;
import com.e2eq.schemas.generator.CompositeArtifacts;
import com.e2eq.schemas.generator.CompositeGenerator;
import com.e2eq.schemas.generator.FieldSpec;
import com.e2eq.schemas.generator.GenerationUnit;
import com.e2eq.schemas.generator.SubobjectSpec;
import com.e2eq.schemas.rest.dto.*;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.*;
import java.util.function.Function;

@ApplicationScoped
public class SchemaPayloadService {

    static final String PROPERTY_PREFIX = CategoryHierarchyService.PROPERTY_PREFIX;
    static final String SUBOBJECT_PREFIX = "Subobject:";

    private final InheritanceResolver inheritanceResolver;
    private final MultiCategoryResolver multiCategoryResolver;
    private final CategoryHierarchyService hierarchyService;
    private final CompositeGenerator compositeGenerator;

    @Inject
    public SchemaPayloadService(InheritanceResolver inheritanceResolver,
                                MultiCategoryResolver multiCategoryResolver,
                                CategoryHierarchyService hierarchyService,
                                CompositeGenerator compositeGenerator) {
        this.inheritanceResolver = Objects.requireNonNull(inheritanceResolver, "inheritanceResolver");
        this.multiCategoryResolver = Objects.requireNonNull(multiCategoryResolver, "multiCategoryResolver");
        this.hierarchyService = Objects.requireNonNull(hierarchyService, "hierarchyService");
        this.compositeGenerator = Objects.requireNonNull(compositeGenerator, "compositeGenerator");
    }

    /**
     * Trims and removes a case-insensitive {@code Category:} prefix.
     */
    public static String stripPrefix(String categoryName) {
        String trimmed = StringUtils.trimToEmpty(categoryName);
        return StringUtils.trim(StringUtils.removeStartIgnoreCase(trimmed, CategoryHierarchyService.CATEGORY_PREFIX));
    }

    /**
     * Flattens repeated and comma separated values into clean category names, keeping their order.
     */
    public static List<String> parseSelection(List<String> raw) {
        List<String> names = new ArrayList<>();
        if (raw == null) {
            return names;
        }
        for (String value : raw) {
            if (value == null) continue;
            for (String part : StringUtils.split(value, ',')) {
                String name = stripPrefix(part);
                if (StringUtils.isNotEmpty(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    public EffectiveSchemaPayload effective(String category) {
        EffectiveSchema schema = inheritanceResolver.resolve(stripPrefix(category));
        List<EffectiveSchemaPayload.Property> properties = schema.properties().stream()
                .map(p -> property(p, schema.propertyOrigins().get(p.name())))
                .toList();
        List<EffectiveSchemaPayload.Subobject> subobjects = schema.subobjects().stream()
                .map(s -> new EffectiveSchemaPayload.Subobject(
                        s.name(),
                        SUBOBJECT_PREFIX + s.name(),
                        flag(s.required()),
                        schema.subobjectOrigins().get(s.name()),
                        s.properties().stream().map(p -> property(p, null)).toList()))
                .toList();
        return new EffectiveSchemaPayload(schema.category(), schema.lineage(), properties, subobjects, messages(schema.warnings()));
    }

    public HierarchyPayload hierarchy(String category) {
        HierarchyView view = hierarchyService.hierarchyOf(stripPrefix(category));
        return new HierarchyPayload(view.rootCategory(), view.nodes(),
                view.inheritedProperties().stream()
                        .map(p -> new HierarchyPayload.InheritedProperty(p.propertyTitle(), p.sourceCategory(), flag(p.required())))
                        .toList());
    }

    public CompositionPayload composition(List<String> categories) {
        ComposedSchema composed = multiCategoryResolver.resolve(parseSelection(categories));
        return new CompositionPayload(
                composed.categoryNames(),
                fields(composed.properties(), PropertyDefinition::name, PropertyDefinition::required, PROPERTY_PREFIX, composed::propertySources),
                fields(composed.subobjects(), SubobjectDefinition::name, SubobjectDefinition::required, SUBOBJECT_PREFIX, composed::subobjectSources),
                messages(composed.warnings()));
    }

    public ArtifactsPayload artifacts(List<String> categories) {
        ComposedSchema composed = multiCategoryResolver.resolve(parseSelection(categories));
        CompositeArtifacts artifacts = compositeGenerator.render(composed);
        List<ArtifactsPayload.Unit> units = artifacts.units().stream().map(SchemaPayloadService::unit).toList();
        return new ArtifactsPayload(artifacts.name(), units, artifacts.templates(), artifacts.form(), messages(artifacts.warnings()));
    }

    private static ArtifactsPayload.Unit unit(GenerationUnit unit) {
        return new ArtifactsPayload.Unit(
                unit.category(),
                unit.identityKey(),
                flag(unit.first()),
                unit.properties().stream().map(SchemaPayloadService::field).toList(),
                unit.subobjects().stream().map(SubobjectSpec::subobject).toList());
    }

    private static ArtifactsPayload.Field field(FieldSpec f) {
        return new ArtifactsPayload.Field(f.property(), f.parameter(), f.label(), f.input(),
                flag(f.mandatory()), flag(f.multiValue()), flag(f.shared()));
    }

    private static EffectiveSchemaPayload.Property property(PropertyDefinition p, String origin) {
        return new EffectiveSchemaPayload.Property(p.name(), PROPERTY_PREFIX + p.name(), p.datatype().label(),
                flag(p.required()), flag(p.multiValue()), origin);
    }

    private static <F> List<FieldPayload> fields(List<F> defs,
                                                 Function<F, String> name,
                                                 Function<F, Boolean> required,
                                                 String titlePrefix,
                                                 Function<String, List<String>> sources) {
        return defs.stream()
                .map(d -> {
                    String n = name.apply(d);
                    List<String> src = sources.apply(n);
                    return new FieldPayload(n, titlePrefix + n, flag(required.apply(d)), flag(src.size() > 1), src);
                })
                .toList();
    }

    private static List<String> messages(List<PromotionWarning> warnings) {
        return warnings.stream().map(PromotionWarning::message).toList();
    }

    private static int flag(boolean value) {
        return value ? 1 : 0;
    }
}
