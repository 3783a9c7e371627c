package com.e2eq.schemas.runtime;

import com.e2eq.schemas.core.CategoryHierarchyService;
import com.e2eq.schemas.core.InheritanceResolver;
import com.e2eq.schemas.core.MultiCategoryResolver;
import com.e2eq.schemas.core.SchemaStore;
import com.e2eq.schemas.core.SchemaStore.SchemaSet;
import com.e2eq.schemas.core.SchemaStoreValidator;
import com.e2eq.schemas.core.YamlSchemaLoader;
import com.e2eq.schemas.generator.CompositeGenerator;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads the category schemas once at startup and exposes the store, the resolvers and the
 * generator for injection. Everything produced is immutable, so one instance serves all requests.
 */
@ApplicationScoped
public class SchemaStoreProducer {

    private static final Logger LOG = Logger.getLogger(SchemaStoreProducer.class);
    static final String FILE_PREFIX = "file:";

    private final String location;
    private final boolean validateOnLoad;

    private SchemaStore store;
    private InheritanceResolver inheritanceResolver;
    private MultiCategoryResolver multiCategoryResolver;
    private CategoryHierarchyService hierarchyService;
    private CompositeGenerator compositeGenerator;

    @Inject
    public SchemaStoreProducer(@ConfigProperty(name = "quantum.schemas.location", defaultValue = "schemas/categories.yaml")
                               String location,
                               @ConfigProperty(name = "quantum.schemas.validate-on-load", defaultValue = "true")
                               boolean validateOnLoad) {
        this.location = location;
        this.validateOnLoad = validateOnLoad;
    }

    @PostConstruct
    void init() {
        this.store = SchemaStore.inMemory(loadSchemaSet());
        if (validateOnLoad) {
            List<String> problems = SchemaStoreValidator.validate(store);
            problems.forEach(p -> LOG.warnf("Schema problem: %s", p));
            if (problems.isEmpty()) {
                LOG.debugf("Schemas from %s validated cleanly", location);
            }
        }
        this.inheritanceResolver = new InheritanceResolver(store);
        this.multiCategoryResolver = new MultiCategoryResolver(inheritanceResolver);
        this.hierarchyService = new CategoryHierarchyService(inheritanceResolver);
        this.compositeGenerator = new CompositeGenerator(store);
        LOG.infof("Schema store ready (hash %s)", store.getHash());
    }

    @Produces
    public SchemaStore schemaStore() {
        return store;
    }

    @Produces
    public InheritanceResolver inheritanceResolver() {
        return inheritanceResolver;
    }

    @Produces
    public MultiCategoryResolver multiCategoryResolver() {
        return multiCategoryResolver;
    }

    @Produces
    public CategoryHierarchyService categoryHierarchyService() {
        return hierarchyService;
    }

    @Produces
    public CompositeGenerator compositeGenerator() {
        return compositeGenerator;
    }

    private SchemaSet loadSchemaSet() {
        YamlSchemaLoader loader = new YamlSchemaLoader();
        try {
            if (location.startsWith(FILE_PREFIX)) {
                return loader.loadFromPath(Path.of(location.substring(FILE_PREFIX.length())));
            }
            return loader.loadFromClasspath(location);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load category schemas from " + location, e);
        }
    }
}
