package com.e2eq.schemas.core;

import com.e2eq.schemas.core.SchemaStore.*;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a {@link SchemaSet} from a YAML (or JSON) document on the classpath or file system.
 * <pre>
 * properties:
 *   - id: Has name
 *     datatype: Text
 * subobjects:
 *   - id: Address
 *     required: [Has street]
 * categories:
 *   - id: Person
 *     parent: Agent
 *     properties:
 *       required: [Has name]
 *       optional: [Has phone]
 * </pre>
 * Within a category, required declarations come before optional ones.
 */
public final class YamlSchemaLoader {

    private static final Logger LOG = Logger.getLogger(YamlSchemaLoader.class);

    // DTOs mirroring YAML
    public record YSchema(Integer version, List<YProperty> properties, List<YSubobject> subobjects, List<YCategory> categories) {}
    public record YProperty(String id, String datatype, Boolean multiValue, String label, List<String> allowedValues, String rangeCategory) {}
    public record YSubobject(String id, String label, List<String> required, List<String> optional) {}
    public record YCategory(String id, String parent, String label, String description, YFields properties, YFields subobjects) {}
    public record YFields(List<String> required, List<String> optional) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public SchemaSet loadFromClasspath(String resourcePath) throws IOException {
        String path = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = YamlSchemaLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(path)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toSchemaSet(mapper.readValue(in, YSchema.class), resourcePath);
        }
    }

    public SchemaSet loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toSchemaSet(mapper.readValue(in, YSchema.class), path.toString());
        }
    }

    public SchemaSet load(InputStream in) throws IOException {
        return toSchemaSet(mapper.readValue(in, YSchema.class), "stream");
    }

    private SchemaSet toSchemaSet(YSchema y, String origin) {
        if (y == null) {
            return new SchemaSet(Map.of(), Map.of(), Map.of());
        }

        Map<String, PropertyType> properties = new LinkedHashMap<>();
        for (YProperty p : Optional.ofNullable(y.properties()).orElse(List.of())) {
            requireId(p.id(), "property", origin);
            Datatype datatype = Datatype.fromLabel(p.datatype());
            if (p.datatype() != null && datatype == Datatype.PAGE && !"page".equalsIgnoreCase(p.datatype().trim())) {
                LOG.warnf("Unknown datatype '%s' for property '%s' in %s, using Page", p.datatype(), p.id(), origin);
            }
            properties.put(p.id(), new PropertyType(
                    p.id(),
                    datatype,
                    Boolean.TRUE.equals(p.multiValue()),
                    p.label(),
                    p.allowedValues(),
                    Optional.ofNullable(p.rangeCategory()).filter(s -> !s.isBlank())));
        }

        Map<String, SubobjectType> subobjects = new LinkedHashMap<>();
        for (YSubobject s : Optional.ofNullable(y.subobjects()).orElse(List.of())) {
            requireId(s.id(), "subobject", origin);
            subobjects.put(s.id(), new SubobjectType(s.id(), s.label(), declarations(s.required(), s.optional())));
        }

        Map<String, CategorySchema> categories = new LinkedHashMap<>();
        for (YCategory c : Optional.ofNullable(y.categories()).orElse(List.of())) {
            requireId(c.id(), "category", origin);
            YFields props = Optional.ofNullable(c.properties()).orElse(new YFields(null, null));
            YFields subs = Optional.ofNullable(c.subobjects()).orElse(new YFields(null, null));
            CategorySchema previous = categories.put(c.id(), new CategorySchema(
                    c.id(),
                    Optional.ofNullable(c.parent()),
                    c.label(),
                    c.description(),
                    declarations(props.required(), props.optional()),
                    declarations(subs.required(), subs.optional())));
            if (previous != null) {
                LOG.warnf("Category '%s' defined more than once in %s; the last definition wins", c.id(), origin);
            }
        }

        LOG.infof("Loaded schema set from %s: %d categories, %d properties, %d subobjects",
                origin, categories.size(), properties.size(), subobjects.size());
        return new SchemaSet(categories, properties, subobjects);
    }

    private static List<Declaration> declarations(List<String> required, List<String> optional) {
        List<Declaration> result = new ArrayList<>();
        Optional.ofNullable(required).orElse(List.of()).stream()
                .filter(n -> n != null && !n.isBlank())
                .forEach(n -> result.add(Declaration.required(n.trim())));
        Optional.ofNullable(optional).orElse(List.of()).stream()
                .filter(n -> n != null && !n.isBlank())
                .forEach(n -> result.add(Declaration.optional(n.trim())));
        return result;
    }

    private static void requireId(String id, String what, String origin) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Every " + what + " needs an id (" + origin + ")");
        }
    }
}
