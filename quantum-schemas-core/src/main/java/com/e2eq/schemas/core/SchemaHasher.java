package com.e2eq.schemas.core;

import com.e2eq.schemas.core.SchemaStore.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Computes stable hashes by canonicalizing to sorted JSON.
 */
public final class SchemaHasher {
    private SchemaHasher() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static String computeHash(SchemaSet set) {
        return sha256(canonicalize(set));
    }

    /**
     * Hash of a generation unit's field set. Field order does not matter; names, requirement
     * and multi-value flags do.
     */
    public static String fieldSetHash(String category,
                                      Collection<PropertyDefinition> properties,
                                      Collection<SubobjectDefinition> subobjects) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("category", category);
        Map<String, Object> props = new TreeMap<>();
        for (PropertyDefinition p : properties) {
            props.put(p.name(), describe(p));
        }
        canonical.put("properties", props);
        Map<String, Object> subs = new TreeMap<>();
        for (SubobjectDefinition s : subobjects) {
            Map<String, Object> sData = new TreeMap<>();
            sData.put("requirement", s.requirement().name());
            sData.put("properties", s.properties().stream()
                    .collect(Collectors.toMap(PropertyDefinition::name, SchemaHasher::describe, (a, b) -> a, TreeMap::new)));
            subs.put(s.name(), sData);
        }
        canonical.put("subobjects", subs);
        return sha256(canonical);
    }

    private static Map<String, Object> describe(PropertyDefinition p) {
        Map<String, Object> pData = new TreeMap<>();
        pData.put("datatype", p.datatype().label());
        pData.put("requirement", p.requirement().name());
        pData.put("multiValue", p.multiValue());
        return pData;
    }

    private static Map<String, Object> canonicalize(SchemaSet set) {
        Map<String, Object> result = new TreeMap<>();

        Map<String, Object> categories = new TreeMap<>();
        for (CategorySchema c : set.categories().values()) {
            Map<String, Object> cData = new TreeMap<>();
            cData.put("name", c.name());
            cData.put("parent", c.parent().orElse(null));
            cData.put("label", c.label());
            cData.put("description", c.description());
            // declaration order drives output order, so it is part of the identity
            cData.put("properties", declarations(c.properties()));
            cData.put("subobjects", declarations(c.subobjects()));
            categories.put(c.name(), cData);
        }
        result.put("categories", categories);

        Map<String, Object> properties = new TreeMap<>();
        for (PropertyType p : set.properties().values()) {
            Map<String, Object> pData = new TreeMap<>();
            pData.put("name", p.name());
            pData.put("datatype", p.datatype().label());
            pData.put("multiValue", p.multiValue());
            pData.put("label", p.label());
            pData.put("allowedValues", new ArrayList<>(p.allowedValues()));
            pData.put("rangeCategory", p.rangeCategory().orElse(null));
            properties.put(p.name(), pData);
        }
        result.put("properties", properties);

        Map<String, Object> subobjects = new TreeMap<>();
        for (SubobjectType s : set.subobjects().values()) {
            Map<String, Object> sData = new TreeMap<>();
            sData.put("name", s.name());
            sData.put("label", s.label());
            sData.put("properties", declarations(s.properties()));
            subobjects.put(s.name(), sData);
        }
        result.put("subobjects", subobjects);

        return result;
    }

    private static List<String> declarations(List<Declaration> decls) {
        return decls.stream()
                .map(d -> d.name() + "=" + d.requirement().name())
                .collect(Collectors.toList());
    }

    private static String sha256(Object canonical) {
        try {
            String json = MAPPER.writeValueAsString(canonical);
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(json.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (Exception e) {
            throw new RuntimeException("Failed to compute schema hash", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
