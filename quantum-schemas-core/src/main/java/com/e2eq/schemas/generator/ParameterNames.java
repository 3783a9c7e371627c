package com.e2eq.schemas.generator;

import java.util.Locale;

/**
 * Maps property names to template parameter names and display labels. Forms, templates and
 * display rows all go through here so the same property always binds to the same parameter.
 */
public final class ParameterNames {
    private ParameterNames() {}

    private static final String HAS_PREFIX = "Has ";

    /** "Has birth date" becomes "birth_date"; "Has ns:Thing" becomes "ns_thing". */
    public static String parameterOf(String propertyName) {
        if (propertyName == null) {
            return "";
        }
        String param = stripHas(propertyName);
        param = param.replace(':', '_');
        param = param.trim().toLowerCase(Locale.ROOT);
        return param.replace(' ', '_');
    }

    /** "Has birth date" becomes "birth date". */
    public static String labelOf(String propertyName) {
        if (propertyName == null) {
            return "";
        }
        return stripHas(propertyName).trim();
    }

    private static String stripHas(String name) {
        return name.startsWith(HAS_PREFIX) ? name.substring(HAS_PREFIX.length()) : name;
    }
}
