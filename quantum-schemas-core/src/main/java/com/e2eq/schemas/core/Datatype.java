package com.e2eq.schemas.core;

import java.util.Locale;

/**
 * Property datatypes known to the platform. Lookups never fail: anything unrecognised is
 * treated as {@link #PAGE}.
 */
public enum Datatype {
    PAGE("Page"),
    TEXT("Text"),
    NUMBER("Number"),
    BOOLEAN("Boolean"),
    DATE("Date"),
    EMAIL("Email"),
    URL("URL"),
    TELEPHONE_NUMBER("Telephone number"),
    CODE("Code"),
    GEOGRAPHIC_COORDINATE("Geographic coordinate"),
    QUANTITY("Quantity"),
    TEMPERATURE("Temperature");

    private final String label;

    Datatype(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Datatype fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return PAGE;
        }
        String wanted = label.trim().toLowerCase(Locale.ROOT);
        for (Datatype dt : values()) {
            if (dt.label.toLowerCase(Locale.ROOT).equals(wanted)
                    || dt.name().toLowerCase(Locale.ROOT).equals(wanted)) {
                return dt;
            }
        }
        return PAGE;
    }

    @Override
    public String toString() {
        return label;
    }
}
