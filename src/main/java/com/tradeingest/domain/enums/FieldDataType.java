package com.tradeingest.domain.enums;

import java.util.Locale;

/** Coercion applied to a mapped value before it lands on a canonical field. */
public enum FieldDataType {
    STRING,
    NUMBER,
    DATE,
    BOOLEAN;

    /** Lenient lookup; unknown or missing names default to STRING. */
    public static FieldDataType fromName(String name) {
        if (name == null || name.isBlank()) {
            return STRING;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STRING;
        }
    }
}
