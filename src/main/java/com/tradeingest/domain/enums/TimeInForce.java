package com.tradeingest.domain.enums;

import java.util.Locale;

public enum TimeInForce {
    DAY,
    GTC,
    IOC,
    FOK,
    GTD;

    /** Unknown or missing values fall back to DAY. */
    public static TimeInForce normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return DAY;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DAY;
        }
    }
}
