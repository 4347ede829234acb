package com.tradeingest.domain.enums;

import java.util.Locale;
import java.util.Map;

/** Status of a normalized order. Imported executions default to FILLED. */
public enum OrderStatus {
    PENDING,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED;

    private static final Map<String, OrderStatus> VOCABULARY = Map.ofEntries(
            Map.entry("WORKING", PENDING),
            Map.entry("OPEN", PENDING),
            Map.entry("PENDING", PENDING),
            Map.entry("PARTIALLY_FILLED", PARTIALLY_FILLED),
            Map.entry("PARTIAL", PARTIALLY_FILLED),
            Map.entry("FILLED", FILLED),
            Map.entry("EXECUTED", FILLED),
            Map.entry("CANCELLED", CANCELLED),
            Map.entry("CANCELED", CANCELLED),
            Map.entry("REJECTED", REJECTED),
            Map.entry("EXPIRED", EXPIRED));

    public static OrderStatus normalize(String raw, OrderStatus fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return VOCABULARY.getOrDefault(raw.trim().toUpperCase(Locale.ROOT), fallback);
    }
}
