package com.tradeingest.domain.enums;

import java.util.Locale;
import java.util.Map;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT,
    TRAILING_STOP,
    MARKET_ON_CLOSE,
    LIMIT_ON_CLOSE;

    private static final Map<String, OrderType> VOCABULARY = Map.ofEntries(
            Map.entry("MARKET", MARKET),
            Map.entry("MKT", MARKET),
            Map.entry("LIMIT", LIMIT),
            Map.entry("LMT", LIMIT),
            Map.entry("STOP", STOP),
            Map.entry("STP", STOP),
            Map.entry("STOP_LIMIT", STOP_LIMIT),
            Map.entry("STP LMT", STOP_LIMIT),
            Map.entry("TRAILING_STOP", TRAILING_STOP),
            Map.entry("TRAIL", TRAILING_STOP),
            Map.entry("MARKET_ON_CLOSE", MARKET_ON_CLOSE),
            Map.entry("MOC", MARKET_ON_CLOSE),
            Map.entry("LIMIT_ON_CLOSE", LIMIT_ON_CLOSE),
            Map.entry("LOC", LIMIT_ON_CLOSE));

    /** Unknown or missing types fall back to MARKET. */
    public static OrderType normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return MARKET;
        }
        return VOCABULARY.getOrDefault(raw.trim().toUpperCase(Locale.ROOT), MARKET);
    }
}
