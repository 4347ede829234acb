package com.tradeingest.domain.enums;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical side of a normalized order. Broker vocabulary (BOT, SLD, B, S, YOU BOUGHT, ...)
 * is folded onto BUY/SELL; SHORT opens with a sell and COVER closes with a buy.
 */
public enum OrderSide {
    BUY,
    SELL;

    private static final Map<String, OrderSide> VOCABULARY = Map.ofEntries(
            Map.entry("BUY", BUY),
            Map.entry("BOT", BUY),
            Map.entry("B", BUY),
            Map.entry("BOUGHT", BUY),
            Map.entry("YOU BOUGHT", BUY),
            Map.entry("COVER", BUY),
            Map.entry("BUY TO COVER", BUY),
            Map.entry("SELL", SELL),
            Map.entry("SLD", SELL),
            Map.entry("S", SELL),
            Map.entry("SOLD", SELL),
            Map.entry("YOU SOLD", SELL),
            Map.entry("SHORT", SELL),
            Map.entry("SELL SHORT", SELL));

    /** Returns the canonical side for a raw broker value, or empty when the value is not recognised. */
    public static Optional<OrderSide> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(VOCABULARY.get(raw.trim().toUpperCase(Locale.ROOT)));
    }
}
