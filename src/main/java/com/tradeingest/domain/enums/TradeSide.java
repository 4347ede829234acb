package com.tradeingest.domain.enums;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Trade-level side. Unlike {@link OrderSide} it keeps SHORT and COVER distinct. */
public enum TradeSide {
    BUY,
    SELL,
    SHORT,
    COVER;

    private static final Map<String, TradeSide> VOCABULARY = Map.ofEntries(
            Map.entry("BUY", BUY),
            Map.entry("BOT", BUY),
            Map.entry("B", BUY),
            Map.entry("BOUGHT", BUY),
            Map.entry("YOU BOUGHT", BUY),
            Map.entry("SELL", SELL),
            Map.entry("SLD", SELL),
            Map.entry("S", SELL),
            Map.entry("SOLD", SELL),
            Map.entry("YOU SOLD", SELL),
            Map.entry("SHORT", SHORT),
            Map.entry("SELL SHORT", SHORT),
            Map.entry("COVER", COVER),
            Map.entry("BUY TO COVER", COVER));

    public static Optional<TradeSide> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(VOCABULARY.get(raw.trim().toUpperCase(Locale.ROOT)));
    }
}
