package com.tradeingest.format;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The canonical upload layout. A file that carries every required column and at least 60% of all
 * columns is imported directly as trades, with no detection step.
 */
public final class StandardSchema {

    public static final String DATE = "Date";
    public static final String TIME = "Time";
    public static final String SYMBOL = "Symbol";
    public static final String SIDE = "Buy/Sell";
    public static final String SHARES = "Shares";
    public static final String PRICE = "Price";
    public static final String COMMISSION = "Commission";
    public static final String FEES = "Fees";
    public static final String ACCOUNT = "Account";

    public static final List<String> COLUMNS =
            List.of(DATE, TIME, SYMBOL, SIDE, SHARES, PRICE, COMMISSION, FEES, ACCOUNT);

    public static final List<String> REQUIRED_COLUMNS = List.of(DATE, SYMBOL, SIDE, SHARES);

    static final double MIN_COVERAGE = 0.6;

    private StandardSchema() {}

    public static boolean matches(List<String> headers) {
        Set<String> present = headers.stream()
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        boolean allRequired = REQUIRED_COLUMNS.stream()
                .allMatch(c -> present.contains(c.toLowerCase(Locale.ROOT)));
        if (!allRequired) {
            return false;
        }
        long found = COLUMNS.stream()
                .filter(c -> present.contains(c.toLowerCase(Locale.ROOT)))
                .count();
        return (double) found / COLUMNS.size() >= MIN_COVERAGE;
    }
}
