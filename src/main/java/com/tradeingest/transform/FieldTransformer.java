package com.tradeingest.transform;

import com.tradeingest.domain.enums.OrderType;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Named value transformers that registry formats reference by string key.
 *
 * <p>Each transformer takes the raw cell text and returns the text handed to type coercion, or
 * {@code null} when the cell should be treated as absent (for example a "~" price). Date transformers
 * emit ISO-8601 so the DATE coercion that follows is unambiguous.
 */
public enum FieldTransformer {
    IBKR_SIDE_MAPPING("ibkrSideMapping") {
        @Override
        public String apply(String value) {
            return mapOrKeep(value, IBKR_SIDES);
        }
    },
    STANDARD_SIDE_MAPPING("standardSideMapping") {
        @Override
        public String apply(String value) {
            String mapped = STANDARD_SIDES.get(value.trim().toUpperCase(Locale.ROOT));
            return mapped != null ? mapped : value.trim().toUpperCase(Locale.ROOT);
        }
    },
    REMOVE_CURRENCY("removeCurrency") {
        @Override
        public String apply(String value) {
            return stripCurrency(value);
        }
    },
    PARSE_DATE("parseDate") {
        @Override
        public String apply(String value) {
            return TemporalParser.parseDateTime(value).map(Object::toString).orElse(null);
        }
    },
    ORDER_EXECUTION_SIDE_MAPPING("orderExecutionSideMapping") {
        @Override
        public String apply(String value) {
            String mapped = ORDER_EXECUTION_SIDES.get(value.trim().toUpperCase(Locale.ROOT));
            return mapped != null ? mapped : value.trim().toUpperCase(Locale.ROOT);
        }
    },
    ORDER_TYPE_MAPPING("orderTypeMapping") {
        @Override
        public String apply(String value) {
            return OrderType.normalize(value).name();
        }
    },
    PARSE_ORDER_DATE_TIME("parseOrderDateTime") {
        @Override
        public String apply(String value) {
            return TemporalParser.parseDateTime(value).map(Object::toString).orElse(null);
        }
    },
    PARSE_SCHWAB_DATE_TIME("parseSchwabDateTime") {
        @Override
        public String apply(String value) {
            return TemporalParser.parseDateTime(value).map(Object::toString).orElse(null);
        }
    },
    SCHWAB_SIDE_MAPPING("schwabSideMapping") {
        @Override
        public String apply(String value) {
            String upper = value.trim().toUpperCase(Locale.ROOT);
            if (upper.equals("BUY") || upper.equals("B")) {
                return "BUY";
            }
            if (upper.equals("SELL") || upper.equals("S")) {
                return "SELL";
            }
            return upper;
        }
    },
    PARSE_ABSOLUTE_QUANTITY("parseAbsoluteQuantity") {
        @Override
        public String apply(String value) {
            String cleaned = stripCurrency(value).replace("+", "").replace("-", "");
            try {
                return new BigDecimal(cleaned).abs().toPlainString();
            } catch (NumberFormatException e) {
                return null;
            }
        }
    },
    PARSE_SCHWAB_PRICE("parseSchwabPrice") {
        @Override
        public String apply(String value) {
            String trimmed = value.trim();
            return trimmed.isEmpty() || trimmed.equals("~") ? null : trimmed;
        }
    },
    SCHWAB_ORDER_TYPE_MAPPING("schwabOrderTypeMapping") {
        @Override
        public String apply(String value) {
            return OrderType.normalize(value).name();
        }
    };

    private static final Map<String, String> IBKR_SIDES =
            Map.of("BOT", "BUY", "SLD", "SELL", "BUY", "BUY", "SELL", "SELL");

    private static final Map<String, String> STANDARD_SIDES = Map.of(
            "BUY", "BUY", "SELL", "SELL", "B", "BUY", "S", "SELL", "SHORT", "SHORT", "COVER", "COVER");

    private static final Map<String, String> ORDER_EXECUTION_SIDES =
            Map.of("B", "BUY", "S", "SELL", "BUY", "BUY", "SELL", "SELL");

    private static final Map<String, FieldTransformer> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(t -> t.transformerName.toLowerCase(Locale.ROOT), Function.identity()));

    private final String transformerName;

    FieldTransformer(String transformerName) {
        this.transformerName = transformerName;
    }

    public String getTransformerName() {
        return transformerName;
    }

    /** Transforms a non-null cell value. */
    public abstract String apply(String value);

    public static Optional<FieldTransformer> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    static String stripCurrency(String value) {
        return value.replaceAll("[$,\\s]", "");
    }

    private static String mapOrKeep(String value, Map<String, String> mapping) {
        String mapped = mapping.get(value.trim().toUpperCase(Locale.ROOT));
        return mapped != null ? mapped : value.trim();
    }
}
