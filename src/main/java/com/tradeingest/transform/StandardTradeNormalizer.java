package com.tradeingest.transform;

import com.tradeingest.domain.enums.TradeSide;
import com.tradeingest.domain.model.NormalizedTrade;
import com.tradeingest.format.StandardSchema;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Converts a row of the canonical upload layout into a trade. */
@Component
public class StandardTradeNormalizer {

    static final String DEFAULT_TIME = "00:00:00";
    static final String NOTES = "Imported from Standard CSV";

    public NormalizedTrade normalize(Map<String, String> row, List<String> accountTags) {
        String rawSide = cell(row, StandardSchema.SIDE).orElse("");
        TradeSide side = TradeSide.normalize(rawSide)
                .orElseThrow(() -> new RowRejectedException("Invalid Buy/Sell value: " + rawSide));

        String rawShares = cell(row, StandardSchema.SHARES).orElse("");
        BigDecimal shares = number(rawShares)
                .filter(q -> q.signum() > 0)
                .orElseThrow(() -> new RowRejectedException("Invalid Shares value: " + rawShares));

        String symbol = cell(row, StandardSchema.SYMBOL)
                .map(s -> s.toUpperCase(Locale.ROOT))
                .orElseThrow(() -> new RowRejectedException("Missing Symbol"));

        String rawDate = cell(row, StandardSchema.DATE).orElse("");
        LocalDate date = TemporalParser.parseDate(rawDate)
                .or(() -> TemporalParser.parseDateTime(rawDate).map(d -> d.toLocalDate()))
                .orElseThrow(() -> new RowRejectedException("Invalid Date value: " + rawDate));

        String time = cell(row, StandardSchema.TIME).orElse(DEFAULT_TIME);
        LocalTime parsedTime = TemporalParser.parseTime(time).orElse(LocalTime.MIDNIGHT);

        List<String> tags = new ArrayList<>(List.of("imported", "standard-format"));
        if (accountTags != null) {
            tags.addAll(accountTags);
        }

        return NormalizedTrade.builder()
                .date(date)
                .time(time)
                .executedTime(date.atTime(parsedTime))
                .symbol(symbol)
                .side(side)
                .quantity(shares)
                .price(cell(row, StandardSchema.PRICE).flatMap(StandardTradeNormalizer::number).orElse(null))
                .commission(cell(row, StandardSchema.COMMISSION).flatMap(StandardTradeNormalizer::number).orElse(null))
                .fees(cell(row, StandardSchema.FEES).flatMap(StandardTradeNormalizer::number).orElse(null))
                .account(cell(row, StandardSchema.ACCOUNT).orElse(null))
                .notes(NOTES)
                .tags(tags)
                .build();
    }

    private static Optional<String> cell(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null) {
            value = row.entrySet().stream()
                    .filter(e -> e.getKey().equalsIgnoreCase(column))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static Optional<BigDecimal> number(String text) {
        try {
            return Optional.of(new BigDecimal(FieldTransformer.stripCurrency(text)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
