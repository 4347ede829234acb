package com.tradeingest.parser;

import com.tradeingest.domain.enums.OrderSection;
import com.tradeingest.domain.enums.OrderSide;
import com.tradeingest.domain.enums.OrderType;
import com.tradeingest.domain.enums.TimeInForce;
import com.tradeingest.domain.model.NormalizedOrder;
import com.tradeingest.domain.model.SectionedExport;
import com.tradeingest.exception.CsvValidationException;
import com.tradeingest.transform.FieldTransformer;
import com.tradeingest.transform.RowRejectedException;
import com.tradeingest.transform.TemporalParser;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parser for the "Today's Trade Activity" export, which stacks several CSV tables in one file.
 *
 * <p>The first line carries the account number and report date. Each section starts at a marker line
 * ({@code Working Orders}, {@code Filled Orders}, {@code Canceled Orders}) followed by its own header
 * row. Parsing stops at the {@code Rolling Strategies} block. Rows are normalized straight into orders;
 * a row that cannot be normalized becomes a section error and never aborts the file.
 */
@Component
public class SectionedExportParser {

    private static final Logger log = LoggerFactory.getLogger(SectionedExportParser.class);

    public static final String SIGNATURE_REGEX =
            "(?i)Today's Trade Activity for \\d+\\w*\\s+.*on\\s+\\d{1,2}/\\d{1,2}/\\d{2,4}";

    public static final Pattern SIGNATURE = Pattern.compile(SIGNATURE_REGEX);

    private static final Pattern METADATA = Pattern.compile("Today's Trade Activity for (\\S+)\\s+.*on\\s+(.+)");

    static final String STOP_MARKER = "Rolling Strategies";
    static final String MARKET_PRICE = "~";

    public static boolean matchesSignature(String content) {
        return content != null && SIGNATURE.matcher(content).find();
    }

    /**
     * Splits the file into its sections.
     *
     * @throws CsvValidationException if the content does not carry the export signature
     */
    public SectionedExport parse(String content) {
        if (!matchesSignature(content)) {
            throw new CsvValidationException("Not a trade activity export");
        }
        List<String> lines = Arrays.stream(RawCsvParser.stripByteOrderMark(content).split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());

        SectionedExport export = new SectionedExport();
        readMetadata(lines.get(0), export);

        OrderSection section = null;
        List<String> sectionHeaders = null;
        boolean expectHeader = false;
        int sectionRow = 0;

        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.startsWith(STOP_MARKER)) {
                break;
            }
            Optional<OrderSection> marker = OrderSection.fromMarkerLine(stripTrailingCommas(line));
            if (marker.isPresent()) {
                section = marker.get();
                expectHeader = true;
                sectionRow = 0;
                continue;
            }
            if (section == null) {
                continue;
            }
            List<String> cells = split(line);
            if (expectHeader) {
                sectionHeaders = cells;
                expectHeader = false;
                continue;
            }
            if (cells.stream().allMatch(String::isBlank)) {
                continue;
            }
            sectionRow++;
            Map<String, String> row = toRow(sectionHeaders, cells);
            try {
                Optional<NormalizedOrder> order = normalize(row, section, export);
                if (order.isPresent()) {
                    export.add(section, order.get());
                } else {
                    export.markSkipped();
                }
            } catch (RowRejectedException e) {
                export.addError(section.getMarker() + " row " + sectionRow + ": " + e.getMessage());
            }
        }

        log.info(
                "Parsed trade activity export: account={} working={} filled={} cancelled={} errors={} skipped={}",
                export.getAccountNumber(),
                export.getOrders(OrderSection.WORKING).size(),
                export.getOrders(OrderSection.FILLED).size(),
                export.getOrders(OrderSection.CANCELLED).size(),
                export.getErrors().size(),
                export.getSkippedRows());
        return export;
    }

    private void readMetadata(String firstLine, SectionedExport export) {
        Matcher matcher = METADATA.matcher(stripTrailingCommas(firstLine));
        if (matcher.find()) {
            export.setAccountNumber(matcher.group(1));
            export.setReportDate(TemporalParser.parseDate(matcher.group(2).trim().split("\\s+")[0]).orElse(null));
        }
    }

    /** Empty result means the row is skipped, not failed. */
    private Optional<NormalizedOrder> normalize(Map<String, String> row, OrderSection section, SectionedExport export) {
        Optional<String> symbol = cell(row, "Symbol");
        if (symbol.isEmpty()) {
            if (section == OrderSection.CANCELLED) {
                return Optional.empty();
            }
            throw new RowRejectedException("Missing symbol");
        }

        String rawSide = cell(row, "Side").orElseThrow(() -> new RowRejectedException("Missing side"));
        OrderSide side = OrderSide.normalize(FieldTransformer.SCHWAB_SIDE_MAPPING.apply(rawSide))
                .orElseThrow(() -> new RowRejectedException("Unrecognized side '" + rawSide + "'"));

        String rawQty = cell(row, "Qty").orElseThrow(() -> new RowRejectedException("Missing quantity"));
        BigDecimal quantity = Optional.ofNullable(FieldTransformer.PARSE_ABSOLUTE_QUANTITY.apply(rawQty))
                .map(BigDecimal::new)
                .filter(q -> q.signum() > 0)
                .orElseThrow(() -> new RowRejectedException("Invalid quantity '" + rawQty + "'"));

        Optional<String> rawPrice = cell(row, "Price").or(() -> cell(row, "PRICE"));
        boolean marketPrice = rawPrice.filter(MARKET_PRICE::equals).isPresent();
        BigDecimal limitPrice = rawPrice.map(FieldTransformer.PARSE_SCHWAB_PRICE::apply)
                .flatMap(SectionedExportParser::number)
                .orElse(null);

        OrderType orderType = cell(row, "Order Type")
                .map(OrderType::normalize)
                .orElse(marketPrice ? OrderType.MARKET : OrderType.LIMIT);

        NormalizedOrder.NormalizedOrderBuilder order = NormalizedOrder.builder()
                .symbol(symbol.get().toUpperCase(Locale.ROOT))
                .side(side)
                .orderQuantity(quantity)
                .limitPrice(limitPrice)
                .fillPrice(cell(row, "Net Price").flatMap(SectionedExportParser::number).orElse(null))
                .orderType(orderType)
                .timeInForce(TimeInForce.normalize(cell(row, "TIF").orElse(null)))
                .orderStatus(section.getDefaultStatus())
                .assetClass(cell(row, "Spread").orElse("STOCK"))
                .positionEffect(cell(row, "Pos Effect").orElse(null))
                .expirationDate(cell(row, "Exp").orElse(null))
                .strikePrice(cell(row, "Strike").flatMap(SectionedExportParser::number).orElse(null))
                .optionType(cell(row, "Type").filter(t -> !t.equalsIgnoreCase("STOCK")).orElse(null))
                .orderNotes(notes(row))
                .orderAccount(export.getAccountNumber())
                .tags(new ArrayList<>());

        switch (section) {
            case FILLED: {
                LocalDateTime executed = timestamp(row, "Exec Time", export);
                order.orderPlacedTime(executed).orderExecutedTime(executed);
                break;
            }
            case WORKING:
                order.orderPlacedTime(timestamp(row, "Time Placed", export));
                break;
            default: {
                LocalDateTime cancelled = timestamp(row, "Time Canceled", export);
                order.orderPlacedTime(cancelled).orderCancelledTime(cancelled);
                break;
            }
        }
        return Optional.of(order.build());
    }

    private static LocalDateTime timestamp(Map<String, String> row, String column, SectionedExport export) {
        Optional<String> raw = cell(row, column);
        if (raw.isPresent()) {
            return TemporalParser.parseDateTime(raw.get())
                    .orElseThrow(() -> new RowRejectedException("Invalid " + column + " '" + raw.get() + "'"));
        }
        if (export.getReportDate() != null) {
            return export.getReportDate().atStartOfDay();
        }
        throw new RowRejectedException("Missing " + column);
    }

    private static String notes(Map<String, String> row) {
        List<String> parts = new ArrayList<>();
        cell(row, "Status").ifPresent(parts::add);
        cell(row, "Notes").ifPresent(parts::add);
        return parts.isEmpty() ? null : String.join(" | ", parts);
    }

    private static Optional<String> cell(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static Optional<BigDecimal> number(String text) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text.replaceAll("[$,\\s+]", "")));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Map<String, String> toRow(List<String> headers, List<String> cells) {
        Map<String, String> row = new LinkedHashMap<>();
        if (headers == null) {
            return row;
        }
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header.isBlank() || row.containsKey(header)) {
                continue;
            }
            row.put(header, i < cells.size() ? cells.get(i) : "");
        }
        return row;
    }

    private static List<String> split(String line) {
        try {
            return RawCsvParser.parseLine(line);
        } catch (CsvValidationException e) {
            log.debug("Falling back to plain split for line: {}", line);
            return Arrays.stream(line.split(",", -1)).map(String::trim).collect(Collectors.toList());
        }
    }

    private static String stripTrailingCommas(String line) {
        return line.replaceAll(",+$", "").trim();
    }
}
