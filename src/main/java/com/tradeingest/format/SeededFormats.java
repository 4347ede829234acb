package com.tradeingest.format;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.enums.FieldDataType;
import com.tradeingest.domain.enums.OrderSection;
import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.DetectionPatterns;
import com.tradeingest.domain.model.FieldMapping;
import com.tradeingest.parser.SectionedExportParser;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** The broker layouts that ship with the service. */
public final class SeededFormats {

    public static final String IBKR_FLEX = "interactive-brokers-flex";
    public static final String TDA_HISTORY = "td-ameritrade-history";
    public static final String ETRADE_TRANSACTIONS = "etrade-transactions";
    public static final String ORDER_BLOTTER = "trade-voyager-orders";
    public static final String SCHWAB_TODAYS_TRADES = "schwab-todays-trades";

    private SeededFormats() {}

    public static List<BrokerFormat> all() {
        return List.of(interactiveBrokers(), tdAmeritrade(), etrade(), orderBlotter(), schwabTodaysTrades());
    }

    static BrokerFormat interactiveBrokers() {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        fields.put("Date", field("date", FieldDataType.DATE, true, null));
        fields.put("Time", field("time", FieldDataType.STRING, false, null));
        fields.put("Symbol", field("symbol", FieldDataType.STRING, true, null));
        fields.put("Buy/Sell", field("side", FieldDataType.STRING, true, "ibkrSideMapping"));
        fields.put("Quantity", field("quantity", FieldDataType.NUMBER, true, null));
        fields.put("T. Price", field("price", FieldDataType.NUMBER, false, null));
        fields.put("Comm/Fee", field("commission", FieldDataType.NUMBER, false, null));
        fields.put("Realized P&L", field("realizedPnL", FieldDataType.NUMBER, false, null));
        fields.put("Account", field("account", FieldDataType.STRING, false, null));

        return seed(IBKR_FLEX, "Interactive Brokers Flex Query", "Interactive Brokers",
                BrokerType.INTERACTIVE_BROKERS, 0.95, fields,
                DetectionPatterns.builder()
                        .requiredHeaders(List.of("Date", "Symbol", "Buy/Sell", "Quantity"))
                        .valuePatterns(patterns("Buy/Sell", "(?i)^(BOT|SLD|BUY|SELL)$"))
                        .build());
    }

    static BrokerFormat tdAmeritrade() {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        fields.put("DATE", field("date", FieldDataType.DATE, true, null));
        fields.put("TIME", field("time", FieldDataType.STRING, false, null));
        fields.put("SYMBOL", field("symbol", FieldDataType.STRING, true, null));
        fields.put("SIDE", field("side", FieldDataType.STRING, true, "standardSideMapping"));
        fields.put("QTY", field("quantity", FieldDataType.NUMBER, true, null));
        fields.put("PRICE", field("price", FieldDataType.NUMBER, false, "removeCurrency"));
        fields.put("NET AMT", field("netAmount", FieldDataType.NUMBER, false, "removeCurrency"));
        fields.put("FEES", field("commission", FieldDataType.NUMBER, false, "removeCurrency"));
        fields.put("ACCOUNT", field("account", FieldDataType.STRING, false, null));

        return seed(TDA_HISTORY, "TD Ameritrade Transaction History", "TD Ameritrade",
                BrokerType.TD_AMERITRADE, 0.95, fields,
                DetectionPatterns.builder()
                        .requiredHeaders(List.of("DATE", "SYMBOL", "SIDE", "QTY"))
                        .valuePatterns(patterns(
                                "SIDE", "(?i)^(BUY|SELL|B|S)$",
                                "PRICE", "^\\$?[\\d,]+\\.?\\d*$"))
                        .build());
    }

    static BrokerFormat etrade() {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        fields.put("TransactionDate", field("date", FieldDataType.DATE, true, null));
        fields.put("TransactionTime", field("time", FieldDataType.STRING, false, null));
        fields.put("Symbol", field("symbol", FieldDataType.STRING, true, null));
        fields.put("Action", field("side", FieldDataType.STRING, true, "standardSideMapping"));
        fields.put("Quantity", field("quantity", FieldDataType.NUMBER, true, null));
        fields.put("Price", field("price", FieldDataType.NUMBER, false, null));
        fields.put("Amount", field("netAmount", FieldDataType.NUMBER, false, null));
        fields.put("Commission", field("commission", FieldDataType.NUMBER, false, null));
        fields.put("AccountNumber", field("account", FieldDataType.STRING, false, null));

        return seed(ETRADE_TRANSACTIONS, "E*TRADE Transactions", "E*TRADE",
                BrokerType.E_TRADE, 0.9, fields,
                DetectionPatterns.builder()
                        .requiredHeaders(List.of("TransactionDate", "Symbol", "Action", "Quantity"))
                        .valuePatterns(patterns("Action", "(?i)^(Buy|Sell|Short|Cover)$"))
                        .build());
    }

    static BrokerFormat orderBlotter() {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        fields.put("TradeID", field("orderId", FieldDataType.STRING, true, null));
        fields.put("OrderID", field("parentOrderId", FieldDataType.STRING, false, null));
        fields.put("Trader", field("accountId", FieldDataType.STRING, false, null));
        fields.put("Account", field("orderAccount", FieldDataType.STRING, true, null));
        fields.put("Branch", field("tags", FieldDataType.STRING, false, null));
        fields.put("route", field("orderRoute", FieldDataType.STRING, false, null));
        fields.put("bkrsym", field("notes", FieldDataType.STRING, false, null));
        fields.put("rrno", field("notes", FieldDataType.STRING, false, null));
        fields.put("B/S", field("side", FieldDataType.STRING, true, "orderExecutionSideMapping"));
        fields.put("SHORT", field("notes", FieldDataType.STRING, false, null));
        fields.put("Market", field("orderType", FieldDataType.STRING, false, "orderTypeMapping"));
        fields.put("symb", field("symbol", FieldDataType.STRING, true, null));
        fields.put("qty", field("orderQuantity", FieldDataType.NUMBER, true, null));
        fields.put("price", field("limitPrice", FieldDataType.NUMBER, false, null));
        fields.put("time", field("orderExecutedTime", FieldDataType.DATE, true, "parseOrderDateTime"));

        return seed(ORDER_BLOTTER, "Trade Voyager Order Execution", "Trade Voyager",
                BrokerType.GENERIC_CSV, 0.95, fields,
                DetectionPatterns.builder()
                        .requiredHeaders(List.of("TradeID", "OrderID", "Account", "B/S", "qty", "price", "time"))
                        .valuePatterns(patterns(
                                "B/S", "(?i)^(B|S|BUY|SELL)$",
                                "Market", "(?i)^(Lmt|Mkt|STP)$",
                                "time", "^\\d{2}/\\d{2}/\\d{2}\\s\\d{2}:\\d{2}:\\d{2}$"))
                        .build());
    }

    static BrokerFormat schwabTodaysTrades() {
        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        fields.put("Time Placed", field("orderPlacedTime", FieldDataType.DATE, false, "parseSchwabDateTime"));
        fields.put("Exec Time", field("orderExecutedTime", FieldDataType.DATE, false, "parseSchwabDateTime"));
        fields.put("Time Canceled", field("orderCancelledTime", FieldDataType.DATE, false, "parseSchwabDateTime"));
        fields.put("Spread", field("assetClass", FieldDataType.STRING, true, null));
        fields.put("Side", field("side", FieldDataType.STRING, true, "schwabSideMapping"));
        fields.put("Qty", field("orderQuantity", FieldDataType.NUMBER, true, "parseAbsoluteQuantity"));
        fields.put("Pos Effect", field("positionEffect", FieldDataType.STRING, false, null));
        fields.put("Symbol", field("symbol", FieldDataType.STRING, true, null));
        fields.put("Exp", field("expirationDate", FieldDataType.STRING, false, null));
        fields.put("Strike", field("strikePrice", FieldDataType.NUMBER, false, null));
        fields.put("Type", field("optionType", FieldDataType.STRING, false, null));
        fields.put("Price", field("limitPrice", FieldDataType.NUMBER, false, "parseSchwabPrice"));
        fields.put("PRICE", field("limitPrice", FieldDataType.NUMBER, false, "parseSchwabPrice"));
        fields.put("Net Price", field("fillPrice", FieldDataType.NUMBER, false, null));
        fields.put("Order Type", field("orderType", FieldDataType.STRING, false, "schwabOrderTypeMapping"));
        fields.put("TIF", field("timeInForce", FieldDataType.STRING, false, null));
        fields.put("Status", field("orderStatus", FieldDataType.STRING, false, null));
        fields.put("Notes", field("orderNotes", FieldDataType.STRING, false, null));

        return seed(SCHWAB_TODAYS_TRADES, "Schwab Today's Trade Activity", "Charles Schwab",
                BrokerType.CHARLES_SCHWAB, 0.95, fields,
                DetectionPatterns.builder()
                        .requiredHeaders(List.of("Spread", "Side", "Qty", "Symbol"))
                        .fileSignature(SectionedExportParser.SIGNATURE_REGEX)
                        .sectionMarkers(Arrays.stream(OrderSection.values())
                                .map(OrderSection::getMarker)
                                .collect(Collectors.toList()))
                        .build());
    }

    private static BrokerFormat seed(
            String id,
            String name,
            String brokerName,
            BrokerType brokerType,
            double confidence,
            Map<String, FieldMapping> fields,
            DetectionPatterns patterns) {
        return BrokerFormat.builder()
                .id(id)
                .name(name)
                .description(name + " export")
                .brokerName(brokerName)
                .brokerType(brokerType)
                .fingerprint(FormatFactory.fingerprint(fields.keySet()))
                .confidence(confidence)
                .fieldMappings(fields)
                .detectionPatterns(patterns)
                .seeded(true)
                .createdBy("system")
                .build();
    }

    private static FieldMapping field(String target, FieldDataType type, boolean required, String transformer) {
        return FieldMapping.builder()
                .targetField(target)
                .dataType(type)
                .required(required)
                .transformer(transformer)
                .build();
    }

    private static Map<String, String> patterns(String... columnAndRegex) {
        Map<String, String> patterns = new LinkedHashMap<>();
        for (int i = 0; i + 1 < columnAndRegex.length; i += 2) {
            patterns.put(columnAndRegex[i], columnAndRegex[i + 1]);
        }
        return patterns;
    }
}
