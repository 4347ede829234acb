package com.tradeingest.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every target field a column mapping may fill on a normalized order or trade.
 *
 * <p>{@link #BROKER_METADATA} is the side-channel sentinel: values mapped to it accumulate into an
 * open-ended map instead of overwriting a single value.
 */
public enum CanonicalField {
    ORDER_ID("orderId", FieldDataType.STRING, false),
    PARENT_ORDER_ID("parentOrderId", FieldDataType.STRING, false),
    SYMBOL("symbol", FieldDataType.STRING, true),
    SIDE("side", FieldDataType.STRING, true),
    ORDER_QUANTITY("orderQuantity", FieldDataType.NUMBER, false),
    QUANTITY("quantity", FieldDataType.NUMBER, true),
    LIMIT_PRICE("limitPrice", FieldDataType.NUMBER, false),
    PRICE("price", FieldDataType.NUMBER, false),
    STOP_PRICE("stopPrice", FieldDataType.NUMBER, false),
    FILL_PRICE("fillPrice", FieldDataType.NUMBER, false),
    ORDER_TYPE("orderType", FieldDataType.STRING, false),
    ORDER_STATUS("orderStatus", FieldDataType.STRING, false),
    TIME_IN_FORCE("timeInForce", FieldDataType.STRING, false),
    ORDER_PLACED_TIME("orderPlacedTime", FieldDataType.DATE, false),
    ORDER_EXECUTED_TIME("orderExecutedTime", FieldDataType.DATE, false),
    ORDER_CANCELLED_TIME("orderCancelledTime", FieldDataType.DATE, false),
    DATE("date", FieldDataType.DATE, true),
    TIME("time", FieldDataType.STRING, false),
    COMMISSION("commission", FieldDataType.NUMBER, false),
    FEES("fees", FieldDataType.NUMBER, false),
    NET_AMOUNT("netAmount", FieldDataType.NUMBER, false),
    REALIZED_PNL("realizedPnL", FieldDataType.NUMBER, false),
    ACCOUNT("account", FieldDataType.STRING, false),
    ACCOUNT_ID("accountId", FieldDataType.STRING, false),
    ORDER_ACCOUNT("orderAccount", FieldDataType.STRING, false),
    ORDER_ROUTE("orderRoute", FieldDataType.STRING, false),
    ASSET_CLASS("assetClass", FieldDataType.STRING, false),
    POSITION_EFFECT("positionEffect", FieldDataType.STRING, false),
    EXPIRATION_DATE("expirationDate", FieldDataType.STRING, false),
    STRIKE_PRICE("strikePrice", FieldDataType.NUMBER, false),
    OPTION_TYPE("optionType", FieldDataType.STRING, false),
    ORDER_NOTES("orderNotes", FieldDataType.STRING, false),
    NOTES("notes", FieldDataType.STRING, false),
    TAGS("tags", FieldDataType.STRING, false),
    BROKER_METADATA("brokerMetadata", FieldDataType.STRING, false);

    private static final Map<String, CanonicalField> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(f -> f.fieldName.toLowerCase(Locale.ROOT), Function.identity()));

    private final String fieldName;
    private final FieldDataType dataType;
    private final boolean required;

    CanonicalField(String fieldName, FieldDataType dataType, boolean required) {
        this.fieldName = fieldName;
        this.dataType = dataType;
        this.required = required;
    }

    public String getFieldName() {
        return fieldName;
    }

    public FieldDataType getDataType() {
        return dataType;
    }

    public boolean isRequired() {
        return required;
    }

    /** Case-insensitive lookup by the camelCase field name used in mappings. */
    public static Optional<CanonicalField> fromFieldName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
