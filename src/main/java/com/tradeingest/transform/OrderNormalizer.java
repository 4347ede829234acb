package com.tradeingest.transform;

import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.enums.OrderSide;
import com.tradeingest.domain.enums.OrderStatus;
import com.tradeingest.domain.enums.OrderType;
import com.tradeingest.domain.enums.TimeInForce;
import com.tradeingest.domain.model.NormalizedOrder;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link NormalizedOrder} from a mapped row. Imported orders default to MARKET, DAY and
 * FILLED; the execution timestamp is derived by {@link ExecutionTimeResolver}.
 */
@Component
public class OrderNormalizer {

    private final ExecutionTimeResolver executionTimeResolver;

    public OrderNormalizer(ExecutionTimeResolver executionTimeResolver) {
        this.executionTimeResolver = executionTimeResolver;
    }

    /**
     * @throws RowRejectedException when the row has no symbol, no recognisable side or no positive quantity
     */
    public NormalizedOrder normalize(MappedRow row, List<String> accountTags) {
        String symbol = row.getString(field(CanonicalField.SYMBOL))
                .map(s -> s.toUpperCase(Locale.ROOT))
                .orElseThrow(() -> new RowRejectedException("Missing symbol"));

        String rawSide = row.getString(field(CanonicalField.SIDE))
                .orElseThrow(() -> new RowRejectedException("Missing side"));
        OrderSide side = OrderSide.normalize(rawSide)
                .orElseThrow(() -> new RowRejectedException("Unrecognized side '" + rawSide + "'"));

        BigDecimal quantity = firstNumber(row, CanonicalField.ORDER_QUANTITY, CanonicalField.QUANTITY)
                .map(BigDecimal::abs)
                .filter(q -> q.signum() > 0)
                .orElseThrow(() -> new RowRejectedException("Missing or non-positive quantity"));

        return NormalizedOrder.builder()
                .orderId(row.getString(field(CanonicalField.ORDER_ID)).orElse(null))
                .parentOrderId(row.getString(field(CanonicalField.PARENT_ORDER_ID)).orElse(null))
                .symbol(symbol)
                .side(side)
                .orderType(OrderType.normalize(row.getString(field(CanonicalField.ORDER_TYPE)).orElse(null)))
                .timeInForce(TimeInForce.normalize(row.getString(field(CanonicalField.TIME_IN_FORCE)).orElse(null)))
                .orderStatus(OrderStatus.normalize(
                        row.getString(field(CanonicalField.ORDER_STATUS)).orElse(null), OrderStatus.FILLED))
                .orderQuantity(quantity)
                .limitPrice(firstNumber(row, CanonicalField.LIMIT_PRICE, CanonicalField.PRICE).orElse(null))
                .stopPrice(row.getNumber(field(CanonicalField.STOP_PRICE)).orElse(null))
                .fillPrice(row.getNumber(field(CanonicalField.FILL_PRICE)).orElse(null))
                .commission(row.getNumber(field(CanonicalField.COMMISSION)).orElse(null))
                .fees(row.getNumber(field(CanonicalField.FEES)).orElse(null))
                .orderPlacedTime(row.getDateTime(field(CanonicalField.ORDER_PLACED_TIME)).orElse(null))
                .orderExecutedTime(executionTimeResolver.resolve(row))
                .orderCancelledTime(row.getDateTime(field(CanonicalField.ORDER_CANCELLED_TIME)).orElse(null))
                .accountId(row.getString(field(CanonicalField.ACCOUNT_ID)).orElse(null))
                .orderAccount(firstString(row, CanonicalField.ORDER_ACCOUNT, CanonicalField.ACCOUNT).orElse(null))
                .orderRoute(row.getString(field(CanonicalField.ORDER_ROUTE)).orElse(null))
                .assetClass(row.getString(field(CanonicalField.ASSET_CLASS)).orElse(null))
                .positionEffect(row.getString(field(CanonicalField.POSITION_EFFECT)).orElse(null))
                .expirationDate(row.getString(field(CanonicalField.EXPIRATION_DATE)).orElse(null))
                .strikePrice(row.getNumber(field(CanonicalField.STRIKE_PRICE)).orElse(null))
                .optionType(row.getString(field(CanonicalField.OPTION_TYPE)).orElse(null))
                .orderNotes(firstString(row, CanonicalField.ORDER_NOTES, CanonicalField.NOTES).orElse(null))
                .tags(tags(row, accountTags))
                .brokerMetadata(new LinkedHashMap<>(row.getBrokerMetadata()))
                .build();
    }

    private static List<String> tags(MappedRow row, List<String> accountTags) {
        List<String> tags = new ArrayList<>();
        row.getString(field(CanonicalField.TAGS)).ifPresent(tags::add);
        if (accountTags != null) {
            tags.addAll(accountTags);
        }
        return tags;
    }

    private static Optional<BigDecimal> firstNumber(MappedRow row, CanonicalField first, CanonicalField second) {
        Optional<BigDecimal> value = row.getNumber(field(first));
        return value.isPresent() ? value : row.getNumber(field(second));
    }

    private static Optional<String> firstString(MappedRow row, CanonicalField first, CanonicalField second) {
        Optional<String> value = row.getString(field(first));
        return value.isPresent() ? value : row.getString(field(second));
    }

    private static String field(CanonicalField field) {
        return field.getFieldName();
    }
}
