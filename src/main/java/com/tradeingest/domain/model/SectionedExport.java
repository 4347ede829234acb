package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.OrderSection;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

/**
 * A multi-section trade-activity export split into its working, filled and cancelled buckets.
 * Section rows that failed to parse are kept as error strings and count against the batch.
 */
@Getter
public class SectionedExport {

    @Setter
    private String accountNumber;

    @Setter
    private LocalDate reportDate;

    private final Map<OrderSection, List<NormalizedOrder>> orders = new EnumMap<>(OrderSection.class);
    private final List<String> errors = new ArrayList<>();
    private int skippedRows;

    public SectionedExport() {
        for (OrderSection section : OrderSection.values()) {
            orders.put(section, new ArrayList<>());
        }
    }

    public void add(OrderSection section, NormalizedOrder order) {
        orders.get(section).add(order);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void markSkipped() {
        skippedRows++;
    }

    public List<NormalizedOrder> getOrders(OrderSection section) {
        return orders.get(section);
    }

    /** Parsed orders plus failed rows; skipped rows (cancelled without a symbol) are not records. */
    public int getTotalRecords() {
        return orders.values().stream().mapToInt(List::size).sum() + errors.size();
    }
}
