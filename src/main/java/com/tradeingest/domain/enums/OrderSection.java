package com.tradeingest.domain.enums;

import java.util.Optional;

/** The three logical buckets of a multi-section trade-activity export. */
public enum OrderSection {
    WORKING("Working Orders", OrderStatus.PENDING),
    FILLED("Filled Orders", OrderStatus.FILLED),
    CANCELLED("Canceled Orders", OrderStatus.CANCELLED);

    private final String marker;
    private final OrderStatus defaultStatus;

    OrderSection(String marker, OrderStatus defaultStatus) {
        this.marker = marker;
        this.defaultStatus = defaultStatus;
    }

    public String getMarker() {
        return marker;
    }

    public OrderStatus getDefaultStatus() {
        return defaultStatus;
    }

    public static Optional<OrderSection> fromMarkerLine(String line) {
        for (OrderSection section : values()) {
            if (section.marker.equalsIgnoreCase(line.trim())) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }
}
