package com.tradeingest.domain.enums;

import java.util.Locale;

/** Broker a batch was attributed to. Part of the duplicate-guard key. */
public enum BrokerType {
    INTERACTIVE_BROKERS,
    TD_AMERITRADE,
    E_TRADE,
    CHARLES_SCHWAB,
    GENERIC_CSV;

    /** Best-effort attribution from a free-text broker name; anything unrecognised is GENERIC_CSV. */
    public static BrokerType fromBrokerName(String brokerName) {
        if (brokerName == null || brokerName.isBlank()) {
            return GENERIC_CSV;
        }
        String name = brokerName.toLowerCase(Locale.ROOT);
        if (name.contains("interactive") || name.contains("ibkr")) {
            return INTERACTIVE_BROKERS;
        }
        if (name.contains("ameritrade") || name.equals("tda")) {
            return TD_AMERITRADE;
        }
        if (name.contains("e*trade") || name.contains("etrade") || name.contains("e-trade")) {
            return E_TRADE;
        }
        if (name.contains("schwab")) {
            return CHARLES_SCHWAB;
        }
        return GENERIC_CSV;
    }
}
