package io.histingest.market.schema;

import java.util.Optional;

/**
 * Statistic type codes as published by the venue feeds.
 */
public enum StatType {
    OPENING_PRICE(1),
    INDICATIVE_OPENING_PRICE(2),
    SETTLEMENT_PRICE(3),
    TRADING_SESSION_LOW_PRICE(4),
    TRADING_SESSION_HIGH_PRICE(5),
    CLEARED_VOLUME(6),
    LOWEST_OFFER(7),
    HIGHEST_BID(8),
    OPEN_INTEREST(9),
    FIXING_PRICE(10),
    CLOSE_PRICE(11),
    NET_CHANGE(12),
    VWAP(13),
    VOLATILITY(14),
    DELTA(15),
    UNCROSSING_PRICE(16);

    private final int code;

    StatType(int code) { this.code = code; }

    public int code() { return code; }

    public static Optional<StatType> fromCode(int code) {
        for (StatType t : values()) {
            if (t.code == code) return Optional.of(t);
        }
        return Optional.empty();
    }
}
