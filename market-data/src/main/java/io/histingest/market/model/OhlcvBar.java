package io.histingest.market.model;

import io.histingest.market.schema.MarketSchema;

import java.math.BigDecimal;
import java.time.Instant;

public record OhlcvBar(
        long instrumentId,
        Instant tsEvent,
        String symbol,
        String granularity,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        long volume,
        Long tradeCount,
        BigDecimal vwap,
        Integer publisherId
) implements CanonicalRecord {
    @Override
    public MarketSchema schema() { return MarketSchema.OHLCV; }
}
