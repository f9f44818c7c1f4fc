package io.histingest.market.model;

import io.histingest.market.schema.MarketSchema;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * @param side aggressor side code: A (ask), B (bid), N (none) or null when not reported
 */
public record Trade(
        long instrumentId,
        Instant tsEvent,
        String symbol,
        BigDecimal price,
        long size,
        String side,
        Long sequence,
        Instant tsRecv,
        Integer publisherId
) implements CanonicalRecord {
    @Override
    public MarketSchema schema() { return MarketSchema.TRADES; }
}
