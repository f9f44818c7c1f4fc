package io.histingest.market.model;

import io.histingest.market.schema.MarketSchema;
import io.histingest.market.schema.StatType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * @param statTypeCode raw venue code, kept even when unknown so the validator can reject it
 */
public record Statistic(
        long instrumentId,
        Instant tsEvent,
        String symbol,
        int statTypeCode,
        BigDecimal price,
        Long quantity,
        String updateAction,
        Long sequence,
        Instant tsRecv,
        Integer publisherId
) implements CanonicalRecord {
    @Override
    public MarketSchema schema() { return MarketSchema.STATISTICS; }

    public Optional<StatType> statType() { return StatType.fromCode(statTypeCode); }
}
