package io.histingest.market.model;

import io.histingest.market.schema.MarketSchema;

import java.math.BigDecimal;
import java.time.Instant;

public record InstrumentDefinition(
        long instrumentId,
        Instant tsEvent,
        String rawSymbol,
        String securityUpdateAction,
        String instrumentClass,
        BigDecimal minPriceIncrement,
        BigDecimal displayFactor,
        Instant expiration,
        Instant activation,
        BigDecimal highLimitPrice,
        BigDecimal lowLimitPrice,
        String currency,
        String exchange,
        String asset,
        String securityGroup,
        Long underlyingId,
        Integer publisherId
) implements CanonicalRecord {
    @Override
    public MarketSchema schema() { return MarketSchema.DEFINITION; }
}
