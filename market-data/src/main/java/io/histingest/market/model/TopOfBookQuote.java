package io.histingest.market.model;

import io.histingest.market.schema.MarketSchema;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Best bid and offer. Either side may be missing, not both.
 */
public record TopOfBookQuote(
        long instrumentId,
        Instant tsEvent,
        String symbol,
        BigDecimal bidPx,
        BigDecimal askPx,
        Long bidSz,
        Long askSz,
        Integer bidCt,
        Integer askCt,
        Long sequence,
        Instant tsRecv,
        Integer publisherId
) implements CanonicalRecord {
    @Override
    public MarketSchema schema() { return MarketSchema.TBBO; }

    public boolean isCrossed() {
        return bidPx != null && askPx != null && askPx.compareTo(bidPx) < 0;
    }
}
