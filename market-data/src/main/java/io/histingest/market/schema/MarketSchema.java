package io.histingest.market.schema;

/**
 * Record families the pipeline knows how to ingest.
 */
public enum MarketSchema {
    OHLCV,
    TRADES,
    TBBO,
    STATISTICS,
    DEFINITION
}
