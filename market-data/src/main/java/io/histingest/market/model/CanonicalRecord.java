package io.histingest.market.model;

import io.histingest.market.schema.MarketSchema;

import java.time.Instant;

/**
 * Typed record ready for validation and storage.
 */
public interface CanonicalRecord {

    long instrumentId();

    Instant tsEvent();

    MarketSchema schema();
}
