package io.histingest.market.validate;

import io.histingest.market.schema.MarketSchema;

import java.util.List;

/**
 * Ordered rules and the idempotency key for one schema.
 */
public record RuleSet(MarketSchema schema, List<SchemaRule<?>> rules, IdempotencyKey key) {
    public RuleSet {
        rules = List.copyOf(rules);
    }
}
