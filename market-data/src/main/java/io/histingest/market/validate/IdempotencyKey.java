package io.histingest.market.validate;

import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.model.OhlcvBar;
import io.histingest.market.model.Statistic;
import io.histingest.market.model.Trade;
import io.histingest.market.schema.MarketSchema;

import java.util.List;
import java.util.function.Function;

/**
 * Columns that identify a stored record; storing two records with equal key values keeps one row.
 *
 * @param values extracts the key values of a record, in column order
 */
public record IdempotencyKey(List<String> columns, Function<CanonicalRecord, List<Object>> values) {

    public List<Object> valuesOf(CanonicalRecord record) { return values.apply(record); }

    public static IdempotencyKey forSchema(MarketSchema schema) {
        switch (schema) {
            case OHLCV:
                return new IdempotencyKey(List.of("instrument_id", "ts_event", "granularity"),
                        r -> List.of(r.instrumentId(), r.tsEvent(), ((OhlcvBar) r).granularity()));
            case TRADES:
                return new IdempotencyKey(List.of("instrument_id", "ts_event", "price", "size"),
                        r -> List.of(r.instrumentId(), r.tsEvent(), ((Trade) r).price().stripTrailingZeros(), ((Trade) r).size()));
            case STATISTICS:
                return new IdempotencyKey(List.of("instrument_id", "ts_event", "stat_type"),
                        r -> List.of(r.instrumentId(), r.tsEvent(), ((Statistic) r).statTypeCode()));
            case TBBO:
            case DEFINITION:
                return new IdempotencyKey(List.of("instrument_id", "ts_event"),
                        r -> List.of(r.instrumentId(), r.tsEvent()));
            default:
                throw new IllegalArgumentException(schema.name());
        }
    }
}
