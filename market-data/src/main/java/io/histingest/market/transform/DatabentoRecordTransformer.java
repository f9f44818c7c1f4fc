package io.histingest.market.transform;

import io.histingest.core.ErrorKind;
import io.histingest.core.Result;
import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.model.InstrumentDefinition;
import io.histingest.market.model.OhlcvBar;
import io.histingest.market.model.RawRecord;
import io.histingest.market.model.Statistic;
import io.histingest.market.model.TopOfBookQuote;
import io.histingest.market.model.Trade;
import io.histingest.market.schema.SchemaRef;

/**
 * Transformer for the provider's native record layout. Accepts both the native field names
 * ({@code open}, {@code count}, {@code bid_px_00}) and their canonical aliases
 * ({@code open_price}, {@code trade_count}, {@code bid_px}).
 */
public class DatabentoRecordTransformer implements RecordTransformer {

    @Override
    public Result<CanonicalRecord> transform(RawRecord raw, SchemaRef schema) {
        if (raw.isUnparsable()) {
            return Result.err(ErrorKind.TRANSFORM, "unparsable_record", String.valueOf(raw.get(RawRecord.PARSE_ERROR)));
        }
        FieldReader f = new FieldReader(raw);
        try {
            switch (schema.type()) {
                case OHLCV: return Result.ok(ohlcv(f, schema));
                case TRADES: return Result.ok(trade(f));
                case TBBO: return Result.ok(quote(f));
                case STATISTICS: return Result.ok(statistic(f));
                case DEFINITION: return Result.ok(definition(f));
                default: return Result.err(ErrorKind.TRANSFORM, "unsupported_schema", "no mapping for " + schema);
            }
        } catch (FieldException e) {
            return Result.err(ErrorKind.TRANSFORM, e.code(), e.getMessage());
        }
    }

    private static OhlcvBar ohlcv(FieldReader f, SchemaRef schema) {
        return new OhlcvBar(
                f.requireLong("instrument_id"),
                f.requireTimestamp("ts_event"),
                f.optString("symbol", "raw_symbol"),
                schema.granularity(),
                f.requirePrice("open", "open_price"),
                f.requirePrice("high", "high_price"),
                f.requirePrice("low", "low_price"),
                f.requirePrice("close", "close_price"),
                f.requireLong("volume"),
                f.optLong("count", "trade_count"),
                f.optPrice("vwap"),
                f.optInt("publisher_id"));
    }

    private static Trade trade(FieldReader f) {
        return new Trade(
                f.requireLong("instrument_id"),
                f.requireTimestamp("ts_event"),
                f.optString("symbol", "raw_symbol"),
                f.requirePrice("price"),
                f.requireLong("size"),
                f.optCode("side"),
                f.optLong("sequence"),
                f.optTimestamp("ts_recv"),
                f.optInt("publisher_id"));
    }

    private static TopOfBookQuote quote(FieldReader f) {
        return new TopOfBookQuote(
                f.requireLong("instrument_id"),
                f.requireTimestamp("ts_event"),
                f.optString("symbol", "raw_symbol"),
                f.optPrice("bid_px", "bid_px_00"),
                f.optPrice("ask_px", "ask_px_00"),
                f.optLong("bid_sz", "bid_sz_00"),
                f.optLong("ask_sz", "ask_sz_00"),
                f.optInt("bid_ct", "bid_ct_00"),
                f.optInt("ask_ct", "ask_ct_00"),
                f.optLong("sequence"),
                f.optTimestamp("ts_recv"),
                f.optInt("publisher_id"));
    }

    private static Statistic statistic(FieldReader f) {
        Integer statType = f.optInt("stat_type");
        if (statType == null) throw new FieldException("missing_field:stat_type", "required field 'stat_type' is missing");
        return new Statistic(
                f.requireLong("instrument_id"),
                f.requireTimestamp("ts_event"),
                f.optString("symbol", "raw_symbol"),
                statType,
                f.optPrice("price", "stat_value"),
                f.optLong("quantity"),
                f.optCode("update_action"),
                f.optLong("sequence"),
                f.optTimestamp("ts_recv"),
                f.optInt("publisher_id"));
    }

    private static InstrumentDefinition definition(FieldReader f) {
        return new InstrumentDefinition(
                f.requireLong("instrument_id"),
                f.requireTimestamp("ts_event"),
                f.optString("raw_symbol", "symbol"),
                f.optCode("security_update_action", "update_action"),
                f.optCode("instrument_class"),
                f.optPrice("min_price_increment"),
                f.optPrice("display_factor"),
                f.optTimestamp("expiration"),
                f.optTimestamp("activation"),
                f.optPrice("high_limit_price"),
                f.optPrice("low_limit_price"),
                f.optString("currency"),
                f.optString("exchange"),
                f.optString("asset"),
                f.optString("group", "security_group"),
                f.optLong("underlying_id"),
                f.optInt("publisher_id"));
    }
}
