package io.histingest.market.storage;

import io.histingest.market.model.InstrumentDefinition;
import io.histingest.market.model.OhlcvBar;
import io.histingest.market.model.Statistic;
import io.histingest.market.model.TopOfBookQuote;
import io.histingest.market.model.Trade;
import io.histingest.market.schema.MarketSchema;
import io.histingest.market.validate.IdempotencyKey;

import java.sql.Types;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The five market data tables.
 */
public final class TableSpecs {
    private static final String TS = "TIMESTAMP WITH TIME ZONE";
    static final int PRICE_PRECISION = 21;
    static final int PRICE_SCALE = 9;

    private static final Map<MarketSchema, TableSpec> SPECS = new EnumMap<>(MarketSchema.class);

    static {
        SPECS.put(MarketSchema.OHLCV, new TableSpec("daily_ohlcv_data", List.of(
                ts("ts_event", true), bigint("instrument_id", true), varchar("granularity", 10, true),
                varchar("symbol", 50, false),
                price("open_price", true), price("high_price", true), price("low_price", true), price("close_price", true),
                bigint("volume", true), bigint("trade_count", false), price("vwap", false), integer("publisher_id", false)),
                IdempotencyKey.forSchema(MarketSchema.OHLCV),
                r -> {
                    OhlcvBar b = (OhlcvBar) r;
                    return new Object[]{b.tsEvent(), b.instrumentId(), b.granularity(), b.symbol(),
                            b.open(), b.high(), b.low(), b.close(), b.volume(), b.tradeCount(), b.vwap(), b.publisherId()};
                }));

        SPECS.put(MarketSchema.TRADES, new TableSpec("trades_data", List.of(
                ts("ts_event", true), bigint("instrument_id", true), varchar("symbol", 50, false),
                price("price", true), bigint("size", true), varchar("side", 1, false),
                bigint("sequence_number", false), ts("ts_recv", false), integer("publisher_id", false)),
                IdempotencyKey.forSchema(MarketSchema.TRADES),
                r -> {
                    Trade t = (Trade) r;
                    return new Object[]{t.tsEvent(), t.instrumentId(), t.symbol(), t.price(), t.size(), t.side(),
                            t.sequence(), t.tsRecv(), t.publisherId()};
                }));

        SPECS.put(MarketSchema.TBBO, new TableSpec("tbbo_data", List.of(
                ts("ts_event", true), bigint("instrument_id", true), varchar("symbol", 50, false),
                price("bid_px", false), price("ask_px", false), bigint("bid_sz", false), bigint("ask_sz", false),
                integer("bid_ct", false), integer("ask_ct", false),
                new Column("is_crossed", "BOOLEAN", Types.BOOLEAN, true),
                bigint("sequence_number", false), ts("ts_recv", false), integer("publisher_id", false)),
                IdempotencyKey.forSchema(MarketSchema.TBBO),
                r -> {
                    TopOfBookQuote q = (TopOfBookQuote) r;
                    return new Object[]{q.tsEvent(), q.instrumentId(), q.symbol(), q.bidPx(), q.askPx(),
                            q.bidSz(), q.askSz(), q.bidCt(), q.askCt(), q.isCrossed(),
                            q.sequence(), q.tsRecv(), q.publisherId()};
                }));

        SPECS.put(MarketSchema.STATISTICS, new TableSpec("statistics_data", List.of(
                ts("ts_event", true), bigint("instrument_id", true), varchar("symbol", 50, false),
                integer("stat_type", true), varchar("stat_type_desc", 50, false), price("stat_value", false),
                bigint("quantity", false), varchar("update_action", 1, false),
                bigint("sequence_number", false), ts("ts_recv", false), integer("publisher_id", false)),
                IdempotencyKey.forSchema(MarketSchema.STATISTICS),
                r -> {
                    Statistic s = (Statistic) r;
                    return new Object[]{s.tsEvent(), s.instrumentId(), s.symbol(), s.statTypeCode(),
                            s.statType().map(Enum::name).orElse(null), s.price(), s.quantity(), s.updateAction(),
                            s.sequence(), s.tsRecv(), s.publisherId()};
                }));

        SPECS.put(MarketSchema.DEFINITION, new TableSpec("definitions_data", List.of(
                ts("ts_event", true), bigint("instrument_id", true), varchar("raw_symbol", 50, true),
                varchar("security_update_action", 1, false), varchar("instrument_class", 1, false),
                price("min_price_increment", false), price("display_factor", false),
                ts("expiration", false), ts("activation", false),
                price("high_limit_price", false), price("low_limit_price", false),
                varchar("currency", 10, false), varchar("exchange", 20, false), varchar("asset", 20, false),
                varchar("security_group", 20, false), bigint("underlying_id", false), integer("publisher_id", false)),
                IdempotencyKey.forSchema(MarketSchema.DEFINITION),
                r -> {
                    InstrumentDefinition d = (InstrumentDefinition) r;
                    return new Object[]{d.tsEvent(), d.instrumentId(), d.rawSymbol(), d.securityUpdateAction(),
                            d.instrumentClass(), d.minPriceIncrement(), d.displayFactor(), d.expiration(), d.activation(),
                            d.highLimitPrice(), d.lowLimitPrice(), d.currency(), d.exchange(), d.asset(),
                            d.securityGroup(), d.underlyingId(), d.publisherId()};
                }));
    }

    private TableSpecs() {}

    public static TableSpec forSchema(MarketSchema schema) {
        TableSpec spec = SPECS.get(schema);
        if (spec == null) throw new IllegalArgumentException("no table for " + schema);
        return spec;
    }

    public static List<TableSpec> all() { return List.copyOf(SPECS.values()); }

    private static Column ts(String name, boolean notNull) {
        return new Column(name, TS, Types.TIMESTAMP_WITH_TIMEZONE, notNull);
    }

    private static Column bigint(String name, boolean notNull) {
        return new Column(name, "BIGINT", Types.BIGINT, notNull);
    }

    private static Column integer(String name, boolean notNull) {
        return new Column(name, "INTEGER", Types.INTEGER, notNull);
    }

    private static Column price(String name, boolean notNull) {
        return new Column(name, "DECIMAL(" + PRICE_PRECISION + "," + PRICE_SCALE + ")", Types.DECIMAL, notNull,
                0, PRICE_PRECISION, PRICE_SCALE);
    }

    private static Column varchar(String name, int len, boolean notNull) {
        return new Column(name, "VARCHAR(" + len + ")", Types.VARCHAR, notNull, len, 0, 0);
    }
}
