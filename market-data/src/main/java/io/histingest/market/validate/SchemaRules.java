package io.histingest.market.validate;

import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.model.InstrumentDefinition;
import io.histingest.market.model.OhlcvBar;
import io.histingest.market.model.Statistic;
import io.histingest.market.model.TopOfBookQuote;
import io.histingest.market.model.Trade;
import io.histingest.market.schema.MarketSchema;
import io.histingest.market.storage.TableSpecs;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Business rules per schema, evaluated in declaration order. The structural rules shared by
 * every schema come first, then the column limits of the schema's table.
 */
public final class SchemaRules {
    public static final String INSTRUMENT_ID_POSITIVE = "instrument_id_positive";
    public static final String TS_EVENT_IN_RANGE = "ts_event_in_range";

    public static final String OHLCV_HIGH_GTE_LOW = "ohlcv_high_gte_low";
    public static final String OHLCV_HIGH_GTE_OPEN = "ohlcv_high_gte_open";
    public static final String OHLCV_HIGH_GTE_CLOSE = "ohlcv_high_gte_close";
    public static final String OHLCV_PRICES_POSITIVE = "ohlcv_prices_positive";
    public static final String OHLCV_LOW_LTE_OPEN = "ohlcv_low_lte_open";
    public static final String OHLCV_LOW_LTE_CLOSE = "ohlcv_low_lte_close";
    public static final String OHLCV_VOLUME_NON_NEGATIVE = "ohlcv_volume_non_negative";

    public static final String TRADE_PRICE_POSITIVE = "trade_price_positive";
    public static final String TRADE_SIZE_POSITIVE = "trade_size_positive";
    public static final String TRADE_SIDE_KNOWN = "trade_side_known";

    public static final String QUOTE_ASK_GTE_BID = "quote_ask_gte_bid";
    public static final String QUOTE_HAS_SIDE = "quote_has_side";
    public static final String QUOTE_SIZES_NON_NEGATIVE = "quote_sizes_non_negative";

    public static final String STAT_TYPE_KNOWN = "stat_type_known";

    public static final String DEFINITION_SYMBOL_PRESENT = "definition_symbol_present";
    public static final String DEFINITION_EXPIRATION_AFTER_ACTIVATION = "definition_expiration_after_activation";

    private static final Instant EARLIEST = Instant.EPOCH;
    private static final Set<String> TRADE_SIDES = Set.of("A", "B", "N");

    private final Map<MarketSchema, RuleSet> ruleSets = new EnumMap<>(MarketSchema.class);

    private SchemaRules(Clock clock) {
        List<SchemaRule<?>> common = List.of(
                SchemaRule.of(INSTRUMENT_ID_POSITIVE, "instrument id must be positive", CanonicalRecord.class,
                        r -> r.instrumentId() > 0),
                SchemaRule.of(TS_EVENT_IN_RANGE, "event time must fall between 1970 and 20 years from now", CanonicalRecord.class,
                        r -> r.tsEvent() != null && !r.tsEvent().isBefore(EARLIEST)
                                && r.tsEvent().isBefore(clock.instant().atZone(ZoneOffset.UTC).plusYears(20).toInstant())));

        register(MarketSchema.OHLCV, common, List.of(
                SchemaRule.of(OHLCV_HIGH_GTE_LOW, "high must be >= low", OhlcvBar.class,
                        b -> b.high().compareTo(b.low()) >= 0),
                SchemaRule.of(OHLCV_HIGH_GTE_OPEN, "high must be >= open", OhlcvBar.class,
                        b -> b.high().compareTo(b.open()) >= 0),
                SchemaRule.of(OHLCV_HIGH_GTE_CLOSE, "high must be >= close", OhlcvBar.class,
                        b -> b.high().compareTo(b.close()) >= 0),
                SchemaRule.of(OHLCV_PRICES_POSITIVE, "open, high, low and close must be positive", OhlcvBar.class,
                        b -> positive(b.open()) && positive(b.high()) && positive(b.low()) && positive(b.close())),
                SchemaRule.of(OHLCV_LOW_LTE_OPEN, "low must be <= open", OhlcvBar.class,
                        b -> b.low().compareTo(b.open()) <= 0),
                SchemaRule.of(OHLCV_LOW_LTE_CLOSE, "low must be <= close", OhlcvBar.class,
                        b -> b.low().compareTo(b.close()) <= 0),
                SchemaRule.of(OHLCV_VOLUME_NON_NEGATIVE, "volume must be >= 0", OhlcvBar.class,
                        b -> b.volume() >= 0)));

        register(MarketSchema.TRADES, common, List.of(
                SchemaRule.of(TRADE_PRICE_POSITIVE, "price must be positive", Trade.class, t -> positive(t.price())),
                SchemaRule.of(TRADE_SIZE_POSITIVE, "size must be positive", Trade.class, t -> t.size() > 0),
                SchemaRule.of(TRADE_SIDE_KNOWN, "side must be A, B or N", Trade.class,
                        t -> t.side() == null || TRADE_SIDES.contains(t.side()))));

        register(MarketSchema.TBBO, common, List.of(
                SchemaRule.of(QUOTE_ASK_GTE_BID, "ask must be >= bid", TopOfBookQuote.class, q -> !q.isCrossed()),
                SchemaRule.of(QUOTE_HAS_SIDE, "bid or ask must be present", TopOfBookQuote.class,
                        q -> q.bidPx() != null || q.askPx() != null),
                SchemaRule.of(QUOTE_SIZES_NON_NEGATIVE, "sizes must be >= 0", TopOfBookQuote.class,
                        q -> (q.bidSz() == null || q.bidSz() >= 0) && (q.askSz() == null || q.askSz() >= 0))));

        register(MarketSchema.STATISTICS, common, List.of(
                SchemaRule.of(STAT_TYPE_KNOWN, "stat type must be a known code", Statistic.class,
                        s -> s.statType().isPresent())));

        register(MarketSchema.DEFINITION, common, List.of(
                SchemaRule.of(DEFINITION_SYMBOL_PRESENT, "raw symbol must be present", InstrumentDefinition.class,
                        d -> d.rawSymbol() != null && !d.rawSymbol().isBlank()),
                SchemaRule.of(DEFINITION_EXPIRATION_AFTER_ACTIVATION, "expiration must be after activation",
                        InstrumentDefinition.class,
                        d -> d.expiration() == null || d.activation() == null || d.expiration().isAfter(d.activation()))));
    }

    public static SchemaRules standard() { return new SchemaRules(Clock.systemUTC()); }

    public static SchemaRules standard(Clock clock) { return new SchemaRules(clock); }

    public RuleSet forSchema(MarketSchema schema) {
        RuleSet rs = ruleSets.get(schema);
        if (rs == null) throw new IllegalArgumentException("no rules for " + schema);
        return rs;
    }

    private void register(MarketSchema schema, List<SchemaRule<?>> common, List<SchemaRule<?>> specific) {
        List<SchemaRule<?>> all = new ArrayList<>(common);
        all.addAll(TableSpecs.forSchema(schema).columnLimitRules());
        all.addAll(specific);
        ruleSets.put(schema, new RuleSet(schema, all, IdempotencyKey.forSchema(schema)));
    }

    private static boolean positive(BigDecimal v) {
        return v != null && v.signum() > 0;
    }
}
