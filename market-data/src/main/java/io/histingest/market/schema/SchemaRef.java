package io.histingest.market.schema;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A resolved schema name such as {@code ohlcv-1d}, {@code trades} or {@code tbbo}. OHLCV carries
 * its bar granularity; the other schemas have none.
 */
public record SchemaRef(MarketSchema type, String granularity) {
    private static final Set<String> GRANULARITIES = Set.of("1s", "1m", "1h", "1d");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("ohlcv-daily", "ohlcv-1d"),
            Map.entry("ohlcv-eod", "ohlcv-1d"),
            Map.entry("ohlcv-d", "ohlcv-1d"),
            Map.entry("ohlcv-h", "ohlcv-1h"),
            Map.entry("ohlcv-m", "ohlcv-1m"),
            Map.entry("ohlcv-s", "ohlcv-1s"),
            Map.entry("top-of-book", "tbbo"),
            Map.entry("quotes", "tbbo"),
            Map.entry("bbo", "tbbo"),
            Map.entry("stats", "statistics"),
            Map.entry("definitions", "definition"),
            Map.entry("trd", "trades"));

    public SchemaRef {
        Objects.requireNonNull(type, "type");
        if (type == MarketSchema.OHLCV) {
            if (granularity == null || !GRANULARITIES.contains(granularity)) {
                throw new IllegalArgumentException("OHLCV needs a granularity in " + GRANULARITIES + ", got " + granularity);
            }
        } else if (granularity != null) {
            throw new IllegalArgumentException(type + " has no granularity");
        }
    }

    public static SchemaRef ohlcv(String granularity) { return new SchemaRef(MarketSchema.OHLCV, granularity); }
    public static SchemaRef of(MarketSchema type) { return new SchemaRef(type, null); }

    /**
     * Parses a schema name, accepting the common aliases ({@code ohlcv-daily}, {@code quotes}, {@code stats}...).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SchemaRef parse(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("schema name is empty");
        String n = name.trim().toLowerCase(Locale.ROOT);
        n = ALIASES.getOrDefault(n, n);
        if (n.startsWith("ohlcv-")) {
            return ohlcv(n.substring("ohlcv-".length()));
        }
        switch (n) {
            case "trades": return of(MarketSchema.TRADES);
            case "tbbo": return of(MarketSchema.TBBO);
            case "statistics": return of(MarketSchema.STATISTICS);
            case "definition": return of(MarketSchema.DEFINITION);
            default: throw new IllegalArgumentException("unknown schema '" + name + "'");
        }
    }

    public String canonicalName() {
        switch (type) {
            case OHLCV: return "ohlcv-" + granularity;
            case TRADES: return "trades";
            case TBBO: return "tbbo";
            case STATISTICS: return "statistics";
            case DEFINITION: return "definition";
            default: throw new IllegalStateException(type.name());
        }
    }

    @Override
    public String toString() { return canonicalName(); }
}
