package io.histingest.market.job;

import io.histingest.config.PipelineConfig;
import io.histingest.market.schema.SchemaRef;
import io.histingest.market.schema.SymbolType;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything one ingestion job needs to know. Dates are inclusive. Build with {@link #builder()};
 * {@link #validate()} lists what is wrong before the job is started.
 */
public record JobConfig(
        String name,
        String provider,
        String dataset,
        String schema,
        List<String> symbols,
        SymbolType stypeIn,
        LocalDate startDate,
        LocalDate endDate,
        int chunkSize,
        int maxRetries,
        Duration backoffMin,
        Duration backoffMax,
        double backoffMultiplier,
        double backoffJitter,
        int maxInFlightChunks,
        Duration extractTimeout,
        Duration storeTimeout,
        long progressEveryRecords
) {
    public JobConfig {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    public static Builder builder() { return new Builder(); }

    /** Builder seeded with runtime defaults (environment overrides included). */
    public static Builder builder(PipelineConfig defaults) {
        return new Builder()
                .chunkSize(defaults.chunkSize())
                .maxRetries(defaults.maxRetries())
                .backoff(Duration.ofMillis(defaults.backoffMinMillis()), Duration.ofMillis(defaults.backoffMaxMillis()),
                        defaults.backoffMultiplier())
                .maxInFlightChunks(defaults.maxInFlightChunks())
                .extractTimeout(defaults.extractTimeout())
                .storeTimeout(defaults.storeTimeout());
    }

    /**
     * @throws IllegalArgumentException when the schema name is unknown; call {@link #validate()} first
     */
    public SchemaRef schemaRef() { return SchemaRef.parse(schema); }

    /**
     * @return problems found, empty when the job may start
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (blank(name)) problems.add("name is required");
        if (blank(provider)) problems.add("provider is required");
        if (blank(dataset)) problems.add("dataset is required");
        if (blank(schema)) {
            problems.add("schema is required");
        } else {
            try {
                SchemaRef.parse(schema);
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
        }
        if (symbols.isEmpty()) problems.add("at least one symbol is required");
        if (symbols.stream().anyMatch(JobConfig::blank)) problems.add("symbols must not be blank");
        if (stypeIn == null) problems.add("stype_in is required");
        if (startDate == null) problems.add("start_date is required");
        if (endDate == null) problems.add("end_date is required");
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            problems.add("start_date " + startDate + " is after end_date " + endDate);
        }
        if (chunkSize <= 0) problems.add("chunk_size must be > 0");
        if (maxRetries < 0) problems.add("max_retries must be >= 0");
        if (backoffMin == null || backoffMin.isNegative() || backoffMin.isZero()) problems.add("backoff min must be > 0");
        if (backoffMin != null && backoffMax != null && backoffMax.compareTo(backoffMin) < 0) {
            problems.add("backoff max must be >= backoff min");
        }
        if (!(backoffMultiplier > 1.0)) problems.add("backoff multiplier must be > 1");
        if (backoffJitter < 0 || backoffJitter > 1) problems.add("backoff jitter must be in [0, 1]");
        if (maxInFlightChunks <= 0) problems.add("max_in_flight_chunks must be > 0");
        if (extractTimeout == null || extractTimeout.isNegative()) problems.add("extract timeout must be >= 0");
        if (storeTimeout == null || storeTimeout.isNegative()) problems.add("store timeout must be >= 0");
        if (progressEveryRecords < 0) problems.add("progress interval must be >= 0");
        return problems;
    }

    private static boolean blank(String s) { return s == null || s.isBlank(); }

    public static final class Builder {
        private String name;
        private String provider;
        private String dataset;
        private String schema;
        private List<String> symbols = List.of();
        private SymbolType stypeIn = SymbolType.CONTINUOUS;
        private LocalDate startDate;
        private LocalDate endDate;
        private int chunkSize = 10_000;
        private int maxRetries = 3;
        private Duration backoffMin = Duration.ofSeconds(1);
        private Duration backoffMax = Duration.ofSeconds(60);
        private double backoffMultiplier = 2.0;
        private double backoffJitter = 0.0;
        private int maxInFlightChunks = 4;
        private Duration extractTimeout = Duration.ofMinutes(5);
        private Duration storeTimeout = Duration.ofMinutes(2);
        private long progressEveryRecords = 0;

        public Builder name(String v) { this.name = v; return this; }
        public Builder provider(String v) { this.provider = v; return this; }
        public Builder dataset(String v) { this.dataset = v; return this; }
        public Builder schema(String v) { this.schema = v; return this; }
        public Builder symbols(List<String> v) { this.symbols = v; return this; }
        public Builder symbols(String... v) { this.symbols = List.of(v); return this; }
        public Builder stypeIn(SymbolType v) { this.stypeIn = v; return this; }
        public Builder dates(LocalDate start, LocalDate end) { this.startDate = start; this.endDate = end; return this; }
        public Builder chunkSize(int v) { this.chunkSize = v; return this; }
        public Builder maxRetries(int v) { this.maxRetries = v; return this; }
        public Builder backoff(Duration min, Duration max, double multiplier) {
            this.backoffMin = min;
            this.backoffMax = max;
            this.backoffMultiplier = multiplier;
            return this;
        }
        public Builder backoffJitter(double v) { this.backoffJitter = v; return this; }
        public Builder maxInFlightChunks(int v) { this.maxInFlightChunks = v; return this; }
        public Builder extractTimeout(Duration v) { this.extractTimeout = v; return this; }
        public Builder storeTimeout(Duration v) { this.storeTimeout = v; return this; }
        public Builder progressEveryRecords(long v) { this.progressEveryRecords = v; return this; }

        public JobConfig build() {
            return new JobConfig(name, provider, dataset, schema, Objects.requireNonNullElse(symbols, List.of()), stypeIn,
                    startDate, endDate, chunkSize, maxRetries, backoffMin, backoffMax, backoffMultiplier, backoffJitter,
                    maxInFlightChunks, extractTimeout, storeTimeout, progressEveryRecords);
        }
    }
}
