package io.histingest.market.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.histingest.config.PipelineConfig;
import io.histingest.market.schema.SymbolType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named jobs read from a YAML file. Each entry under {@code jobs:} carries name, dataset, schema, symbols (a list or a
 * single string), stype_in and start/end dates; provider, chunk_size and max_retries are optional. An optional
 * top-level {@code provider} and {@code retry_policy} (max_retries, base_delay and max_delay in seconds,
 * backoff_multiplier) apply to every job that does not set its own. Other sections are ignored.
 */
public final class JobCatalog {
    private static final Logger log = LoggerFactory.getLogger(JobCatalog.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);

    record Document(
            @JsonProperty("provider") String provider,
            @JsonProperty("jobs") List<Entry> jobs,
            @JsonProperty("retry_policy") RetryDefaults retryPolicy) {
    }

    record Entry(
            @JsonProperty("name") String name,
            @JsonProperty("provider") String provider,
            @JsonProperty("dataset") String dataset,
            @JsonProperty("schema") String schema,
            @JsonProperty("symbols") List<String> symbols,
            @JsonProperty("stype_in") String stypeIn,
            @JsonProperty("start_date") LocalDate startDate,
            @JsonProperty("end_date") LocalDate endDate,
            @JsonProperty("chunk_size") Integer chunkSize,
            @JsonProperty("max_retries") Integer maxRetries) {

        List<String> missing() {
            List<String> missing = new ArrayList<>();
            if (blank(name)) missing.add("name");
            if (blank(dataset)) missing.add("dataset");
            if (blank(schema)) missing.add("schema");
            if (symbols == null || symbols.isEmpty()) missing.add("symbols");
            if (startDate == null) missing.add("start_date");
            if (endDate == null) missing.add("end_date");
            if (blank(stypeIn)) missing.add("stype_in");
            return missing;
        }
    }

    record RetryDefaults(
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("base_delay") Double baseDelay,
            @JsonProperty("max_delay") Double maxDelay,
            @JsonProperty("backoff_multiplier") Double backoffMultiplier) {
    }

    private final String source;
    private final String provider;
    private final RetryDefaults retry;
    private final Map<String, Entry> jobs = new LinkedHashMap<>();
    private final List<String> problems = new ArrayList<>();

    private JobCatalog(String source, Document doc) {
        this.source = source;
        this.provider = doc.provider();
        this.retry = doc.retryPolicy();
        List<Entry> entries = doc.jobs() == null ? List.of() : doc.jobs();
        if (entries.isEmpty()) problems.add("no jobs defined");
        for (int i = 0; i < entries.size(); i++) {
            Entry e = entries.get(i);
            if (e == null) {
                problems.add("job #" + (i + 1) + " is empty");
                continue;
            }
            List<String> missing = e.missing();
            String label = blank(e.name()) ? "job #" + (i + 1) : "job " + e.name();
            if (!missing.isEmpty()) {
                log.error("{} in {} is missing required fields: {}", label, source, missing);
                problems.add(label + " is missing required fields: " + String.join(", ", missing));
            }
            if (blank(e.name())) continue;
            if (jobs.putIfAbsent(e.name(), e) != null) problems.add("job " + e.name() + " is defined more than once");
        }
    }

    /**
     * @throws IOException when the file cannot be read or is not valid YAML for this layout
     */
    public static JobCatalog load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(file.toString(), in);
        }
    }

    public static JobCatalog read(String source, InputStream in) throws IOException {
        Document doc = YAML.readValue(in, Document.class);
        JobCatalog catalog = new JobCatalog(source, doc == null ? new Document(null, null, null) : doc);
        log.info("Loaded {} job(s) from {}", catalog.jobs.size(), source);
        return catalog;
    }

    public List<String> names() { return List.copyOf(jobs.keySet()); }

    /** Problems with the file as a whole: empty file, entries missing required fields, duplicate names. */
    public List<String> problems() { return List.copyOf(problems); }

    /**
     * A builder for the named job, seeded with {@code defaults}, then the file's retry policy, then the job's own
     * fields. The provider is the job's, else the file's, else {@code fallbackProvider}. The caller may override
     * further before {@link JobConfig.Builder#build()}.
     *
     * @throws IllegalArgumentException when the job's stype_in is not a known symbol type
     */
    public Optional<JobConfig.Builder> builder(String name, PipelineConfig defaults, String fallbackProvider) {
        Entry e = jobs.get(name);
        if (e == null) return Optional.empty();
        JobConfig.Builder b = JobConfig.builder(defaults);
        if (retry != null) {
            if (retry.maxRetries() != null) b.maxRetries(retry.maxRetries());
            Duration min = retry.baseDelay() == null ? Duration.ofMillis(defaults.backoffMinMillis()) : seconds(retry.baseDelay());
            Duration max = retry.maxDelay() == null ? Duration.ofMillis(defaults.backoffMaxMillis()) : seconds(retry.maxDelay());
            double multiplier = retry.backoffMultiplier() == null ? defaults.backoffMultiplier() : retry.backoffMultiplier();
            b.backoff(min, max, multiplier);
        }
        b.name(e.name())
                .provider(!blank(e.provider()) ? e.provider() : !blank(provider) ? provider : fallbackProvider)
                .dataset(e.dataset())
                .schema(e.schema())
                .symbols(e.symbols())
                .dates(e.startDate(), e.endDate());
        if (!blank(e.stypeIn())) b.stypeIn(SymbolType.parse(e.stypeIn()));
        if (e.chunkSize() != null) b.chunkSize(e.chunkSize());
        if (e.maxRetries() != null) b.maxRetries(e.maxRetries());
        return Optional.of(b);
    }

    /**
     * Everything wrong with the named job: file-level problems for its entry plus {@link JobConfig#validate()}.
     * Empty when the job may start.
     */
    public List<String> validate(String name, PipelineConfig defaults, String fallbackProvider) {
        List<String> out = new ArrayList<>();
        if (!jobs.containsKey(name)) {
            out.add("job " + name + " not found in " + source + " (known: " + String.join(", ", jobs.keySet()) + ")");
            return out;
        }
        String prefix = "job " + name + " ";
        for (String p : problems) {
            if (p.startsWith(prefix)) out.add(p);
        }
        JobConfig job;
        try {
            job = builder(name, defaults, fallbackProvider).orElseThrow().build();
        } catch (IllegalArgumentException e) {
            out.add(e.getMessage());
            return out;
        }
        for (String p : job.validate()) {
            if (!out.contains(p)) out.add(p);
        }
        return out;
    }

    private static Duration seconds(double s) { return Duration.ofMillis(Math.round(s * 1000)); }

    private static boolean blank(String s) { return s == null || s.isBlank(); }
}
