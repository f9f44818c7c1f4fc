package io.histingest.market.runtime;

import com.codahale.metrics.MetricRegistry;
import io.histingest.core.Chunk;
import io.histingest.core.ErrorKind;
import io.histingest.core.Result;
import io.histingest.error.FileQuarantineSink;
import io.histingest.error.QuarantineEntry;
import io.histingest.error.QuarantineSink;
import io.histingest.market.extract.ExtractorRegistry;
import io.histingest.market.extract.FileReplayExtractor;
import io.histingest.market.extract.ProviderException;
import io.histingest.market.extract.ReplayFixtures;
import io.histingest.market.job.JobConfig;
import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.model.RawRecord;
import io.histingest.market.storage.JdbcStorageLoader;
import io.histingest.market.storage.JdbcStorageLoaderTest;
import io.histingest.market.storage.StorageLoader;
import io.histingest.market.storage.StoreCounts;
import io.histingest.market.validate.SchemaRules;
import io.histingest.metrics.Metrics;
import io.histingest.progress.ProgressEvent;
import io.histingest.progress.Stage;
import io.histingest.state.InMemoryOperationStateStore;
import io.histingest.state.OperationSnapshot;
import io.histingest.state.OperationStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineOrchestratorTest {
    private static final String DATASET = "GLBX.MDP3";
    private static final LocalDate START = LocalDate.of(2020, 1, 1);

    private Path replay;
    private Path dlq;
    private JdbcDataSource db;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private final List<ProgressEvent> events = new CopyOnWriteArrayList<>();
    private final InMemoryOperationStateStore states = new InMemoryOperationStateStore();
    private final MetricRegistry registry = new MetricRegistry();
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setup() throws Exception {
        replay = Files.createTempDirectory("replay");
        dlq = Files.createTempDirectory("dlq");
        db = JdbcStorageLoaderTest.h2();
    }

    @AfterEach
    void cleanup() throws IOException {
        if (orchestrator != null) orchestrator.close();
        for (Path root : List.of(replay, dlq)) {
            try (Stream<Path> s = Files.walk(root)) {
                s.sorted(Collections.reverseOrder()).forEach(p -> p.toFile().delete());
            }
        }
    }

    private PipelineOrchestrator build(ExtractorRegistry extractors, StorageLoader loader, QuarantineSink sink) {
        orchestrator = PipelineOrchestrator.builder()
                .extractors(extractors)
                .loader(loader)
                .quarantine(sink)
                .stateStore(states)
                .progress(events::add)
                .metrics(registry)
                .sleeper(sleeps::add)
                .build();
        return orchestrator;
    }

    private PipelineOrchestrator replayPipeline() {
        return build(new ExtractorRegistry().register(new FileReplayExtractor(replay)),
                new JdbcStorageLoader(db, new Metrics(registry)), new FileQuarantineSink(dlq));
    }

    private static JobConfig.Builder job(String schema, String... symbols) {
        return JobConfig.builder()
                .name("es_backfill")
                .provider(FileReplayExtractor.PROVIDER)
                .dataset(DATASET)
                .schema(schema)
                .symbols(symbols)
                .dates(START, START.plusYears(5))
                .chunkSize(100)
                .maxInFlightChunks(3);
    }

    /** 1000 daily bars; the bars at {@code badIndexes} have high below low. */
    private void writeBars(int... badIndexes) throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            boolean bad = false;
            for (int b : badIndexes) bad |= b == i;
            lines.add(bad
                    ? ReplayFixtures.bar(1, START.plusDays(i), "ESH4", "10", "9", "12", "11", 100)
                    : ReplayFixtures.bar(1, START.plusDays(i), "ESH4", "10", "12", "9", "11", 100 + i));
        }
        ReplayFixtures.write(replay, DATASET, "ohlcv-1d", "bars.jsonl", lines);
    }

    private List<QuarantineEntry> quarantined(String jobName) throws IOException {
        return new FileQuarantineSink(dlq).entries(jobName);
    }

    private static Chunk<RawRecord> barChunk(long seq, int n) {
        List<RawRecord> records = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            records.add(RawRecord.of(Map.of("instrument_id", 1, "ts_event", START.plusDays(seq * n + i) + "T00:00:00Z",
                    "open", "10", "high", "12", "low", "9", "close", "11", "volume", 5)));
        }
        return new Chunk<>(seq, records);
    }

    private static JobConfig.Builder scriptedJob() {
        return job("ohlcv-1d", "ESH4").provider(ScriptedExtractor.PROVIDER).maxInFlightChunks(1);
    }

    @Test
    void invalid_bars_are_quarantined_and_the_rest_stored() throws Exception {
        writeBars(10, 11, 12, 13, 14);

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ESH4").build());

        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, outcome.status(), outcome::describe);
        assertTrue(outcome.succeeded());
        assertEquals(995, JdbcStorageLoaderTest.rows(db, "daily_ohlcv_data"));
        assertEquals(995, outcome.summary().recordsStored());
        assertEquals(5, outcome.summary().recordsQuarantined());
        assertEquals(1000, outcome.summary().recordsFetched());
        assertEquals(10, outcome.summary().chunksProcessed());

        List<QuarantineEntry> entries = quarantined("es_backfill");
        assertEquals(1, entries.size());
        QuarantineEntry e = entries.get(0);
        assertEquals(5, e.recordCount());
        assertEquals("business_rule_violation", e.errorType());
        assertEquals(SchemaRules.OHLCV_HIGH_GTE_LOW, e.context().get("reason"));
        assertEquals(outcome.jobId(), e.jobId());
        assertNotNull(outcome.quarantineLocation());
        assertTrue(outcome.describe().contains("5 quarantined"));
    }

    @Test
    void rerunning_the_same_job_leaves_the_row_count_unchanged() throws Exception {
        writeBars(10, 11, 12, 13, 14);
        PipelineOrchestrator p = replayPipeline();

        for (int i = 0; i < 3; i++) {
            JobOutcome o = p.run(job("ohlcv-1d", "ESH4").build());
            assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, o.status());
            assertEquals(995, o.summary().recordsStored());
            assertEquals(995, JdbcStorageLoaderTest.rows(db, "daily_ohlcv_data"));
        }
    }

    @Test
    void clean_run_completes_and_persists_a_terminal_snapshot() throws Exception {
        writeBars();

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ESH4").build());

        assertEquals(OperationStatus.COMPLETED, outcome.status());
        assertNull(outcome.error());
        assertNull(outcome.quarantineLocation());
        OperationSnapshot saved = states.get(outcome.jobId()).orElseThrow();
        assertEquals(OperationStatus.COMPLETED, saved.status());
        assertEquals(1000, saved.recordsStored());
        assertNotNull(saved.endedAt());
        assertEquals(1000, registry.meter("ingest.records.stored").getCount());
        assertEquals(1, registry.counter("ingest.jobs.completed").getCount());
        assertTrue(quarantined("es_backfill").isEmpty());
    }

    @Test
    void extraction_timeouts_exhaust_retries_and_fail_the_job() throws Exception {
        ScriptedExtractor hangs = new ScriptedExtractor(n -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw ProviderException.transientFailure("slow", "provider did not answer", null);
        });
        PipelineOrchestrator p = build(new ExtractorRegistry().register(hangs), (r, s) -> Result.ok(StoreCounts.NONE),
                new FileQuarantineSink(dlq));

        JobOutcome outcome = p.run(scriptedJob().extractTimeout(Duration.ofMillis(50)).build());

        assertEquals(OperationStatus.FAILED, outcome.status());
        assertFalse(outcome.succeeded());
        assertEquals(ErrorKind.PROVIDER_PERMANENT, outcome.error().kind());
        assertEquals("timeout", outcome.error().code());
        assertTrue(outcome.error().retriesExhausted());
        assertEquals(4, outcome.error().attempts());
        assertEquals(List.of(1000L, 2000L, 4000L), sleeps);
        assertEquals(3, registry.counter("ingest.retries").getCount());
        assertTrue(quarantined("es_backfill").isEmpty());
        assertTrue(hangs.closed);
        assertEquals(OperationStatus.FAILED, states.get(outcome.jobId()).orElseThrow().status());
    }

    @Test
    void slow_chunk_that_ignores_interrupts_is_kept_not_skipped() {
        ScriptedExtractor slowFirst = new ScriptedExtractor(n -> {
            if (n == 0) {
                long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(250);
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            }
            return n < 3 ? barChunk(n, 10) : null;
        });
        List<CanonicalRecord> stored = new CopyOnWriteArrayList<>();
        PipelineOrchestrator p = build(new ExtractorRegistry().register(slowFirst),
                (r, s) -> { stored.addAll(r); return Result.ok(new StoreCounts(r.size(), r.size(), 0)); },
                new FileQuarantineSink(dlq));

        JobOutcome outcome = p.run(scriptedJob().extractTimeout(Duration.ofMillis(100)).build());

        assertEquals(OperationStatus.COMPLETED, outcome.status(), outcome::describe);
        assertEquals(30, stored.size());
        assertEquals(30, outcome.summary().recordsFetched());
        assertEquals(4, slowFirst.calls.get(), "the timed-out call is waited for, not repeated");
        assertFalse(sleeps.isEmpty());
    }

    @Test
    void transient_extraction_failure_recovers_on_retry() {
        ScriptedExtractor flaky = new ScriptedExtractor(n -> {
            if (n == 0) throw ProviderException.transientFailure("rate_limited", "429", null);
            return n == 1 ? barChunk(0, 10) : null;
        });
        List<CanonicalRecord> stored = new CopyOnWriteArrayList<>();
        PipelineOrchestrator p = build(new ExtractorRegistry().register(flaky),
                (r, s) -> { stored.addAll(r); return Result.ok(new StoreCounts(r.size(), r.size(), 0)); },
                new FileQuarantineSink(dlq));

        JobOutcome outcome = p.run(scriptedJob().build());

        assertEquals(OperationStatus.COMPLETED, outcome.status(), outcome::describe);
        assertEquals(10, stored.size());
        assertEquals(List.of(1000L), sleeps);
    }

    @Test
    void unknown_symbol_fails_up_front_with_remediation() throws Exception {
        writeBars();
        ReplayFixtures.symbols(replay, DATASET, "ESH4", "NQH4");

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ESZ9").build());

        assertEquals(OperationStatus.FAILED, outcome.status());
        assertEquals(ErrorKind.PROVIDER_PERMANENT, outcome.error().kind());
        assertEquals("symbol_not_found", outcome.error().code());
        assertNotNull(outcome.error().remediation());
        assertTrue(outcome.describe().contains("Suggested"));
        assertTrue(sleeps.isEmpty());
        assertEquals(0, JdbcStorageLoaderTest.rows(db, "daily_ohlcv_data"));
    }

    @Test
    void crossed_quote_is_quarantined_while_its_siblings_are_stored() throws Exception {
        ReplayFixtures.write(replay, DATASET, "tbbo", "quotes.jsonl", List.of(
                ReplayFixtures.quote(7, "2024-01-02T14:30:01Z", "ESH4", "4780.25", "4780.50"),
                ReplayFixtures.quote(7, "2024-01-02T14:30:02Z", "ESH4", "4780.75", "4780.50"),
                ReplayFixtures.quote(7, "2024-01-02T14:30:03Z", "ESH4", "4780.50", "4780.75")));

        JobOutcome outcome = replayPipeline().run(job("tbbo", "ESH4").build());

        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, outcome.status());
        assertEquals(2, JdbcStorageLoaderTest.rows(db, "tbbo_data"));
        List<QuarantineEntry> entries = quarantined("es_backfill");
        assertEquals(1, entries.size());
        assertEquals(SchemaRules.QUOTE_ASK_GTE_BID, entries.get(0).context().get("reason"));
        assertEquals("4780.75", entries.get(0).failedRecords().get(0).get("bid_px_00"));
    }

    @Test
    void oversized_field_is_quarantined_instead_of_failing_the_chunk() throws Exception {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String symbol = i == 2 ? "ESH4".repeat(15) : "ESH4";
            lines.add(ReplayFixtures.bar(1, START.plusDays(i), symbol, "10", "12", "9", "11", 100));
        }
        ReplayFixtures.write(replay, DATASET, "ohlcv-1d", "bars.jsonl", lines);

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ALL_SYMBOLS").build());

        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, outcome.status(), outcome::describe);
        assertEquals(4, JdbcStorageLoaderTest.rows(db, "daily_ohlcv_data"));
        List<QuarantineEntry> entries = quarantined("es_backfill");
        assertEquals(1, entries.size());
        assertEquals("column_limit:symbol", entries.get(0).context().get("reason"));
    }

    @Test
    void transform_failures_are_grouped_by_reason() throws Exception {
        List<String> lines = new ArrayList<>();
        lines.add(ReplayFixtures.bar(1, START, "ESH4", "10", "12", "9", "11", 100));
        lines.add("{\"instrument_id\":1,\"ts_event\":\"2020-01-02T00:00:00Z\",\"symbol\":\"ESH4\",\"open\":\"10\"}");
        lines.add("{\"instrument_id\":1,\"ts_event\":\"2020-01-03T00:00:00Z\",\"symbol\":\"ESH4\",\"open\":\"10\"}");
        lines.add("{oops");
        ReplayFixtures.write(replay, DATASET, "ohlcv-1d", "bars.jsonl", lines);

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ESH4").build());

        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, outcome.status());
        assertEquals(1, outcome.summary().recordsStored());
        assertEquals(3, outcome.summary().recordsQuarantined());
        Map<Object, Integer> byReason = quarantined("es_backfill").stream()
                .collect(Collectors.toMap(e -> e.context().get("reason"), QuarantineEntry::recordCount));
        assertEquals(Map.of("missing_field:high", 2, "unparsable_record", 1), byReason);
        assertTrue(quarantined("es_backfill").stream().allMatch(e -> e.errorType().equals("transform_error")));
    }

    @Test
    void every_record_quarantined_still_completes() throws Exception {
        writeBars();
        List<String> bad = new ArrayList<>();
        for (int i = 0; i < 3; i++) bad.add(ReplayFixtures.bar(1, START.plusDays(i), "ESH4", "10", "9", "12", "11", 1));
        ReplayFixtures.write(replay, DATASET, "ohlcv-1d", "bars.jsonl", bad);

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ESH4").build());

        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, outcome.status());
        assertEquals(0, outcome.summary().recordsStored());
        assertEquals(3, outcome.summary().recordsQuarantined());
    }

    @Test
    void empty_range_completes_with_nothing_stored() throws Exception {
        writeBars();

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ESH4")
                .dates(LocalDate.of(2010, 1, 1), LocalDate.of(2010, 12, 31)).build());

        assertEquals(OperationStatus.COMPLETED, outcome.status());
        assertEquals(0, outcome.summary().recordsFetched());
        assertEquals(0, outcome.summary().chunksProcessed());
    }

    @Test
    void transient_storage_failure_is_retried() {
        AtomicInteger calls = new AtomicInteger();
        StorageLoader flaky = (records, schema) -> {
            if (calls.getAndIncrement() == 0) {
                return Result.err(ErrorKind.STORAGE_TRANSIENT, "08006", "connection reset");
            }
            return Result.ok(new StoreCounts(records.size(), records.size(), 0));
        };
        ScriptedExtractor one = new ScriptedExtractor(n -> n == 0 ? barChunk(0, 20) : null);

        JobOutcome outcome = build(new ExtractorRegistry().register(one), flaky, new FileQuarantineSink(dlq))
                .run(scriptedJob().build());

        assertEquals(OperationStatus.COMPLETED, outcome.status(), outcome::describe);
        assertEquals(2, calls.get());
        assertEquals(20, outcome.summary().recordsStored());
        assertEquals(List.of(1000L), sleeps);
    }

    @Test
    void permanent_storage_failure_fails_without_quarantining_valid_records() throws Exception {
        ScriptedExtractor chunks = new ScriptedExtractor(n -> n < 5 ? barChunk(n, 10) : null);
        StorageLoader broken = (records, schema) -> Result.err(ErrorKind.STORAGE_PERMANENT, "23514", "check constraint");

        JobOutcome outcome = build(new ExtractorRegistry().register(chunks), broken, new FileQuarantineSink(dlq))
                .run(scriptedJob().build());

        assertEquals(OperationStatus.FAILED, outcome.status());
        assertEquals(ErrorKind.STORAGE_PERMANENT, outcome.error().kind());
        assertEquals(0, outcome.snapshot().recordsStored());
        assertTrue(sleeps.isEmpty());
        assertTrue(quarantined("es_backfill").isEmpty());
        assertTrue(chunks.calls.get() < 5, "extraction stops after a fatal storage error");
    }

    @Test
    void quarantine_write_failure_does_not_abort_the_job() throws Exception {
        writeBars(3);
        QuarantineSink failing = new QuarantineSink() {
            @Override
            public Result<String> record(QuarantineEntry entry) {
                return Result.err(ErrorKind.QUARANTINE_PERSISTENCE, "write_failed", "disk full");
            }

            @Override
            public String locationFor(String jobName) { return "nowhere"; }
        };
        PipelineOrchestrator p = build(new ExtractorRegistry().register(new FileReplayExtractor(replay)),
                new JdbcStorageLoader(db, new Metrics(registry)), failing);

        JobOutcome outcome = p.run(job("ohlcv-1d", "ESH4").build());

        assertTrue(outcome.succeeded());
        assertEquals(999, JdbcStorageLoaderTest.rows(db, "daily_ohlcv_data"));
        assertTrue(outcome.snapshot().errors().stream().anyMatch(e -> e.kind() == ErrorKind.QUARANTINE_PERSISTENCE));
        assertEquals(1, registry.counter("ingest.quarantine.failures").getCount());
        assertTrue(outcome.describe().contains("quarantine write(s) failed"));
    }

    @Test
    void throwing_quarantine_sink_is_recorded_and_the_job_continues() throws Exception {
        writeBars(3);
        QuarantineSink throwing = new QuarantineSink() {
            @Override
            public Result<String> record(QuarantineEntry entry) {
                throw new IllegalStateException("sink closed");
            }

            @Override
            public String locationFor(String jobName) { return "nowhere"; }
        };
        PipelineOrchestrator p = build(new ExtractorRegistry().register(new FileReplayExtractor(replay)),
                new JdbcStorageLoader(db, new Metrics(registry)), throwing);

        JobOutcome outcome = p.run(job("ohlcv-1d", "ESH4").build());

        assertTrue(outcome.succeeded(), outcome::describe);
        assertEquals(10, outcome.summary().chunksProcessed());
        assertEquals(999, JdbcStorageLoaderTest.rows(db, "daily_ohlcv_data"));
        assertTrue(outcome.snapshot().errors().stream().anyMatch(e -> e.kind() == ErrorKind.QUARANTINE_PERSISTENCE));
        assertEquals(1, registry.counter("ingest.quarantine.failures").getCount());
    }

    @Test
    void crashing_chunk_worker_fails_the_job() {
        ScriptedExtractor chunks = new ScriptedExtractor(n -> n < 4 ? barChunk(n, 10) : null);
        PipelineOrchestrator p = PipelineOrchestrator.builder()
                .extractors(new ExtractorRegistry().register(chunks))
                .transformer((raw, schema) -> { throw new IllegalStateException("transformer bug"); })
                .loader((r, s) -> Result.ok(new StoreCounts(r.size(), r.size(), 0)))
                .quarantine(new FileQuarantineSink(dlq))
                .stateStore(states)
                .progress(events::add)
                .metrics(registry)
                .sleeper(sleeps::add)
                .build();
        orchestrator = p;

        JobOutcome outcome = p.run(scriptedJob().build());

        assertEquals(OperationStatus.FAILED, outcome.status());
        assertEquals("worker_crashed", outcome.error().code());
        assertTrue(outcome.error().message().contains("transformer bug"));
        assertFalse(outcome.snapshot().errors().isEmpty());
        assertTrue(chunks.calls.get() < 4, "no chunks are pulled after a worker crashed");
    }

    @Test
    void progress_is_monotonic_and_ends_with_final_stats() throws Exception {
        writeBars(500);

        JobOutcome outcome = replayPipeline().run(job("ohlcv-1d", "ESH4").build());

        assertFalse(events.isEmpty());
        assertEquals(Stage.EXTRACTION, events.get(0).stage());
        long lastCompleted = -1;
        long lastStored = -1;
        for (ProgressEvent e : events) {
            assertEquals(outcome.jobId(), e.jobId());
            assertTrue(e.completed() >= lastCompleted);
            lastCompleted = e.completed();
            if (e.recordsStored() != null) {
                assertTrue(e.recordsStored() >= lastStored);
                lastStored = e.recordsStored();
            }
        }
        ProgressEvent last = events.get(events.size() - 1);
        assertTrue(last.isFinal());
        assertEquals(999, last.finalStats().recordsStored());
        assertEquals(1000, last.total());
        assertTrue(events.stream().filter(e -> e.stage() != Stage.EXTRACTION || e.isFinal()).allMatch(e -> e.total() == 1000));
        assertEquals("COMPLETED_WITH_QUARANTINE", last.finalStats().status());
        assertEquals(1, events.stream().filter(ProgressEvent::isFinal).count());
    }

    @Test
    void cancelled_job_stops_pulling_chunks_and_fails() throws Exception {
        CountDownLatch firstStore = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedExtractor endless = new ScriptedExtractor(n -> barChunk(n, 5));
        StorageLoader gated = (records, schema) -> {
            firstStore.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Result.ok(new StoreCounts(records.size(), records.size(), 0));
        };
        PipelineOrchestrator p = build(new ExtractorRegistry().register(endless), gated, new FileQuarantineSink(dlq));

        JobHandle handle = p.submit(scriptedJob().build());
        assertTrue(firstStore.await(5, TimeUnit.SECONDS));
        handle.cancel("operator request");
        release.countDown();
        JobOutcome outcome = handle.await();

        assertTrue(handle.isDone());
        assertEquals(OperationStatus.FAILED, outcome.status());
        assertEquals(ErrorKind.CANCELLED, outcome.error().kind());
        assertTrue(outcome.error().message().contains("operator request"));
        assertTrue(outcome.snapshot().recordsStored() >= 5);
        assertEquals(handle.jobId(), outcome.jobId());
    }

    @Test
    void invalid_configuration_and_unknown_provider_fail_before_extraction() {
        PipelineOrchestrator p = replayPipeline();

        JobOutcome bad = p.run(job("ohlcv-1d", "ESH4").chunkSize(0).build());
        assertEquals(OperationStatus.FAILED, bad.status());
        assertEquals(ErrorKind.INVALID_JOB_CONFIG, bad.error().kind());
        assertTrue(bad.error().message().contains("chunk_size"));

        JobOutcome unknown = p.run(job("ohlcv-1d", "ESH4").provider("bloomberg").build());
        assertEquals(ErrorKind.INVALID_JOB_CONFIG, unknown.error().kind());
        assertEquals("unknown_provider", unknown.error().code());
        assertTrue(unknown.error().remediation().contains("replay"));

        assertEquals(OperationStatus.FAILED, states.get(unknown.jobId()).orElseThrow().status());
        assertEquals(2, registry.counter("ingest.jobs.failed").getCount());
    }

    @Test
    void schema_alias_resolves_to_the_same_table() throws Exception {
        writeBars();

        JobOutcome outcome = replayPipeline().run(job("ohlcv-daily", "ESH4").build());

        assertEquals(OperationStatus.COMPLETED, outcome.status());
        assertEquals(1000, JdbcStorageLoaderTest.rows(db, "daily_ohlcv_data"));
    }
}
