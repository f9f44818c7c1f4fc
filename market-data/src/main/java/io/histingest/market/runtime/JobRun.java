package io.histingest.market.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.histingest.core.CancellationToken;
import io.histingest.core.Chunk;
import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineError;
import io.histingest.core.Result;
import io.histingest.error.QuarantineEntry;
import io.histingest.market.extract.ChunkStream;
import io.histingest.market.extract.Extractor;
import io.histingest.market.job.JobConfig;
import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.model.RawRecord;
import io.histingest.market.schema.SchemaRef;
import io.histingest.market.storage.StoreCounts;
import io.histingest.market.validate.ValidationResult;
import io.histingest.market.validate.Violation;
import io.histingest.progress.JobSummary;
import io.histingest.progress.ProgressEvent;
import io.histingest.retry.ExponentialBackoffRetryPolicy;
import io.histingest.retry.RetryExecutor;
import io.histingest.state.ChunkMetrics;
import io.histingest.state.OperationSnapshot;
import io.histingest.state.OperationState;
import io.histingest.state.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * One execution of a job. The calling thread pulls chunks while a bounded pool processes them;
 * at most {@code maxInFlightChunks} chunks are extracted but not yet finished. All updates to
 * the operation state, its snapshots and progress events happen while holding the state's lock.
 */
final class JobRun {
    private static final Logger log = LoggerFactory.getLogger(JobRun.class);

    static final String TRANSFORM_ERROR = "transform_error";
    static final String BUSINESS_RULE_VIOLATION = "business_rule_violation";

    private final PipelineOrchestrator owner;
    private final String jobId;
    private final JobConfig config;
    private final CancellationToken token;
    private final OperationState state;
    private final AtomicReference<PipelineError> fatal = new AtomicReference<>();
    private final AtomicLong transformed = new AtomicLong();
    private final AtomicLong validated = new AtomicLong();
    private volatile boolean cancelled;
    private SchemaRef schema;

    private final Timer extractTimer;
    private final Timer chunkTimer;
    private final Meter extractedMeter;
    private final Meter storedMeter;
    private final Meter quarantinedMeter;
    private final Counter quarantineFailures;
    private final Histogram chunkSizes;

    /** A raw record on its way to quarantine. */
    private static final class Rejected {
        final RawRecord raw;
        final String errorType;
        final String reason;
        final String message;

        Rejected(RawRecord raw, String errorType, String reason, String message) {
            this.raw = raw;
            this.errorType = errorType;
            this.reason = reason;
            this.message = message;
        }
    }

    JobRun(PipelineOrchestrator owner, String jobId, JobConfig config, CancellationToken token) {
        this.owner = owner;
        this.jobId = jobId;
        this.config = config;
        this.token = token;
        this.state = new OperationState(jobId, config.name(), config.schema(), owner.clock());
        this.extractTimer = owner.metrics().timer("extract.time");
        this.chunkTimer = owner.metrics().timer("chunk.time");
        this.extractedMeter = owner.metrics().meter("records.extracted");
        this.storedMeter = owner.metrics().meter("records.stored");
        this.quarantinedMeter = owner.metrics().meter("records.quarantined");
        this.quarantineFailures = owner.metrics().counter("quarantine.failures");
        this.chunkSizes = owner.metrics().histogram("chunk.size");
    }

    JobOutcome run() {
        persist(state.snapshot());
        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            return failBeforeStart(PipelineError.of(ErrorKind.INVALID_JOB_CONFIG, "invalid_job_config",
                    String.join("; ", problems)).withRemediation("fix the job configuration and resubmit"));
        }
        schema = config.schemaRef();
        Optional<Extractor> extractor = owner.extractors().resolve(config.provider());
        if (extractor.isEmpty()) {
            return failBeforeStart(PipelineError.of(ErrorKind.INVALID_JOB_CONFIG, "unknown_provider",
                    "no extractor registered for provider '" + config.provider() + "'")
                    .withRemediation("registered providers: " + owner.extractors().providers()));
        }

        log.info("Starting job {} ({}): {} {} {} from {} to {}", jobId, config.name(), config.dataset(), schema,
                config.symbols(), config.startDate(), config.endDate());
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(config.maxRetries(),
                config.backoffMin().toMillis(), config.backoffMultiplier(), config.backoffMax().toMillis(),
                config.backoffJitter());
        AtomicInteger threadNo = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(config.maxInFlightChunks(),
                r -> new Thread(r, "ingest-" + config.name() + "-worker-" + threadNo.incrementAndGet()));
        try (RetryExecutor retry = new RetryExecutor(policy, owner.sleeper(), owner.metrics().counter("retries"))) {
            transition(OperationStatus.EXTRACTING);
            synchronized (state) {
                owner.progress().report(ProgressEvent.started(jobId,
                        "Fetching " + schema + " data for " + String.join(", ", config.symbols()), 0));
            }
            Extractor source = extractor.get();
            Result<ChunkStream> opened = retry.execute("open " + config.provider() + " stream",
                    ErrorKind.PROVIDER_TRANSIENT, config.extractTimeout(), token,
                    () -> Result.ok(source.stream(config)));
            if (!opened.isOk()) {
                noteExtractionFailure(opened.error());
            } else {
                try (ChunkStream stream = opened.value()) {
                    stream.estimatedTotal().ifPresent(t -> {
                        synchronized (state) { state.estimateTotal(t); }
                    });
                    pump(stream, retry, workers);
                }
            }
        } finally {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(1, TimeUnit.MINUTES)) workers.shutdownNow();
            } catch (InterruptedException ie) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        return finish();
    }

    private void pump(ChunkStream stream, RetryExecutor retry, ExecutorService workers) {
        Semaphore permits = new Semaphore(config.maxInFlightChunks());
        List<Future<?>> inFlight = new ArrayList<>();
        while (true) {
            if (token.isCancelled()) {
                cancelled = true;
                log.warn("Job {} cancelled: {}", jobId, token.reason());
                break;
            }
            if (fatal.get() != null) break;
            try {
                permits.acquire();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                token.cancel("interrupted");
                cancelled = true;
                break;
            }
            if (fatal.get() != null) {
                permits.release();
                break;
            }
            Result<Optional<Chunk<RawRecord>>> next;
            try (Timer.Context ignored = extractTimer.time()) {
                next = retry.executeSerially("extract chunk", ErrorKind.PROVIDER_TRANSIENT, config.extractTimeout(),
                        token, () -> Result.ok(stream.next()));
            }
            if (!next.isOk()) {
                permits.release();
                noteExtractionFailure(next.error());
                break;
            }
            if (next.value().isEmpty()) {
                permits.release();
                break;
            }
            Chunk<RawRecord> chunk = next.value().get();
            extractedMeter.mark(chunk.size());
            chunkSizes.update(chunk.size());
            synchronized (state) { state.recordsFetched(chunk.size()); }
            inFlight.add(workers.submit(() -> {
                try {
                    process(chunk, retry);
                } catch (RuntimeException e) {
                    crashed(chunk.seq(), e);
                } finally {
                    permits.release();
                }
            }));
            if (!reap(inFlight, false)) return;
        }
        reap(inFlight, true);
    }

    /**
     * Collects finished chunk workers, or all of them when {@code all} is set, so a worker that
     * died is never dropped unseen.
     *
     * @return false when interrupted while waiting
     */
    private boolean reap(List<Future<?>> inFlight, boolean all) {
        Iterator<Future<?>> it = inFlight.iterator();
        while (it.hasNext()) {
            Future<?> f = it.next();
            if (!all && !f.isDone()) continue;
            try {
                f.get();
            } catch (ExecutionException e) {
                crashed(null, e.getCause() == null ? e : e.getCause());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                token.cancel("interrupted");
                cancelled = true;
                return false;
            }
            it.remove();
        }
        return true;
    }

    private void crashed(Long chunkSeq, Throwable cause) {
        log.error("Chunk worker for job {} crashed on chunk {}", jobId, chunkSeq, cause);
        PipelineError err = PipelineError.of(ErrorKind.STORAGE_PERMANENT, "worker_crashed", cause.toString(), cause);
        synchronized (state) { state.addError(err, chunkSeq); }
        fatal.compareAndSet(null, err);
    }

    private void noteExtractionFailure(PipelineError e) {
        if (e.kind() == ErrorKind.CANCELLED) {
            cancelled = true;
            return;
        }
        log.error("Extraction for job {} failed: {}", jobId, e.describe());
        fatal.compareAndSet(null, e);
    }

    private void process(Chunk<RawRecord> chunk, RetryExecutor retry) {
        long t0 = System.nanoTime();
        try (Timer.Context ignored = chunkTimer.time()) {
            transition(OperationStatus.TRANSFORMING);
            List<Rejected> rejected = new ArrayList<>();
            List<CanonicalRecord> canonical = new ArrayList<>(chunk.size());
            Map<CanonicalRecord, RawRecord> origin = new IdentityHashMap<>();
            for (RawRecord raw : chunk.records()) {
                Result<CanonicalRecord> r = owner.transformer().transform(raw, schema);
                if (r.isOk()) {
                    canonical.add(r.value());
                    origin.put(r.value(), raw);
                } else {
                    rejected.add(new Rejected(raw, TRANSFORM_ERROR, r.error().code(), r.error().message()));
                }
            }
            transformed.addAndGet(canonical.size());

            transition(OperationStatus.VALIDATING);
            ValidationResult vr = owner.validator().validate(canonical, schema);
            validated.addAndGet(vr.valid().size());
            for (Violation v : vr.invalid()) {
                rejected.add(new Rejected(origin.get(v.record()), BUSINESS_RULE_VIOLATION, v.ruleId(), v.message()));
            }

            transition(OperationStatus.STORING);
            StoreCounts counts = StoreCounts.NONE;
            if (!vr.valid().isEmpty()) {
                Result<StoreCounts> stored = retry.execute("store chunk " + chunk.seq(), ErrorKind.STORAGE_TRANSIENT,
                        config.storeTimeout(), null, () -> owner.loader().store(vr.valid(), schema));
                if (!stored.isOk()) {
                    PipelineError e = stored.error();
                    log.error("Storing chunk {} of job {} failed: {}", chunk.seq(), jobId, e.describe());
                    synchronized (state) { state.addError(e, chunk.seq()); }
                    fatal.compareAndSet(null, e);
                    return;
                }
                counts = stored.value();
                storedMeter.mark(counts.stored());
            }

            int entries = quarantine(chunk, rejected);
            long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            completeChunk(new ChunkMetrics(chunk.seq(), chunk.size(), vr.valid().size(), rejected.size(),
                    counts.stored(), counts.inserted(), entries, millis));
        }
    }

    /**
     * Writes one entry per distinct (error type, reason) in the chunk.
     *
     * @return entries written
     */
    private int quarantine(Chunk<RawRecord> chunk, List<Rejected> rejected) {
        if (rejected.isEmpty()) return 0;
        Map<String, List<Rejected>> groups = new LinkedHashMap<>();
        for (Rejected r : rejected) {
            groups.computeIfAbsent(r.errorType + "|" + r.reason, k -> new ArrayList<>()).add(r);
        }
        int written = 0;
        for (List<Rejected> group : groups.values()) {
            Rejected first = group.get(0);
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("chunk_seq", chunk.seq());
            context.put("reason", first.reason);
            context.put("record_count", group.size());
            context.put("provider", config.provider());
            context.put("dataset", config.dataset());
            context.put("stype_in", config.stypeIn().wireName());
            QuarantineEntry entry = new QuarantineEntry(owner.clock().instant(), config.name(), jobId,
                    schema.canonicalName(), first.errorType,
                    group.size() == 1 ? first.message : first.message + " (" + group.size() + " records)",
                    group.stream().map(r -> r.raw.fields()).collect(Collectors.toList()),
                    context);
            Result<String> r;
            try {
                r = owner.quarantine().record(entry);
            } catch (RuntimeException e) {
                r = Result.err(PipelineError.of(ErrorKind.QUARANTINE_PERSISTENCE, "write_failed",
                        "quarantine sink failed: " + e, e));
            }
            if (r.isOk()) {
                written++;
                quarantinedMeter.mark(group.size());
                log.info("Quarantined {} record(s) of chunk {} ({}: {}) to {}", group.size(), chunk.seq(),
                        first.errorType, first.reason, r.value());
            } else {
                quarantineFailures.inc();
                log.warn("Could not quarantine {} record(s) of chunk {}: {}", group.size(), chunk.seq(), r.error().message());
                synchronized (state) { state.addError(r.error(), chunk.seq()); }
            }
        }
        return written;
    }

    private void transition(OperationStatus next) {
        synchronized (state) {
            if (state.status().isTerminal()) return;
            if (state.moveTo(next)) persist(state.snapshot());
        }
    }

    private void completeChunk(ChunkMetrics m) {
        synchronized (state) {
            state.chunkCompleted(m);
            OperationSnapshot s = state.snapshot();
            owner.progress().report(ProgressEvent.chunk(jobId, "Processed chunk " + m.chunkSeq(),
                    s.recordsProcessed(), s.totalRecords(), s.recordsStored(), s.recordsQuarantined(), s.chunksProcessed()));
            if (state.tickDue(config.progressEveryRecords())) persist(s);
        }
    }

    private JobOutcome failBeforeStart(PipelineError e) {
        log.error("Job {} rejected: {}", jobId, e.describe());
        fatal.set(e);
        return finish();
    }

    private JobOutcome finish() {
        PipelineError cause = fatal.get();
        if (cause == null && cancelled) cause = token.toError();
        OperationStatus terminal;
        OperationSnapshot snapshot;
        JobSummary summary;
        String location;
        synchronized (state) {
            if (cause != null) terminal = OperationStatus.FAILED;
            else if (state.recordsQuarantined() > 0) terminal = OperationStatus.COMPLETED_WITH_QUARANTINE;
            else terminal = OperationStatus.COMPLETED;
            state.finish(terminal, cause);
            snapshot = state.snapshot();
            persist(snapshot);
            location = snapshot.recordsQuarantined() > 0 ? owner.quarantine().locationFor(config.name()) : null;
            summary = new JobSummary(terminal.name(), snapshot.startedAt(), snapshot.endedAt(),
                    JobSummary.seconds(snapshot.startedAt(), snapshot.endedAt()),
                    snapshot.recordsFetched(), transformed.get(), validated.get(),
                    snapshot.recordsStored(), snapshot.recordsNewlyInserted(), snapshot.recordsQuarantined(),
                    snapshot.quarantineEntries(), snapshot.chunksProcessed(), snapshot.errors().size(), location);
            ProgressEvent last = cause != null
                    ? ProgressEvent.failed(jobId, "Failed", snapshot.recordsProcessed(), snapshot.totalRecords(), cause.describe(), summary)
                    : ProgressEvent.finished(jobId, terminal == OperationStatus.COMPLETED ? "Completed" : "Completed with quarantined records",
                            snapshot.recordsProcessed(), snapshot.totalRecords(), summary);
            owner.progress().report(last);
        }
        JobOutcome outcome = new JobOutcome(jobId, config.name(), terminal, snapshot, cause, summary, location);
        if (terminal == OperationStatus.FAILED) {
            owner.metrics().counter("jobs.failed").inc();
            log.error(outcome.describe());
        } else {
            owner.metrics().counter("jobs.completed").inc();
            log.info(outcome.describe());
        }
        return outcome;
    }

    private void persist(OperationSnapshot snapshot) {
        try {
            owner.stateStore().put(snapshot);
        } catch (IOException e) {
            log.warn("Could not persist state of job {}: {}", jobId, e.getMessage());
        }
    }
}
