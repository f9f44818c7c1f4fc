package io.histingest.market.runtime;

import com.codahale.metrics.MetricRegistry;
import io.histingest.core.CancellationToken;
import io.histingest.error.QuarantineSink;
import io.histingest.market.extract.ExtractorRegistry;
import io.histingest.market.job.JobConfig;
import io.histingest.market.storage.StorageLoader;
import io.histingest.market.transform.RecordTransformer;
import io.histingest.market.validate.Validator;
import io.histingest.metrics.Metrics;
import io.histingest.progress.ProgressReporter;
import io.histingest.retry.Sleeper;
import io.histingest.state.OperationStateStore;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs ingestion jobs: extract chunks, transform, validate, store the valid records, quarantine
 * the rest and report progress. Each job gets its own worker pool; jobs share only the state
 * store, the storage loader and the quarantine sink.
 */
public class PipelineOrchestrator implements AutoCloseable {
    private final ExtractorRegistry extractors;
    private final RecordTransformer transformer;
    private final Validator validator;
    private final StorageLoader loader;
    private final QuarantineSink quarantine;
    private final OperationStateStore stateStore;
    private final ProgressReporter progress;
    private final Metrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService jobPool;

    PipelineOrchestrator(ExtractorRegistry extractors,
                         RecordTransformer transformer,
                         Validator validator,
                         StorageLoader loader,
                         QuarantineSink quarantine,
                         OperationStateStore stateStore,
                         ProgressReporter progress,
                         MetricRegistry registry,
                         Sleeper sleeper,
                         Clock clock) {
        this.extractors = extractors;
        this.transformer = transformer;
        this.validator = validator;
        this.loader = loader;
        this.quarantine = quarantine;
        this.stateStore = stateStore;
        this.progress = progress;
        this.metrics = new Metrics(registry);
        this.sleeper = sleeper;
        this.clock = clock;
        AtomicInteger n = new AtomicInteger();
        this.jobPool = Executors.newCachedThreadPool(r -> new Thread(r, "ingest-job-" + n.incrementAndGet()));
    }

    public static OrchestratorBuilder builder() { return new OrchestratorBuilder(); }

    /** Runs a job on the calling thread. */
    public JobOutcome run(JobConfig config) {
        return new JobRun(this, newJobId(config), config, new CancellationToken()).run();
    }

    /** Starts a job in the background. */
    public JobHandle submit(JobConfig config) {
        CancellationToken token = new CancellationToken();
        String jobId = newJobId(config);
        JobRun run = new JobRun(this, jobId, config, token);
        Future<JobOutcome> outcome = jobPool.submit(run::run);
        return new JobHandle(jobId, token, outcome);
    }

    private static String newJobId(JobConfig config) {
        String base = config.name() == null ? "job" : config.name().replaceAll("[^A-Za-z0-9._-]", "_");
        return base + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    ExtractorRegistry extractors() { return extractors; }
    RecordTransformer transformer() { return transformer; }
    Validator validator() { return validator; }
    StorageLoader loader() { return loader; }
    QuarantineSink quarantine() { return quarantine; }
    OperationStateStore stateStore() { return stateStore; }
    ProgressReporter progress() { return progress; }
    Metrics metrics() { return metrics; }
    Sleeper sleeper() { return sleeper; }
    Clock clock() { return clock; }

    @Override
    public void close() {
        jobPool.shutdown();
    }
}
