package io.histingest.market.runtime;

import com.codahale.metrics.MetricRegistry;
import io.histingest.error.QuarantineSink;
import io.histingest.market.extract.ExtractorRegistry;
import io.histingest.market.storage.StorageLoader;
import io.histingest.market.transform.DatabentoRecordTransformer;
import io.histingest.market.transform.RecordTransformer;
import io.histingest.market.validate.SchemaRules;
import io.histingest.market.validate.Validator;
import io.histingest.progress.ProgressReporter;
import io.histingest.retry.Sleeper;
import io.histingest.state.InMemoryOperationStateStore;
import io.histingest.state.OperationStateStore;

import java.time.Clock;
import java.util.Objects;

public class OrchestratorBuilder {
    private ExtractorRegistry extractors;
    private RecordTransformer transformer;
    private Validator validator;
    private StorageLoader loader;
    private QuarantineSink quarantine;
    private OperationStateStore stateStore = new InMemoryOperationStateStore();
    private ProgressReporter progress = ProgressReporter.NO_OP;
    private MetricRegistry metrics = new MetricRegistry();
    private Sleeper sleeper = Sleeper.system();
    private Clock clock = Clock.systemUTC();

    public OrchestratorBuilder extractors(ExtractorRegistry v) { this.extractors = v; return this; }
    public OrchestratorBuilder transformer(RecordTransformer v) { this.transformer = v; return this; }
    public OrchestratorBuilder validator(Validator v) { this.validator = v; return this; }
    public OrchestratorBuilder loader(StorageLoader v) { this.loader = v; return this; }
    public OrchestratorBuilder quarantine(QuarantineSink v) { this.quarantine = v; return this; }
    public OrchestratorBuilder stateStore(OperationStateStore v) { this.stateStore = v; return this; }
    public OrchestratorBuilder progress(ProgressReporter v) { this.progress = v; return this; }
    public OrchestratorBuilder metrics(MetricRegistry v) { this.metrics = v; return this; }
    public OrchestratorBuilder sleeper(Sleeper v) { this.sleeper = v; return this; }
    public OrchestratorBuilder clock(Clock v) { this.clock = v; return this; }

    public PipelineOrchestrator build() {
        Objects.requireNonNull(extractors, "extractors");
        Objects.requireNonNull(loader, "loader");
        Objects.requireNonNull(quarantine, "quarantine");
        Objects.requireNonNull(clock, "clock");
        RecordTransformer tf = transformer != null ? transformer : new DatabentoRecordTransformer();
        Validator v = validator != null ? validator : new Validator(SchemaRules.standard(clock));
        return new PipelineOrchestrator(extractors, tf, v, loader, quarantine,
                Objects.requireNonNull(stateStore, "stateStore"),
                Objects.requireNonNull(progress, "progress"),
                Objects.requireNonNull(metrics, "metrics"),
                Objects.requireNonNull(sleeper, "sleeper"),
                clock);
    }
}
