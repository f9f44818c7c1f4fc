package io.histingest.market.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.zaxxer.hikari.HikariDataSource;
import io.histingest.admin.StatusServer;
import io.histingest.config.PipelineConfig;
import io.histingest.error.FileQuarantineSink;
import io.histingest.error.QuarantineSink;
import io.histingest.market.extract.ExtractorRegistry;
import io.histingest.market.extract.FileReplayExtractor;
import io.histingest.market.runtime.PipelineOrchestrator;
import io.histingest.market.storage.DataSources;
import io.histingest.market.storage.JdbcStorageLoader;
import io.histingest.market.storage.SchemaInitializer;
import io.histingest.market.storage.StorageConfig;
import io.histingest.market.storage.StorageLoader;
import io.histingest.metrics.Metrics;
import io.histingest.progress.AsyncProgressReporter;
import io.histingest.progress.LoggingProgressReporter;
import io.histingest.progress.ProgressReporter;
import io.histingest.state.FileOperationStateStore;
import io.histingest.state.OperationStateStore;

import javax.sql.DataSource;
import java.io.IOException;

public class IngestModule extends AbstractModule {
    private final PipelineConfig config;
    private final StorageConfig storage;

    public IngestModule(PipelineConfig config, StorageConfig storage) {
        this.config = config;
        this.storage = storage;
    }

    @Override
    protected void configure() {
        bind(PipelineConfig.class).toInstance(config);
        bind(StorageConfig.class).toInstance(storage);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton DataSource dataSource() {
        HikariDataSource ds = DataSources.pooled(storage);
        Runtime.getRuntime().addShutdownHook(new Thread(ds::close, "hikari-close"));
        return ds;
    }

    @Provides SchemaInitializer schemaInitializer(DataSource ds) { return new SchemaInitializer(ds, storage.timescale()); }

    @Provides @Singleton StorageLoader storageLoader(DataSource ds, MetricRegistry registry) {
        return new JdbcStorageLoader(ds, new Metrics(registry));
    }

    @Provides @Singleton QuarantineSink quarantineSink() { return new FileQuarantineSink(config.quarantineDir()); }

    @Provides @Singleton OperationStateStore stateStore() throws IOException {
        return new FileOperationStateStore(config.stateDir());
    }

    @Provides @Singleton ExtractorRegistry extractors() {
        return new ExtractorRegistry().register(new FileReplayExtractor(config.replayDir()));
    }

    @Provides @Singleton ProgressReporter progress() {
        return new AsyncProgressReporter(new LoggingProgressReporter(), 1024);
    }

    @Provides StatusServer statusServer(OperationStateStore store, MetricRegistry registry) throws IOException {
        return new StatusServer(config.adminPort(), store, registry);
    }

    @Provides @Singleton PipelineOrchestrator orchestrator(ExtractorRegistry extractors, StorageLoader loader,
                                                          QuarantineSink quarantine, OperationStateStore store,
                                                          ProgressReporter progress, MetricRegistry registry) {
        return PipelineOrchestrator.builder()
                .extractors(extractors)
                .loader(loader)
                .quarantine(quarantine)
                .stateStore(store)
                .progress(progress)
                .metrics(registry)
                .build();
    }
}
