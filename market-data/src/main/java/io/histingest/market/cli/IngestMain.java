package io.histingest.market.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.histingest.admin.StatusServer;
import io.histingest.config.PipelineConfig;
import io.histingest.market.ingestor.IngestModule;
import io.histingest.market.job.JobCatalog;
import io.histingest.market.job.JobConfig;
import io.histingest.market.runtime.JobOutcome;
import io.histingest.market.runtime.PipelineOrchestrator;
import io.histingest.market.schema.SymbolType;
import io.histingest.market.storage.SchemaInitializer;
import io.histingest.market.storage.StorageConfig;
import io.histingest.progress.ProgressReporter;
import io.histingest.state.OperationSnapshot;
import io.histingest.state.OperationStateStore;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point: run an ingestion job, list job snapshots, purge old ones.
 */
@CommandLine.Command(name = "hist-ingest", mixinStandardHelpOptions = true,
        description = "Historical market data ingestion",
        subcommands = {IngestMain.Ingest.class, IngestMain.Jobs.class, IngestMain.Purge.class})
public final class IngestMain implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new IngestMain()).execute(args));
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "a subcommand is required");
    }

    static Injector injector() {
        return Guice.createInjector(new IngestModule(PipelineConfig.fromEnv(), StorageConfig.fromEnv()));
    }

    @CommandLine.Command(name = "ingest", mixinStandardHelpOptions = true,
            description = "Run one ingestion job, described by options or picked by name from a YAML job file")
    static final class Ingest implements Callable<Integer> {
        static final String DEFAULT_PROVIDER = "replay";

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(names = {"--config"}, description = "YAML file with a jobs: list")
        Path config;

        @CommandLine.Option(names = {"--job"}, description = "Name of the job to run from --config")
        String jobName;

        @CommandLine.Option(names = {"-n", "--name"}, description = "Job name")
        String name;

        @CommandLine.Option(names = {"-p", "--provider"}, description = "Provider (default: " + DEFAULT_PROVIDER + ")")
        String provider;

        @CommandLine.Option(names = {"-d", "--dataset"}, description = "Provider dataset, e.g. GLBX.MDP3")
        String dataset;

        @CommandLine.Option(names = {"--schema"}, description = "ohlcv-1d, trades, tbbo, statistics, definition...")
        String schema;

        @CommandLine.Option(names = {"-t", "--symbols"}, split = ",", description = "Symbols (comma-separated or repeat option)")
        List<String> symbols = new ArrayList<>();

        @CommandLine.Option(names = {"--stype-in"}, description = "continuous (default), parent, raw_symbol or instrument_id")
        String stypeIn;

        @CommandLine.Option(names = {"-s", "--start"}, description = "Start date (yyyy-MM-dd)")
        LocalDate start;

        @CommandLine.Option(names = {"-e", "--end"}, description = "End date (yyyy-MM-dd), inclusive")
        LocalDate end;

        @CommandLine.Option(names = {"-c", "--chunk-size"}, description = "Records per chunk")
        Integer chunkSize;

        @CommandLine.Option(names = {"--max-retries"}, description = "Retries per operation beyond the first attempt")
        Integer maxRetries;

        @CommandLine.Option(names = {"--init-schema"}, description = "Create tables before running")
        boolean initSchema;

        @CommandLine.Option(names = {"--serve"}, description = "Expose job status and metrics over HTTP while running")
        boolean serve;

        private JobConfig.Builder fromOptions(PipelineConfig defaults) {
            if (jobName != null) throw usage("--job needs --config");
            List<String> missing = new ArrayList<>();
            if (name == null) missing.add("--name");
            if (dataset == null) missing.add("--dataset");
            if (schema == null) missing.add("--schema");
            if (symbols.isEmpty()) missing.add("--symbols");
            if (start == null) missing.add("--start");
            if (end == null) missing.add("--end");
            if (!missing.isEmpty()) throw usage("Missing required options: " + String.join(", ", missing) + " (or use --config with --job)");
            return JobConfig.builder(defaults)
                    .name(name)
                    .provider(DEFAULT_PROVIDER)
                    .dataset(dataset)
                    .schema(schema)
                    .symbols(symbols)
                    .stypeIn(stypeIn == null ? SymbolType.CONTINUOUS : SymbolType.parse(stypeIn))
                    .dates(start, end);
        }

        private JobConfig.Builder fromFile(PipelineConfig defaults) throws IOException {
            if (jobName == null) throw usage("--config needs --job");
            if (name != null || dataset != null || schema != null || !symbols.isEmpty() || stypeIn != null
                    || start != null || end != null) {
                throw usage("--config --job cannot be combined with --name, --dataset, --schema, --symbols, --stype-in, --start or --end");
            }
            JobCatalog catalog = JobCatalog.load(config);
            List<String> problems = catalog.validate(jobName, defaults, DEFAULT_PROVIDER);
            if (!problems.isEmpty()) {
                System.out.println("Job " + jobName + " in " + config + " is invalid:");
                problems.forEach(p -> System.out.println("  " + p));
                return null;
            }
            return catalog.builder(jobName, defaults, DEFAULT_PROVIDER).orElseThrow();
        }

        private CommandLine.ParameterException usage(String message) {
            return new CommandLine.ParameterException(spec.commandLine(), message);
        }

        @Override
        public Integer call() throws Exception {
            PipelineConfig defaults = PipelineConfig.fromEnv();
            JobConfig.Builder builder = config == null ? fromOptions(defaults) : fromFile(defaults);
            if (builder == null) return 1;
            if (provider != null) builder.provider(provider);
            if (chunkSize != null) builder.chunkSize(chunkSize);
            if (maxRetries != null) builder.maxRetries(maxRetries);
            JobConfig job = builder.build();

            Injector injector = Guice.createInjector(new IngestModule(defaults, StorageConfig.fromEnv()));
            if (initSchema) injector.getInstance(SchemaInitializer.class).initialize();
            StatusServer server = null;
            if (serve) {
                server = injector.getInstance(StatusServer.class);
                server.start();
                System.out.println("Status server listening on port " + server.port());
            }
            try (PipelineOrchestrator orchestrator = injector.getInstance(PipelineOrchestrator.class);
                 ProgressReporter progress = injector.getInstance(ProgressReporter.class)) {
                JobOutcome outcome = orchestrator.run(job);
                System.out.println(outcome.describe());
                return outcome.succeeded() ? 0 : 1;
            } finally {
                if (server != null) server.close();
            }
        }
    }

    @CommandLine.Command(name = "jobs", mixinStandardHelpOptions = true, description = "List recorded jobs")
    static final class Jobs implements Callable<Integer> {
        @Override
        public Integer call() throws Exception {
            OperationStateStore store = injector().getInstance(OperationStateStore.class);
            List<OperationSnapshot> all = store.list();
            for (OperationSnapshot s : all) {
                System.out.println(s.jobId() + "  " + s.status() + "  stored=" + s.recordsStored()
                        + " quarantined=" + s.recordsQuarantined() + " chunks=" + s.chunksProcessed()
                        + "  started=" + s.startedAt() + (s.endedAt() == null ? "" : " ended=" + s.endedAt()));
            }
            if (all.isEmpty()) System.out.println("No jobs recorded");
            return 0;
        }
    }

    @CommandLine.Command(name = "purge", mixinStandardHelpOptions = true, description = "Delete snapshots of finished jobs")
    static final class Purge implements Callable<Integer> {
        @CommandLine.Option(names = {"--older-than-hours"}, defaultValue = "168", description = "Age threshold (default: ${DEFAULT-VALUE})")
        long hours;

        @Override
        public Integer call() throws Exception {
            OperationStateStore store = injector().getInstance(OperationStateStore.class);
            int removed = store.purgeTerminalOlderThan(Duration.ofHours(hours), Instant.now());
            System.out.println("Removed " + removed + " job snapshot(s)");
            return 0;
        }
    }
}
