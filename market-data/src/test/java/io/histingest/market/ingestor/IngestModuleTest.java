package io.histingest.market.ingestor;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.histingest.admin.StatusServer;
import io.histingest.config.PipelineConfig;
import io.histingest.market.extract.FileReplayExtractor;
import io.histingest.market.extract.ReplayFixtures;
import io.histingest.market.job.JobConfig;
import io.histingest.market.runtime.JobOutcome;
import io.histingest.market.runtime.PipelineOrchestrator;
import io.histingest.market.storage.SchemaInitializer;
import io.histingest.market.storage.StorageConfig;
import io.histingest.progress.ProgressReporter;
import io.histingest.state.OperationStateStore;
import io.histingest.state.OperationStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class IngestModuleTest {

    @Test
    void wires_a_working_orchestrator() throws Exception {
        Path base = Files.createTempDirectory("ingest-module");
        PipelineConfig config = new PipelineConfig(base.resolve("state"), base.resolve("dlq"), base.resolve("replay"),
                50, 1, 10, 100, 2.0, 2, Duration.ofSeconds(30), Duration.ofSeconds(30), 0);
        StorageConfig storage = new StorageConfig("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
                "sa", "", 2, false);
        List<String> lines = new ArrayList<>();
        LocalDate day = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < 120; i++) {
            lines.add(ReplayFixtures.bar(9, day.plusDays(i), "CLH4", "70", "72", "69", i == 7 ? "75" : "71", 10));
        }
        ReplayFixtures.write(config.replayDir(), "GLBX.MDP3", "ohlcv-1d", "cl.jsonl", lines);

        Injector injector = Guice.createInjector(new IngestModule(config, storage));
        injector.getInstance(SchemaInitializer.class).initialize();
        assertSame(injector.getInstance(PipelineOrchestrator.class), injector.getInstance(PipelineOrchestrator.class));

        JobOutcome outcome;
        try (ProgressReporter progress = injector.getInstance(ProgressReporter.class)) {
            outcome = injector.getInstance(PipelineOrchestrator.class).run(JobConfig.builder(config)
                    .name("cl_daily").provider(FileReplayExtractor.PROVIDER).dataset("GLBX.MDP3").schema("ohlcv-1d")
                    .symbols("CLH4").dates(day, day.plusDays(200)).build());
        }

        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, outcome.status(), outcome::describe);
        assertEquals(119, outcome.summary().recordsStored());
        assertEquals(3, outcome.summary().chunksProcessed());
        OperationStateStore store = injector.getInstance(OperationStateStore.class);
        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, store.get(outcome.jobId()).orElseThrow().status());
        assertTrue(Files.isDirectory(config.quarantineDir().resolve("cl_daily")));

        StatusServer server = injector.getInstance(StatusServer.class);
        server.start();
        try {
            assertTrue(server.port() > 0);
        } finally {
            server.close();
        }
    }
}
