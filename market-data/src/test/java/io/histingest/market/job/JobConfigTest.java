package io.histingest.market.job;

import io.histingest.config.PipelineConfig;
import io.histingest.market.schema.SchemaRef;
import io.histingest.market.schema.SymbolType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JobConfigTest {

    private static JobConfig.Builder valid() {
        return JobConfig.builder()
                .name("es_daily")
                .provider("replay")
                .dataset("GLBX.MDP3")
                .schema("ohlcv-1d")
                .symbols("ES.c.0")
                .dates(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
    }

    @Test
    void defaults_are_applied() {
        JobConfig c = valid().build();

        assertTrue(c.validate().isEmpty(), () -> c.validate().toString());
        assertEquals(SymbolType.CONTINUOUS, c.stypeIn());
        assertEquals(10_000, c.chunkSize());
        assertEquals(3, c.maxRetries());
        assertEquals(Duration.ofSeconds(1), c.backoffMin());
        assertEquals(Duration.ofSeconds(60), c.backoffMax());
        assertEquals(2.0, c.backoffMultiplier());
        assertEquals(SchemaRef.ohlcv("1d"), c.schemaRef());
    }

    @Test
    void collects_every_problem() {
        JobConfig c = JobConfig.builder()
                .schema("ohlcv-7d")
                .dates(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1))
                .chunkSize(0)
                .maxRetries(-1)
                .build();

        List<String> problems = c.validate();

        assertTrue(problems.contains("name is required"));
        assertTrue(problems.contains("provider is required"));
        assertTrue(problems.contains("dataset is required"));
        assertTrue(problems.contains("at least one symbol is required"));
        assertTrue(problems.contains("chunk_size must be > 0"));
        assertTrue(problems.contains("max_retries must be >= 0"));
        assertTrue(problems.stream().anyMatch(p -> p.contains("granularity")));
        assertTrue(problems.stream().anyMatch(p -> p.startsWith("start_date")));
    }

    @Test
    void single_day_range_is_valid() {
        JobConfig c = valid().dates(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 5)).build();
        assertTrue(c.validate().isEmpty());
    }

    @Test
    void backoff_bounds_are_checked() {
        JobConfig c = valid().backoff(Duration.ofSeconds(10), Duration.ofSeconds(1), 2.0).build();
        assertTrue(c.validate().contains("backoff max must be >= backoff min"));
    }

    @Test
    void flat_backoff_is_rejected() {
        JobConfig c = valid().backoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 1.0).build();
        assertTrue(c.validate().contains("backoff multiplier must be > 1"));
    }

    @Test
    void builder_seeded_from_runtime_defaults() {
        PipelineConfig d = PipelineConfig.defaults();
        PipelineConfig small = new PipelineConfig(d.stateDir(), d.quarantineDir(), d.replayDir(), 500, 5,
                200, 2_000, 3.0, 2, Duration.ofSeconds(30), Duration.ofSeconds(10), 0);

        JobConfig c = JobConfig.builder(small).name("x").provider("replay").dataset("D").schema("trades")
                .symbols("A").dates(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)).build();

        assertEquals(500, c.chunkSize());
        assertEquals(5, c.maxRetries());
        assertEquals(Duration.ofMillis(200), c.backoffMin());
        assertEquals(3.0, c.backoffMultiplier());
        assertEquals(2, c.maxInFlightChunks());
        assertEquals(Duration.ofSeconds(10), c.storeTimeout());
        assertTrue(c.validate().isEmpty());
    }
}
