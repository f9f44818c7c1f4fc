package io.histingest.state;

import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineError;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class OperationStateTest {
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void counters_accumulate_across_chunks() {
        OperationState state = new OperationState("j1", "job", "trades", clock);
        state.moveTo(OperationStatus.EXTRACTING);
        state.recordsFetched(100);
        state.chunkCompleted(new ChunkMetrics(0, 100, 98, 2, 98, 98, 1, 12));
        state.recordsFetched(50);
        state.chunkCompleted(new ChunkMetrics(1, 50, 50, 0, 50, 0, 0, 5));

        OperationSnapshot s = state.snapshot();
        assertEquals(150, s.recordsFetched());
        assertEquals(150, s.recordsProcessed());
        assertEquals(148, s.recordsStored());
        assertEquals(98, s.recordsNewlyInserted());
        assertEquals(2, s.recordsQuarantined());
        assertEquals(2, s.chunksProcessed());
        assertEquals(2, s.chunkMetrics().size());
    }

    @Test
    void terminal_state_is_final() {
        OperationState state = new OperationState("j2", "job", "tbbo", clock);
        state.moveTo(OperationStatus.EXTRACTING);
        state.finish(OperationStatus.COMPLETED, null);
        assertThrows(IllegalStateException.class, () -> state.moveTo(OperationStatus.STORING));
        assertThrows(IllegalStateException.class, () -> state.finish(OperationStatus.FAILED, null));
        assertEquals(OperationStatus.COMPLETED, state.snapshot().status());
        assertNotNull(state.snapshot().endedAt());
    }

    @Test
    void pending_can_only_start_or_fail() {
        OperationState state = new OperationState("j3", "job", "ohlcv-1d", clock);
        assertThrows(IllegalStateException.class, () -> state.moveTo(OperationStatus.STORING));
        state.finish(OperationStatus.FAILED, PipelineError.of(ErrorKind.INVALID_JOB_CONFIG, "symbols", "no symbols"));
        OperationSnapshot s = state.snapshot();
        assertEquals(OperationStatus.FAILED, s.status());
        assertEquals(ErrorKind.INVALID_JOB_CONFIG, s.failure().kind());
        assertEquals(1, s.errors().size());
    }

    @Test
    void tick_fires_every_n_processed_records() {
        OperationState state = new OperationState("j4", "job", "trades", clock);
        state.moveTo(OperationStatus.EXTRACTING);
        state.chunkCompleted(new ChunkMetrics(0, 40, 40, 0, 40, 40, 0, 1));
        assertFalse(state.tickDue(100));
        state.chunkCompleted(new ChunkMetrics(1, 70, 70, 0, 70, 70, 0, 1));
        assertTrue(state.tickDue(100));
        assertFalse(state.tickDue(100));
    }
}
