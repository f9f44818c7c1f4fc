package io.histingest.state;

import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineError;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FileOperationStateStoreTest {

    private static OperationSnapshot finished(String id, Instant at, OperationStatus status) {
        OperationState s = new OperationState(id, "job-" + id, "ohlcv-1d", Clock.fixed(at, ZoneOffset.UTC));
        s.moveTo(OperationStatus.EXTRACTING);
        s.chunkCompleted(new ChunkMetrics(0, 10, 9, 1, 9, 9, 1, 3));
        s.finish(status, status == OperationStatus.FAILED
                ? PipelineError.of(ErrorKind.STORAGE_PERMANENT, "23502", "null value") : null);
        return s.snapshot();
    }

    @Test
    void put_overwrites_and_get_round_trips() throws Exception {
        Path dir = Files.createTempDirectory("state");
        FileOperationStateStore store = new FileOperationStateStore(dir);
        OperationState s = new OperationState("abc", "es", "trades", Clock.systemUTC());
        store.put(s.snapshot());
        s.moveTo(OperationStatus.EXTRACTING);
        s.chunkCompleted(new ChunkMetrics(0, 5, 5, 0, 5, 5, 0, 1));
        store.put(s.snapshot());

        Optional<OperationSnapshot> back = store.get("abc");
        assertTrue(back.isPresent());
        assertEquals(OperationStatus.EXTRACTING, back.get().status());
        assertEquals(5, back.get().recordsStored());
        assertEquals(1, back.get().chunkMetrics().size());
        assertEquals(1, store.list().size());
    }

    @Test
    void failure_details_survive_persistence() throws Exception {
        FileOperationStateStore store = new FileOperationStateStore(Files.createTempDirectory("state-fail"));
        store.put(finished("f1", Instant.parse("2024-01-01T00:00:00Z"), OperationStatus.FAILED));
        OperationSnapshot back = store.get("f1").orElseThrow();
        assertEquals(ErrorKind.STORAGE_PERMANENT, back.failure().kind());
        assertEquals("23502", back.failure().code());
    }

    @Test
    void purge_removes_only_old_terminal_jobs() throws Exception {
        FileOperationStateStore store = new FileOperationStateStore(Files.createTempDirectory("state-purge"));
        Instant now = Instant.parse("2024-06-10T00:00:00Z");
        store.put(finished("old", now.minus(Duration.ofDays(3)), OperationStatus.COMPLETED));
        store.put(finished("recent", now.minus(Duration.ofHours(1)), OperationStatus.COMPLETED));
        OperationState running = new OperationState("running", "r", "trades", Clock.fixed(now.minus(Duration.ofDays(5)), ZoneOffset.UTC));
        running.moveTo(OperationStatus.EXTRACTING);
        store.put(running.snapshot());

        int removed = store.purgeTerminalOlderThan(Duration.ofDays(1), now);

        assertEquals(1, removed);
        assertTrue(store.get("old").isEmpty());
        assertTrue(store.get("recent").isPresent());
        assertTrue(store.get("running").isPresent());
    }

    @Test
    void in_memory_store_behaves_the_same() throws Exception {
        InMemoryOperationStateStore store = new InMemoryOperationStateStore();
        Instant now = Instant.parse("2024-06-10T00:00:00Z");
        store.put(finished("a", now.minus(Duration.ofDays(2)), OperationStatus.COMPLETED_WITH_QUARANTINE));
        assertEquals(OperationStatus.COMPLETED_WITH_QUARANTINE, store.get("a").orElseThrow().status());
        assertEquals(1, store.purgeTerminalOlderThan(Duration.ofDays(1), now));
        assertTrue(store.list().isEmpty());
    }
}
