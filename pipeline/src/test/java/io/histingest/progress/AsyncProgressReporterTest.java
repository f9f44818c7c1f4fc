package io.histingest.progress;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class AsyncProgressReporterTest {

    @Test
    void delivers_events_in_order() {
        List<ProgressEvent> seen = new CopyOnWriteArrayList<>();
        AsyncProgressReporter reporter = new AsyncProgressReporter(seen::add, 100);
        for (int i = 1; i <= 20; i++) {
            reporter.report(ProgressEvent.chunk("job", "Storing", i * 10L, 200, i * 10L, 0, i));
        }
        reporter.close();

        assertEquals(20, seen.size());
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i).recordsStored() >= seen.get(i - 1).recordsStored());
        }
    }

    @Test
    void slow_consumer_never_blocks_producer() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AsyncProgressReporter reporter = new AsyncProgressReporter(e -> {
            try { release.await(5, TimeUnit.SECONDS); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
        }, 2);

        long t0 = System.nanoTime();
        for (int i = 0; i < 50; i++) {
            reporter.report(ProgressEvent.chunk("job", "Storing", i, 50, i, 0, i));
        }
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
        assertTrue(elapsedMs < 1_000, "report() blocked for " + elapsedMs + " ms");
        assertTrue(reporter.dropped() > 0);
        release.countDown();
        reporter.close();
    }

    @Test
    void final_event_carries_summary() {
        List<ProgressEvent> seen = new CopyOnWriteArrayList<>();
        AsyncProgressReporter reporter = new AsyncProgressReporter(seen::add, 4);
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = start.plusSeconds(3);
        JobSummary summary = new JobSummary("COMPLETED", start, end, JobSummary.seconds(start, end),
                10, 10, 10, 10, 10, 0, 0, 1, 0, "dlq/job");
        reporter.report(ProgressEvent.finished("job", "Completed", 10, 10, summary));
        reporter.close();

        assertEquals(1, seen.size());
        assertTrue(seen.get(0).isFinal());
        assertEquals(3.0, seen.get(0).finalStats().durationSeconds());
        assertEquals(ProgressEvent.VERSION, seen.get(0).version());
    }
}
