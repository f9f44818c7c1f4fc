package io.histingest.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands events to a delegate on a daemon thread through a bounded queue. {@link #report} never
 * blocks: when the queue is full the event is dropped and counted. Final events are enqueued
 * with a short wait so the summary is not lost behind a burst of chunk events.
 */
public class AsyncProgressReporter implements ProgressReporter {
    private static final Logger log = LoggerFactory.getLogger(AsyncProgressReporter.class);

    private final ProgressReporter delegate;
    private final BlockingQueue<ProgressEvent> queue;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();
    private final Thread worker;

    public AsyncProgressReporter(ProgressReporter delegate, int capacity) {
        this.delegate = delegate;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.worker = new Thread(this::drain, "progress-reporter");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public void report(ProgressEvent event) {
        if (!running.get()) return;
        boolean accepted;
        if (event.isFinal()) {
            try {
                accepted = queue.offer(event, 1, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                accepted = false;
            }
        } else {
            accepted = queue.offer(event);
        }
        if (!accepted) dropped.incrementAndGet();
    }

    public long dropped() { return dropped.get(); }

    private void drain() {
        while (running.get() || !queue.isEmpty()) {
            ProgressEvent e;
            try {
                e = queue.poll(50, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (e == null) continue;
            try {
                delegate.report(e);
            } catch (RuntimeException ex) {
                log.warn("Progress reporter failed on event for job {}: {}", e.jobId(), ex.toString());
            }
        }
    }

    /** Stops accepting events and waits for the queue to drain. */
    @Override
    public void close() {
        running.set(false);
        try {
            worker.join(5_000);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        delegate.close();
    }
}
