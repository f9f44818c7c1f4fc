package io.histingest.core;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between a job handle and its workers.
 */
public final class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() { return reason.get() != null; }

    public String reason() { return reason.get(); }

    public PipelineError toError() {
        return PipelineError.of(ErrorKind.CANCELLED, "cancelled", "job cancelled: " + reason.get());
    }
}
