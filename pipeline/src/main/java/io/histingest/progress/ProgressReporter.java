package io.histingest.progress;

/**
 * Receives progress events from a running job. Called from pipeline threads in the order the
 * events were produced; implementations must not block for long.
 */
@FunctionalInterface
public interface ProgressReporter extends AutoCloseable {
    ProgressReporter NO_OP = event -> { };

    void report(ProgressEvent event);

    @Override
    default void close() { }
}
