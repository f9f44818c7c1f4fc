package io.histingest.retry;

/**
 * Blocking pause between attempts; swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    static Sleeper system() {
        return Thread::sleep;
    }
}
