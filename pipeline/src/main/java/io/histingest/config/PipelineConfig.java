package io.histingest.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime defaults for ingestion jobs. Each key reads a system property first, then an
 * environment variable, then falls back to a built-in default.
 */
public record PipelineConfig(
        Path stateDir,
        Path quarantineDir,
        Path replayDir,
        int chunkSize,
        int maxRetries,
        long backoffMinMillis,
        long backoffMaxMillis,
        double backoffMultiplier,
        int maxInFlightChunks,
        Duration extractTimeout,
        Duration storeTimeout,
        int adminPort
) {
    public PipelineConfig {
        if (chunkSize <= 0) throw new IllegalArgumentException("chunkSize must be > 0");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (maxInFlightChunks <= 0) throw new IllegalArgumentException("maxInFlightChunks must be > 0");
        if (!(backoffMultiplier > 1.0)) throw new IllegalArgumentException("backoffMultiplier must be > 1");
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(Path.of("state"), Path.of("dlq"), Path.of("replay"),
                10_000, 3, 1_000, 60_000, 2.0, 4,
                Duration.ofMinutes(5), Duration.ofMinutes(2), 8080);
    }

    public static PipelineConfig fromEnv() {
        Path state = Path.of(read("histingest.state.dir", "HISTINGEST_STATE_DIR", "state"));
        Path dlq = Path.of(read("histingest.quarantine.dir", "HISTINGEST_QUARANTINE_DIR", "dlq"));
        Path replay = Path.of(read("histingest.replay.dir", "HISTINGEST_REPLAY_DIR", "replay"));
        int chunk = Integer.parseInt(read("histingest.chunk.size", "HISTINGEST_CHUNK_SIZE", "10000"));
        int retries = Integer.parseInt(read("histingest.max.retries", "HISTINGEST_MAX_RETRIES", "3"));
        long backoffMin = Long.parseLong(read("histingest.backoff.min.ms", "HISTINGEST_BACKOFF_MIN_MS", "1000"));
        long backoffMax = Long.parseLong(read("histingest.backoff.max.ms", "HISTINGEST_BACKOFF_MAX_MS", "60000"));
        double multiplier = Double.parseDouble(read("histingest.backoff.multiplier", "HISTINGEST_BACKOFF_MULTIPLIER", "2.0"));
        int inflight = Integer.parseInt(read("histingest.max.inflight", "HISTINGEST_MAX_INFLIGHT", "4"));
        long extractMs = Long.parseLong(read("histingest.extract.timeout.ms", "HISTINGEST_EXTRACT_TIMEOUT_MS", "300000"));
        long storeMs = Long.parseLong(read("histingest.store.timeout.ms", "HISTINGEST_STORE_TIMEOUT_MS", "120000"));
        int port = Integer.parseInt(read("histingest.admin.port", "HISTINGEST_ADMIN_PORT", "8080"));
        return new PipelineConfig(state, dlq, replay, chunk, retries, backoffMin, backoffMax, multiplier, inflight,
                Duration.ofMillis(extractMs), Duration.ofMillis(storeMs), port);
    }

    static String read(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
