package io.histingest.market.runtime;

import io.histingest.core.Chunk;
import io.histingest.market.extract.ChunkStream;
import io.histingest.market.extract.Extractor;
import io.histingest.market.extract.ProviderException;
import io.histingest.market.job.JobConfig;
import io.histingest.market.model.RawRecord;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extractor whose chunks come from a test-supplied function of the call number.
 */
final class ScriptedExtractor implements Extractor {

    @FunctionalInterface
    interface Script {
        /** @return the chunk for call {@code n} (0-based), or null when exhausted */
        Chunk<RawRecord> next(int n) throws ProviderException;
    }

    static final String PROVIDER = "scripted";

    private final Script script;
    final AtomicInteger calls = new AtomicInteger();
    volatile boolean closed;

    ScriptedExtractor(Script script) {
        this.script = script;
    }

    @Override
    public String provider() { return PROVIDER; }

    @Override
    public ChunkStream stream(JobConfig job) {
        return new ChunkStream() {
            @Override
            public Optional<Chunk<RawRecord>> next() throws ProviderException {
                return Optional.ofNullable(script.next(calls.getAndIncrement()));
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
