package io.histingest.market.extract;

import io.histingest.core.Chunk;
import io.histingest.market.model.RawRecord;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Finite, forward-only sequence of chunks for one job.
 * <p>
 * A {@code next()} call that throws leaves the cursor where it was, so calling it again asks
 * for the same chunk. Calls are never concurrent: a call that outlives its timeout is waited
 * for, and its chunk kept, before another starts. Once retries run out the outstanding call is
 * interrupted and {@link #close()} may follow while it unwinds.
 */
public interface ChunkStream extends AutoCloseable {

    /**
     * @return the next chunk, or empty once the range is exhausted
     */
    Optional<Chunk<RawRecord>> next() throws ProviderException;

    /** Total records the provider expects to deliver, when it can tell. */
    default OptionalLong estimatedTotal() { return OptionalLong.empty(); }

    @Override
    void close();
}
