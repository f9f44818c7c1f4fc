package io.histingest.market.extract;

import io.histingest.market.job.JobConfig;

/**
 * Pulls raw records from an upstream provider. Extractors classify their failures but never
 * retry; the orchestrator owns retries.
 */
public interface Extractor {

    /** Name jobs use to select this extractor. */
    String provider();

    /**
     * Opens a lazy stream over the job's symbols and date range. May fail permanently when the
     * request itself is unacceptable (unknown symbol, schema not offered for the dataset).
     */
    ChunkStream stream(JobConfig job) throws ProviderException;
}
